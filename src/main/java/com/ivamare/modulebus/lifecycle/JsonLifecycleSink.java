package com.ivamare.modulebus.lifecycle;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Writes lifecycle events as single-line JSON objects to the lifecycle logger.
 *
 * <p>Example:
 * <pre>
 * {"event":"created","messageId":"...","source":"camera1","type":"start"}
 * </pre>
 */
public class JsonLifecycleSink implements LifecycleSink {

    private final ObjectMapper objectMapper;
    private final Logger log;

    public JsonLifecycleSink(ObjectMapper objectMapper) {
        this(objectMapper, LoggerFactory.getLogger(Slf4jLifecycleSink.LOGGER_NAME));
    }

    public JsonLifecycleSink(ObjectMapper objectMapper, Logger log) {
        this.objectMapper = objectMapper;
        this.log = log;
    }

    @Override
    public void record(LifecycleEvent event) {
        log.info(toJson(event));
    }

    String toJson(LifecycleEvent event) {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("event", event.eventType().getValue());
        fields.put("messageId", String.valueOf(event.messageId()));
        fields.put("source", event.sourceName());
        fields.put("type", event.messageType());
        try {
            return objectMapper.writeValueAsString(fields);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize lifecycle event", e);
        }
    }
}
