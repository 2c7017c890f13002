package com.ivamare.modulebus.lifecycle;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes lifecycle events as comma separated text to the lifecycle logger.
 */
public class Slf4jLifecycleSink implements LifecycleSink {

    /**
     * Logger every built-in sink writes to.
     */
    public static final String LOGGER_NAME = "com.ivamare.modulebus.lifecycle";

    private final Logger log;

    public Slf4jLifecycleSink() {
        this(LoggerFactory.getLogger(LOGGER_NAME));
    }

    public Slf4jLifecycleSink(Logger log) {
        this.log = log;
    }

    @Override
    public void record(LifecycleEvent event) {
        log.info(event.toText());
    }
}
