package com.ivamare.modulebus.lifecycle;

import java.util.UUID;

/**
 * Diagnostic record of a message being created or destroyed.
 *
 * @param eventType Whether the message was created or destroyed
 * @param messageId Identity of the message
 * @param sourceName Name of the module that sent the message
 * @param messageType Type of the message
 */
public record LifecycleEvent(
    LifecycleEventType eventType,
    UUID messageId,
    String sourceName,
    String messageType
) {
    /**
     * Formats the event as {@code eventName,messageId,sourceName,messageType}.
     */
    public String toText() {
        return String.join(",", eventType.getValue(), String.valueOf(messageId), sourceName, messageType);
    }
}
