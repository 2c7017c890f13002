package com.ivamare.modulebus.exception;

/**
 * Thrown when strictly registering a message type that is already known.
 */
public class DuplicateMessageTypeException extends ModuleBusException {

    private final String messageType;

    public DuplicateMessageTypeException(String messageType) {
        super("Message type '" + messageType + "' already exists");
        this.messageType = messageType;
    }

    public String getMessageType() {
        return messageType;
    }
}
