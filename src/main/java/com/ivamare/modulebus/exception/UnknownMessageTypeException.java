package com.ivamare.modulebus.exception;

/**
 * Thrown when a message type is used that was never registered.
 */
public class UnknownMessageTypeException extends ModuleBusException {

    private final String messageType;

    public UnknownMessageTypeException(String messageType) {
        super("Invalid message type '" + messageType + "'");
        this.messageType = messageType;
    }

    public String getMessageType() {
        return messageType;
    }
}
