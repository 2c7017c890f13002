package com.ivamare.modulebus.exception;

/**
 * Raised on the sender side for a recipient error that carried an exception.
 *
 * <p>The recipient's exception is the cause. Recipients never throw this themselves;
 * they attach a fatal {@code MessageError} to the message and the sender (or the
 * dispatcher on the sender's behalf) raises it once the message has finalized.
 */
public class RecipientFatalException extends ModuleBusException {

    private final String messageType;
    private final String recipient;
    private final String errorMessage;

    public RecipientFatalException(String messageType, String recipient, String errorMessage, Throwable cause) {
        super("Module " + recipient + " failed on '" + messageType + "': " + errorMessage, cause);
        this.messageType = messageType;
        this.recipient = recipient;
        this.errorMessage = errorMessage;
    }

    public String getMessageType() {
        return messageType;
    }

    public String getRecipient() {
        return recipient;
    }

    public String getErrorMessage() {
        return errorMessage;
    }
}
