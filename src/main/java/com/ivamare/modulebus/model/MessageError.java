package com.ivamare.modulebus.model;

/**
 * Error or warning a recipient attaches to a message it could not handle.
 *
 * <p>An error with an exception is fatal: the sender must raise it. Without an
 * exception it is only a warning.
 *
 * @param source Name of the module that reported the problem
 * @param message Human readable description
 * @param exception Exception for the sender to raise (nullable)
 */
public record MessageError(String source, String message, Exception exception) {

    public MessageError {
        source = source != null ? source : "";
        message = message != null ? message : "";
    }

    /**
     * Create an advisory error.
     */
    public static MessageError warning(String source, String message) {
        return new MessageError(source, message, null);
    }

    /**
     * Create a fatal error.
     */
    public static MessageError fatal(String source, String message, Exception exception) {
        if (exception == null) {
            throw new IllegalArgumentException("exception is required for a fatal error");
        }
        return new MessageError(source, message, exception);
    }

    public Exception getException() {
        return exception;
    }

    public boolean hasException() {
        return exception != null;
    }
}
