package com.ivamare.modulebus.exception;

/**
 * Thrown when an invalid state transition or operation is attempted.
 */
public class InvalidOperationException extends ModuleBusException {

    public InvalidOperationException(String message) {
        super(message);
    }
}
