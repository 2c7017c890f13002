package com.ivamare.modulebus.exception;

/**
 * Base exception for all Module Bus errors.
 */
public class ModuleBusException extends RuntimeException {

    public ModuleBusException(String message) {
        super(message);
    }

    public ModuleBusException(String message, Throwable cause) {
        super(message, cause);
    }
}
