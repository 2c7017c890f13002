package com.ivamare.modulebus.exception;

/**
 * Thrown when registering a module under a name that is already taken.
 */
public class DuplicateModuleException extends ModuleBusException {

    private final String moduleName;

    public DuplicateModuleException(String moduleName) {
        super("Module already registered: " + moduleName);
        this.moduleName = moduleName;
    }

    public String getModuleName() {
        return moduleName;
    }
}
