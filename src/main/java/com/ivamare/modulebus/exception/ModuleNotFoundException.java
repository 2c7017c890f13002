package com.ivamare.modulebus.exception;

/**
 * Thrown when no module is registered under the requested name.
 */
public class ModuleNotFoundException extends ModuleBusException {

    private final String moduleName;

    public ModuleNotFoundException(String moduleName) {
        super("No module registered under name: " + moduleName);
        this.moduleName = moduleName;
    }

    public String getModuleName() {
        return moduleName;
    }
}
