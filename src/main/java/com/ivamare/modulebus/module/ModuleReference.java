package com.ivamare.modulebus.module;

/**
 * Anything that can be named as the source of a message.
 */
@FunctionalInterface
public interface ModuleReference {

    /**
     * Stable, human readable name of the module.
     *
     * @return The module name
     */
    String moduleName();
}
