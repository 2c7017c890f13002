package com.ivamare.modulebus.module;

import java.util.List;
import java.util.Optional;

/**
 * Registry of the modules messages are delivered to.
 *
 * <p>Modules are kept in registration order, which is also the delivery order.
 */
public interface ModuleRegistry {

    /**
     * Register a module.
     *
     * @param module The module
     * @throws com.ivamare.modulebus.exception.DuplicateModuleException if the name is taken
     */
    void register(MessageModule module);

    /**
     * Remove a module.
     *
     * @param moduleName The module name
     * @return true if a module was removed
     */
    boolean unregister(String moduleName);

    /**
     * Get a module by name.
     *
     * @param moduleName The module name
     * @return Optional containing the module if registered
     */
    Optional<MessageModule> get(String moduleName);

    /**
     * Get a module by name, throwing if not found.
     *
     * @param moduleName The module name
     * @return The module
     * @throws com.ivamare.modulebus.exception.ModuleNotFoundException if not registered
     */
    MessageModule getOrThrow(String moduleName);

    /**
     * Check if a module is registered.
     *
     * @param moduleName The module name
     * @return true if registered
     */
    boolean hasModule(String moduleName);

    /**
     * Get all registered modules in registration order.
     *
     * @return Snapshot of the modules
     */
    List<MessageModule> modules();

    /**
     * Remove all modules. Useful for testing.
     */
    void clear();
}
