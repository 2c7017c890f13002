package com.ivamare.modulebus.registry;

import java.util.List;

/**
 * Set of message type names recognised by the bus.
 *
 * <p>The set only grows: there is no removal. It guards against typos in type
 * strings and is not a type system.
 */
public interface MessageTypeRegistry {

    /**
     * Register a message type, failing if it is already known.
     *
     * @param name The message type (space separated lower case by convention)
     * @throws com.ivamare.modulebus.exception.DuplicateMessageTypeException if already registered
     */
    default void register(String name) {
        register(name, true);
    }

    /**
     * Register a message type.
     *
     * @param name The message type
     * @param failIfExists Whether an existing registration is an error
     * @throws com.ivamare.modulebus.exception.DuplicateMessageTypeException if
     *         {@code failIfExists} is set and the type is already registered
     */
    void register(String name, boolean failIfExists);

    /**
     * Check if a message type is registered.
     *
     * @param name The message type
     * @return true if registered
     */
    boolean isRegistered(String name);

    /**
     * Verify a message type is registered.
     *
     * @param name The message type
     * @throws com.ivamare.modulebus.exception.UnknownMessageTypeException if not registered
     */
    void requireRegistered(String name);

    /**
     * Get all registered message types, sorted.
     *
     * @return Snapshot of the registered types
     */
    List<String> registeredTypes();
}
