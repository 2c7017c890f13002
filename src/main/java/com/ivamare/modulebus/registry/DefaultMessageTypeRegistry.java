package com.ivamare.modulebus.registry;

import com.ivamare.modulebus.exception.DuplicateMessageTypeException;
import com.ivamare.modulebus.exception.UnknownMessageTypeException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Default implementation of MessageTypeRegistry, seeded with {@link MessageTypes#BUILT_IN}.
 *
 * <p>Writes are serialized so the duplicate check and the insert happen together;
 * lookups do not lock.
 */
public class DefaultMessageTypeRegistry implements MessageTypeRegistry {

    private static final Logger log = LoggerFactory.getLogger(DefaultMessageTypeRegistry.class);

    private final Set<String> types = ConcurrentHashMap.newKeySet();

    public DefaultMessageTypeRegistry() {
        this(MessageTypes.BUILT_IN);
    }

    public DefaultMessageTypeRegistry(Collection<String> initialTypes) {
        for (String type : initialTypes) {
            types.add(validate(type));
        }
    }

    @Override
    public synchronized void register(String name, boolean failIfExists) {
        validate(name);
        if (types.contains(name)) {
            if (failIfExists) {
                throw new DuplicateMessageTypeException(name);
            }
            log.debug("Message type '{}' already registered", name);
            return;
        }
        types.add(name);
        log.debug("Registered message type '{}'", name);
    }

    @Override
    public boolean isRegistered(String name) {
        return name != null && types.contains(name);
    }

    @Override
    public void requireRegistered(String name) {
        if (!isRegistered(name)) {
            throw new UnknownMessageTypeException(name);
        }
    }

    @Override
    public List<String> registeredTypes() {
        return types.stream().sorted().toList();
    }

    private static String validate(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("message type is required");
        }
        return name;
    }
}
