package com.ivamare.modulebus.module.impl;

import com.ivamare.modulebus.exception.DuplicateModuleException;
import com.ivamare.modulebus.exception.ModuleNotFoundException;
import com.ivamare.modulebus.module.MessageModule;
import com.ivamare.modulebus.module.ModuleRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.config.BeanPostProcessor;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Default implementation of ModuleRegistry.
 *
 * <p>Implements BeanPostProcessor to automatically register every Spring bean
 * that is a {@link MessageModule}.
 */
public class DefaultModuleRegistry implements ModuleRegistry, BeanPostProcessor {

    private static final Logger log = LoggerFactory.getLogger(DefaultModuleRegistry.class);

    private final Map<String, MessageModule> modules = new LinkedHashMap<>();

    @Override
    public synchronized void register(MessageModule module) {
        String name = module.moduleName();
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("moduleName is required");
        }
        if (modules.containsKey(name)) {
            throw new DuplicateModuleException(name);
        }
        modules.put(name, module);
        log.debug("Registered module {}", name);
    }

    @Override
    public synchronized boolean unregister(String moduleName) {
        boolean removed = modules.remove(moduleName) != null;
        if (removed) {
            log.debug("Unregistered module {}", moduleName);
        }
        return removed;
    }

    @Override
    public synchronized Optional<MessageModule> get(String moduleName) {
        return Optional.ofNullable(modules.get(moduleName));
    }

    @Override
    public MessageModule getOrThrow(String moduleName) {
        return get(moduleName).orElseThrow(() -> new ModuleNotFoundException(moduleName));
    }

    @Override
    public synchronized boolean hasModule(String moduleName) {
        return modules.containsKey(moduleName);
    }

    @Override
    public synchronized List<MessageModule> modules() {
        return List.copyOf(modules.values());
    }

    @Override
    public synchronized void clear() {
        modules.clear();
    }

    /**
     * BeanPostProcessor callback - registers MessageModule beans.
     */
    @Override
    public Object postProcessAfterInitialization(Object bean, String beanName) {
        if (bean instanceof MessageModule module) {
            register(module);
            log.info("Discovered module {} (bean {})", module.moduleName(), beanName);
        }
        return bean;
    }
}
