package com.ivamare.modulebus;

import com.ivamare.modulebus.api.MessageDispatcher;
import com.ivamare.modulebus.module.ModuleRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.event.EventListener;

import jakarta.annotation.PreDestroy;

/**
 * Auto-start configuration for the dispatcher.
 *
 * <p>Enable with:
 * <pre>
 * modulebus:
 *   dispatcher:
 *     auto-start: true
 * </pre>
 */
@Configuration
@ConditionalOnProperty(prefix = "modulebus.dispatcher", name = "auto-start", havingValue = "true")
public class DispatcherAutoStartConfiguration {

    private static final Logger log = LoggerFactory.getLogger(DispatcherAutoStartConfiguration.class);

    private final MessageDispatcher dispatcher;
    private final ModuleRegistry moduleRegistry;
    private final ModuleBusProperties properties;

    public DispatcherAutoStartConfiguration(
            MessageDispatcher dispatcher,
            ModuleRegistry moduleRegistry,
            ModuleBusProperties properties) {
        this.dispatcher = dispatcher;
        this.moduleRegistry = moduleRegistry;
        this.properties = properties;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void startDispatcher() {
        int moduleCount = moduleRegistry.modules().size();
        if (moduleCount == 0) {
            log.warn("No modules registered, messages will finalize without recipients");
        }

        dispatcher.start();

        log.info("Started dispatcher for {} modules", moduleCount);
    }

    @PreDestroy
    public void stopDispatcher() {
        if (!dispatcher.isRunning()) {
            return;
        }

        log.info("Stopping dispatcher...");

        dispatcher.stop(properties.getDispatcher().getShutdownTimeout()).join();

        log.info("Dispatcher stopped");
    }
}
