package com.ivamare.modulebus.api;

import com.ivamare.modulebus.api.impl.DefaultMessageDispatcher;
import com.ivamare.modulebus.module.ModuleRegistry;
import com.ivamare.modulebus.registry.MessageTypeRegistry;
import com.ivamare.modulebus.registry.MessageTypes;

/**
 * Builder for creating MessageDispatcher instances.
 */
public class DispatcherBuilder {

    private ModuleRegistry moduleRegistry;
    private MessageTypeRegistry messageTypeRegistry;
    private int concurrency = 4;
    private int pollIntervalMs = 100;
    private boolean strictTypes = true;

    /**
     * Set the registry of modules to deliver to.
     *
     * @param moduleRegistry The module registry
     * @return this builder
     */
    public DispatcherBuilder moduleRegistry(ModuleRegistry moduleRegistry) {
        this.moduleRegistry = moduleRegistry;
        return this;
    }

    /**
     * Set the registry used to validate message types.
     * Defaults to {@link MessageTypes#global()}.
     *
     * @param messageTypeRegistry The message type registry
     * @return this builder
     */
    public DispatcherBuilder messageTypeRegistry(MessageTypeRegistry messageTypeRegistry) {
        this.messageTypeRegistry = messageTypeRegistry;
        return this;
    }

    /**
     * Set the number of worker threads delivering to modules.
     *
     * @param concurrency Number of worker threads
     * @return this builder
     */
    public DispatcherBuilder concurrency(int concurrency) {
        this.concurrency = concurrency;
        return this;
    }

    /**
     * Set how long the dispatch loop waits for a message before checking for shutdown.
     *
     * @param ms Poll interval in milliseconds
     * @return this builder
     */
    public DispatcherBuilder pollIntervalMs(int ms) {
        this.pollIntervalMs = ms;
        return this;
    }

    /**
     * Set whether messages of unregistered types are rejected on send.
     *
     * @param strictTypes Enable strict type checking
     * @return this builder
     */
    public DispatcherBuilder strictTypes(boolean strictTypes) {
        this.strictTypes = strictTypes;
        return this;
    }

    /**
     * Build the dispatcher.
     *
     * @return The configured dispatcher (not started)
     * @throws IllegalStateException if required fields are missing
     */
    public MessageDispatcher build() {
        if (moduleRegistry == null) {
            throw new IllegalStateException("moduleRegistry is required");
        }
        if (concurrency < 1) {
            throw new IllegalStateException("concurrency must be at least 1");
        }
        if (pollIntervalMs < 1) {
            throw new IllegalStateException("pollIntervalMs must be at least 1");
        }

        if (messageTypeRegistry == null) {
            messageTypeRegistry = MessageTypes.global();
        }

        return new DefaultMessageDispatcher(
            moduleRegistry,
            messageTypeRegistry,
            concurrency,
            pollIntervalMs,
            strictTypes
        );
    }
}
