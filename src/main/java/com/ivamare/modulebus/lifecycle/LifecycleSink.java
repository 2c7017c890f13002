package com.ivamare.modulebus.lifecycle;

/**
 * Receives lifecycle events for general messages.
 *
 * <p>Called from whichever thread creates or finalizes the message, so
 * implementations must be thread-safe and must not block.
 */
@FunctionalInterface
public interface LifecycleSink {

    /**
     * Sink that discards every event.
     */
    LifecycleSink NOOP = event -> { };

    /**
     * Record a lifecycle event.
     *
     * @param event The event
     */
    void record(LifecycleEvent event);
}
