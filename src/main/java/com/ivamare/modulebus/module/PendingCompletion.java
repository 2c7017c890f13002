package com.ivamare.modulebus.module;

/**
 * Handle a module uses to report that deferred work on a message has finished.
 */
@FunctionalInterface
public interface PendingCompletion {

    /**
     * Signal completion. Only the first call has an effect.
     */
    void done();
}
