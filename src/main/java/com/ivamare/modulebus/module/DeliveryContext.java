package com.ivamare.modulebus.module;

import com.ivamare.modulebus.model.Message;

/**
 * Context provided to a module while it processes a message.
 *
 * @param message The message being delivered
 * @param recipientIndex Position of this module in the delivery (0-based)
 * @param recipientCount Number of modules the message is delivered to
 * @param deferrer Function that keeps the message open past this delivery (nullable)
 */
public record DeliveryContext(
    Message message,
    int recipientIndex,
    int recipientCount,
    Deferrer deferrer
) {
    /**
     * Keep the message open after {@code processMessage} returns, for work that finishes
     * on another thread. The message is not finalized before the returned handle is done.
     *
     * @return Handle to call once the deferred work has finished
     * @throws IllegalStateException if deferral is not available
     */
    public PendingCompletion defer() {
        if (deferrer == null) {
            throw new IllegalStateException("Deferred completion not available");
        }
        return deferrer.defer();
    }

    /**
     * Check if this module is the last one the message is delivered to.
     *
     * @return true if no module follows this one
     */
    public boolean isLastRecipient() {
        return recipientIndex == recipientCount - 1;
    }

    /**
     * Functional interface for keeping a message open.
     */
    @FunctionalInterface
    public interface Deferrer {
        PendingCompletion defer();
    }
}
