package com.ivamare.modulebus.api;

import com.ivamare.modulebus.model.Message;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;

/**
 * Delivers messages to every registered module.
 *
 * <p>Messages are delivered in send order. A message is finalized once every module has
 * finished with it; a {@linkplain Message#isSynchronous() synchronous} message is only
 * delivered after all earlier messages have finalized, and no later message is delivered
 * before it has finalized itself.
 *
 * <p>Once a message finalizes, the sender (if it is a
 * {@link com.ivamare.modulebus.module.MessageModule}) receives every fatal error and,
 * if there are any, the responses.
 */
public interface MessageDispatcher {

    /**
     * Queue a message for delivery. Messages may be queued before the dispatcher starts.
     *
     * @param message The message
     * @throws com.ivamare.modulebus.exception.UnknownMessageTypeException if strict type
     *         checking is enabled and the type is not registered
     * @throws com.ivamare.modulebus.exception.InvalidOperationException if the dispatcher
     *         is stopping
     */
    void send(Message message);

    /**
     * Start delivering messages.
     */
    void start();

    /**
     * Stop accepting messages and deliver what is queued.
     *
     * @param timeout Maximum time to wait for queued and in-flight messages
     * @return Future completing when the dispatcher has stopped
     */
    CompletableFuture<Void> stop(Duration timeout);

    /**
     * Stop immediately without waiting for in-flight messages.
     */
    void stopNow();

    /**
     * Check if the dispatcher is running and accepting messages.
     *
     * @return true if running
     */
    boolean isRunning();

    /**
     * Number of delivered messages that have not finalized yet.
     *
     * @return in-flight message count
     */
    int inFlightCount();

    /**
     * Number of messages waiting for delivery.
     *
     * @return queued message count
     */
    int queuedCount();

    /**
     * Number of messages finalized since start.
     *
     * @return completed message count
     */
    long completedCount();

    /**
     * Number of fatal recipient errors seen since start.
     *
     * @return fatal error count
     */
    long fatalErrorCount();

    /**
     * Create a new dispatcher builder.
     *
     * @return DispatcherBuilder instance
     */
    static DispatcherBuilder builder() {
        return new DispatcherBuilder();
    }
}
