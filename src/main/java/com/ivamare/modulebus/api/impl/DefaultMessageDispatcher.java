package com.ivamare.modulebus.api.impl;

import com.ivamare.modulebus.api.MessageDispatcher;
import com.ivamare.modulebus.exception.InvalidOperationException;
import com.ivamare.modulebus.model.Message;
import com.ivamare.modulebus.model.MessageError;
import com.ivamare.modulebus.module.DeliveryContext;
import com.ivamare.modulebus.module.MessageModule;
import com.ivamare.modulebus.module.ModuleRegistry;
import com.ivamare.modulebus.module.PendingCompletion;
import com.ivamare.modulebus.registry.MessageTypeRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Default dispatcher: one loop thread takes messages in send order and hands each
 * module's delivery to a fixed pool of worker threads.
 *
 * <p>The loop retains a message once per recipient before the first delivery, so the
 * message cannot finalize while a recipient is still unaccounted for. Whichever thread
 * releases the last reference completes the message.
 */
public class DefaultMessageDispatcher implements MessageDispatcher {

    private static final Logger log = LoggerFactory.getLogger(DefaultMessageDispatcher.class);

    private final ModuleRegistry moduleRegistry;
    private final MessageTypeRegistry messageTypeRegistry;
    private final int concurrency;
    private final int pollIntervalMs;
    private final boolean strictTypes;

    private final BlockingQueue<Message> queue = new LinkedBlockingQueue<>();
    // Ids of messages queued or in flight
    private final Set<UUID> pendingIds = ConcurrentHashMap.newKeySet();
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicBoolean stopping = new AtomicBoolean(false);
    private final AtomicInteger inFlightCount = new AtomicInteger(0);
    private final AtomicLong completedCount = new AtomicLong(0);
    private final AtomicLong fatalErrorCount = new AtomicLong(0);

    // Guards waiting for inFlightCount to reach zero
    private final ReentrantLock idleLock = new ReentrantLock();
    private final Condition idle = idleLock.newCondition();

    private ExecutorService loopExecutor;
    private ExecutorService workers;

    /**
     * Creates a new DefaultMessageDispatcher.
     *
     * @param moduleRegistry Registry of modules to deliver to
     * @param messageTypeRegistry Registry used to validate message types
     * @param concurrency Number of worker threads delivering to modules
     * @param pollIntervalMs Poll interval of the dispatch loop in milliseconds
     * @param strictTypes Whether unregistered message types are rejected on send
     */
    public DefaultMessageDispatcher(
            ModuleRegistry moduleRegistry,
            MessageTypeRegistry messageTypeRegistry,
            int concurrency,
            int pollIntervalMs,
            boolean strictTypes) {
        this.moduleRegistry = moduleRegistry;
        this.messageTypeRegistry = messageTypeRegistry;
        this.concurrency = concurrency;
        this.pollIntervalMs = pollIntervalMs;
        this.strictTypes = strictTypes;
    }

    @Override
    public void send(Message message) {
        Objects.requireNonNull(message, "message");
        if (stopping.get()) {
            throw new InvalidOperationException("Dispatcher is stopping, cannot send '" + message.getType() + "'");
        }
        if (message.isFinalized()) {
            throw new InvalidOperationException("Message " + message.getMessageId() + " is already finalized");
        }
        if (strictTypes) {
            messageTypeRegistry.requireRegistered(message.getType());
        }
        if (!pendingIds.add(message.getMessageId())) {
            throw new InvalidOperationException("Message " + message.getMessageId() + " is already queued or in flight");
        }
        queue.add(message);
        log.debug("Queued '{}' from {} (messageId={})",
            message.getType(), message.getSourceName(), message.getMessageId());
    }

    @Override
    public void start() {
        if (running.getAndSet(true)) {
            log.warn("Dispatcher already running");
            return;
        }

        stopping.set(false);
        workers = Executors.newFixedThreadPool(concurrency, threadFactory("modulebus-worker-"));
        loopExecutor = Executors.newSingleThreadExecutor(threadFactory("modulebus-dispatcher-"));

        log.info("Starting dispatcher, concurrency={}, strictTypes={}, queued={}",
            concurrency, strictTypes, queue.size());

        loopExecutor.submit(this::runLoop);
    }

    @Override
    public CompletableFuture<Void> stop(Duration timeout) {
        if (!running.get()) {
            return CompletableFuture.completedFuture(null);
        }

        stopping.set(true);
        log.info("Stopping dispatcher, waiting for {} queued and {} in-flight messages",
            queue.size(), inFlightCount.get());

        return CompletableFuture.runAsync(() -> {
            try {
                long deadline = System.currentTimeMillis() + timeout.toMillis();

                // The loop exits by itself once the queue is drained
                loopExecutor.shutdown();
                if (!loopExecutor.awaitTermination(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                    log.warn("Timeout waiting for dispatch loop, {} messages still queued", queue.size());
                    loopExecutor.shutdownNow();
                }

                while (inFlightCount.get() > 0 && System.currentTimeMillis() < deadline) {
                    Thread.sleep(20);
                }
                if (inFlightCount.get() > 0) {
                    log.warn("Timeout waiting for {} in-flight messages", inFlightCount.get());
                }

                running.set(false);
                workers.shutdown();
                if (!workers.awaitTermination(5, TimeUnit.SECONDS)) {
                    workers.shutdownNow();
                }

                log.info("Dispatcher stopped, {} messages completed", completedCount.get());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });
    }

    @Override
    public void stopNow() {
        stopping.set(true);
        running.set(false);
        if (loopExecutor != null) {
            loopExecutor.shutdownNow();
        }
        if (workers != null) {
            workers.shutdownNow();
        }
    }

    @Override
    public boolean isRunning() {
        return running.get() && !stopping.get();
    }

    @Override
    public int inFlightCount() {
        return inFlightCount.get();
    }

    @Override
    public int queuedCount() {
        return queue.size();
    }

    @Override
    public long completedCount() {
        return completedCount.get();
    }

    @Override
    public long fatalErrorCount() {
        return fatalErrorCount.get();
    }

    // --- Dispatch Loop ---

    private void runLoop() {
        log.debug("Dispatch loop started");

        try {
            while (running.get()) {
                Message message = queue.poll(pollIntervalMs, TimeUnit.MILLISECONDS);
                if (message == null) {
                    if (stopping.get()) {
                        break;
                    }
                    continue;
                }

                try {
                    if (message.isSynchronous()) {
                        awaitIdle();
                        deliver(message);
                        awaitIdle();
                    } else {
                        deliver(message);
                    }
                } catch (RuntimeException e) {
                    log.error("Failed to dispatch '{}' from {} (messageId={})",
                        message.getType(), message.getSourceName(), message.getMessageId(), e);
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            if (!stopping.get()) {
                running.set(false);
                workers.shutdown();
                log.warn("Dispatch loop ended before stop was requested");
            }
            log.debug("Dispatch loop ended");
        }
    }

    private void awaitIdle() throws InterruptedException {
        idleLock.lock();
        try {
            while (inFlightCount.get() > 0) {
                idle.await();
            }
        } finally {
            idleLock.unlock();
        }
    }

    private void deliver(Message message) {
        List<MessageModule> recipients = moduleRegistry.modules();

        log.debug("Delivering '{}' to {} modules (messageId={}, sync={})",
            message.getType(), recipients.size(), message.getMessageId(), message.isSynchronous());

        if (!recipients.isEmpty()) {
            try {
                message.retain(recipients.size());
            } catch (InvalidOperationException e) {
                pendingIds.remove(message.getMessageId());
                log.error("Dropped '{}' from {}: {}", message.getType(), message.getSourceName(), e.getMessage());
                return;
            }
        }
        inFlightCount.incrementAndGet();

        if (recipients.isEmpty()) {
            complete(message);
            return;
        }

        for (int i = 0; i < recipients.size(); i++) {
            MessageModule module = recipients.get(i);
            DeliveryContext context = new DeliveryContext(
                message, i, recipients.size(), () -> deferCompletion(message));
            try {
                workers.execute(() -> processWith(module, message, context));
            } catch (RejectedExecutionException e) {
                message.addError(MessageError.fatal(module.moduleName(), "Delivery rejected", e));
                releaseOne(message);
            }
        }
    }

    private void processWith(MessageModule module, Message message, DeliveryContext context) {
        try {
            module.processMessage(message, context);
        } catch (Exception e) {
            log.debug("Module {} failed processing '{}' (messageId={})",
                module.moduleName(), message.getType(), message.getMessageId(), e);
            message.addError(MessageError.fatal(module.moduleName(), e.getMessage(), e));
        } finally {
            releaseOne(message);
        }
    }

    private PendingCompletion deferCompletion(Message message) {
        message.retain();
        AtomicBoolean done = new AtomicBoolean(false);
        return () -> {
            if (done.compareAndSet(false, true)) {
                releaseOne(message);
            }
        };
    }

    private void releaseOne(Message message) {
        if (message.release()) {
            complete(message);
        }
    }

    private void complete(Message message) {
        try {
            if (message.isFinalized()) {
                log.error("Message {} ('{}' from {}) was finalized outside the dispatcher, outcome not routed",
                    message.getMessageId(), message.getType(), message.getSourceName());
                return;
            }
            try {
                message.finalizeMessage();
            } catch (RuntimeException e) {
                log.error("Finalizer failed for '{}' from {} (messageId={})",
                    message.getType(), message.getSourceName(), message.getMessageId(), e);
            }
            routeOutcome(message);
            completedCount.incrementAndGet();
        } finally {
            pendingIds.remove(message.getMessageId());
            if (inFlightCount.decrementAndGet() == 0) {
                signalIdle();
            }
        }
    }

    private void routeOutcome(Message message) {
        MessageModule sender = message.getSource() instanceof MessageModule module ? module : null;

        for (MessageError error : message.getErrors()) {
            if (!error.hasException()) {
                log.warn("Warning from {} on '{}': {}", error.source(), message.getType(), error.message());
                continue;
            }

            fatalErrorCount.incrementAndGet();
            if (sender == null) {
                log.error("Fatal error from {} on '{}': {}",
                    error.source(), message.getType(), error.message(), error.exception());
                continue;
            }
            try {
                sender.handleError(message, error);
            } catch (RuntimeException e) {
                log.error("Module {} raised error from {} on '{}'",
                    sender.moduleName(), error.source(), message.getType(), e);
            }
        }

        if (sender != null && message.hasResponses()) {
            try {
                sender.handleResponses(message);
            } catch (RuntimeException e) {
                log.error("Module {} failed handling responses to '{}'", sender.moduleName(), message.getType(), e);
            }
        }
    }

    private void signalIdle() {
        idleLock.lock();
        try {
            idle.signalAll();
        } finally {
            idleLock.unlock();
        }
    }

    private static ThreadFactory threadFactory(String prefix) {
        AtomicInteger counter = new AtomicInteger(1);
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + counter.getAndIncrement());
            thread.setDaemon(true);
            return thread;
        };
    }
}
