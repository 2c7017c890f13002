package com.ivamare.modulebus.model;

import com.ivamare.modulebus.exception.InvalidOperationException;
import com.ivamare.modulebus.exception.RecipientFatalException;
import com.ivamare.modulebus.lifecycle.LifecycleEvent;
import com.ivamare.modulebus.lifecycle.LifecycleEventType;
import com.ivamare.modulebus.lifecycle.LifecycleSink;
import com.ivamare.modulebus.lifecycle.LifecycleSinks;
import com.ivamare.modulebus.module.ModuleReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * A message passed between modules.
 *
 * <p>Once sent, a message travels through every recipient module. Recipients may only
 * append to its errors and responses; the payload is shared and must be treated as
 * read-only.
 *
 * <p>The dispatcher {@linkplain #retain() retains} the message once per recipient and
 * {@linkplain #release() releases} it as each recipient finishes. The caller whose release
 * brings the count to zero calls {@link #finalizeMessage()}, which records the destruction
 * event and runs the finalizer exactly once.
 *
 * <p>Example:
 * <pre>
 * Message message = Message.builder(MessageTypes.NEW_PARAMETERS_FILE, this)
 *     .data(Map.of("path", "/cfg.xml"))
 *     .finalizer(() -&gt; log.info("parameters loaded"))
 *     .build();
 * </pre>
 */
public class Message extends Envelope {

    private static final Logger log = LoggerFactory.getLogger(Message.class);

    // refCount value once finalized; no retain or release is accepted after it
    private static final int FINALIZED = -1;

    private final Object data;
    private final boolean synchronous;
    private final int level;
    private final LifecycleSink lifecycleSink;
    private final AtomicReference<Runnable> finalizer;

    private final List<MessageError> errors = new CopyOnWriteArrayList<>();
    private final List<MessageResponse> responses = new CopyOnWriteArrayList<>();

    private final AtomicInteger refCount = new AtomicInteger(0);

    protected Message(Builder builder) {
        super(builder.type, builder.source);
        this.data = builder.data;
        this.synchronous = builder.synchronous;
        this.level = builder.level;
        this.lifecycleSink = builder.lifecycleSink != null
            ? builder.lifecycleSink : LifecycleSinks.defaultSink();
        this.finalizer = new AtomicReference<>(builder.finalizer);

        if (level == MessageLevel.GENERAL) {
            recordEvent(LifecycleEventType.CREATED);
        }
    }

    /**
     * Start building a message.
     *
     * @param type The message type
     * @param source The module sending the message
     * @return A new builder
     */
    public static Builder builder(String type, ModuleReference source) {
        return new Builder(type, source);
    }

    /**
     * Create a general, asynchronous message without payload.
     */
    public static Message of(String type, ModuleReference source) {
        return builder(type, source).build();
    }

    /**
     * Create a general, asynchronous message with a payload.
     */
    public static Message of(String type, ModuleReference source, Object data) {
        return builder(type, source).data(data).build();
    }

    public Object getData() {
        return data;
    }

    /**
     * Read the payload as a specific type.
     *
     * @param type Expected payload type
     * @return The payload, or null if there is none
     * @throws ClassCastException if the payload is of another type
     */
    public <T> T getData(Class<T> type) {
        return Payloads.cast(data, type, "Message '" + getType() + "'");
    }

    public boolean isSynchronous() {
        return synchronous;
    }

    public int getLevel() {
        return level;
    }

    // --- Outcomes ---

    public void addError(MessageError error) {
        errors.add(error);
    }

    public void addResponse(MessageResponse response) {
        responses.add(response);
    }

    public List<MessageError> getErrors() {
        return List.copyOf(errors);
    }

    public List<MessageResponse> getResponses() {
        return List.copyOf(responses);
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    public boolean hasResponses() {
        return !responses.isEmpty();
    }

    public List<MessageError> getFatalErrors() {
        return errors.stream().filter(MessageError::hasException).toList();
    }

    public boolean hasFatalErrors() {
        return errors.stream().anyMatch(MessageError::hasException);
    }

    /**
     * Raise the first fatal error attached by a recipient, if any.
     *
     * <p>Meant for the sender once the message has finalized. Exceptions of further
     * fatal errors are attached as suppressed.
     *
     * @throws RecipientFatalException if any recipient attached a fatal error
     */
    public void throwIfFatal() {
        List<MessageError> fatal = getFatalErrors();
        if (fatal.isEmpty()) {
            return;
        }
        MessageError first = fatal.get(0);
        RecipientFatalException exception = new RecipientFatalException(
            getType(), first.source(), first.message(), first.exception());
        for (MessageError other : fatal.subList(1, fatal.size())) {
            exception.addSuppressed(other.exception());
        }
        throw exception;
    }

    // --- Reference counting ---

    /**
     * Account for one more recipient still processing this message.
     *
     * @return The new count
     */
    public int retain() {
        return retain(1);
    }

    /**
     * Account for several more recipients still processing this message.
     *
     * @param count Number of recipients, at least 1
     * @return The new count
     * @throws InvalidOperationException if the message was already finalized
     */
    public int retain(int count) {
        if (count < 1) {
            throw new IllegalArgumentException("count must be at least 1");
        }
        while (true) {
            int current = refCount.get();
            if (current == FINALIZED) {
                throw new InvalidOperationException("Message " + getMessageId() + " is already finalized");
            }
            if (refCount.compareAndSet(current, current + count)) {
                return current + count;
            }
        }
    }

    /**
     * Record that one recipient finished with this message.
     *
     * <p>Decrement and zero check are a single atomic step: of any number of concurrent
     * callers exactly one sees {@code true}.
     *
     * @return true if this call released the last reference and the caller must finalize
     * @throws InvalidOperationException if no reference is held or the message was finalized
     */
    public boolean release() {
        while (true) {
            int current = refCount.get();
            if (current == FINALIZED) {
                throw new InvalidOperationException("Message " + getMessageId() + " is already finalized");
            }
            if (current == 0) {
                throw new InvalidOperationException(
                    "Reference count underflow on message " + getMessageId() + " (" + getType() + ")");
            }
            if (refCount.compareAndSet(current, current - 1)) {
                return current == 1;
            }
        }
    }

    public int getRefCount() {
        return Math.max(refCount.get(), 0);
    }

    public boolean isFinalized() {
        return refCount.get() == FINALIZED;
    }

    /**
     * Finish the message once every recipient has released it.
     *
     * <p>Records the destruction event for general messages, then runs the finalizer.
     * The finalizer is dropped afterwards.
     *
     * @throws InvalidOperationException if recipients are still pending or the message
     *         was already finalized
     */
    public void finalizeMessage() {
        while (!refCount.compareAndSet(0, FINALIZED)) {
            int current = refCount.get();
            if (current == FINALIZED) {
                throw new InvalidOperationException("Message " + getMessageId() + " is already finalized");
            }
            if (current > 0) {
                throw new InvalidOperationException(
                    "Message " + getMessageId() + " still has " + current + " pending recipients");
            }
        }

        if (level == MessageLevel.GENERAL) {
            recordEvent(LifecycleEventType.DESTROYED);
        }

        Runnable callback = finalizer.getAndSet(null);
        if (callback != null) {
            callback.run();
        }
    }

    private void recordEvent(LifecycleEventType eventType) {
        try {
            lifecycleSink.record(new LifecycleEvent(eventType, getMessageId(), getSourceName(), getType()));
        } catch (RuntimeException e) {
            log.warn("Lifecycle sink failed to record {} for message {}", eventType.getValue(), getMessageId(), e);
        }
    }

    @Override
    public String toString() {
        return "Message{messageId=" + getMessageId()
            + ", type=" + getType()
            + ", source=" + getSourceName()
            + ", synchronous=" + synchronous
            + ", level=" + level
            + ", refCount=" + getRefCount()
            + ", finalized=" + isFinalized()
            + '}';
    }

    /**
     * Builder for {@link Message}.
     */
    public static final class Builder {
        private final String type;
        private final ModuleReference source;
        private Object data;
        private boolean synchronous;
        private int level = MessageLevel.GENERAL;
        private Runnable finalizer;
        private LifecycleSink lifecycleSink;

        private Builder(String type, ModuleReference source) {
            this.type = type;
            this.source = source;
        }

        /**
         * Set the payload, usually a map or a parameters object.
         *
         * <p>Optional. Defaults to no payload.
         *
         * @param data The payload
         * @return this builder
         */
        public Builder data(Object data) {
            this.data = data;
            return this;
        }

        /**
         * Whether every message sent before this one must finish before it is delivered,
         * and it must finish before any later message is delivered.
         *
         * <p>Optional. Defaults to false.
         *
         * @param synchronous The barrier flag
         * @return this builder
         */
        public Builder synchronous(boolean synchronous) {
            this.synchronous = synchronous;
            return this;
        }

        /**
         * Set the message level.
         *
         * <p>Optional. Defaults to {@link MessageLevel#GENERAL}.
         *
         * @param level The level
         * @return this builder
         */
        public Builder level(int level) {
            this.level = level;
            return this;
        }

        /**
         * Set a callback to run once every module has processed the message.
         *
         * <p>Optional.
         *
         * @param finalizer The callback
         * @return this builder
         */
        public Builder finalizer(Runnable finalizer) {
            this.finalizer = finalizer;
            return this;
        }

        /**
         * Set the sink for lifecycle events.
         *
         * <p>Optional. Defaults to {@link LifecycleSinks#defaultSink()}.
         *
         * @param lifecycleSink The sink
         * @return this builder
         */
        public Builder lifecycleSink(LifecycleSink lifecycleSink) {
            this.lifecycleSink = lifecycleSink;
            return this;
        }

        public Message build() {
            return new Message(this);
        }
    }
}
