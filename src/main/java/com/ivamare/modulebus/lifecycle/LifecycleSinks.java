package com.ivamare.modulebus.lifecycle;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Holder for the process-wide default {@link LifecycleSink}.
 *
 * <p>Messages built without an explicit sink record to whatever is installed here
 * at construction time.
 */
public final class LifecycleSinks {

    private static final AtomicReference<LifecycleSink> DEFAULT =
        new AtomicReference<>(new Slf4jLifecycleSink());

    private LifecycleSinks() {
    }

    public static LifecycleSink defaultSink() {
        return DEFAULT.get();
    }

    /**
     * Install a new default sink.
     *
     * @param sink The sink
     * @return The previously installed sink
     */
    public static LifecycleSink setDefault(LifecycleSink sink) {
        return DEFAULT.getAndSet(Objects.requireNonNull(sink, "sink"));
    }
}
