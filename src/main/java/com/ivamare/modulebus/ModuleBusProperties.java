package com.ivamare.modulebus;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties for Module Bus.
 *
 * <p>Example configuration:
 * <pre>
 * modulebus:
 *   enabled: true
 *   message-types: ["new frame", "stage position"]
 *   dispatcher:
 *     auto-start: true
 *     concurrency: 4
 *     poll-interval-ms: 100
 *     strict-types: true
 *     shutdown-timeout: 30s
 *   lifecycle:
 *     enabled: true
 *     format: text
 * </pre>
 */
@ConfigurationProperties(prefix = "modulebus")
public class ModuleBusProperties {

    /**
     * Enable/disable Module Bus auto-configuration.
     */
    private boolean enabled = true;

    /**
     * Additional message types registered at startup. Already known types are accepted.
     */
    private List<String> messageTypes = new ArrayList<>();

    /**
     * Dispatcher configuration.
     */
    private DispatcherProperties dispatcher = new DispatcherProperties();

    /**
     * Lifecycle event logging configuration.
     */
    private LifecycleProperties lifecycle = new LifecycleProperties();

    // Getters and setters

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public List<String> getMessageTypes() {
        return messageTypes;
    }

    public void setMessageTypes(List<String> messageTypes) {
        this.messageTypes = messageTypes;
    }

    public DispatcherProperties getDispatcher() {
        return dispatcher;
    }

    public void setDispatcher(DispatcherProperties dispatcher) {
        this.dispatcher = dispatcher;
    }

    public LifecycleProperties getLifecycle() {
        return lifecycle;
    }

    public void setLifecycle(LifecycleProperties lifecycle) {
        this.lifecycle = lifecycle;
    }

    /**
     * Dispatcher configuration properties.
     */
    public static class DispatcherProperties {

        /**
         * Start the dispatcher on application ready.
         */
        private boolean autoStart = false;

        /**
         * Number of worker threads delivering to modules.
         */
        private int concurrency = 4;

        /**
         * Poll interval of the dispatch loop in milliseconds.
         */
        private int pollIntervalMs = 100;

        /**
         * Reject messages whose type was never registered.
         */
        private boolean strictTypes = true;

        /**
         * Maximum time to drain queued and in-flight messages on shutdown.
         */
        private Duration shutdownTimeout = Duration.ofSeconds(30);

        public boolean isAutoStart() {
            return autoStart;
        }

        public void setAutoStart(boolean autoStart) {
            this.autoStart = autoStart;
        }

        public int getConcurrency() {
            return concurrency;
        }

        public void setConcurrency(int concurrency) {
            this.concurrency = concurrency;
        }

        public int getPollIntervalMs() {
            return pollIntervalMs;
        }

        public void setPollIntervalMs(int pollIntervalMs) {
            this.pollIntervalMs = pollIntervalMs;
        }

        public boolean isStrictTypes() {
            return strictTypes;
        }

        public void setStrictTypes(boolean strictTypes) {
            this.strictTypes = strictTypes;
        }

        public Duration getShutdownTimeout() {
            return shutdownTimeout;
        }

        public void setShutdownTimeout(Duration shutdownTimeout) {
            this.shutdownTimeout = shutdownTimeout;
        }
    }

    /**
     * Lifecycle event logging properties.
     */
    public static class LifecycleProperties {

        /**
         * Record created/destroyed events of general messages.
         */
        private boolean enabled = true;

        /**
         * Output format of lifecycle events.
         */
        private LifecycleFormat format = LifecycleFormat.TEXT;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public LifecycleFormat getFormat() {
            return format;
        }

        public void setFormat(LifecycleFormat format) {
            this.format = format;
        }
    }

    /**
     * Output format of lifecycle events.
     */
    public enum LifecycleFormat {
        TEXT,
        JSON
    }
}
