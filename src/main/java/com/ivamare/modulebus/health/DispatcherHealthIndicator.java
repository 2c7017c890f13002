package com.ivamare.modulebus.health;

import com.ivamare.modulebus.api.MessageDispatcher;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;

/**
 * Health indicator for the Module Bus dispatcher.
 *
 * <p>Reports:
 * <ul>
 *   <li>Whether the dispatcher is running</li>
 *   <li>Queued and in-flight message counts</li>
 *   <li>Completed messages and fatal recipient errors</li>
 * </ul>
 */
public class DispatcherHealthIndicator implements HealthIndicator {

    private final MessageDispatcher dispatcher;

    public DispatcherHealthIndicator(MessageDispatcher dispatcher) {
        this.dispatcher = dispatcher;
    }

    @Override
    public Health health() {
        if (dispatcher == null) {
            return Health.unknown()
                .withDetail("message", "No dispatcher configured")
                .build();
        }

        Health.Builder builder = dispatcher.isRunning() ? Health.up() : Health.down();

        return builder
            .withDetail("inFlight", dispatcher.inFlightCount())
            .withDetail("queued", dispatcher.queuedCount())
            .withDetail("completed", dispatcher.completedCount())
            .withDetail("fatalErrors", dispatcher.fatalErrorCount())
            .build();
    }
}
