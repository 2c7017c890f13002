package com.ivamare.modulebus.health;

import com.ivamare.modulebus.ModuleBusAutoConfiguration;
import com.ivamare.modulebus.api.MessageDispatcher;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;

/**
 * Auto-configuration for Module Bus health indicators.
 */
@AutoConfiguration(after = ModuleBusAutoConfiguration.class)
@ConditionalOnClass(HealthIndicator.class)
@ConditionalOnProperty(prefix = "modulebus", name = "enabled", havingValue = "true", matchIfMissing = true)
public class HealthAutoConfiguration {

    @Bean
    @ConditionalOnBean(MessageDispatcher.class)
    @ConditionalOnMissingBean(DispatcherHealthIndicator.class)
    public DispatcherHealthIndicator dispatcherHealthIndicator(MessageDispatcher dispatcher) {
        return new DispatcherHealthIndicator(dispatcher);
    }
}
