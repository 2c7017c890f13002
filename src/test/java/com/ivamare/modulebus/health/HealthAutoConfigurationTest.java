package com.ivamare.modulebus.health;

import com.ivamare.modulebus.api.MessageDispatcher;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;

@DisplayName("HealthAutoConfiguration")
class HealthAutoConfigurationTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
        .withConfiguration(AutoConfigurations.of(HealthAutoConfiguration.class));

    @Test
    @DisplayName("should create DispatcherHealthIndicator when a dispatcher exists")
    void shouldCreateHealthIndicatorWhenDispatcherExists() {
        contextRunner
            .withUserConfiguration(MockDispatcherConfig.class)
            .run(context -> {
                assertThat(context).hasSingleBean(DispatcherHealthIndicator.class);
            });
    }

    @Test
    @DisplayName("should not create DispatcherHealthIndicator without a dispatcher")
    void shouldNotCreateHealthIndicatorWithoutDispatcher() {
        contextRunner.run(context -> {
            assertThat(context).doesNotHaveBean(DispatcherHealthIndicator.class);
        });
    }

    @Test
    @DisplayName("should not create DispatcherHealthIndicator when disabled")
    void shouldNotCreateHealthIndicatorWhenDisabled() {
        contextRunner
            .withUserConfiguration(MockDispatcherConfig.class)
            .withPropertyValues("modulebus.enabled=false")
            .run(context -> {
                assertThat(context).doesNotHaveBean(DispatcherHealthIndicator.class);
            });
    }

    @Test
    @DisplayName("should not create duplicate health indicator if one exists")
    void shouldNotCreateDuplicateHealthIndicator() {
        contextRunner
            .withUserConfiguration(MockDispatcherConfig.class, CustomHealthIndicatorConfig.class)
            .run(context -> {
                assertThat(context).hasSingleBean(DispatcherHealthIndicator.class);
                assertThat(context.getBean(DispatcherHealthIndicator.class))
                    .isSameAs(CustomHealthIndicatorConfig.CUSTOM_INDICATOR);
            });
    }

    @Configuration
    static class MockDispatcherConfig {
        @Bean
        public MessageDispatcher messageDispatcher() {
            return mock(MessageDispatcher.class);
        }
    }

    @Configuration
    static class CustomHealthIndicatorConfig {
        static final DispatcherHealthIndicator CUSTOM_INDICATOR = new DispatcherHealthIndicator(null);

        @Bean
        public DispatcherHealthIndicator dispatcherHealthIndicator() {
            return CUSTOM_INDICATOR;
        }
    }
}
