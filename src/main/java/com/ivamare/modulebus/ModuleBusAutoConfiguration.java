package com.ivamare.modulebus;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ivamare.modulebus.api.MessageDispatcher;
import com.ivamare.modulebus.lifecycle.JsonLifecycleSink;
import com.ivamare.modulebus.lifecycle.LifecycleSink;
import com.ivamare.modulebus.lifecycle.LifecycleSinks;
import com.ivamare.modulebus.lifecycle.Slf4jLifecycleSink;
import com.ivamare.modulebus.module.ModuleRegistry;
import com.ivamare.modulebus.module.impl.DefaultModuleRegistry;
import com.ivamare.modulebus.registry.MessageTypeRegistry;
import com.ivamare.modulebus.registry.MessageTypes;
import org.springframework.beans.factory.InitializingBean;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;

/**
 * Auto-configuration for Module Bus.
 *
 * <p>Automatically configures:
 * <ul>
 *   <li>Message Type Registry (process-wide, plus configured types)</li>
 *   <li>Lifecycle Sink (installed as the process default)</li>
 *   <li>Module Registry (discovers MessageModule beans)</li>
 *   <li>Message Dispatcher</li>
 * </ul>
 *
 * <p>To disable auto-configuration:
 * <pre>
 * modulebus.enabled=false
 * </pre>
 */
@AutoConfiguration
@ConditionalOnProperty(prefix = "modulebus", name = "enabled", havingValue = "true", matchIfMissing = true)
@EnableConfigurationProperties(ModuleBusProperties.class)
@Import(DispatcherAutoStartConfiguration.class)
public class ModuleBusAutoConfiguration {

    // --- Object Mapper ---

    @Bean
    @ConditionalOnMissingBean
    public ObjectMapper moduleBusObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.findAndRegisterModules();
        return mapper;
    }

    // --- Message Types ---

    @Bean
    @ConditionalOnMissingBean
    public MessageTypeRegistry messageTypeRegistry(ModuleBusProperties properties) {
        MessageTypeRegistry registry = MessageTypes.global();
        properties.getMessageTypes().forEach(type -> registry.register(type, false));
        return registry;
    }

    // --- Lifecycle ---

    @Bean
    @ConditionalOnMissingBean
    public LifecycleSink lifecycleSink(ModuleBusProperties properties, ObjectMapper objectMapper) {
        ModuleBusProperties.LifecycleProperties lifecycle = properties.getLifecycle();
        if (!lifecycle.isEnabled()) {
            return LifecycleSink.NOOP;
        }
        return switch (lifecycle.getFormat()) {
            case JSON -> new JsonLifecycleSink(objectMapper);
            case TEXT -> new Slf4jLifecycleSink();
        };
    }

    @Bean
    public InitializingBean lifecycleSinkInstaller(LifecycleSink lifecycleSink) {
        return () -> LifecycleSinks.setDefault(lifecycleSink);
    }

    // --- Module Registry ---

    @Bean
    @ConditionalOnMissingBean(ModuleRegistry.class)
    public static DefaultModuleRegistry moduleRegistry() {
        return new DefaultModuleRegistry();
    }

    // --- Dispatcher ---

    @Bean(destroyMethod = "stopNow")
    @ConditionalOnMissingBean
    public MessageDispatcher messageDispatcher(
            ModuleRegistry moduleRegistry,
            MessageTypeRegistry messageTypeRegistry,
            ModuleBusProperties properties) {
        ModuleBusProperties.DispatcherProperties dp = properties.getDispatcher();
        return MessageDispatcher.builder()
            .moduleRegistry(moduleRegistry)
            .messageTypeRegistry(messageTypeRegistry)
            .concurrency(dp.getConcurrency())
            .pollIntervalMs(dp.getPollIntervalMs())
            .strictTypes(dp.isStrictTypes())
            .build();
    }
}
