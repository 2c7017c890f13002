package com.ivamare.modulebus;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ModuleBusProperties")
class ModuleBusPropertiesTest {

    @Test
    @DisplayName("should have default values")
    void shouldHaveDefaultValues() {
        ModuleBusProperties properties = new ModuleBusProperties();

        assertTrue(properties.isEnabled());
        assertTrue(properties.getMessageTypes().isEmpty());

        ModuleBusProperties.DispatcherProperties dispatcher = properties.getDispatcher();
        assertFalse(dispatcher.isAutoStart());
        assertEquals(4, dispatcher.getConcurrency());
        assertEquals(100, dispatcher.getPollIntervalMs());
        assertTrue(dispatcher.isStrictTypes());
        assertEquals(Duration.ofSeconds(30), dispatcher.getShutdownTimeout());

        ModuleBusProperties.LifecycleProperties lifecycle = properties.getLifecycle();
        assertTrue(lifecycle.isEnabled());
        assertEquals(ModuleBusProperties.LifecycleFormat.TEXT, lifecycle.getFormat());
    }

    @Test
    @DisplayName("should set message types")
    void shouldSetMessageTypes() {
        ModuleBusProperties properties = new ModuleBusProperties();
        properties.setMessageTypes(List.of("new frame"));

        assertEquals(List.of("new frame"), properties.getMessageTypes());
    }

    @Test
    @DisplayName("should set dispatcher properties")
    void shouldSetDispatcherProperties() {
        ModuleBusProperties properties = new ModuleBusProperties();
        ModuleBusProperties.DispatcherProperties dispatcher = new ModuleBusProperties.DispatcherProperties();
        dispatcher.setAutoStart(true);
        dispatcher.setConcurrency(8);
        dispatcher.setPollIntervalMs(20);
        dispatcher.setStrictTypes(false);
        dispatcher.setShutdownTimeout(Duration.ofSeconds(5));
        properties.setDispatcher(dispatcher);

        assertTrue(properties.getDispatcher().isAutoStart());
        assertEquals(8, properties.getDispatcher().getConcurrency());
        assertEquals(20, properties.getDispatcher().getPollIntervalMs());
        assertFalse(properties.getDispatcher().isStrictTypes());
        assertEquals(Duration.ofSeconds(5), properties.getDispatcher().getShutdownTimeout());
    }

    @Test
    @DisplayName("should set lifecycle properties")
    void shouldSetLifecycleProperties() {
        ModuleBusProperties properties = new ModuleBusProperties();
        properties.getLifecycle().setEnabled(false);
        properties.getLifecycle().setFormat(ModuleBusProperties.LifecycleFormat.JSON);

        assertFalse(properties.getLifecycle().isEnabled());
        assertEquals(ModuleBusProperties.LifecycleFormat.JSON, properties.getLifecycle().getFormat());
    }
}
