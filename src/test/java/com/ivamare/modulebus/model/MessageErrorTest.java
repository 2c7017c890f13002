package com.ivamare.modulebus.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("MessageError")
class MessageErrorTest {

    @Test
    @DisplayName("should create warning without exception")
    void shouldCreateWarning() {
        MessageError error = MessageError.warning("stage", "position out of range");

        assertEquals("stage", error.source());
        assertEquals("position out of range", error.message());
        assertNull(error.getException());
        assertFalse(error.hasException());
    }

    @Test
    @DisplayName("should create fatal error with exception")
    void shouldCreateFatalError() {
        IllegalStateException cause = new IllegalStateException("camera offline");

        MessageError error = MessageError.fatal("camera1", "cannot start", cause);

        assertSame(cause, error.getException());
        assertTrue(error.hasException());
    }

    @Test
    @DisplayName("should require exception for fatal error")
    void shouldRequireExceptionForFatalError() {
        assertThrows(IllegalArgumentException.class, () -> MessageError.fatal("camera1", "cannot start", null));
    }

    @Test
    @DisplayName("should default missing source and message to empty")
    void shouldDefaultMissingFields() {
        MessageError error = new MessageError(null, null, null);

        assertEquals("", error.source());
        assertEquals("", error.message());
    }
}
