package com.ivamare.modulebus.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("MessageResponse")
class MessageResponseTest {

    @Test
    @DisplayName("should expose source and data")
    void shouldExposeSourceAndData() {
        Map<String, Object> data = Map.of("exposure", 100);

        MessageResponse response = new MessageResponse("camera1", data);

        assertEquals("camera1", response.source());
        assertSame(data, response.data());
        assertEquals(data, response.getData(Map.class));
    }

    @Test
    @DisplayName("should allow missing data")
    void shouldAllowMissingData() {
        MessageResponse response = new MessageResponse(null, null);

        assertEquals("", response.source());
        assertNull(response.getData(String.class));
    }

    @Test
    @DisplayName("should fail on data of another type")
    void shouldFailOnDataOfAnotherType() {
        MessageResponse response = new MessageResponse("camera1", "text");

        ClassCastException exception = assertThrows(ClassCastException.class,
            () -> response.getData(Integer.class));
        assertEquals("Response from camera1 carries java.lang.String, not java.lang.Integer",
            exception.getMessage());
    }
}
