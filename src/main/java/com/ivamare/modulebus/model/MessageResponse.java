package com.ivamare.modulebus.model;

/**
 * Information a recipient sends back to the original sender of a message.
 *
 * @param source Name of the module that added the response
 * @param data The response payload (nullable)
 */
public record MessageResponse(String source, Object data) {

    public MessageResponse {
        source = source != null ? source : "";
    }

    /**
     * Read the payload as a specific type.
     *
     * @param type Expected payload type
     * @return The payload, or null if there is none
     * @throws ClassCastException if the payload is of another type
     */
    public <T> T getData(Class<T> type) {
        return Payloads.cast(data, type, "Response from " + source);
    }
}
