package com.ivamare.modulebus.model;

/**
 * Typed access to untyped message payloads.
 */
final class Payloads {

    private Payloads() {
    }

    static <T> T cast(Object data, Class<T> type, String owner) {
        if (data == null) {
            return null;
        }
        if (!type.isInstance(data)) {
            throw new ClassCastException(owner + " carries " + data.getClass().getName()
                + ", not " + type.getName());
        }
        return type.cast(data);
    }
}
