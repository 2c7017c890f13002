package com.ivamare.modulebus.lifecycle;

/**
 * Lifecycle events recorded for general (level 1) messages.
 */
public enum LifecycleEventType {
    CREATED("created"),
    DESTROYED("destroyed");

    private final String value;

    LifecycleEventType(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static LifecycleEventType fromValue(String value) {
        for (LifecycleEventType type : values()) {
            if (type.value.equals(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown LifecycleEventType: " + value);
    }
}
