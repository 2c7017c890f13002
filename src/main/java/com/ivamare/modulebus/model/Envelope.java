package com.ivamare.modulebus.model;

import com.ivamare.modulebus.module.ModuleReference;

import java.util.Objects;
import java.util.UUID;

/**
 * Common part of every message: identity, type and the module that sent it.
 *
 * <p>The source module is only referenced, the envelope does not control its lifetime.
 */
public abstract class Envelope {

    private final UUID messageId;
    private final String type;
    private final ModuleReference source;

    protected Envelope(String type, ModuleReference source) {
        if (type == null || type.isBlank()) {
            throw new IllegalArgumentException("type is required");
        }
        this.messageId = UUID.randomUUID();
        this.type = type;
        this.source = Objects.requireNonNull(source, "source");
    }

    public UUID getMessageId() {
        return messageId;
    }

    public String getType() {
        return type;
    }

    public ModuleReference getSource() {
        return source;
    }

    public String getSourceName() {
        return source.moduleName();
    }
}
