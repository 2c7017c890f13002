package com.ivamare.modulebus.model;

import com.ivamare.modulebus.lifecycle.LifecycleSink;
import com.ivamare.modulebus.module.ModuleReference;
import com.ivamare.modulebus.registry.MessageTypes;

/**
 * A message whose only purpose is to hold up the queue until everything sent
 * before it has been processed. Use sparingly.
 */
public class SyncMessage extends Message {

    public SyncMessage(ModuleReference source) {
        this(source, null);
    }

    public SyncMessage(ModuleReference source, LifecycleSink lifecycleSink) {
        super(Message.builder(MessageTypes.SYNC, source)
            .synchronous(true)
            .lifecycleSink(lifecycleSink));
    }
}
