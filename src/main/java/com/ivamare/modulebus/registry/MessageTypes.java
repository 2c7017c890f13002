package com.ivamare.modulebus.registry;

import java.util.List;

/**
 * Built-in message types and the process-wide type registry.
 */
public final class MessageTypes {

    public static final String ADD_TO_UI = "add to ui";
    public static final String CLOSE_EVENT = "close event";
    public static final String CONFIGURE1 = "configure1";
    public static final String CONFIGURE2 = "configure2";
    public static final String CURRENT_PARAMETERS = "current parameters";
    public static final String MODULE = "module";
    public static final String NEW_DIRECTORY = "new directory";
    public static final String NEW_PARAMETERS_FILE = "new parameters file";
    public static final String NEW_SHUTTERS_FILE = "new shutters file";
    public static final String START = "start";
    public static final String SYNC = "sync";

    /**
     * Types every registry starts with.
     */
    public static final List<String> BUILT_IN = List.of(
        ADD_TO_UI,
        CLOSE_EVENT,
        CONFIGURE1,
        CONFIGURE2,
        CURRENT_PARAMETERS,
        MODULE,
        NEW_DIRECTORY,
        NEW_PARAMETERS_FILE,
        NEW_SHUTTERS_FILE,
        START,
        SYNC
    );

    private static final MessageTypeRegistry GLOBAL = new DefaultMessageTypeRegistry();

    private MessageTypes() {
    }

    /**
     * The registry shared by the whole process. Modules add their own types to it
     * while initializing.
     *
     * @return The process-wide registry
     */
    public static MessageTypeRegistry global() {
        return GLOBAL;
    }
}
