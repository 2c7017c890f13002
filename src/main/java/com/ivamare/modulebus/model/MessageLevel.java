package com.ivamare.modulebus.model;

/**
 * Conventional message levels.
 *
 * <p>Most messages are general. High-volume messages that only matter to one or two
 * modules use a higher level so uninterested modules can skip them quickly.
 */
public final class MessageLevel {

    /** General messages. The only level whose lifecycle is logged. */
    public static final int GENERAL = 1;

    /** New camera frame messages. */
    public static final int NEW_FRAME = 2;

    /** Joystick and mouse drag messages. */
    public static final int JOYSTICK = 3;

    private MessageLevel() {
    }
}
