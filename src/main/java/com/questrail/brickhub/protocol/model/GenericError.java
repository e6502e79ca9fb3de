package com.questrail.brickhub.protocol.model;

import java.util.Map;

/**
 * Generic error message ($05).
 *
 * <p>
 * Reported by the hub when a command could not be executed. The error
 * names the type byte of the failing command, which is how it is matched
 * to a pending synchronous request.
 * </p>
 */
public record GenericError(int commandType, int errorCode) implements UpstreamMessage
{
    public static final int TYPE = 0x05;

    public static final int ACK = 0x01;
    public static final int MACK = 0x02;
    public static final int BUFFER_OVERFLOW = 0x03;
    public static final int TIMEOUT = 0x04;
    public static final int COMMAND_NOT_RECOGNIZED = 0x05;
    public static final int INVALID_USE = 0x06;
    public static final int OVERCURRENT = 0x07;
    public static final int INTERNAL_ERROR = 0x08;

    private static final Map<Integer, String> DESCRIPTIONS = Map.of(
            ACK, "ACK",
            MACK, "MACK",
            BUFFER_OVERFLOW, "Buffer Overflow",
            TIMEOUT, "Timeout",
            COMMAND_NOT_RECOGNIZED, "Command NOT recognized",
            INVALID_USE, "Invalid use (e.g. parameter error(s))",
            OVERCURRENT, "Overcurrent",
            INTERNAL_ERROR, "Internal ERROR"
    );

    @Override
    public int type() {
        return TYPE;
    }

    @Override
    public boolean isReplyTo(DownstreamMessage request) {
        return request.type() == commandType;
    }

    /**
     * Human-readable error text as reported to callers.
     */
    public String message() {
        return String.format("Command 0x%02x caused error 0x%02x: %s",
                commandType, errorCode, DESCRIPTIONS.getOrDefault(errorCode, "Unknown error"));
    }

    @Override
    public String toString() {
        return "GenericError[" + message() + ']';
    }
}
