package com.questrail.brickhub.protocol.model;

import java.util.Arrays;
import java.util.Objects;

/**
 * Port output command ($81).
 *
 * <p>
 * Carries a subcommand (start power, write direct mode data, ...) for the
 * peripheral on {@code port}. The command is synchronous only when it asks
 * for completion feedback; the hub then answers with a
 * {@link PortOutputFeedback} once the command completes or is discarded.
 * </p>
 */
public record PortOutput(
        int port,
        int startupAndCompletion,
        int subcommand,
        byte[] parameters
) implements DownstreamMessage
{
    public static final int TYPE = 0x81;

    public static final int STARTUP_BUFFER_IF_NEEDED = 0x00;
    public static final int STARTUP_IMMEDIATELY = 0x10;
    public static final int COMPLETION_NO_ACTION = 0x00;
    public static final int COMPLETION_FEEDBACK = 0x01;

    public static final int SUBCMD_START_POWER = 0x01;
    public static final int SUBCMD_WRITE_DIRECT_MODE_DATA = 0x51;

    public PortOutput {
        parameters = (parameters == null) ? new byte[0] : parameters.clone();
    }

    @Override
    public int type() {
        return TYPE;
    }

    @Override
    public byte[] parameters() {
        return parameters.clone();
    }

    @Override
    public boolean needsReply() {
        return (startupAndCompletion & COMPLETION_FEEDBACK) != 0;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PortOutput other)) return false;
        return port == other.port
                && startupAndCompletion == other.startupAndCompletion
                && subcommand == other.subcommand
                && Arrays.equals(parameters, other.parameters);
    }

    @Override
    public int hashCode() {
        return Objects.hash(port, startupAndCompletion, subcommand, Arrays.hashCode(parameters));
    }

    @Override
    public String toString() {
        return String.format("PortOutput[port=0x%02x, flags=0x%02x, subcommand=0x%02x, parameters=%s]",
                port, startupAndCompletion, subcommand, Arrays.toString(parameters));
    }
}
