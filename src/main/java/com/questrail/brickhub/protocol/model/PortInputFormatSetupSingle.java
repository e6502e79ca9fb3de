package com.questrail.brickhub.protocol.model;

/**
 * Port input format setup, single mode ($41).
 *
 * <p>
 * Selects the sensor mode of a port and whether value notifications are
 * sent whenever the value changes by more than {@code deltaInterval}.
 * The hub confirms with a {@link PortInputFormatSingle} for the same port.
 * </p>
 */
public record PortInputFormatSetupSingle(
        int port,
        int mode,
        long deltaInterval,
        boolean notificationsEnabled
) implements DownstreamMessage
{
    public static final int TYPE = 0x41;

    public PortInputFormatSetupSingle {
        if (deltaInterval < 0 || deltaInterval > 0xFFFFFFFFL) {
            throw new IllegalArgumentException("deltaInterval must fit an unsigned 32-bit value");
        }
    }

    @Override
    public int type() {
        return TYPE;
    }

    @Override
    public boolean needsReply() {
        return true;
    }
}
