package com.questrail.brickhub.protocol.model;

/**
 * Hub action message ($02).
 *
 * <p>
 * Downstream actions ask the hub to switch off, disconnect, or toggle
 * port power. {@link #SWITCH_OFF} and {@link #DISCONNECT} are
 * acknowledged by the hub with {@link #UPSTREAM_SHUTDOWN} and
 * {@link #UPSTREAM_DISCONNECT} respectively; the hub may also send those
 * on its own, e.g. when the button is held down.
 * </p>
 */
public record HubAction(int action) implements DownstreamMessage, UpstreamMessage
{
    public static final int TYPE = 0x02;

    public static final int SWITCH_OFF = 0x01;
    public static final int DISCONNECT = 0x02;
    public static final int VCC_PORT_CONTROL_ON = 0x03;
    public static final int VCC_PORT_CONTROL_OFF = 0x04;
    public static final int BUSY_INDICATION_ON = 0x05;
    public static final int BUSY_INDICATION_OFF = 0x06;
    public static final int SHUTDOWN = 0x2F;

    public static final int UPSTREAM_SHUTDOWN = 0x30;
    public static final int UPSTREAM_DISCONNECT = 0x31;
    public static final int UPSTREAM_BOOT_MODE = 0x32;

    @Override
    public int type() {
        return TYPE;
    }

    @Override
    public boolean needsReply() {
        return action == SWITCH_OFF || action == DISCONNECT;
    }

    @Override
    public boolean isReplyTo(DownstreamMessage request) {
        if (!(request instanceof HubAction sent)) {
            return false;
        }
        return (sent.action() == SWITCH_OFF && action == UPSTREAM_SHUTDOWN)
                || (sent.action() == DISCONNECT && action == UPSTREAM_DISCONNECT);
    }

    @Override
    public String toString() {
        return String.format("HubAction[action=0x%02x]", action);
    }
}
