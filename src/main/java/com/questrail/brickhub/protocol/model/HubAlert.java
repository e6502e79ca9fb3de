package com.questrail.brickhub.protocol.model;

/**
 * Hub alert message ($03).
 *
 * <p>
 * The driver enables, disables or requests an alert; the hub answers with
 * an {@link #UPSTREAM_UPDATE} carrying the alert status. Status
 * {@code 0x00} means the alert condition is not present.
 * </p>
 *
 * <p>The status byte is only transmitted for upstream updates.</p>
 */
public record HubAlert(
        int alert,
        int operation,
        int status
) implements DownstreamMessage, UpstreamMessage
{
    public static final int TYPE = 0x03;

    public static final int LOW_VOLTAGE = 0x01;
    public static final int HIGH_CURRENT = 0x02;
    public static final int LOW_SIGNAL = 0x03;
    public static final int OVER_POWER = 0x04;

    public static final int ENABLE_UPDATES = 0x01;
    public static final int DISABLE_UPDATES = 0x02;
    public static final int REQUEST_UPDATE = 0x03;
    public static final int UPSTREAM_UPDATE = 0x04;

    public static final int STATUS_OK = 0x00;
    public static final int STATUS_ALERT = 0xFF;

    public static HubAlert request(int alert) {
        return new HubAlert(alert, REQUEST_UPDATE, STATUS_OK);
    }

    public static HubAlert update(int alert, int status) {
        return new HubAlert(alert, UPSTREAM_UPDATE, status);
    }

    @Override
    public int type() {
        return TYPE;
    }

    @Override
    public boolean needsReply() {
        return operation == REQUEST_UPDATE;
    }

    @Override
    public boolean isReplyTo(DownstreamMessage request) {
        return request instanceof HubAlert sent
                && operation == UPSTREAM_UPDATE
                && alert == sent.alert();
    }

    public boolean isOk() {
        return status == STATUS_OK;
    }

    @Override
    public String toString() {
        return String.format("HubAlert[alert=0x%02x, operation=0x%02x, status=0x%02x]",
                alert, operation, status);
    }
}
