package com.questrail.brickhub.protocol.model;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Objects;

/**
 * Hub property message ($01).
 *
 * <p>
 * Travels in both directions. The driver sets, subscribes to or requests a
 * property; the hub answers a {@link #REQUEST_UPDATE} (and every update of
 * a subscribed property) with an {@link #UPSTREAM_UPDATE} carrying the
 * property value in {@link #parameters()}.
 * </p>
 */
public record HubProperties(
        int property,
        int operation,
        byte[] parameters
) implements DownstreamMessage, UpstreamMessage
{
    public static final int TYPE = 0x01;

    public static final int ADVERTISE_NAME = 0x01;
    public static final int BUTTON = 0x02;
    public static final int FW_VERSION = 0x03;
    public static final int HW_VERSION = 0x04;
    public static final int RSSI = 0x05;
    public static final int VOLTAGE_PERCENT = 0x06;
    public static final int BATTERY_TYPE = 0x07;
    public static final int MANUFACTURER = 0x08;
    public static final int RADIO_FW_VERSION = 0x09;
    public static final int WIRELESS_PROTOCOL_VERSION = 0x0A;
    public static final int SYSTEM_TYPE_ID = 0x0B;
    public static final int HW_NETWORK_ID = 0x0C;
    public static final int PRIMARY_MAC = 0x0D;
    public static final int SECONDARY_MAC = 0x0E;
    public static final int HW_NETWORK_FAMILY = 0x0F;

    public static final int SET = 0x01;
    public static final int ENABLE_UPDATES = 0x02;
    public static final int DISABLE_UPDATES = 0x03;
    public static final int RESET = 0x04;
    public static final int REQUEST_UPDATE = 0x05;
    public static final int UPSTREAM_UPDATE = 0x06;

    public HubProperties {
        parameters = (parameters == null) ? new byte[0] : parameters.clone();
    }

    /**
     * Synchronous request for the current value of {@code property}.
     */
    public static HubProperties request(int property) {
        return new HubProperties(property, REQUEST_UPDATE, new byte[0]);
    }

    /**
     * Value update as sent by the hub.
     */
    public static HubProperties update(int property, byte[] value) {
        return new HubProperties(property, UPSTREAM_UPDATE, value);
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
        return operation == REQUEST_UPDATE;
    }

    @Override
    public boolean isReplyTo(DownstreamMessage request) {
        return request instanceof HubProperties sent
                && operation == UPSTREAM_UPDATE
                && property == sent.property();
    }

    /**
     * Interprets the parameters as text, e.g. the advertised name.
     */
    public String parametersAsText() {
        return new String(parameters, StandardCharsets.UTF_8);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof HubProperties other)) return false;
        return property == other.property
                && operation == other.operation
                && Arrays.equals(parameters, other.parameters);
    }

    @Override
    public int hashCode() {
        return Objects.hash(property, operation, Arrays.hashCode(parameters));
    }

    @Override
    public String toString() {
        return String.format("HubProperties[property=0x%02x, operation=0x%02x, parameters=%s]",
                property, operation, Arrays.toString(parameters));
    }
}
