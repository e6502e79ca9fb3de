package com.questrail.brickhub.protocol.codec;

import com.questrail.brickhub.protocol.model.*;

import java.util.Objects;

/**
 * HubMessageEncoder
 * ============================================================================
 * Converts a semantic {@link HubMessage} into the bytes written to the hub.
 *
 * <p>
 * Downstream messages are what the engine writes. Upstream messages are
 * encodable too, so that simulators, bridges and tests can produce exactly
 * the frames a hub would send.
 * </p>
 */
public final class HubMessageEncoder
{
    public byte[] encode(HubMessage message) {
        Objects.requireNonNull(message, "message");
        return HubFraming.wrap(new HubFrame(HubFraming.DEFAULT_HUB_ID, message.type(), payloadOf(message)));
    }

    private static byte[] payloadOf(HubMessage message) {
        if (message instanceof HubProperties properties) {
            byte[] parameters = properties.parameters();
            byte[] out = new byte[2 + parameters.length];
            out[0] = (byte) properties.property();
            out[1] = (byte) properties.operation();
            System.arraycopy(parameters, 0, out, 2, parameters.length);
            return out;
        }
        if (message instanceof HubAction action) {
            return new byte[] { (byte) action.action() };
        }
        if (message instanceof HubAlert alert) {
            if (alert.operation() == HubAlert.UPSTREAM_UPDATE) {
                return new byte[] { (byte) alert.alert(), (byte) alert.operation(), (byte) alert.status() };
            }
            return new byte[] { (byte) alert.alert(), (byte) alert.operation() };
        }
        if (message instanceof HubAttachedIo attached) {
            return encodeAttachedIo(attached);
        }
        if (message instanceof GenericError error) {
            return new byte[] { (byte) error.commandType(), (byte) error.errorCode() };
        }
        if (message instanceof PortData data) {
            byte[] value = data.value();
            byte[] out = new byte[1 + value.length];
            out[0] = (byte) data.port();
            System.arraycopy(value, 0, out, 1, value.length);
            return out;
        }
        if (message instanceof PortInputFormatSetupSingle setup) {
            return encodeInputFormat(setup.port(), setup.mode(), setup.deltaInterval(), setup.notificationsEnabled());
        }
        if (message instanceof PortInputFormatSingle format) {
            return encodeInputFormat(format.port(), format.mode(), format.deltaInterval(), format.notificationsEnabled());
        }
        if (message instanceof PortOutput output) {
            byte[] parameters = output.parameters();
            byte[] out = new byte[3 + parameters.length];
            out[0] = (byte) output.port();
            out[1] = (byte) output.startupAndCompletion();
            out[2] = (byte) output.subcommand();
            System.arraycopy(parameters, 0, out, 3, parameters.length);
            return out;
        }
        if (message instanceof PortOutputFeedback feedback) {
            return new byte[] { (byte) feedback.port(), (byte) feedback.status() };
        }
        throw new IllegalArgumentException("Unsupported message: " + message);
    }

    private static byte[] encodeAttachedIo(HubAttachedIo attached) {
        switch (attached.event()) {
            case HubAttachedIo.EVENT_DETACHED:
                return new byte[] { (byte) attached.port(), (byte) attached.event() };
            case HubAttachedIo.EVENT_ATTACHED: {
                byte[] out = new byte[12];
                out[0] = (byte) attached.port();
                out[1] = (byte) attached.event();
                HubBytes.putU16(out, 2, attached.deviceType());
                HubBytes.putU32(out, 4, attached.hardwareRevision() & 0xFFFFFFFFL);
                HubBytes.putU32(out, 8, attached.softwareRevision() & 0xFFFFFFFFL);
                return out;
            }
            default: {
                byte[] out = new byte[6];
                out[0] = (byte) attached.port();
                out[1] = (byte) attached.event();
                HubBytes.putU16(out, 2, attached.deviceType());
                out[4] = (byte) attached.virtualPair().first();
                out[5] = (byte) attached.virtualPair().second();
                return out;
            }
        }
    }

    private static byte[] encodeInputFormat(int port, int mode, long deltaInterval, boolean enabled) {
        byte[] out = new byte[7];
        out[0] = (byte) port;
        out[1] = (byte) mode;
        HubBytes.putU32(out, 2, deltaInterval);
        out[6] = (byte) (enabled ? 0x01 : 0x00);
        return out;
    }
}
