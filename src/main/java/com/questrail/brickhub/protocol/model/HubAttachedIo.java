package com.questrail.brickhub.protocol.model;

import java.util.Optional;

/**
 * Attached I/O notification ($04).
 *
 * <p>
 * Reports a peripheral appearing on, or disappearing from, a port.
 * </p>
 *
 * <ul>
 *   <li>{@link #EVENT_ATTACHED} carries the device type and the hardware
 *       and software revisions of the peripheral.</li>
 *   <li>{@link #EVENT_ATTACHED_VIRTUAL} carries the device type and the two
 *       physical ports merged into the virtual port.</li>
 *   <li>{@link #EVENT_DETACHED} carries only the port.</li>
 * </ul>
 *
 * <p>Fields that an event does not carry are zero ({@code virtualPair} is
 * {@code null}).</p>
 */
public record HubAttachedIo(
        int port,
        int event,
        int deviceType,
        int hardwareRevision,
        int softwareRevision,
        VirtualPorts virtualPair
) implements UpstreamMessage
{
    public static final int TYPE = 0x04;

    public static final int EVENT_DETACHED = 0x00;
    public static final int EVENT_ATTACHED = 0x01;
    public static final int EVENT_ATTACHED_VIRTUAL = 0x02;

    public static final int DEV_MOTOR = 0x0001;
    public static final int DEV_SYSTEM_TRAIN_MOTOR = 0x0002;
    public static final int DEV_BUTTON = 0x0005;
    public static final int DEV_LED_LIGHT = 0x0008;
    public static final int DEV_VOLTAGE = 0x0014;
    public static final int DEV_CURRENT = 0x0015;
    public static final int DEV_PIEZO_SOUND = 0x0016;
    public static final int DEV_RGB_LIGHT = 0x0017;
    public static final int DEV_TILT_EXTERNAL = 0x0022;
    public static final int DEV_MOTION_SENSOR = 0x0023;
    public static final int DEV_VISION_SENSOR = 0x0025;
    public static final int DEV_MOTOR_EXTERNAL_TACHO = 0x0026;
    public static final int DEV_MOTOR_INTERNAL_TACHO = 0x0027;
    public static final int DEV_TILT_INTERNAL = 0x0028;

    public HubAttachedIo {
        if (event < EVENT_DETACHED || event > EVENT_ATTACHED_VIRTUAL) {
            throw new IllegalArgumentException("Unknown attachment event: " + event);
        }
        if (event == EVENT_ATTACHED_VIRTUAL && virtualPair == null) {
            throw new IllegalArgumentException("Virtual attachment requires a port pair");
        }
        if (event != EVENT_ATTACHED_VIRTUAL && virtualPair != null) {
            throw new IllegalArgumentException("Only virtual attachments carry a port pair");
        }
    }

    public static HubAttachedIo attached(int port, int deviceType, int hardwareRevision, int softwareRevision) {
        return new HubAttachedIo(port, EVENT_ATTACHED, deviceType, hardwareRevision, softwareRevision, null);
    }

    public static HubAttachedIo attachedVirtual(int port, int deviceType, VirtualPorts pair) {
        return new HubAttachedIo(port, EVENT_ATTACHED_VIRTUAL, deviceType, 0, 0, pair);
    }

    public static HubAttachedIo detached(int port) {
        return new HubAttachedIo(port, EVENT_DETACHED, 0, 0, 0, null);
    }

    @Override
    public int type() {
        return TYPE;
    }

    public boolean isDetach() {
        return event == EVENT_DETACHED;
    }

    public Optional<VirtualPorts> virtualPorts() {
        return Optional.ofNullable(virtualPair);
    }

    @Override
    public String toString() {
        return switch (event) {
            case EVENT_DETACHED -> String.format("HubAttachedIo[port=0x%02x, detached]", port);
            case EVENT_ATTACHED_VIRTUAL -> String.format("HubAttachedIo[port=0x%02x, virtual, device=0x%04x, %s]",
                    port, deviceType, virtualPair);
            default -> String.format("HubAttachedIo[port=0x%02x, attached, device=0x%04x]", port, deviceType);
        };
    }
}
