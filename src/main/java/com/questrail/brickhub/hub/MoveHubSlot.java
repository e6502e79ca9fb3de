package com.questrail.brickhub.hub;

import java.util.Arrays;
import java.util.Optional;

/**
 * Named accessors of a {@link MoveHub}.
 *
 * <p>
 * Slots with a fixed port are bound by port. {@link #VISION_SENSOR} and
 * {@link #EXTERNAL_MOTOR} have no fixed port and are bound by the
 * capability of whatever is attached to port C or D.
 * </p>
 */
public enum MoveHubSlot
{
    MOTOR_A(MoveHub.PORT_A, true),
    MOTOR_B(MoveHub.PORT_B, true),
    MOTOR_AB(MoveHub.PORT_AB, true),
    PORT_C(MoveHub.PORT_C, false),
    PORT_D(MoveHub.PORT_D, false),
    LED(MoveHub.PORT_LED, true),
    TILT_SENSOR(MoveHub.PORT_TILT_SENSOR, true),
    CURRENT(MoveHub.PORT_CURRENT, true),
    VOLTAGE(MoveHub.PORT_VOLTAGE, true),
    VISION_SENSOR(-1, false),
    EXTERNAL_MOTOR(-1, false);

    private final int port;
    private final boolean builtIn;

    MoveHubSlot(int port, boolean builtIn) {
        this.port = port;
        this.builtIn = builtIn;
    }

    /**
     * @return the fixed port of this slot, if it has one
     */
    public Optional<Integer> fixedPort() {
        return port < 0 ? Optional.empty() : Optional.of(port);
    }

    /**
     * @return {@code true} for peripherals that are part of the hub itself
     *         and are expected to appear at startup
     */
    public boolean isBuiltIn() {
        return builtIn;
    }

    static Optional<MoveHubSlot> forPort(int port) {
        return Arrays.stream(values()).filter(slot -> slot.port == port).findFirst();
    }
}
