package com.questrail.brickhub.peripheral;

import com.questrail.brickhub.hub.Hub;
import com.questrail.brickhub.protocol.model.PortOutput;
import com.questrail.brickhub.protocol.model.VirtualPorts;

/**
 * Plain motor without a rotation sensor.
 */
public class Motor extends Peripheral
{
    public static final int MAX_POWER = 100;

    public Motor(Hub hub, int port, VirtualPorts virtualPorts) {
        super(hub, port, virtualPorts);
    }

    @Override
    public PeripheralKind kind() {
        return PeripheralKind.MOTOR;
    }

    /**
     * Runs the motor at a constant power without waiting for the hub.
     *
     * @param power -100 (full reverse) to 100 (full forward); 0 floats the motor
     */
    public void startPower(int power) {
        if (power < -MAX_POWER || power > MAX_POWER) {
            throw new IllegalArgumentException("power must be between -100 and 100: " + power);
        }
        hub().send(new PortOutput(
                port(),
                PortOutput.STARTUP_IMMEDIATELY | PortOutput.COMPLETION_NO_ACTION,
                PortOutput.SUBCMD_START_POWER,
                new byte[] { (byte) power }));
    }
}
