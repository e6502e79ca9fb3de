package com.questrail.brickhub.peripheral;

import com.questrail.brickhub.hub.Hub;
import com.questrail.brickhub.protocol.model.VirtualPorts;

/**
 * Tilt sensor, either built into the hub or external.
 */
public class TiltSensor extends Peripheral
{
    public TiltSensor(Hub hub, int port, VirtualPorts virtualPorts) {
        super(hub, port, virtualPorts);
    }

    @Override
    public PeripheralKind kind() {
        return PeripheralKind.TILT_SENSOR;
    }
}
