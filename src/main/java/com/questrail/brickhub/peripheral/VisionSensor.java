package com.questrail.brickhub.peripheral;

import com.questrail.brickhub.hub.Hub;
import com.questrail.brickhub.protocol.model.VirtualPorts;

/**
 * Color and distance sensor.
 */
public class VisionSensor extends Peripheral
{
    public VisionSensor(Hub hub, int port, VirtualPorts virtualPorts) {
        super(hub, port, virtualPorts);
    }

    @Override
    public PeripheralKind kind() {
        return PeripheralKind.VISION_SENSOR;
    }
}
