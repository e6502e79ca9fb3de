package com.questrail.brickhub.peripheral;

import com.questrail.brickhub.hub.Hub;
import com.questrail.brickhub.protocol.model.VirtualPorts;

/**
 * Hub-internal current sensor.
 */
public class CurrentSensor extends Peripheral
{
    public CurrentSensor(Hub hub, int port, VirtualPorts virtualPorts) {
        super(hub, port, virtualPorts);
    }

    @Override
    public PeripheralKind kind() {
        return PeripheralKind.CURRENT_SENSOR;
    }
}
