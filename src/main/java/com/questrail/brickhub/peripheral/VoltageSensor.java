package com.questrail.brickhub.peripheral;

import com.questrail.brickhub.hub.Hub;
import com.questrail.brickhub.protocol.model.VirtualPorts;

/**
 * Hub-internal battery voltage sensor.
 */
public class VoltageSensor extends Peripheral
{
    public VoltageSensor(Hub hub, int port, VirtualPorts virtualPorts) {
        super(hub, port, virtualPorts);
    }

    @Override
    public PeripheralKind kind() {
        return PeripheralKind.VOLTAGE_SENSOR;
    }
}
