package com.questrail.brickhub.peripheral;

import com.questrail.brickhub.hub.Hub;
import com.questrail.brickhub.protocol.model.VirtualPorts;

/**
 * Motor with a built-in tachometer, internal or external.
 */
public class EncodedMotor extends Motor
{
    public EncodedMotor(Hub hub, int port, VirtualPorts virtualPorts) {
        super(hub, port, virtualPorts);
    }

    @Override
    public PeripheralKind kind() {
        return PeripheralKind.ENCODED_MOTOR;
    }
}
