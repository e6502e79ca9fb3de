package com.questrail.brickhub.peripheral;

import com.questrail.brickhub.hub.Hub;
import com.questrail.brickhub.protocol.model.VirtualPorts;

/**
 * Creates the peripheral bound to a freshly attached port.
 */
@FunctionalInterface
public interface PeripheralFactory
{

    /**
     * @param hub owning hub
     * @param port attached port
     * @param virtualPorts merged physical ports, or {@code null} for a plain port
     */
    Peripheral create(Hub hub, int port, VirtualPorts virtualPorts);
}
