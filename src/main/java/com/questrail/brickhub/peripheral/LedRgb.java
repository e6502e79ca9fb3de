package com.questrail.brickhub.peripheral;

import com.questrail.brickhub.hub.Hub;
import com.questrail.brickhub.protocol.model.PortOutput;
import com.questrail.brickhub.protocol.model.VirtualPorts;

/**
 * RGB indicator light.
 */
public class LedRgb extends Peripheral
{
    public static final int COLOR_BLACK = 0x00;
    public static final int COLOR_PINK = 0x01;
    public static final int COLOR_PURPLE = 0x02;
    public static final int COLOR_BLUE = 0x03;
    public static final int COLOR_LIGHTBLUE = 0x04;
    public static final int COLOR_CYAN = 0x05;
    public static final int COLOR_GREEN = 0x06;
    public static final int COLOR_YELLOW = 0x07;
    public static final int COLOR_ORANGE = 0x08;
    public static final int COLOR_RED = 0x09;
    public static final int COLOR_WHITE = 0x0A;
    public static final int COLOR_NONE = 0xFF;

    private static final int MODE_INDEX = 0x00;

    public LedRgb(Hub hub, int port, VirtualPorts virtualPorts) {
        super(hub, port, virtualPorts);
    }

    @Override
    public PeripheralKind kind() {
        return PeripheralKind.RGB_LIGHT;
    }

    /**
     * Switches the light to one of the indexed colors without waiting for the hub.
     */
    public void setColor(int color) {
        if ((color < COLOR_BLACK || color > COLOR_WHITE) && color != COLOR_NONE) {
            throw new IllegalArgumentException("Unknown color index: " + color);
        }
        hub().send(new PortOutput(
                port(),
                PortOutput.STARTUP_IMMEDIATELY | PortOutput.COMPLETION_NO_ACTION,
                PortOutput.SUBCMD_WRITE_DIRECT_MODE_DATA,
                new byte[] { MODE_INDEX, (byte) color }));
    }
}
