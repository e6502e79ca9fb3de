package com.questrail.brickhub.protocol.model;

import java.util.Arrays;

/**
 * Port value notification in combined-mode format ($46).
 *
 * <p>The value bytes start with the mode/dataset pointer; interpreting them
 * is left to the peripheral.</p>
 */
public record PortValueCombined(int port, byte[] value) implements PortData
{
    public static final int TYPE = 0x46;

    public PortValueCombined {
        value = (value == null) ? new byte[0] : value.clone();
    }

    @Override
    public int type() {
        return TYPE;
    }

    @Override
    public byte[] value() {
        return value.clone();
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof PortValueCombined other
                && port == other.port
                && Arrays.equals(value, other.value);
    }

    @Override
    public int hashCode() {
        return 31 * port + Arrays.hashCode(value);
    }

    @Override
    public String toString() {
        return String.format("PortValueCombined[port=0x%02x, value=%s]", port, Arrays.toString(value));
    }
}
