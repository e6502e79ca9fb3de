package com.questrail.brickhub.protocol.model;

/**
 * Pair of physical ports merged into one virtual port by the hub.
 *
 * <p>Used by peripherals that drive both ports in lockstep, e.g. the
 * combined A+B motor.</p>
 */
public record VirtualPorts(int first, int second)
{

    public VirtualPorts {
        if (first < 0 || first > 0xFF || second < 0 || second > 0xFF) {
            throw new IllegalArgumentException("Ports must be 0-255");
        }
        if (first == second) {
            throw new IllegalArgumentException("Virtual port pair must name two distinct ports");
        }
    }

    @Override
    public String toString() {
        return String.format("VirtualPorts[0x%02x+0x%02x]", first, second);
    }
}
