package com.questrail.brickhub.observability;

import com.questrail.brickhub.peripheral.Peripheral;

import java.time.Instant;

/**
 * Record representing a peripheral entering or leaving a port.
 */
public record PeripheralEvent(
    Instant timestamp,
    int port,
    int deviceType,
    Peripheral peripheral
) {
}
