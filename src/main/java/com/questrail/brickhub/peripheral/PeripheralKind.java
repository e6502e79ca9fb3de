package com.questrail.brickhub.peripheral;

/**
 * Capability tag of a peripheral.
 *
 * <p>Hub variants dispatch on this tag instead of inspecting runtime types.</p>
 */
public enum PeripheralKind
{
    GENERIC,
    MOTOR,
    ENCODED_MOTOR,
    VISION_SENSOR,
    RGB_LIGHT,
    TILT_SENSOR,
    CURRENT_SENSOR,
    VOLTAGE_SENSOR
}
