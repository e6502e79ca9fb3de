package com.questrail.brickhub.peripheral;

import com.questrail.brickhub.protocol.model.HubAttachedIo;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Maps device type codes reported in attachment notifications to the
 * factory of the matching peripheral class.
 *
 * <p>Immutable once built. New device types are added through
 * {@link #toBuilder()} without touching the hub engine.</p>
 */
public final class PeripheralRegistry
{
    private static final PeripheralRegistry DEFAULTS = builder()
            .register(HubAttachedIo.DEV_MOTOR, Motor::new)
            .register(HubAttachedIo.DEV_MOTOR_EXTERNAL_TACHO, EncodedMotor::new)
            .register(HubAttachedIo.DEV_MOTOR_INTERNAL_TACHO, EncodedMotor::new)
            .register(HubAttachedIo.DEV_VISION_SENSOR, VisionSensor::new)
            .register(HubAttachedIo.DEV_RGB_LIGHT, LedRgb::new)
            .register(HubAttachedIo.DEV_TILT_EXTERNAL, TiltSensor::new)
            .register(HubAttachedIo.DEV_TILT_INTERNAL, TiltSensor::new)
            .register(HubAttachedIo.DEV_CURRENT, CurrentSensor::new)
            .register(HubAttachedIo.DEV_VOLTAGE, VoltageSensor::new)
            .build();

    private final Map<Integer, PeripheralFactory> factories;
    private final PeripheralFactory fallback;

    private PeripheralRegistry(Map<Integer, PeripheralFactory> factories, PeripheralFactory fallback) {
        this.factories = Collections.unmodifiableMap(new HashMap<>(factories));
        this.fallback = fallback;
    }

    /**
     * Registry covering the peripherals shipped with the Boost set.
     */
    public static PeripheralRegistry defaults() {
        return DEFAULTS;
    }

    /**
     * Resolves a device type code to its dedicated factory.
     *
     * @return the factory, or empty if the type has no dedicated class
     */
    public Optional<PeripheralFactory> lookup(int deviceType) {
        return Optional.ofNullable(factories.get(deviceType));
    }

    /**
     * Factory used for device types without a dedicated class.
     */
    public PeripheralFactory fallback() {
        return fallback;
    }

    public boolean supports(int deviceType) {
        return factories.containsKey(deviceType);
    }

    public Builder toBuilder() {
        Builder builder = new Builder().withFallback(fallback);
        factories.forEach(builder::register);
        return builder;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder
    {
        private final Map<Integer, PeripheralFactory> factories = new HashMap<>();
        private PeripheralFactory fallback = Peripheral::new;

        public Builder register(int deviceType, PeripheralFactory factory) {
            if (deviceType < 0 || deviceType > 0xFFFF) {
                throw new IllegalArgumentException("Device type must be 0-65535");
            }
            factories.put(deviceType, Objects.requireNonNull(factory, "factory"));
            return this;
        }

        public Builder withFallback(PeripheralFactory fallback) {
            this.fallback = Objects.requireNonNull(fallback, "fallback");
            return this;
        }

        public PeripheralRegistry build() {
            return new PeripheralRegistry(factories, fallback);
        }
    }
}
