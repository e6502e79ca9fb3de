package com.questrail.brickhub.hub;

import com.questrail.brickhub.config.HubConfig;
import com.questrail.brickhub.observability.HubObservabilitySink;
import com.questrail.brickhub.observability.NullObservabilitySink;
import com.questrail.brickhub.peripheral.CurrentSensor;
import com.questrail.brickhub.peripheral.EncodedMotor;
import com.questrail.brickhub.peripheral.HubButton;
import com.questrail.brickhub.peripheral.LedRgb;
import com.questrail.brickhub.peripheral.Peripheral;
import com.questrail.brickhub.peripheral.PeripheralRegistry;
import com.questrail.brickhub.peripheral.TiltSensor;
import com.questrail.brickhub.peripheral.VisionSensor;
import com.questrail.brickhub.peripheral.VoltageSensor;
import com.questrail.brickhub.protocol.codec.HubBytes;
import com.questrail.brickhub.protocol.model.HubAlert;
import com.questrail.brickhub.protocol.model.HubAttachedIo;
import com.questrail.brickhub.protocol.model.HubProperties;
import com.questrail.brickhub.transport.Connection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumSet;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * MoveHub
 * =============================================================================
 * The Boost Move Hub: a {@link Hub} with a known set of built-in peripherals.
 *
 * <h2>Startup</h2>
 * The constructor returns once:
 * <ol>
 *   <li>the built-in peripherals have attached, or the configured wait
 *       ({@link HubConfig#deviceWaitAttempts()} x
 *       {@link HubConfig#deviceWaitInterval()}) ran out; missing devices are
 *       logged and their accessors stay empty</li>
 *   <li>the advertised name, MAC address, battery level and low-voltage
 *       alert have been read (see {@link #status()})</li>
 * </ol>
 *
 * <h2>Named accessors</h2>
 * Each attachment is evaluated once against {@link MoveHubSlot}: by its
 * port for the fixed slots, and by {@link com.questrail.brickhub.peripheral.PeripheralKind}
 * for the vision sensor and the external motor. A detach clears the slots
 * the port was bound to. Accessors read from other threads may lag a
 * physical attach slightly.
 */
public class MoveHub extends Hub
{
    public static final int PORT_A = 0x00;
    public static final int PORT_B = 0x01;
    public static final int PORT_C = 0x02;
    public static final int PORT_D = 0x03;
    public static final int PORT_AB = 0x10;
    public static final int PORT_LED = 0x32;
    public static final int PORT_TILT_SENSOR = 0x3A;
    public static final int PORT_CURRENT = 0x3B;
    public static final int PORT_VOLTAGE = 0x3C;

    private static final Logger log = LoggerFactory.getLogger(MoveHub.class);

    private static final Set<Integer> INTERNAL_MOTOR_PORTS = Set.of(PORT_A, PORT_B, PORT_AB);

    private final Map<MoveHubSlot, Peripheral> slots = new ConcurrentHashMap<>();
    private final HubButton button;
    private final MoveHubStatus status;

    public MoveHub(Connection connection) {
        this(connection, HubConfig.defaults(), PeripheralRegistry.defaults(), NullObservabilitySink.INSTANCE);
    }

    public MoveHub(Connection connection,
                   HubConfig config,
                   PeripheralRegistry registry,
                   HubObservabilitySink observabilitySink)
    {
        super(connection, config, registry, observabilitySink);
        this.button = new HubButton(this);

        runExclusive(() -> {
            addMessageHandler(HubAttachedIo.class, this::bindAttachment);
            peripherals().values().forEach(this::bind);
        });

        try {
            waitForBuiltInDevices();
            this.status = reportStatus();
        } catch (RuntimeException e) {
            close();
            throw e;
        }
    }

    // ========================================================================
    // Accessors
    // ========================================================================

    public Optional<Peripheral> slot(MoveHubSlot slot) {
        return Optional.ofNullable(slots.get(Objects.requireNonNull(slot, "slot")));
    }

    public Optional<EncodedMotor> motorA() {
        return typed(MoveHubSlot.MOTOR_A, EncodedMotor.class);
    }

    public Optional<EncodedMotor> motorB() {
        return typed(MoveHubSlot.MOTOR_B, EncodedMotor.class);
    }

    public Optional<EncodedMotor> motorAB() {
        return typed(MoveHubSlot.MOTOR_AB, EncodedMotor.class);
    }

    public Optional<Peripheral> portC() {
        return slot(MoveHubSlot.PORT_C);
    }

    public Optional<Peripheral> portD() {
        return slot(MoveHubSlot.PORT_D);
    }

    public Optional<LedRgb> led() {
        return typed(MoveHubSlot.LED, LedRgb.class);
    }

    public Optional<TiltSensor> tiltSensor() {
        return typed(MoveHubSlot.TILT_SENSOR, TiltSensor.class);
    }

    public Optional<CurrentSensor> current() {
        return typed(MoveHubSlot.CURRENT, CurrentSensor.class);
    }

    public Optional<VoltageSensor> voltage() {
        return typed(MoveHubSlot.VOLTAGE, VoltageSensor.class);
    }

    public Optional<VisionSensor> visionSensor() {
        return typed(MoveHubSlot.VISION_SENSOR, VisionSensor.class);
    }

    public Optional<EncodedMotor> externalMotor() {
        return typed(MoveHubSlot.EXTERNAL_MOTOR, EncodedMotor.class);
    }

    public HubButton button() {
        return button;
    }

    public MoveHubStatus status() {
        return status;
    }

    /**
     * @return built-in slots that have nothing bound
     */
    public Set<MoveHubSlot> missingBuiltIns() {
        Set<MoveHubSlot> missing = EnumSet.noneOf(MoveHubSlot.class);
        for (MoveHubSlot slot : MoveHubSlot.values()) {
            if (slot.isBuiltIn() && !slots.containsKey(slot)) {
                missing.add(slot);
            }
        }
        return missing;
    }

    private <T extends Peripheral> Optional<T> typed(MoveHubSlot slot, Class<T> type) {
        return slot(slot).filter(type::isInstance).map(type::cast);
    }

    // ========================================================================
    // Binding
    // ========================================================================

    private void bindAttachment(HubAttachedIo event) {
        if (event.isDetach()) {
            slots.entrySet().removeIf(entry -> entry.getValue().port() == event.port());
            return;
        }
        peripheral(event.port()).ifPresent(this::bind);
    }

    private void bind(Peripheral peripheral) {
        final int port = peripheral.port();
        MoveHubSlot.forPort(port).ifPresent(slot -> slots.put(slot, peripheral));

        switch (peripheral.kind()) {
            case VISION_SENSOR -> slots.put(MoveHubSlot.VISION_SENSOR, peripheral);
            case ENCODED_MOTOR -> {
                if (!INTERNAL_MOTOR_PORTS.contains(port)) {
                    slots.put(MoveHubSlot.EXTERNAL_MOTOR, peripheral);
                }
            }
            default -> {
                // bound by port only
            }
        }
    }

    // ========================================================================
    // Startup
    // ========================================================================

    private void waitForBuiltInDevices() {
        for (int attempt = 0; attempt < config().deviceWaitAttempts(); attempt++) {
            Set<MoveHubSlot> missing = missingBuiltIns();
            if (missing.isEmpty()) {
                log.debug("All devices are present: {}", slots);
                return;
            }
            log.debug("Waiting for builtin devices to appear: {}", missing);
            try {
                Thread.sleep(config().deviceWaitInterval().toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Interrupted while waiting for builtin devices");
                break;
            }
        }

        Set<MoveHubSlot> missing = missingBuiltIns();
        if (missing.isEmpty()) {
            log.debug("All devices are present: {}", slots);
        } else {
            log.warn("Got only these devices: {}; missing {}", slots.keySet(), missing);
        }
    }

    private MoveHubStatus reportStatus() {
        HubProperties name = request(HubProperties.request(HubProperties.ADVERTISE_NAME), HubProperties.class);
        HubProperties mac = request(HubProperties.request(HubProperties.PRIMARY_MAC), HubProperties.class);
        log.info("{} on {}", name.parametersAsText(), HubBytes.toHex(mac.parameters()));

        HubProperties voltage = request(HubProperties.request(HubProperties.VOLTAGE_PERCENT), HubProperties.class);
        byte[] level = voltage.parameters();
        int batteryPercent = level.length > 0 ? HubBytes.u8(level, 0) : -1;
        log.info("Voltage: {}%", batteryPercent);

        HubAlert lowVoltage = request(HubAlert.request(HubAlert.LOW_VOLTAGE), HubAlert.class);
        if (!lowVoltage.isOk()) {
            log.warn("Low voltage, check power source (maybe replace battery)");
        }

        return new MoveHubStatus(
                name.parametersAsText(),
                HubBytes.toHex(mac.parameters()),
                batteryPercent,
                !lowVoltage.isOk());
    }
}
