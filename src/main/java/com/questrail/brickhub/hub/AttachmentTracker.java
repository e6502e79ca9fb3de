package com.questrail.brickhub.hub;

import com.questrail.brickhub.observability.HubObservabilitySink;
import com.questrail.brickhub.observability.PeripheralEvent;
import com.questrail.brickhub.peripheral.Peripheral;
import com.questrail.brickhub.peripheral.PeripheralFactory;
import com.questrail.brickhub.peripheral.PeripheralRegistry;
import com.questrail.brickhub.protocol.model.HubAttachedIo;
import com.questrail.brickhub.protocol.model.VirtualPorts;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * AttachmentTracker
 * =============================================================================
 * Maintains the set of peripherals attached to a hub, one port at a time.
 *
 * <h2>Per-port state machine</h2>
 * <pre>
 *   absent ──ATTACHED──────────▶ attached-simple
 *   absent ──ATTACHED_VIRTUAL──▶ attached-virtual
 *   attached-* ──DETACHED──────▶ absent
 * </pre>
 *
 * Any other transition is a {@link ProtocolViolationException}: attaching
 * an occupied port never replaces the existing peripheral, and detaching an
 * empty port is never ignored.
 *
 * <h2>Threading</h2>
 * {@link #apply} is only called by the hub engine from its exclusive
 * notification section. The map is concurrent so that other threads may
 * read it at any time; they may observe an attachment slightly late.
 */
final class AttachmentTracker
{
    private static final Logger log = LoggerFactory.getLogger(AttachmentTracker.class);

    private final Hub hub;
    private final PeripheralRegistry registry;
    private final HubObservabilitySink observabilitySink;
    private final Map<Integer, Peripheral> peripherals = new ConcurrentHashMap<>();
    private final Map<Integer, Peripheral> view = Collections.unmodifiableMap(peripherals);

    AttachmentTracker(Hub hub, PeripheralRegistry registry, HubObservabilitySink observabilitySink) {
        this.hub = Objects.requireNonNull(hub, "hub");
        this.registry = Objects.requireNonNull(registry, "registry");
        this.observabilitySink = Objects.requireNonNull(observabilitySink, "observabilitySink");
    }

    void apply(HubAttachedIo event) {
        switch (event.event()) {
            case HubAttachedIo.EVENT_DETACHED -> detach(event.port());
            case HubAttachedIo.EVENT_ATTACHED, HubAttachedIo.EVENT_ATTACHED_VIRTUAL -> attach(event);
            default -> throw new ProtocolViolationException("Unknown attachment event: " + event);
        }
    }

    Peripheral get(int port) {
        return peripherals.get(port);
    }

    /**
     * Live, read-only view of the peripheral set.
     */
    Map<Integer, Peripheral> view() {
        return view;
    }

    private void attach(HubAttachedIo event) {
        final int port = event.port();
        final int deviceType = event.deviceType();

        Peripheral existing = peripherals.get(port);
        if (existing != null) {
            throw new ProtocolViolationException(String.format(
                    "Port 0x%02x already holds %s; refusing to replace it with device type 0x%04x",
                    port, existing, deviceType));
        }

        PeripheralFactory factory = registry.lookup(deviceType).orElseGet(() -> {
            log.warn("Have no dedicated class for peripheral type 0x{} on port 0x{}",
                    Integer.toHexString(deviceType), Integer.toHexString(port));
            return registry.fallback();
        });

        VirtualPorts virtualPorts = event.virtualPorts().orElse(null);
        Peripheral peripheral = factory.create(hub, port, virtualPorts);
        peripherals.put(port, peripheral);

        if (event.event() == HubAttachedIo.EVENT_ATTACHED) {
            log.debug("Port 0x{} revisions: hardware 0x{}, software 0x{}",
                    Integer.toHexString(port),
                    Integer.toHexString(event.hardwareRevision()),
                    Integer.toHexString(event.softwareRevision()));
        }
        log.info("Attached peripheral: {}", peripheral);

        observabilitySink.onPeripheralAttached(new PeripheralEvent(Instant.now(), port, deviceType, peripheral));
    }

    private void detach(int port) {
        Peripheral removed = peripherals.remove(port);
        if (removed == null) {
            throw new ProtocolViolationException(String.format(
                    "Detach for port 0x%02x which has no attached peripheral", port));
        }
        log.debug("Detached peripheral: {}", removed);

        observabilitySink.onPeripheralDetached(new PeripheralEvent(Instant.now(), port, 0, removed));
    }
}
