package com.questrail.brickhub.peripheral;

import com.questrail.brickhub.hub.Hub;
import com.questrail.brickhub.protocol.model.PortInputFormatSetupSingle;
import com.questrail.brickhub.protocol.model.PortInputFormatSingle;
import com.questrail.brickhub.protocol.model.UpstreamMessage;
import com.questrail.brickhub.protocol.model.VirtualPorts;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Device attached to a hub port.
 *
 * <p>
 * This class is also the fallback for device types without a dedicated
 * class: it keeps port bookkeeping and value intake working without any
 * device-specific behaviour.
 * </p>
 *
 * <h2>Lifecycle</h2>
 * Peripherals are created by the hub when an attachment notification
 * arrives and dropped when the matching detach arrives. Nothing else
 * constructs or destroys them.
 *
 * <h2>Value intake</h2>
 * The hub hands every value notification for this port to
 * {@link #queuePortData}. Notifications are kept in a bounded queue; when
 * it is full the oldest entry is dropped.
 */
public class Peripheral
{
    private static final Logger log = LoggerFactory.getLogger(Peripheral.class);

    private final Hub hub;
    private final int port;
    private final VirtualPorts virtualPorts;
    private final BlockingQueue<UpstreamMessage> portData;

    private volatile UpstreamMessage latestPortData;

    public Peripheral(Hub hub, int port, VirtualPorts virtualPorts) {
        this.hub = Objects.requireNonNull(hub, "hub");
        this.port = port;
        this.virtualPorts = virtualPorts;
        this.portData = new ArrayBlockingQueue<>(hub.config().portDataQueueCapacity());
    }

    public PeripheralKind kind() {
        return PeripheralKind.GENERIC;
    }

    public int port() {
        return port;
    }

    /**
     * @return the physical ports merged into this port, if it is virtual
     */
    public Optional<VirtualPorts> virtualPorts() {
        return Optional.ofNullable(virtualPorts);
    }

    protected Hub hub() {
        return hub;
    }

    /**
     * Accepts a value notification addressed to this port.
     *
     * <p>Called on the notification delivery context; never blocks.</p>
     */
    public void queuePortData(UpstreamMessage message) {
        Objects.requireNonNull(message, "message");
        latestPortData = message;
        while (!portData.offer(message)) {
            UpstreamMessage dropped = portData.poll();
            log.debug("Port data queue full on port 0x{}, dropped {}", Integer.toHexString(port), dropped);
        }
    }

    /**
     * Takes the oldest queued value notification, waiting up to {@code timeout}.
     */
    public Optional<UpstreamMessage> nextPortData(Duration timeout) throws InterruptedException {
        return Optional.ofNullable(portData.poll(timeout.toNanos(), TimeUnit.NANOSECONDS));
    }

    /**
     * @return the most recent value notification, queued or not
     */
    public Optional<UpstreamMessage> latestPortData() {
        return Optional.ofNullable(latestPortData);
    }

    /**
     * Selects the input mode of this port and waits for the hub to confirm it.
     *
     * @param mode device-specific sensor mode
     * @param deltaInterval minimum value change that triggers a notification
     * @param notificationsEnabled whether value notifications are pushed
     * @return the input format confirmed by the hub
     */
    public PortInputFormatSingle setInputFormat(int mode, long deltaInterval, boolean notificationsEnabled) {
        return hub.request(
                new PortInputFormatSetupSingle(port, mode, deltaInterval, notificationsEnabled),
                PortInputFormatSingle.class);
    }

    @Override
    public String toString() {
        String base = String.format("%s[port=0x%02x", getClass().getSimpleName(), port);
        return virtualPorts == null ? base + ']' : base + ", " + virtualPorts + ']';
    }
}
