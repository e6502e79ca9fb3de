package com.questrail.brickhub.hub;

import com.questrail.brickhub.config.HubConfig;
import com.questrail.brickhub.config.SyncSendPolicy;
import com.questrail.brickhub.observability.DeviceErrorEvent;
import com.questrail.brickhub.observability.HubErrorEvent;
import com.questrail.brickhub.observability.HubObservabilitySink;
import com.questrail.brickhub.observability.NullObservabilitySink;
import com.questrail.brickhub.peripheral.Peripheral;
import com.questrail.brickhub.peripheral.PeripheralRegistry;
import com.questrail.brickhub.protocol.codec.HubBytes;
import com.questrail.brickhub.protocol.codec.HubMessageDecoder;
import com.questrail.brickhub.protocol.codec.HubMessageEncoder;
import com.questrail.brickhub.protocol.codec.MessageDecodeException;
import com.questrail.brickhub.protocol.model.DownstreamMessage;
import com.questrail.brickhub.protocol.model.GenericError;
import com.questrail.brickhub.protocol.model.HubAction;
import com.questrail.brickhub.protocol.model.HubAttachedIo;
import com.questrail.brickhub.protocol.model.PortData;
import com.questrail.brickhub.protocol.model.PortValueCombined;
import com.questrail.brickhub.protocol.model.PortValueSingle;
import com.questrail.brickhub.protocol.model.UpstreamMessage;
import com.questrail.brickhub.transport.Connection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

/**
 * Hub
 * =============================================================================
 * Driver-side engine for one connected hub.
 *
 * <h2>Purpose</h2>
 * The hub is the single authority over its {@link Connection}. It:
 * <ul>
 *   <li>encodes and writes commands, always to {@link #HUB_HARDWARE_HANDLE}</li>
 *   <li>decodes every notification and dispatches it to the registered handlers</li>
 *   <li>hands the reply of the one outstanding synchronous command to its sender</li>
 *   <li>keeps the peripheral set in step with attach/detach notifications</li>
 * </ul>
 *
 * <h2>Threading Model</h2>
 * Notifications arrive on the connection's delivery context; commands are
 * sent from any number of caller threads.
 * <ul>
 *   <li>Notifications are processed one at a time, in delivery order.
 *       Reply correlation and handler dispatch for a notification both
 *       finish before the next one starts.</li>
 *   <li>At most one synchronous command is pending. What happens to a
 *       second one is decided by {@link HubConfig#syncSendPolicy()}.</li>
 *   <li>Handlers run on the delivery context and must not issue
 *       synchronous commands themselves: the reply could never be delivered.</li>
 * </ul>
 *
 * <h2>Built-in handlers</h2>
 * Registered at construction, in this order:
 * <ol>
 *   <li>{@link HubAttachedIo} → attachment tracking</li>
 *   <li>{@link PortValueSingle}, {@link PortValueCombined} → owning peripheral</li>
 *   <li>{@link GenericError} → logged, and fails any pending request</li>
 *   <li>{@link HubAction} → teardown when the hub disconnects or switches off</li>
 * </ol>
 *
 * <h2>Failure model</h2>
 * An undecodable notification or an inconsistent attachment event is a
 * protocol defect: it is reported to the observability sink and rethrown
 * into the delivery context. Device-reported errors are not defects.
 */
public class Hub implements AutoCloseable
{
    /** Characteristic handle all commands are written to. */
    public static final int HUB_HARDWARE_HANDLE = 0x0E;

    private static final Logger log = LoggerFactory.getLogger(Hub.class);

    private final Connection connection;
    private final HubConfig config;
    private final HubObservabilitySink observabilitySink;
    private final HubMessageEncoder encoder = new HubMessageEncoder();
    private final HubMessageDecoder decoder = new HubMessageDecoder();
    private final AttachmentTracker attachments;
    private final List<HandlerRegistration<?>> handlers = new CopyOnWriteArrayList<>();

    private final ReentrantLock notificationLock = new ReentrantLock();
    private final Object pendingLock = new Object();
    private final Semaphore syncSlot = new Semaphore(1, true);
    private final AtomicBoolean closed = new AtomicBoolean(false);

    // guarded by pendingLock
    private PendingRequest pending;

    // guarded by notificationLock
    private UpstreamMessage correlatedReply;

    public Hub(Connection connection) {
        this(connection, HubConfig.defaults(), PeripheralRegistry.defaults(), NullObservabilitySink.INSTANCE);
    }

    public Hub(Connection connection, HubConfig config) {
        this(connection, config, PeripheralRegistry.defaults(), NullObservabilitySink.INSTANCE);
    }

    /**
     * Creates the engine, installs itself as the connection's notification
     * handler and enables notifications.
     *
     * @param connection open link to the hub
     * @param config operational configuration
     * @param registry device type → peripheral mapping
     * @param observabilitySink receiver of attachment and error events; may be {@code null}
     */
    public Hub(Connection connection,
               HubConfig config,
               PeripheralRegistry registry,
               HubObservabilitySink observabilitySink)
    {
        this.connection = Objects.requireNonNull(connection, "connection");
        this.config = Objects.requireNonNull(config, "config");
        this.observabilitySink = Objects.requireNonNullElse(observabilitySink, NullObservabilitySink.INSTANCE);
        this.attachments = new AttachmentTracker(this, registry, this.observabilitySink);

        addMessageHandler(HubAttachedIo.class, attachments::apply);
        addMessageHandler(PortValueSingle.class, this::handlePortData);
        addMessageHandler(PortValueCombined.class, this::handlePortData);
        addMessageHandler(GenericError.class, this::handleError);
        addMessageHandler(HubAction.class, this::handleAction);

        connection.setNotificationHandler(this::onNotification);
        connection.enableNotifications();
    }

    public HubConfig config() {
        return config;
    }

    /**
     * Registers a handler for every notification of {@code type}.
     *
     * <p>Handlers run in registration order; one notification may reach
     * several handlers, including one that is also its awaited reply.
     * A handler that throws is logged and reported to the observability
     * sink, and the remaining handlers still run. Only a
     * {@link ProtocolViolationException} stops dispatch.</p>
     */
    public <T extends UpstreamMessage> void addMessageHandler(Class<T> type, Consumer<? super T> handler) {
        handlers.add(new HandlerRegistration<>(
                Objects.requireNonNull(type, "type"),
                Objects.requireNonNull(handler, "handler")));
    }

    /**
     * Live, read-only view of the attached peripherals keyed by port.
     */
    public Map<Integer, Peripheral> peripherals() {
        return attachments.view();
    }

    public Optional<Peripheral> peripheral(int port) {
        return Optional.ofNullable(attachments.get(port));
    }

    // ========================================================================
    // Sending
    // ========================================================================

    /**
     * Sends a command.
     *
     * <p>If the command needs a reply, the calling thread blocks until the
     * correlated reply arrives (or the reply timeout expires) and the reply
     * is returned. Otherwise the command is written and an empty result is
     * returned immediately.</p>
     *
     * @throws IllegalStateException if another synchronous command is pending
     *         and the policy is {@link SyncSendPolicy#REJECT}; nothing is written
     * @throws CommandException if the hub answers with a generic error
     * @throws ReplyTimeoutException if no reply arrives in time
     */
    public Optional<UpstreamMessage> send(DownstreamMessage message) {
        Objects.requireNonNull(message, "message");
        log.debug("Send message: {}", message);

        byte[] bytes = encoder.encode(message);
        if (!message.needsReply()) {
            write(bytes);
            return Optional.empty();
        }

        boolean serialize = config.syncSendPolicy() == SyncSendPolicy.SERIALIZE;
        if (serialize) {
            acquireSyncSlot(message);
        }
        try {
            return Optional.of(exchange(message, bytes));
        } finally {
            if (serialize) {
                syncSlot.release();
            }
        }
    }

    /**
     * Sends a synchronous command and returns its reply as {@code replyType}.
     *
     * @throws IllegalArgumentException if the command does not expect a reply
     * @throws HubException if the reply is of a different type
     */
    public <T extends UpstreamMessage> T request(DownstreamMessage message, Class<T> replyType) {
        if (!message.needsReply()) {
            throw new IllegalArgumentException("Command does not expect a reply: " + message);
        }
        UpstreamMessage reply = send(message).orElseThrow();
        if (!replyType.isInstance(reply)) {
            throw new HubException("Expected " + replyType.getSimpleName() + " in reply to "
                    + message + ", got " + reply);
        }
        return replyType.cast(reply);
    }

    /**
     * Asks the hub to drop the link and waits for it to acknowledge.
     */
    public void requestDisconnect() {
        request(new HubAction(HubAction.DISCONNECT), HubAction.class);
    }

    /**
     * Asks the hub to power off and waits for it to acknowledge.
     */
    public void switchOff() {
        request(new HubAction(HubAction.SWITCH_OFF), HubAction.class);
    }

    private UpstreamMessage exchange(DownstreamMessage message, byte[] bytes) {
        PendingRequest request = PendingRequest.of(message);
        synchronized (pendingLock) {
            if (pending != null) {
                throw new IllegalStateException("Pending request " + pending.request()
                        + " while trying to send " + message);
            }
            pending = request;
        }

        log.debug("Waiting for sync reply to {}...", message);
        try {
            write(bytes);
        } catch (RuntimeException e) {
            abandon(request);
            throw e;
        }

        UpstreamMessage reply = await(request);
        log.debug("Fetched sync reply: {}", reply);

        if (reply instanceof GenericError error) {
            throw new CommandException(error);
        }
        return reply;
    }

    private UpstreamMessage await(PendingRequest request) {
        Duration timeout = config.replyTimeout();
        try {
            if (config.waitsForever()) {
                return request.reply().get();
            }
            return request.reply().get(timeout.toNanos(), TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            abandon(request);
            throw new ReplyTimeoutException(request.request(), timeout);
        } catch (InterruptedException e) {
            abandon(request);
            Thread.currentThread().interrupt();
            throw new HubException("Interrupted while waiting for reply to " + request.request(), e);
        } catch (ExecutionException e) {
            throw new HubException("Reply to " + request.request() + " failed", e.getCause());
        }
    }

    private void acquireSyncSlot(DownstreamMessage message) {
        try {
            syncSlot.acquire();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new HubException("Interrupted while queueing " + message, e);
        }
    }

    private void abandon(PendingRequest request) {
        synchronized (pendingLock) {
            if (pending == request) {
                pending = null;
            }
        }
    }

    private void write(byte[] bytes) {
        connection.write(HUB_HARDWARE_HANDLE, bytes);
    }

    // ========================================================================
    // Receiving
    // ========================================================================

    /**
     * Entry point for the connection's notification delivery.
     *
     * @throws MessageDecodeException if the bytes are not a known message
     * @throws ProtocolViolationException if the message contradicts the tracked state
     */
    public void onNotification(int handle, byte[] data) {
        Objects.requireNonNull(data, "data");
        notificationLock.lock();
        try {
            log.debug("Notification on 0x{}: {}", Integer.toHexString(handle), HubBytes.toHex(data));

            UpstreamMessage message = decoder.decode(data);
            log.debug("Decoded message: {}", message);

            correlatedReply = completePendingIfReply(message) ? message : null;
            dispatch(message);
        } catch (MessageDecodeException | ProtocolViolationException e) {
            observabilitySink.onError(new HubErrorEvent(Instant.now(),
                    "Fatal notification " + HubBytes.toHex(data), e));
            throw e;
        } finally {
            notificationLock.unlock();
        }
    }

    /**
     * Runs {@code action} while no notification is being processed.
     *
     * <p>Lets a subclass register handlers and inspect the peripheral set
     * without missing an attachment in between.</p>
     */
    protected void runExclusive(Runnable action) {
        notificationLock.lock();
        try {
            action.run();
        } finally {
            notificationLock.unlock();
        }
    }

    private boolean completePendingIfReply(UpstreamMessage message) {
        synchronized (pendingLock) {
            if (pending == null || !message.isReplyTo(pending.request())) {
                return false;
            }
            log.debug("Found matching upstream msg: {}", message);
            PendingRequest matched = pending;
            pending = null;
            matched.complete(message);
            return true;
        }
    }

    private void dispatch(UpstreamMessage message) {
        for (HandlerRegistration<?> registration : handlers) {
            try {
                registration.offer(message);
            } catch (ProtocolViolationException e) {
                throw e;
            } catch (RuntimeException e) {
                log.error("Handler {} failed on {}", registration.handler(), message, e);
                observabilitySink.onError(new HubErrorEvent(Instant.now(),
                        "Handler failed on " + message, e));
            }
        }
    }

    private void handlePortData(PortData message) {
        Peripheral peripheral = attachments.get(message.port());
        if (peripheral == null) {
            log.warn("Notification on port with no device: 0x{}", Integer.toHexString(message.port()));
            return;
        }
        peripheral.queuePortData(message);
    }

    private void handleError(GenericError error) {
        log.warn("Command error: {}", error.message());

        PendingRequest failed;
        synchronized (pendingLock) {
            failed = pending;
            pending = null;
        }
        if (failed != null) {
            failed.complete(error);
        }
        boolean answeredRequest = failed != null || correlatedReply == error;
        observabilitySink.onDeviceError(new DeviceErrorEvent(Instant.now(), error, answeredRequest));
    }

    private void handleAction(HubAction action) {
        if (action.action() == HubAction.UPSTREAM_DISCONNECT) {
            log.warn("Hub disconnects");
            close();
        } else if (action.action() == HubAction.UPSTREAM_SHUTDOWN) {
            log.warn("Hub switches off");
            close();
        } else if (action.action() == HubAction.UPSTREAM_BOOT_MODE) {
            log.warn("Hub entered boot mode");
        }
    }

    // ========================================================================
    // Teardown
    // ========================================================================

    /**
     * Releases the connection. Only the first call has any effect.
     *
     * <p>The connection is released even when the link has already dropped,
     * so its transport resources are freed either way.</p>
     */
    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            log.debug("Disconnecting from hub (link alive: {})", connection.isAlive());
            connection.disconnect();
        }
    }

    public boolean isClosed() {
        return closed.get();
    }

    private record HandlerRegistration<T extends UpstreamMessage>(Class<T> type, Consumer<? super T> handler)
    {
        void offer(UpstreamMessage message) {
            if (type.isInstance(message)) {
                log.debug("Handling msg with {}: {}", handler, message);
                handler.accept(type.cast(message));
            }
        }
    }
}
