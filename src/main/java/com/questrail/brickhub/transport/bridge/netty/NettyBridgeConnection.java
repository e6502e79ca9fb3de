package com.questrail.brickhub.transport.bridge.netty;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.questrail.brickhub.config.BridgeConfig;
import com.questrail.brickhub.protocol.codec.HubBytes;
import com.questrail.brickhub.transport.Connection;
import com.questrail.brickhub.transport.NotificationHandler;
import com.questrail.brickhub.transport.TransportException;

import io.netty.bootstrap.Bootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;
import io.netty.handler.codec.LineBasedFrameDecoder;
import io.netty.handler.codec.string.StringDecoder;
import io.netty.handler.codec.string.StringEncoder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * NettyBridgeConnection
 * =============================================================================
 * Netty-backed {@link Connection} to a BLE bridge process reached over TCP.
 *
 * <h2>Wire format</h2>
 * One JSON object per line, UTF-8:
 * <pre>
 *   out: {"type":"write","handle":14,"data":"0500010605"}
 *   in:  {"type":"notification","handle":14,"data":"0f0004..."}
 * </pre>
 * Inbound objects of any other type are logged and ignored. Lines that are
 * not valid JSON, or notifications without hex data, are reported and
 * dropped.
 *
 * <h2>Netty containment rule</h2>
 * Netty types MUST NOT escape this package. Notification payloads are
 * handed to the {@link NotificationHandler} as {@code byte[]}.
 *
 * <h2>Delivery</h2>
 * A dedicated single-threaded event loop reads the socket, so notifications
 * are delivered serially and in order. An exception thrown by the handler
 * closes the link.
 *
 * <h2>Lifecycle</h2>
 * - {@link #connect()} opens the socket and blocks until it is up.
 * - {@link #disconnect()} closes the channel and shuts down the event loop group.
 */
public final class NettyBridgeConnection implements Connection
{
    /** Client characteristic configuration descriptor of the hub characteristic. */
    public static final int NOTIFICATION_CONFIG_HANDLE = 0x0F;

    static final String TYPE_WRITE = "write";
    static final String TYPE_NOTIFICATION = "notification";

    private static final byte[] ENABLE_NOTIFICATIONS = {0x01, 0x00};

    private static final Logger log = LoggerFactory.getLogger(NettyBridgeConnection.class);

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    private final BridgeConfig config;
    private final EventLoopGroup group;
    private final Bootstrap bootstrap;
    private final AtomicBoolean disconnected = new AtomicBoolean(false);

    private volatile NotificationHandler handler;
    private volatile Channel channel;

    public NettyBridgeConnection(BridgeConfig config)
    {
        this.config = Objects.requireNonNull(config, "config");

        this.group = new NioEventLoopGroup(1);
        this.bootstrap = new Bootstrap();

        bootstrap.group(group)
                .channel(NioSocketChannel.class)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) config.connectTimeout().toMillis())
                .option(ChannelOption.TCP_NODELAY, true)
                .handler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch)
                    {
                        ChannelPipeline p = ch.pipeline();
                        p.addLast(new LineBasedFrameDecoder(8192));
                        p.addLast(new StringDecoder(StandardCharsets.UTF_8));
                        p.addLast(new StringEncoder(StandardCharsets.UTF_8));
                        p.addLast(new InboundHandler());
                    }
                });
    }

    /**
     * Opens the bridge connection and waits for it to be established.
     *
     * @return this connection, for chaining into a hub constructor
     * @throws TransportException if the bridge cannot be reached
     */
    public NettyBridgeConnection connect()
    {
        if (disconnected.get()) {
            throw new IllegalStateException("Connection has been disconnected");
        }
        log.info("Connecting to bridge at {}:{}", config.host(), config.port());

        ChannelFuture f = bootstrap.connect(config.host(), config.port()).awaitUninterruptibly();
        if (!f.isSuccess()) {
            group.shutdownGracefully();
            throw new TransportException(
                    "Cannot connect to bridge at " + config.host() + ":" + config.port(), f.cause());
        }
        channel = f.channel();
        log.debug("Connected to bridge: {}", channel);
        return this;
    }

    @Override
    public void write(int handle, byte[] data)
    {
        Objects.requireNonNull(data, "data");

        Channel ch = channel;
        if (ch == null || !ch.isActive()) {
            throw new TransportException("Bridge connection is not open");
        }

        String line = toLine(new BridgeMessage(TYPE_WRITE, handle, HubBytes.toHex(data)));
        log.debug("Bridge write: {}", line);
        ch.writeAndFlush(line + "\n").addListener((ChannelFutureListener) future -> {
            if (!future.isSuccess()) {
                log.error("Bridge write failed: {}", line, future.cause());
            }
        });
    }

    @Override
    public void setNotificationHandler(NotificationHandler handler)
    {
        this.handler = Objects.requireNonNull(handler, "handler");
    }

    @Override
    public void enableNotifications()
    {
        write(NOTIFICATION_CONFIG_HANDLE, ENABLE_NOTIFICATIONS);
    }

    @Override
    public void disconnect()
    {
        if (!disconnected.compareAndSet(false, true)) {
            return;
        }
        log.info("Disconnecting from bridge");

        Channel ch = channel;
        if (ch != null) {
            ch.close().awaitUninterruptibly();
        }
        group.shutdownGracefully();
    }

    @Override
    public boolean isAlive()
    {
        Channel ch = channel;
        return !disconnected.get() && ch != null && ch.isActive();
    }

    /**
     * @return whether the event loop has been told to shut down
     */
    boolean isReleased()
    {
        return group.isShuttingDown();
    }

    static String toLine(BridgeMessage message)
    {
        try {
            return MAPPER.writeValueAsString(message);
        } catch (JsonProcessingException e) {
            throw new TransportException("Cannot serialize bridge message " + message, e);
        }
    }

    /**
     * One line of the bridge protocol.
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    record BridgeMessage(String type, Integer handle, String data)
    {
    }

    /**
     * InboundHandler
     * -------------------------------------------------------------------------
     * Parses bridge lines and forwards notification payloads to the handler.
     */
    private final class InboundHandler extends SimpleChannelInboundHandler<String>
    {
        @Override
        protected void channelRead0(ChannelHandlerContext ctx, String line)
        {
            if (line.isBlank()) {
                return;
            }

            BridgeMessage message;
            byte[] payload;
            try {
                message = MAPPER.readValue(line, BridgeMessage.class);
                if (!TYPE_NOTIFICATION.equals(message.type())) {
                    log.debug("Ignoring bridge message: {}", line);
                    return;
                }
                if (message.data() == null) {
                    log.warn("Dropping notification without data: {}", line);
                    return;
                }
                payload = HubBytes.fromHex(message.data());
            } catch (JsonProcessingException | IllegalArgumentException e) {
                log.warn("Dropping malformed bridge line: {}", line, e);
                return;
            }

            NotificationHandler h = handler;
            if (h == null) {
                log.warn("No notification handler installed, dropping {}", line);
                return;
            }
            int handle = message.handle() == null ? 0 : message.handle();
            h.onNotification(handle, payload);
        }

        @Override
        public void channelInactive(ChannelHandlerContext ctx)
        {
            if (!disconnected.get()) {
                log.warn("Bridge closed the connection");
            }
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause)
        {
            log.error("Bridge connection failed, closing", cause);
            ctx.close();
        }
    }
}
