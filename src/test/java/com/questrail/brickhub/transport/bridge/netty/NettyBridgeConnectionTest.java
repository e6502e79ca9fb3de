package com.questrail.brickhub.transport.bridge.netty;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.questrail.brickhub.config.BridgeConfig;
import com.questrail.brickhub.config.HubConfig;
import com.questrail.brickhub.hub.Hub;
import com.questrail.brickhub.protocol.model.HubProperties;
import com.questrail.brickhub.transport.TransportException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.net.InetAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Runs the bridge connection against a local socket playing the bridge process.
 */
final class NettyBridgeConnectionTest
{
    private static final ObjectMapper JSON = new ObjectMapper();
    private static final int TIMEOUT_MS = 5000;

    private ServerSocket server;
    private NettyBridgeConnection connection;
    private ExecutorService executor;

    @BeforeEach
    void setUp() throws IOException
    {
        server = new ServerSocket(0, 1, InetAddress.getLoopbackAddress());
        server.setSoTimeout(TIMEOUT_MS);
        executor = Executors.newSingleThreadExecutor();
    }

    @AfterEach
    void tearDown() throws IOException
    {
        if (connection != null) {
            connection.disconnect();
        }
        server.close();
        executor.shutdownNow();
    }

    private BridgeConfig config(int port)
    {
        return BridgeConfig.builder()
                .withHost(InetAddress.getLoopbackAddress().getHostAddress())
                .withPort(port)
                .withConnectTimeout(Duration.ofSeconds(2))
                .build();
    }

    private static JsonNode readJson(BufferedReader reader) throws IOException
    {
        String line = reader.readLine();
        assertNotNull(line, "bridge closed the stream");
        return JSON.readTree(line);
    }

    private static void send(Writer writer, String line) throws IOException
    {
        writer.write(line);
        writer.write('\n');
        writer.flush();
    }

    @Test
    void writesAreSentAsJsonLines() throws Exception
    {
        connection = new NettyBridgeConnection(config(server.getLocalPort())).connect();

        try (Socket bridge = server.accept()) {
            bridge.setSoTimeout(TIMEOUT_MS);
            BufferedReader reader = new BufferedReader(
                    new InputStreamReader(bridge.getInputStream(), StandardCharsets.UTF_8));

            connection.enableNotifications();
            connection.write(Hub.HUB_HARDWARE_HANDLE, new byte[] { 0x05, 0x00, 0x01, 0x06, 0x05 });

            JsonNode enable = readJson(reader);
            assertEquals("write", enable.get("type").asText());
            assertEquals(NettyBridgeConnection.NOTIFICATION_CONFIG_HANDLE, enable.get("handle").asInt());
            assertEquals("0100", enable.get("data").asText());

            JsonNode write = readJson(reader);
            assertEquals("write", write.get("type").asText());
            assertEquals(0x0E, write.get("handle").asInt());
            assertEquals("0500010605", write.get("data").asText());
        }
    }

    @Test
    void notificationsAreDeliveredInOrderAndOtherLinesAreDropped() throws Exception
    {
        BlockingQueue<byte[]> received = new LinkedBlockingQueue<>();
        connection = new NettyBridgeConnection(config(server.getLocalPort()));
        connection.setNotificationHandler((handle, data) -> received.add(data));
        connection.connect();

        try (Socket bridge = server.accept()) {
            Writer writer = new OutputStreamWriter(bridge.getOutputStream(), StandardCharsets.UTF_8);

            send(writer, "{\"type\":\"notification\",\"handle\":14,\"data\":\"0500453a07\"}");
            send(writer, "this is not json");
            send(writer, "{\"type\":\"status\",\"state\":\"connected\"}");
            send(writer, "{\"type\":\"notification\",\"handle\":14,\"data\":\"zz\"}");
            send(writer, "{\"type\":\"notification\",\"handle\":14,\"data\":\"0500453a08\"}");

            assertArrayEquals(new byte[] { 0x05, 0x00, 0x45, 0x3A, 0x07 },
                    received.poll(TIMEOUT_MS, TimeUnit.MILLISECONDS));
            assertArrayEquals(new byte[] { 0x05, 0x00, 0x45, 0x3A, 0x08 },
                    received.poll(TIMEOUT_MS, TimeUnit.MILLISECONDS));
            assertNull(received.poll(100, TimeUnit.MILLISECONDS));
            assertTrue(connection.isAlive());
        }
    }

    @Test
    void hubRequestIsAnsweredThroughTheBridge() throws Exception
    {
        connection = new NettyBridgeConnection(config(server.getLocalPort())).connect();

        try (Socket bridge = server.accept()) {
            bridge.setSoTimeout(TIMEOUT_MS);
            BufferedReader reader = new BufferedReader(
                    new InputStreamReader(bridge.getInputStream(), StandardCharsets.UTF_8));
            Writer writer = new OutputStreamWriter(bridge.getOutputStream(), StandardCharsets.UTF_8);

            Hub hub = new Hub(connection, HubConfig.builder().withReplyTimeout(Duration.ofSeconds(5)).build());
            assertEquals("0100", readJson(reader).get("data").asText());

            Future<HubProperties> reply = executor.submit(() ->
                    hub.request(HubProperties.request(HubProperties.VOLTAGE_PERCENT), HubProperties.class));

            assertEquals("0500010605", readJson(reader).get("data").asText());
            send(writer, "{\"type\":\"notification\",\"handle\":14,\"data\":\"060001060664\"}");

            HubProperties voltage = reply.get(TIMEOUT_MS, TimeUnit.MILLISECONDS);
            assertArrayEquals(new byte[] { 0x64 }, voltage.parameters());

            hub.close();
            assertFalse(connection.isAlive());
        }
    }

    @Test
    void closingHubAfterBridgeDroppedReleasesEventLoop() throws Exception
    {
        connection = new NettyBridgeConnection(config(server.getLocalPort())).connect();
        Hub hub;

        try (Socket bridge = server.accept()) {
            bridge.setSoTimeout(TIMEOUT_MS);
            BufferedReader reader = new BufferedReader(
                    new InputStreamReader(bridge.getInputStream(), StandardCharsets.UTF_8));

            hub = new Hub(connection, HubConfig.defaults());
            assertEquals("0100", readJson(reader).get("data").asText());
        }

        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(TIMEOUT_MS);
        while (connection.isAlive() && System.nanoTime() < deadline) {
            Thread.sleep(10);
        }
        assertFalse(connection.isAlive());
        assertFalse(connection.isReleased());

        hub.close();

        assertTrue(hub.isClosed());
        assertTrue(connection.isReleased());
    }

    @Test
    void disconnectIsIdempotent() throws Exception
    {
        connection = new NettyBridgeConnection(config(server.getLocalPort())).connect();

        try (Socket ignored = server.accept()) {
            assertTrue(connection.isAlive());
            connection.disconnect();
            connection.disconnect();

            assertFalse(connection.isAlive());
            assertTrue(connection.isReleased());
            assertThrows(TransportException.class, () -> connection.write(0x0E, new byte[] { 0x01 }));
        }
    }

    @Test
    void writeBeforeConnectFails()
    {
        connection = new NettyBridgeConnection(config(server.getLocalPort()));

        assertFalse(connection.isAlive());
        assertThrows(TransportException.class, () -> connection.write(0x0E, new byte[] { 0x01 }));
    }

    @Test
    void connectFailureIsReported() throws Exception
    {
        int port = server.getLocalPort();
        server.close();

        NettyBridgeConnection unreachable = new NettyBridgeConnection(config(port));

        assertThrows(TransportException.class, unreachable::connect);
        assertFalse(unreachable.isAlive());
    }
}
