package com.questrail.brickhub.observability;

import com.questrail.brickhub.config.HubConfig;
import com.questrail.brickhub.hub.Hub;
import com.questrail.brickhub.peripheral.PeripheralRegistry;
import com.questrail.brickhub.protocol.model.GenericError;
import com.questrail.brickhub.protocol.model.HubAttachedIo;
import com.questrail.brickhub.transport.FakeConnection;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

final class Slf4jHubObservabilitySinkTest
{
    @Test
    void hubEventsAreLoggedWithoutDisturbingTheHub()
    {
        FakeConnection connection = new FakeConnection();
        Hub hub = new Hub(connection, HubConfig.defaults(), PeripheralRegistry.defaults(),
                new Slf4jHubObservabilitySink());

        assertDoesNotThrow(() -> {
            connection.inject(HubAttachedIo.attached(0x32, HubAttachedIo.DEV_RGB_LIGHT, 0, 0));
            connection.inject(HubAttachedIo.detached(0x32));
            connection.inject(new GenericError(0x81, GenericError.OVERCURRENT));
        });
        assertTrue(hub.peripherals().isEmpty());
    }

    @Test
    void errorEventsAcceptMissingCause()
    {
        Slf4jHubObservabilitySink sink = new Slf4jHubObservabilitySink();

        assertDoesNotThrow(() -> sink.onError(new HubErrorEvent(Instant.now(), "no cause", null)));
        assertDoesNotThrow(() -> NullObservabilitySink.INSTANCE.onError(
                new HubErrorEvent(Instant.now(), "ignored", new IllegalStateException())));
    }

    @Test
    void nullSinkIsUsedWhenNoneIsGiven()
    {
        FakeConnection connection = new FakeConnection();
        new Hub(connection, HubConfig.defaults(), PeripheralRegistry.defaults(), null);

        assertDoesNotThrow(() -> connection.inject(new GenericError(0x01, GenericError.TIMEOUT)));
    }
}
