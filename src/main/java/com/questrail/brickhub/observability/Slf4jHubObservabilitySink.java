package com.questrail.brickhub.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of HubObservabilitySink that emits logs via SLF4J.
 */
public final class Slf4jHubObservabilitySink implements HubObservabilitySink
{
    private static final Logger log = LoggerFactory.getLogger(Slf4jHubObservabilitySink.class);

    @Override
    public void onPeripheralAttached(PeripheralEvent event) {
        log.info("Port 0x{}: attached {} (device type 0x{})",
            Integer.toHexString(event.port()),
            event.peripheral(),
            Integer.toHexString(event.deviceType()));
    }

    @Override
    public void onPeripheralDetached(PeripheralEvent event) {
        log.info("Port 0x{}: detached {}", Integer.toHexString(event.port()), event.peripheral());
    }

    @Override
    public void onDeviceError(DeviceErrorEvent event) {
        if (event.pendingRequest()) {
            log.warn("Hub rejected pending command: {}", event.error().message());
        } else {
            log.warn("Hub rejected command: {}", event.error().message());
        }
    }

    @Override
    public void onError(HubErrorEvent event) {
        log.error("Hub protocol error: {}", event.message(), event.cause());
    }
}
