package com.questrail.brickhub.hub;

/**
 * The device reported something that contradicts the driver's view of it,
 * e.g. a detach for a port with nothing attached.
 *
 * <p>Thrown into the notification delivery context. The driver state can
 * no longer be trusted afterwards.</p>
 */
public final class ProtocolViolationException extends RuntimeException
{
    public ProtocolViolationException(String message) {
        super(message);
    }
}
