package com.questrail.brickhub.transport;

/**
 * Raised when a {@link Connection} cannot be opened or cannot carry a write.
 */
public class TransportException extends RuntimeException
{
    public TransportException(String message) {
        super(message);
    }

    public TransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
