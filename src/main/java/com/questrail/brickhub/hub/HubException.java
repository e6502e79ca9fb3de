package com.questrail.brickhub.hub;

/**
 * Root of the failures a synchronous hub command reports to its caller.
 */
public class HubException extends RuntimeException
{
    public HubException(String message) {
        super(message);
    }

    public HubException(String message, Throwable cause) {
        super(message, cause);
    }
}
