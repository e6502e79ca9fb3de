package com.questrail.brickhub.hub;

import com.questrail.brickhub.protocol.model.DownstreamMessage;

import java.time.Duration;

/**
 * No reply arrived for a synchronous command within the configured timeout.
 */
public final class ReplyTimeoutException extends HubException
{
    public ReplyTimeoutException(DownstreamMessage request, Duration timeout) {
        super("No reply to " + request + " within " + timeout.toMillis() + " ms");
    }
}
