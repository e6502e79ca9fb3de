package com.questrail.brickhub.hub;

import com.questrail.brickhub.protocol.model.DownstreamMessage;
import com.questrail.brickhub.protocol.model.UpstreamMessage;

import java.util.concurrent.CompletableFuture;

/**
 * The one synchronous command awaiting its reply, plus the single-slot
 * channel the reply is handed over on.
 */
record PendingRequest(DownstreamMessage request, CompletableFuture<UpstreamMessage> reply)
{
    static PendingRequest of(DownstreamMessage request) {
        return new PendingRequest(request, new CompletableFuture<>());
    }

    void complete(UpstreamMessage message) {
        reply.complete(message);
    }
}
