package com.questrail.brickhub.observability;

import com.questrail.brickhub.protocol.model.GenericError;

import java.time.Instant;

/**
 * Record representing an error reported by the hub itself.
 *
 * <p>{@code pendingRequest} tells whether a synchronous send was waiting
 * when the error arrived; if not, the failing command was fire-and-forget.</p>
 */
public record DeviceErrorEvent(
    Instant timestamp,
    GenericError error,
    boolean pendingRequest
) {
}
