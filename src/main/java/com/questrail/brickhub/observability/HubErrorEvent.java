package com.questrail.brickhub.observability;

import java.time.Instant;

/**
 * Record representing a driver-side protocol defect.
 */
public record HubErrorEvent(
    Instant timestamp,
    String message,
    Throwable cause
) {
}
