package com.questrail.brickhub.protocol.model;

/**
 * Hub → driver notification.
 *
 * <p>
 * Notifications are either unsolicited (attachment changes, sensor values)
 * or replies to a synchronous {@link DownstreamMessage}. Correlation is
 * decided by the notification itself through {@link #isReplyTo}.
 * </p>
 */
public sealed interface UpstreamMessage extends HubMessage
        permits HubProperties, HubAction, HubAlert, HubAttachedIo, GenericError,
                PortData, PortInputFormatSingle, PortOutputFeedback {

    /**
     * Returns whether this notification answers {@code request}.
     *
     * @param request the currently pending synchronous command
     * @return {@code true} if this message completes {@code request}
     */
    default boolean isReplyTo(DownstreamMessage request) {
        return false;
    }
}
