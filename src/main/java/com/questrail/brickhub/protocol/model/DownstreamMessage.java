package com.questrail.brickhub.protocol.model;

/**
 * Driver → hub command.
 *
 * <p>
 * Instances are immutable once constructed. Whether the command is
 * synchronous is a property of the message itself: the hub engine blocks
 * the sender until a correlated {@link UpstreamMessage} arrives when
 * {@link #needsReply()} is {@code true}.
 * </p>
 */
public sealed interface DownstreamMessage extends HubMessage
        permits HubProperties, HubAction, HubAlert, PortInputFormatSetupSingle, PortOutput {

    /**
     * @return {@code true} if the hub answers this command with a reply
     *         that the sender must wait for
     */
    boolean needsReply();
}
