package com.questrail.brickhub.protocol.model;

/**
 * Canonical semantic representation of a hub protocol message.
 *
 * <h2>Purpose</h2>
 * <p>
 * {@code HubMessage} represents a fully decoded hub message. It is the only
 * form of message that the hub engine, the attachment tracker and the
 * peripherals are permitted to reason about.
 * </p>
 *
 * <p>
 * Wire-level concerns are resolved below this layer:
 * </p>
 * <ul>
 *   <li>Length byte and hub id in the frame header</li>
 *   <li>Byte order of multi-byte fields (little endian)</li>
 *   <li>Transport details (BLE characteristic, bridge socket)</li>
 * </ul>
 *
 * <h2>Directionality</h2>
 * <ul>
 *   <li>Driver → hub messages are {@link DownstreamMessage}s</li>
 *   <li>Hub → driver messages are {@link UpstreamMessage}s</li>
 * </ul>
 *
 * <p>
 * A few message types ({@link HubProperties}, {@link HubAction},
 * {@link HubAlert}) travel in both directions and implement both.
 * </p>
 */
public sealed interface HubMessage
        permits DownstreamMessage, UpstreamMessage {

    /**
     * Returns the message type byte carried at offset 2 of the frame.
     *
     * @return unsigned message type
     */
    int type();
}
