/**
 * Hub Message Codec
 * =============================================================================
 *
 * Two layers, each with a single job:
 * <ul>
 *   <li><b>Framing</b> ({@code HubFraming}, {@link com.questrail.brickhub.protocol.codec.HubFrame}):
 *       checks and strips the common {@code [length, hubId, type]} header.</li>
 *   <li><b>Semantics</b> ({@link com.questrail.brickhub.protocol.codec.HubMessageDecoder},
 *       {@link com.questrail.brickhub.protocol.codec.HubMessageEncoder}):
 *       maps frame payloads to and from the records in
 *       {@code com.questrail.brickhub.protocol.model}.</li>
 * </ul>
 *
 * Decoding failures are {@link com.questrail.brickhub.protocol.codec.MessageDecodeException}.
 * The codec keeps no state and never talks to a transport.
 */
package com.questrail.brickhub.protocol.codec;
