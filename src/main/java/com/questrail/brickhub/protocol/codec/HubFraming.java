package com.questrail.brickhub.protocol.codec;

import java.util.Arrays;

/**
 * HubFraming
 * -----------------------------------------------------------------------------
 * Common header handling for hub frames.
 *
 * <p>Every frame starts with:</p>
 * <ul>
 *   <li>a length byte covering the whole frame, header included</li>
 *   <li>a hub id byte (always {@code 0x00} for a single hub)</li>
 *   <li>the message type byte</li>
 * </ul>
 *
 * <p>The protocol allows a two-byte length for frames above 127 bytes. The
 * hub never produces such frames for the messages handled here, so they are
 * rejected rather than guessed at.</p>
 */
final class HubFraming
{
    static final int HEADER_LENGTH = 3;
    static final int MAX_FRAME_LENGTH = 127;
    static final int DEFAULT_HUB_ID = 0x00;

    static final int LENGTH_OFFSET = 0;
    static final int HUB_ID_OFFSET = 1;
    static final int TYPE_OFFSET = 2;

    private HubFraming() {}

    /**
     * Splits raw notification bytes into header fields and payload.
     *
     * @throws MessageDecodeException if the bytes do not form one complete frame
     */
    static HubFrame unwrap(byte[] data) {
        if (data == null || data.length < HEADER_LENGTH) {
            throw new MessageDecodeException("Frame too short for hub header: "
                    + (data == null ? "null" : HubBytes.toHex(data)));
        }

        final int length = HubBytes.u8(data, LENGTH_OFFSET);
        if ((length & 0x80) != 0) {
            throw new MessageDecodeException("Extended frame length is not supported: "
                    + HubBytes.toHex(data));
        }
        if (length != data.length) {
            throw new MessageDecodeException("Frame length byte " + length
                    + " does not match " + data.length + " received bytes: " + HubBytes.toHex(data));
        }

        return new HubFrame(
                HubBytes.u8(data, HUB_ID_OFFSET),
                HubBytes.u8(data, TYPE_OFFSET),
                Arrays.copyOfRange(data, HEADER_LENGTH, data.length));
    }

    /**
     * Prepends the common header to a frame payload.
     *
     * @throws IllegalArgumentException if the frame would exceed the
     *         single-byte length limit
     */
    static byte[] wrap(HubFrame frame) {
        final int length = HEADER_LENGTH + frame.payloadLength();
        if (length > MAX_FRAME_LENGTH) {
            throw new IllegalArgumentException("Frame of " + length + " bytes exceeds "
                    + MAX_FRAME_LENGTH + " byte limit");
        }

        byte[] out = new byte[length];
        out[LENGTH_OFFSET] = (byte) length;
        out[HUB_ID_OFFSET] = (byte) frame.hubId();
        out[TYPE_OFFSET] = (byte) frame.type();
        System.arraycopy(frame.payload(), 0, out, HEADER_LENGTH, frame.payloadLength());
        return out;
    }
}
