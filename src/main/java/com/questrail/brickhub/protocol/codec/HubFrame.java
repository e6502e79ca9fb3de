package com.questrail.brickhub.protocol.codec;

/**
 * HubFrame
 * -----------------------------------------------------------------------------
 * Immutable, wire-adjacent representation of one hub frame.
 *
 * <h2>What this represents</h2>
 * A {@code HubFrame} is a frame after the common header ({@code length},
 * {@code hubId}, {@code type}) has been checked and stripped. It is still
 * <em>not</em> a semantic message: the engine never branches on frames.
 *
 * The payload is copied on the way in and on the way out.
 */
public final class HubFrame
{
    private final int hubId;
    private final int type;
    private final byte[] payload;

    public HubFrame(int hubId, int type, byte[] payload) {
        this.hubId = hubId;
        this.type = type;
        this.payload = (payload == null) ? new byte[0] : payload.clone();
    }

    public int hubId() {
        return hubId;
    }

    /**
     * Returns the unsigned message type byte.
     */
    public int type() {
        return type;
    }

    /**
     * Returns a copy of the payload bytes following the type byte.
     */
    public byte[] payload() {
        return payload.clone();
    }

    int payloadLength() {
        return payload.length;
    }

    @Override
    public String toString() {
        return "HubFrame[" +
                "hubId=" + hubId +
                ", type=0x" + Integer.toHexString(type) +
                ", payload=" + HubBytes.toHex(payload) +
                ']';
    }
}
