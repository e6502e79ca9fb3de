package com.questrail.brickhub.protocol.model;

/**
 * Port output command feedback ($82).
 *
 * <p>Only a feedback with {@link #COMPLETED} or {@link #DISCARDED} set
 * finishes a pending {@link PortOutput}; progress updates do not.</p>
 */
public record PortOutputFeedback(int port, int status) implements UpstreamMessage
{
    public static final int TYPE = 0x82;

    public static final int IN_PROGRESS = 0x01;
    public static final int COMPLETED = 0x02;
    public static final int DISCARDED = 0x04;
    public static final int IDLE = 0x08;
    public static final int BUSY = 0x10;

    @Override
    public int type() {
        return TYPE;
    }

    @Override
    public boolean isReplyTo(DownstreamMessage request) {
        return request instanceof PortOutput output
                && output.port() == port
                && (status & (COMPLETED | DISCARDED)) != 0;
    }

    @Override
    public String toString() {
        return String.format("PortOutputFeedback[port=0x%02x, status=0x%02x]", port, status);
    }
}
