package com.questrail.brickhub.protocol.model;

/**
 * Port input format notification, single mode ($47).
 */
public record PortInputFormatSingle(
        int port,
        int mode,
        long deltaInterval,
        boolean notificationsEnabled
) implements UpstreamMessage
{
    public static final int TYPE = 0x47;

    @Override
    public int type() {
        return TYPE;
    }

    @Override
    public boolean isReplyTo(DownstreamMessage request) {
        return request instanceof PortInputFormatSetupSingle setup && setup.port() == port;
    }
}
