package com.questrail.brickhub.protocol.model;

/**
 * Value notification addressed to the peripheral attached at {@link #port()}.
 */
public sealed interface PortData extends UpstreamMessage
        permits PortValueSingle, PortValueCombined {

    int port();

    /**
     * @return a copy of the raw value bytes
     */
    byte[] value();
}
