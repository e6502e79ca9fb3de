package com.questrail.brickhub.config;

/**
 * What the hub engine does when a synchronous send starts while another
 * synchronous send is still waiting for its reply.
 */
public enum SyncSendPolicy
{
    /**
     * Fail the second send with {@link IllegalStateException} before any
     * byte is written. Callers serialize their own synchronous sends.
     */
    REJECT,

    /**
     * Block the second sender until the outstanding request completes.
     * Waiting senders are admitted in arrival order.
     */
    SERIALIZE
}
