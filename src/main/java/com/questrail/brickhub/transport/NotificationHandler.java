package com.questrail.brickhub.transport;

/**
 * Callback sink for {@link Connection} notifications.
 */
@FunctionalInterface
public interface NotificationHandler
{
    /**
     * Called for each notification pushed by the device.
     *
     * <p>The payload is one complete frame. No streaming assumptions are
     * permitted at this boundary.</p>
     *
     * @param handle characteristic handle the notification arrived on
     * @param data raw notification bytes
     */
    void onNotification(int handle, byte[] data);
}
