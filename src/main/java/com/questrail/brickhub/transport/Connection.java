package com.questrail.brickhub.transport;

/**
 * Connection
 * -----------------------------------------------------------------------------
 * Minimal port for the link between the driver and one physical hub.
 *
 * <p>The connection is a pure transport. Higher layers are responsible for:</p>
 * <ul>
 *   <li>encoding commands before {@link #write}</li>
 *   <li>decoding the bytes handed to the {@link NotificationHandler}</li>
 *   <li>correlating replies with requests</li>
 * </ul>
 *
 * <p>Implementations may be backed by a BLE stack, a bridge process or a
 * test harness.</p>
 */
public interface Connection
{
    /**
     * Write raw bytes to a characteristic handle.
     *
     * @param handle hardware characteristic handle
     * @param data bytes to write
     * @throws TransportException if the bytes cannot be handed to the transport
     */
    void write(int handle, byte[] data);

    /**
     * Install the single notification callback.
     *
     * <p>Notifications MUST be delivered serially, from one delivery context,
     * in the order the device sent them. Installing a new handler replaces
     * the previous one.</p>
     */
    void setNotificationHandler(NotificationHandler handler);

    /**
     * Ask the device to start pushing notifications.
     */
    void enableNotifications();

    /**
     * Release the link. Calling this on a link that is already down has no effect.
     */
    void disconnect();

    /**
     * @return {@code true} while the link can carry traffic
     */
    boolean isAlive();
}
