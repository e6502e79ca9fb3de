package com.questrail.brickhub.protocol.codec;

/**
 * Indicates that notification bytes could not be translated into a valid
 * semantic hub message.
 *
 * This typically reflects:
 * <ul>
 *   <li>Unknown or unsupported message type byte</li>
 *   <li>Length byte disagreeing with the received frame</li>
 *   <li>Illegal payload shape for the message type</li>
 * </ul>
 *
 * After such a failure the driver can no longer trust its view of the
 * device, so the hub engine treats it as fatal.
 */
public final class MessageDecodeException extends RuntimeException
{
    public MessageDecodeException(String message) {
        super(message);
    }

    public MessageDecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
