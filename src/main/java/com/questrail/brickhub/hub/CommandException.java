package com.questrail.brickhub.hub;

import com.questrail.brickhub.protocol.model.GenericError;

import java.util.Objects;

/**
 * The hub answered a synchronous command with a generic error.
 *
 * <p>The request slot is already free again when this is thrown; whether
 * to retry is up to the caller.</p>
 */
public final class CommandException extends HubException
{
    private final transient GenericError error;

    public CommandException(GenericError error) {
        super(Objects.requireNonNull(error, "error").message());
        this.error = error;
    }

    public GenericError error() {
        return error;
    }
}
