package org.bbottema.connectionbroker;

import org.jetbrains.annotations.NotNull;

/**
 * A checkin that does not match the holder's current owner. This always points at an ownership bug in the calling code
 * (double checkin, checkin of someone else's handle), so it is never swallowed.
 */
public class InvalidHandleException extends PoolException {
	
	InvalidHandleException(@NotNull String message) {
		super(message);
	}
}
