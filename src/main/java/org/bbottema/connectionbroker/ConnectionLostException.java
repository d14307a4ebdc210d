package org.bbottema.connectionbroker;

import org.jetbrains.annotations.Nullable;

/**
 * The connection behind a checked out handle died. Check out again to get another one, the pool heals itself once the
 * worker reconnects.
 */
public class ConnectionLostException extends PoolException {
	
	ConnectionLostException(int workerId, @Nullable Throwable cause) {
		super("Connection of worker " + workerId + " was lost while checked out", cause);
	}
}
