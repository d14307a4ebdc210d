package org.bbottema.connectionbroker;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Base type of every error the pool surfaces to its callers. None of these are retried by the pool itself.
 */
public abstract class PoolException extends RuntimeException {
	
	PoolException(@NotNull String message) {
		super(message);
	}
	
	PoolException(@NotNull String message, @Nullable Throwable cause) {
		super(message, cause);
	}
}
