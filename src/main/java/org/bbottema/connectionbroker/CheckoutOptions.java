package org.bbottema.connectionbroker;

import lombok.Builder;
import lombok.Value;
import org.bbottema.connectionbroker.util.Timeout;
import org.jetbrains.annotations.Nullable;

/**
 * Per-checkout overrides. Anything left {@code null} falls back to the {@link PoolConfig}.
 */
@Builder
@Value
public class CheckoutOptions {
	
	static final CheckoutOptions DEFAULTS = CheckoutOptions.builder().build();
	
	/**
	 * Overrides {@link PoolConfig#isQueue()}.
	 */
	@Nullable Boolean queue;
	/**
	 * Overrides {@link PoolConfig#getTimeout()}.
	 */
	@Nullable Timeout timeout;
	/**
	 * Maximum time the connection may stay checked out. Past it the pool takes the connection back and the handle fails with
	 * {@link CheckoutDeadlineExceededException}. No deadline when {@code null}.
	 */
	@Nullable Timeout deadline;
}
