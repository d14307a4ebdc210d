package org.bbottema.connectionbroker;

import lombok.Getter;
import org.bbottema.connectionbroker.util.Timeout;
import org.jetbrains.annotations.NotNull;

public class CheckoutTimeoutException extends PoolException {
	
	/**
	 * The configured checkout timeout that was just overshot.
	 */
	@NotNull @Getter private final Timeout timeout;
	
	CheckoutTimeoutException(@NotNull Timeout timeout) {
		super("Checkout has been waiting in the queue for more than the configured timeout of " + timeout);
		this.timeout = timeout;
	}
}
