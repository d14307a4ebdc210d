package org.bbottema.connectionbroker;

import lombok.Getter;
import org.bbottema.connectionbroker.util.Timeout;
import org.jetbrains.annotations.NotNull;

/**
 * The handle was held longer than the deadline given at checkout, so the pool took the connection back.
 */
public class CheckoutDeadlineExceededException extends PoolException {
	
	@NotNull @Getter private final Timeout deadline;
	
	CheckoutDeadlineExceededException(@NotNull Timeout deadline) {
		super("Connection was reclaimed by the pool after being checked out for longer than its deadline of " + deadline);
		this.deadline = deadline;
	}
}
