package org.bbottema.connectionbroker;

import lombok.Getter;

import java.util.concurrent.TimeUnit;

/**
 * The pool has been queueing longer than its target delay for a full interval and is shedding new checkouts.
 */
public class PoolOverloadedException extends PoolException {
	
	/**
	 * Smallest queue delay observed in the current controlled-delay interval.
	 */
	@Getter private final long minimumQueueDelayMs;
	
	PoolOverloadedException(long minimumQueueDelayNanos, long queueTargetMs) {
		super("Connection pool is overloaded: queue delay stayed above the target of " + queueTargetMs + "ms (current minimum "
				+ TimeUnit.NANOSECONDS.toMillis(minimumQueueDelayNanos) + "ms)");
		this.minimumQueueDelayMs = TimeUnit.NANOSECONDS.toMillis(minimumQueueDelayNanos);
	}
}
