package org.bbottema.connectionbroker;

import lombok.Getter;

/**
 * Something that can sit in the pool's queue: an available {@link Holder} while the pool is {@link PoolStatus#READY}, or a
 * {@link Waiter} while it is {@link PoolStatus#BUSY}.
 */
abstract class QueueEntry<T> {
	
	/**
	 * {@link System#nanoTime()} at the moment the entry was put in the queue. Entries are appended, so the queue is ordered by
	 * this stamp and ties keep their arrival order.
	 */
	@Getter private long queuedAtNanos;
	
	void stampQueued(long nowNanos) {
		this.queuedAtNanos = nowNanos;
	}
}
