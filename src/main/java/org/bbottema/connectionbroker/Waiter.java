package org.bbottema.connectionbroker;

import lombok.Getter;
import org.bbottema.connectionbroker.util.Timeout;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.concurrent.locks.Condition;

/**
 * A checkout parked in the queue while the pool is busy. Exactly one of serve, expire, cancel or shutdown takes effect:
 * whichever reaches the pool's lock first while the waiter is still {@link WaiterState#WAITING}.
 */
final class Waiter<T> extends QueueEntry<T> {
	
	enum WaiterState {
		WAITING, SERVED, EXPIRED, CANCELLED, SHUTDOWN
	}
	
	@NotNull @Getter private final Condition served;
	@Nullable @Getter private final Timeout deadline;
	@NotNull @Getter private WaiterState state = WaiterState.WAITING;
	@Nullable @Getter private CheckoutHandle<T> handle;
	
	Waiter(@NotNull Condition served, long nowNanos, @Nullable Timeout deadline) {
		this.served = served;
		this.deadline = deadline;
		stampQueued(nowNanos);
	}
	
	void serve(@NotNull CheckoutHandle<T> handle) {
		this.handle = handle;
		settle(WaiterState.SERVED);
		served.signal();
	}
	
	void expire() {
		settle(WaiterState.EXPIRED);
	}
	
	void cancel() {
		settle(WaiterState.CANCELLED);
	}
	
	void shutdown() {
		settle(WaiterState.SHUTDOWN);
		served.signal();
	}
	
	private void settle(@NotNull WaiterState outcome) {
		if (state != WaiterState.WAITING) {
			throw new IllegalStateException("Waiter already settled as " + state + ", cannot become " + outcome);
		}
		state = outcome;
	}
}
