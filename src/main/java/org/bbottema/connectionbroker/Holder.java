package org.bbottema.connectionbroker;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.ToString;
import org.bbottema.connectionbroker.util.Timeout;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Ownership token for one worker's connection. At any time it is owned either by the pool (sitting in the queue, or on its
 * way to its worker for a ping) or by exactly one {@link CheckoutHandle}.
 * <p>
 * A holder lives as long as the physical connection. When the connection fails the holder is invalidated for good and the
 * worker announces a fresh one after reconnecting.
 * <p>
 * All state changes happen under the pool's lock.
 */
@ToString
final class Holder<T> extends QueueEntry<T> {
	
	enum HolderState {
		NEW, AVAILABLE, CHECKED_OUT, PINGING, INVALIDATED
	}
	
	@ToString.Exclude
	@NotNull @Getter private final ConnectionWorker<T> worker;
	@ToString.Exclude
	@NotNull private final T connection;
	/**
	 * Bumped on every checkout. A handle is only valid for the lock value it was created with.
	 */
	@Getter private long lock;
	/**
	 * {@link System#nanoTime()} of the last return to the pool.
	 */
	@Getter private long checkinTimeNanos;
	@Nullable @Getter private Timeout deadline;
	private long deadlineNanos;
	@ToString.Exclude
	@Nullable @Getter private CheckoutHandle<T> owner;
	@NotNull @Getter(AccessLevel.PACKAGE) private HolderState state = HolderState.NEW;
	
	Holder(@NotNull ConnectionWorker<T> worker, @NotNull T connection) {
		this.worker = worker;
		this.connection = connection;
	}
	
	@ToString.Include(name = "worker", rank = 1)
	int getWorkerId() {
		return worker.getId();
	}
	
	/**
	 * Transfers ownership to a new handle. From here on only that handle's owner may touch the connection.
	 */
	@NotNull
	CheckoutHandle<T> checkOut(@NotNull ConnectionPool<T> pool, long nowNanos, @Nullable Timeout deadline) {
		lock++;
		state = HolderState.CHECKED_OUT;
		this.deadline = (deadline != null && !deadline.isForever()) ? deadline : null;
		this.deadlineNanos = this.deadline != null ? nowNanos + this.deadline.toNanos() : 0;
		owner = new CheckoutHandle<>(pool, this, lock, checkinTimeNanos, nowNanos);
		return owner;
	}
	
	/**
	 * Ownership went back to the pool. Any handle created before stays stale.
	 */
	void release() {
		owner = null;
		deadline = null;
		deadlineNanos = 0;
	}
	
	/**
	 * Ownership is back with the pool, whether the holder goes on to the queue or straight to a waiter.
	 */
	void markReturned(long nowNanos) {
		checkinTimeNanos = nowNanos;
	}
	
	void makeAvailable() {
		state = HolderState.AVAILABLE;
		stampQueued(checkinTimeNanos);
	}
	
	void startPing() {
		state = HolderState.PINGING;
	}
	
	void invalidate() {
		release();
		state = HolderState.INVALIDATED;
	}
	
	boolean isOverdue(long nowNanos) {
		return state == HolderState.CHECKED_OUT && deadline != null && nowNanos - deadlineNanos >= 0;
	}
	
	boolean isIdleFor(long idleNanos, long nowNanos) {
		return state == HolderState.AVAILABLE && nowNanos - checkinTimeNanos >= idleNanos;
	}
	
	/**
	 * Only to be used by the current owner.
	 */
	@NotNull
	T getConnection() {
		return connection;
	}
}
