package org.bbottema.connectionbroker;

import lombok.AccessLevel;
import lombok.Getter;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.concurrent.TimeUnit;

import static java.util.Objects.requireNonNull;

/**
 * What a caller gets from {@link ConnectionPool#checkout()}: exclusive use of one connection until {@link #checkin()}.
 * <p>
 * A handle is single-use. Once checked in it can't be used or checked in again, and the pool may take it back on its own
 * (connection lost, deadline exceeded, pool shut down), after which {@link #getConnection()} throws the reason.
 *
 * @param <T> the connection type
 */
public final class CheckoutHandle<T> {
	
	enum HandleState {
		CHECKED_OUT, CHECKED_IN, REVOKED
	}
	
	@NotNull @Getter(AccessLevel.PACKAGE) private final ConnectionPool<T> pool;
	@NotNull @Getter(AccessLevel.PACKAGE) private final Holder<T> holder;
	/**
	 * The holder's lock value at the moment of transfer.
	 */
	@Getter private final long lock;
	private final long checkinTimeNanos;
	private final long checkoutTimeNanos;
	
	@NotNull private volatile HandleState state = HandleState.CHECKED_OUT;
	@Nullable private volatile PoolException revocationCause;
	
	CheckoutHandle(@NotNull ConnectionPool<T> pool, @NotNull Holder<T> holder, long lock, long checkinTimeNanos, long checkoutTimeNanos) {
		this.pool = pool;
		this.holder = holder;
		this.lock = lock;
		this.checkinTimeNanos = checkinTimeNanos;
		this.checkoutTimeNanos = checkoutTimeNanos;
	}
	
	/**
	 * @throws AlreadyCheckedInException after {@link #checkin()}
	 * @throws PoolException the revocation cause if the pool took the connection back, see {@link #getRevocationCause()}
	 */
	@NotNull
	public T getConnection() {
		switch (state) {
			case CHECKED_IN:
				throw new AlreadyCheckedInException(this);
			case REVOKED:
				throw requireNonNull(revocationCause);
			default:
				return holder.getConnection();
		}
	}
	
	/**
	 * Returns the connection to the pool.
	 *
	 * @throws AlreadyCheckedInException if this handle was checked in before
	 * @throws InvalidHandleException    if this handle no longer owns its connection
	 * @throws PoolException             the revocation cause if the pool took the connection back in the meantime
	 */
	public void checkin() {
		pool.checkin(this);
	}
	
	/**
	 * Gives the connection up as broken: it is not returned to the pool, its worker reconnects instead.
	 *
	 * @throws PoolException the revocation cause if the pool took the connection back in the meantime
	 */
	public void disconnect(@NotNull Throwable cause) {
		pool.disconnect(this, cause);
	}
	
	public boolean isCheckedOut() {
		return state == HandleState.CHECKED_OUT;
	}
	
	public boolean isRevoked() {
		return state == HandleState.REVOKED;
	}
	
	boolean isCheckedIn() {
		return state == HandleState.CHECKED_IN;
	}
	
	/**
	 * @return why the pool took the connection back: {@link ConnectionLostException}, {@link CheckoutDeadlineExceededException}
	 * or {@link PoolShutdownException}. {@code null} while the handle was not revoked.
	 */
	@Nullable
	public PoolException getRevocationCause() {
		return revocationCause;
	}
	
	/**
	 * @return how long the connection sat idle in the pool before this checkout.
	 */
	public long idleMsBeforeCheckout() {
		return TimeUnit.NANOSECONDS.toMillis(checkoutTimeNanos - checkinTimeNanos);
	}
	
	/**
	 * @return the numbers of milliseconds since this handle was checked out.
	 */
	public long checkedOutMs() {
		return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - checkoutTimeNanos);
	}
	
	void markCheckedIn() {
		state = HandleState.CHECKED_IN;
	}
	
	void revoke(@NotNull PoolException cause) {
		revocationCause = cause;
		state = HandleState.REVOKED;
	}
	
	@Override
	public String toString() {
		return "CheckoutHandle(worker=" + holder.getWorkerId() + ", lock=" + lock + ", state=" + state + ")";
	}
}
