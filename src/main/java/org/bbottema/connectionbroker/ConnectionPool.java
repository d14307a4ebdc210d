package org.bbottema.connectionbroker;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.bbottema.connectionbroker.codel.ControlledDelay;
import org.bbottema.connectionbroker.util.SleepUtil;
import org.bbottema.connectionbroker.util.Timeout;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.LinkedList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

import static java.util.Objects.requireNonNull;
import static java.util.concurrent.Executors.newSingleThreadExecutor;

/**
 * Hands out a fixed set of connections, one caller at a time per connection.
 * <p>
 * Every state change (checkout, checkin, worker ready, worker failure, waiter expiry, housekeeping) runs under one lock, which
 * makes this the single point that orders pool events. The queue holds either available holders (pool {@link PoolStatus#READY})
 * or waiting checkouts (pool {@link PoolStatus#BUSY}), both in FIFO order. A checkin while checkouts are waiting hands the
 * connection straight to the oldest waiter.
 * <p>
 * Checkouts that would have to queue are shed with {@link PoolOverloadedException} once the queue delay has been above
 * {@link PoolConfig#getQueueTarget()} for a full {@link PoolConfig#getQueueInterval()}, see {@link ControlledDelay}.
 *
 * @param <T> the connection type
 */
@Slf4j
public class ConnectionPool<T> {

	private static final long HOUSEKEEPING_INTERVAL_MS = 10;
	private static final long WORKER_TERMINATION_TIMEOUT_MS = 5000;

	@NotNull private final Lock poolLock = new ReentrantLock();
	@NotNull private final LinkedList<QueueEntry<T>> queue = new LinkedList<>();
	@NotNull private final Set<Holder<T>> connected = new HashSet<>();
	@NotNull private final Set<Holder<T>> checkedOut = new LinkedHashSet<>();
	@NotNull private final List<ConnectionWorker<T>> workers = new ArrayList<>();
	@NotNull private final ControlledDelay controlledDelay;
	@NotNull private PoolStatus status = PoolStatus.BUSY;

	@NotNull @Getter private final PoolConfig poolConfig;
	@NotNull @Getter private final Connector<T> connector;

	private volatile boolean shuttingDown;
	@Nullable private Future<Void> shutdownSequence;
	@Nullable private volatile Thread housekeeperThread;

	private long totalCheckouts;
	private long totalQueuedCheckouts;
	private long totalBusyRejections;
	private long totalOverloadRejections;
	private long totalTimeouts;
	private long totalConnectionsLost;
	private long totalDeadlineReclaims;

	private ConnectionPool(@NotNull PoolConfig poolConfig, @NotNull Connector<T> connector) {
		this.poolConfig = poolConfig;
		this.connector = connector;
		this.controlledDelay = new ControlledDelay(poolConfig.getQueueTarget(), poolConfig.getQueueInterval());
		for (int id = 1; id <= poolConfig.getPoolSize(); id++) {
			workers.add(new ConnectionWorker<>(this, connector, id));
		}
	}

	/**
	 * Starts one {@link ConnectionWorker} per connection plus the housekeeper. The returned pool is the handle for every
	 * further call; connections become available as their workers finish connecting.
	 */
	@NotNull
	public static <T> ConnectionPool<T> start(@NotNull PoolConfig poolConfig, @NotNull Connector<T> connector) {
		final ConnectionPool<T> pool = new ConnectionPool<>(poolConfig, connector);
		for (ConnectionWorker<T> worker : pool.workers) {
			worker.start(poolConfig.getThreadFactory());
		}
		final Thread housekeeper = poolConfig.getThreadFactory().newThread(pool.new Housekeeper());
		pool.housekeeperThread = housekeeper;
		housekeeper.start();
		log.info("connection pool started with {} connection worker(s)", poolConfig.getPoolSize());
		return pool;
	}

	/**
	 * Delegates to {@link #checkout(CheckoutOptions)} with the pool's defaults.
	 */
	@NotNull
	public CheckoutHandle<T> checkout() throws InterruptedException {
		return checkout(CheckoutOptions.DEFAULTS);
	}

	/**
	 * Delegates to {@link #checkout(CheckoutOptions)}.
	 */
	@NotNull
	public CheckoutHandle<T> checkout(final boolean queueingAllowed, @NotNull final Timeout timeout) throws InterruptedException {
		return checkout(CheckoutOptions.builder().queue(queueingAllowed).timeout(timeout).build());
	}

	/**
	 * Takes the oldest available connection, or else waits in line for one to be checked in.
	 * <p>
	 * Interrupting a waiting caller withdraws its checkout. If the connection was handed over before the interrupt got
	 * processed, the caller keeps the handle and its interrupt flag is restored.
	 *
	 * @throws PoolBusyException         if nothing is available and the checkout may not queue
	 * @throws PoolOverloadedException   if nothing is available and the pool is shedding load
	 * @throws CheckoutTimeoutException  if nothing became available within the timeout
	 * @throws PoolShutdownException     if the pool was or got shut down
	 * @throws InterruptedException      if the caller was interrupted while waiting
	 */
	@NotNull
	public CheckoutHandle<T> checkout(@NotNull final CheckoutOptions options) throws InterruptedException {
		final boolean queueingAllowed = (options.getQueue() != null) ? options.getQueue() : poolConfig.isQueue();
		final Timeout timeout = (options.getTimeout() != null) ? options.getTimeout() : poolConfig.getTimeout();

		poolLock.lock();
		try {
			if (shuttingDown) {
				throw new PoolShutdownException();
			}
			final long now = System.nanoTime();
			if (status == PoolStatus.READY) {
				final Holder<T> holder = (Holder<T>) queue.removeFirst();
				controlledDelay.sample(0, now);
				return handOver(holder, now, options.getDeadline());
			}
			if (!queueingAllowed) {
				totalBusyRejections++;
				throw new PoolBusyException(poolConfig.getPoolSize());
			}
			if (controlledDelay.shouldDrop(now)) {
				totalOverloadRejections++;
				throw new PoolOverloadedException(controlledDelay.getMinimumDelayNanos(), poolConfig.getQueueTarget().getDurationMs());
			}
			final Waiter<T> waiter = new Waiter<>(poolLock.newCondition(), now, options.getDeadline());
			queue.addLast(waiter);
			totalQueuedCheckouts++;
			return awaitHandOver(waiter, timeout);
		} finally {
			poolLock.unlock();
		}
	}

	/**
	 * Returns a connection to the pool, serving the oldest waiter with it if there is one.
	 *
	 * @throws PoolException the revocation cause if the pool already took the connection back, see
	 *                       {@link CheckoutHandle#getRevocationCause()}
	 * @see CheckoutHandle#checkin()
	 */
	public void checkin(@NotNull final CheckoutHandle<T> handle) {
		poolLock.lock();
		try {
			rejectIfRevoked(handle, "checkin");
			returnToPool(takeBack(handle), System.nanoTime());
		} finally {
			poolLock.unlock();
		}
	}

	/**
	 * @see CheckoutHandle#disconnect(Throwable)
	 */
	void disconnect(@NotNull final CheckoutHandle<T> handle, @NotNull final Throwable cause) {
		final Holder<T> holder;
		poolLock.lock();
		try {
			rejectIfRevoked(handle, "disconnect");
			holder = takeBack(handle);
			holder.invalidate();
		} finally {
			poolLock.unlock();
		}
		holder.getWorker().reportFailure(holder, cause);
	}

	/**
	 * A worker finished connecting. Returns false if the pool is shutting down, in which case the worker should disconnect.
	 */
	boolean announceReady(@NotNull final Holder<T> holder) {
		poolLock.lock();
		try {
			if (shuttingDown) {
				holder.invalidate();
				return false;
			}
			connected.add(holder);
			log.debug("connection worker {} ready, {} of {} connections up", holder.getWorkerId(), connected.size(), poolConfig.getPoolSize());
			returnToPool(holder, System.nanoTime());
			return true;
		} finally {
			poolLock.unlock();
		}
	}

	/**
	 * A worker's connection failed. The holder is purged wherever it is; if a caller has it checked out, that caller's handle
	 * fails with {@link ConnectionLostException}.
	 */
	void announceFailed(@NotNull final Holder<T> holder, @NotNull final Throwable cause) {
		poolLock.lock();
		try {
			if (!connected.remove(holder)) {
				return;
			}
			switch (holder.getState()) {
				case AVAILABLE:
					queue.remove(holder);
					updateStatus();
					break;
				case CHECKED_OUT:
					checkedOut.remove(holder);
					revoke(holder, new ConnectionLostException(holder.getWorkerId(), cause));
					totalConnectionsLost++;
					break;
				default:
					// being pinged, or already given up by its owner
			}
			holder.invalidate();
			log.warn("connection worker {} failed, {} of {} connections left", holder.getWorkerId(), connected.size(), poolConfig.getPoolSize(), cause);
		} finally {
			poolLock.unlock();
		}
	}

	void pingCompleted(@NotNull final Holder<T> holder) {
		poolLock.lock();
		try {
			if (holder.getState() == Holder.HolderState.PINGING) {
				returnToPool(holder, System.nanoTime());
			}
		} finally {
			poolLock.unlock();
		}
	}

	@NotNull
	private CheckoutHandle<T> handOver(@NotNull final Holder<T> holder, final long now, @Nullable final Timeout deadline) {
		final CheckoutHandle<T> handle = holder.checkOut(this, now, deadline);
		checkedOut.add(holder);
		totalCheckouts++;
		updateStatus();
		return handle;
	}

	/**
	 * Waits on the waiter's own condition until one of serve, expire, cancel or shutdown settles it.
	 */
	@NotNull
	private CheckoutHandle<T> awaitHandOver(@NotNull final Waiter<T> waiter, @NotNull final Timeout timeout) throws InterruptedException {
		long remainingNanos = timeout.toNanos();
		try {
			while (waiter.getState() == Waiter.WaiterState.WAITING) {
				if (remainingNanos <= 0L) {
					waiter.expire();
					queue.remove(waiter);
					totalTimeouts++;
					updateStatus();
					throw new CheckoutTimeoutException(timeout);
				}
				remainingNanos = waiter.getServed().awaitNanos(remainingNanos);
			}
		} catch (InterruptedException e) {
			if (waiter.getState() == Waiter.WaiterState.SERVED) {
				Thread.currentThread().interrupt();
				return requireNonNull(waiter.getHandle());
			}
			if (waiter.getState() == Waiter.WaiterState.WAITING) {
				waiter.cancel();
				queue.remove(waiter);
				updateStatus();
				log.debug("queued checkout cancelled by interrupt");
			}
			throw e;
		}
		if (waiter.getState() == Waiter.WaiterState.SHUTDOWN) {
			throw new PoolShutdownException();
		}
		return requireNonNull(waiter.getHandle());
	}

	/**
	 * The pool took the connection back on its own; the caller learns why instead of the call passing silently.
	 */
	private void rejectIfRevoked(@NotNull final CheckoutHandle<T> handle, @NotNull final String operation) {
		if (handle.isRevoked()) {
			final PoolException cause = requireNonNull(handle.getRevocationCause());
			log.warn("rejecting {} of {}, the pool already took it back: {}", operation, handle, cause.getMessage());
			throw cause;
		}
	}
	
	/**
	 * Validates that the handle still owns its holder and takes ownership back.
	 */
	@NotNull
	private Holder<T> takeBack(@NotNull final CheckoutHandle<T> handle) {
		if (handle.getPool() != this) {
			throw new InvalidHandleException("Handle " + handle + " belongs to another pool");
		}
		if (handle.isCheckedIn()) {
			log.warn("rejecting duplicate checkin of {}", handle);
			throw new AlreadyCheckedInException(handle);
		}
		final Holder<T> holder = handle.getHolder();
		if (holder.getState() != Holder.HolderState.CHECKED_OUT || holder.getLock() != handle.getLock() || holder.getOwner() != handle) {
			log.error("rejecting checkin of {}, it does not own {}", handle, holder);
			throw new InvalidHandleException("Handle " + handle + " does not own its connection anymore, rejecting checkin");
		}
		handle.markCheckedIn();
		holder.release();
		checkedOut.remove(holder);
		return holder;
	}

	/**
	 * Ownership of the holder is back with the pool: pass it on to the oldest waiter, or else queue it as available.
	 */
	private void returnToPool(@NotNull final Holder<T> holder, final long now) {
		if (shuttingDown) {
			holder.invalidate();
			return;
		}
		holder.markReturned(now);
		final Waiter<T> waiter = (status == PoolStatus.BUSY) ? (Waiter<T>) queue.pollFirst() : null;
		if (waiter != null) {
			controlledDelay.sample(now - waiter.getQueuedAtNanos(), now);
			waiter.serve(handOver(holder, now, waiter.getDeadline()));
			log.debug("connection of worker {} handed to a waiter queued for {}ms", holder.getWorkerId(),
					TimeUnit.NANOSECONDS.toMillis(now - waiter.getQueuedAtNanos()));
		} else {
			holder.makeAvailable();
			queue.addLast(holder);
			updateStatus();
		}
	}

	private void revoke(@NotNull final Holder<T> holder, @NotNull final PoolException cause) {
		final CheckoutHandle<T> owner = holder.getOwner();
		if (owner != null) {
			owner.revoke(cause);
		}
		holder.release();
	}

	/**
	 * The queue only ever holds one kind of entry, so its head tells which state the pool is in.
	 */
	private void updateStatus() {
		status = (!queue.isEmpty() && queue.getFirst() instanceof Holder) ? PoolStatus.READY : PoolStatus.BUSY;
	}

	/**
	 * Reclaims overdue checkouts and collects idle holders for pinging. The pings themselves are sent outside the lock.
	 */
	void housekeep() {
		final List<Holder<T>> idleHolders = new ArrayList<>();
		poolLock.lock();
		try {
			if (shuttingDown) {
				return;
			}
			final long now = System.nanoTime();
			reclaimOverdueCheckouts(now);
			collectIdleHolders(now, idleHolders);
		} finally {
			poolLock.unlock();
		}
		for (Holder<T> holder : idleHolders) {
			log.debug("pinging connection of worker {}", holder.getWorkerId());
			holder.getWorker().ping(holder);
		}
	}

	private void reclaimOverdueCheckouts(final long now) {
		final List<Holder<T>> overdue = new ArrayList<>();
		for (Holder<T> holder : checkedOut) {
			if (holder.isOverdue(now)) {
				overdue.add(holder);
			}
		}
		for (Holder<T> holder : overdue) {
			final Timeout deadline = requireNonNull(holder.getDeadline());
			log.warn("connection of worker {} checked out for longer than its deadline of {}, reclaiming it", holder.getWorkerId(), deadline);
			checkedOut.remove(holder);
			revoke(holder, new CheckoutDeadlineExceededException(deadline));
			totalDeadlineReclaims++;
			returnToPool(holder, now);
		}
	}

	private void collectIdleHolders(final long now, @NotNull final List<Holder<T>> idleHolders) {
		final Timeout idleInterval = poolConfig.getIdleInterval();
		if (idleInterval.isDisabled() || status != PoolStatus.READY) {
			return;
		}
		for (Iterator<QueueEntry<T>> it = queue.iterator(); it.hasNext(); ) {
			final Holder<T> holder = (Holder<T>) it.next();
			if (holder.isIdleFor(idleInterval.toNanos(), now)) {
				it.remove();
				holder.startPing();
				idleHolders.add(holder);
			}
		}
		updateStatus();
	}

	/**
	 * Stops the pool: waiting checkouts fail with {@link PoolShutdownException}, checked out handles are revoked, and every
	 * worker disconnects. Subsequent checkouts fail right away.
	 *
	 * @return completes once all workers and the housekeeper have finished.
	 */
	@NotNull
	public synchronized Future<Void> stop() {
		if (shutdownSequence == null) {
			initiateShutdown();
			ExecutorService executorService = newSingleThreadExecutor(poolConfig.getThreadFactory());
			shutdownSequence = executorService.submit(new ShutdownSequence(), null);
			executorService.shutdown();
		}
		return requireNonNull(shutdownSequence);
	}

	public boolean isShuttingDown() {
		return shuttingDown;
	}

	private void initiateShutdown() {
		poolLock.lock();
		try {
			shuttingDown = true;
			for (QueueEntry<T> entry : queue) {
				if (entry instanceof Waiter) {
					((Waiter<T>) entry).shutdown();
				}
			}
			queue.clear();
			for (Holder<T> holder : checkedOut) {
				revoke(holder, new PoolShutdownException());
			}
			checkedOut.clear();
			for (Holder<T> holder : connected) {
				holder.invalidate();
			}
			connected.clear();
			updateStatus();
		} finally {
			poolLock.unlock();
		}
		log.info("connection pool shutting down");
	}

	/**
	 * @see PoolMetrics
	 */
	@NotNull
	public PoolMetrics getPoolMetrics() {
		poolLock.lock();
		try {
			int available = 0;
			int waiting = 0;
			for (QueueEntry<T> entry : queue) {
				if (entry instanceof Holder) {
					available++;
				} else {
					waiting++;
				}
			}
			return new PoolMetrics(
					status,
					poolConfig.getPoolSize(),
					connected.size(),
					available,
					checkedOut.size(),
					waiting,
					TimeUnit.NANOSECONDS.toMillis(controlledDelay.getMinimumDelayNanos()),
					controlledDelay.isDropping(),
					totalCheckouts,
					totalQueuedCheckouts,
					totalBusyRejections,
					totalOverloadRejections,
					totalTimeouts,
					totalConnectionsLost,
					totalDeadlineReclaims);
		} finally {
			poolLock.unlock();
		}
	}

	@NotNull
	List<ConnectionWorker<T>> getWorkers() {
		return Collections.unmodifiableList(workers);
	}

	private class Housekeeper implements Runnable {

		@Override
		public void run() {
			while (!shuttingDown) {
				housekeep();
				if (!SleepUtil.sleep(HOUSEKEEPING_INTERVAL_MS)) {
					break;
				}
			}
			log.debug("Housekeeper finished");
		}
	}

	private class ShutdownSequence implements Runnable {

		@Override
		public void run() {
			for (ConnectionWorker<T> worker : workers) {
				worker.stop();
			}
			try {
				for (ConnectionWorker<T> worker : workers) {
					if (!worker.awaitTermination(WORKER_TERMINATION_TIMEOUT_MS)) {
						log.warn("{} did not finish within {}ms", worker, WORKER_TERMINATION_TIMEOUT_MS);
					}
				}
				final Thread housekeeper = housekeeperThread;
				if (housekeeper != null) {
					housekeeper.join(WORKER_TERMINATION_TIMEOUT_MS);
				}
			} catch (InterruptedException e) {
				Thread.currentThread().interrupt();
				log.warn("interrupted while waiting for the connection workers to finish");
				return;
			}
			log.info("connection pool shutdown complete");
		}
	}
}
