package org.bbottema.connectionbroker;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;

/**
 * Owns one physical connection on its own thread. It connects, announces a {@link Holder} for the connection to the pool and
 * then only reacts to messages in its mailbox:
 * <ul>
 *     <li>ping: the pool handed over an idle holder, check the connection and give the holder back</li>
 *     <li>failure: the connection broke, withdraw the holder from the pool, disconnect and reconnect after a backoff</li>
 *     <li>stop: the pool shuts down, disconnect and finish</li>
 * </ul>
 * The pool never connects or reconnects anything itself, it only learns about connections through
 * {@link ConnectionPool#announceReady(Holder)} and {@link ConnectionPool#announceFailed(Holder, Throwable)}.
 */
@Slf4j
public class ConnectionWorker<T> implements Runnable {

	@NotNull private final ConnectionPool<T> pool;
	@NotNull private final Connector<T> connector;
	@Getter private final int id;
	@NotNull private final BlockingQueue<Message<T>> mailbox = new LinkedBlockingQueue<>();

	@Nullable private volatile Holder<T> currentHolder;
	@Nullable private volatile Thread thread;
	private volatile boolean stopped;
	private int failedAttempts;

	ConnectionWorker(@NotNull ConnectionPool<T> pool, @NotNull Connector<T> connector, int id) {
		this.pool = pool;
		this.connector = connector;
		this.id = id;
	}

	void start(@NotNull ThreadFactory threadFactory) {
		final Thread workerThread = threadFactory.newThread(this);
		thread = workerThread;
		workerThread.start();
	}

	@Override
	public void run() {
		while (!stopped && !pool.isShuttingDown()) {
			if (failedAttempts > 0 && !backOff()) {
				break;
			}
			final T connection = connect();
			if (connection == null) {
				continue;
			}

			final Holder<T> holder = new Holder<>(this, connection);
			currentHolder = holder;
			final Throwable cause = pool.announceReady(holder) ? serve(holder) : null;
			currentHolder = null;

			if (cause != null) {
				pool.announceFailed(holder, cause);
				failedAttempts++;
			}
			disconnect(connection);
		}
		log.debug("connection worker {} finished", id);
	}

	/**
	 * Reports whatever connection the worker currently holds as broken. Ignored while (re)connecting.
	 */
	void reportFailure(@NotNull Throwable cause) {
		final Holder<T> holder = currentHolder;
		if (holder != null) {
			reportFailure(holder, cause);
		}
	}

	void reportFailure(@NotNull Holder<T> holder, @NotNull Throwable cause) {
		mailbox.add(new Message<>(MessageType.FAILURE, holder, cause));
	}

	void ping(@NotNull Holder<T> holder) {
		mailbox.add(new Message<>(MessageType.PING, holder, null));
	}

	void stop() {
		stopped = true;
		mailbox.add(new Message<T>(MessageType.STOP, null, null));
	}

	boolean awaitTermination(long timeoutMs) throws InterruptedException {
		final Thread workerThread = thread;
		if (workerThread == null) {
			return true;
		}
		workerThread.join(timeoutMs);
		return !workerThread.isAlive();
	}

	/**
	 * @return the failure that ended the connection, or {@code null} if the worker was asked to stop.
	 */
	@Nullable
	private Throwable serve(@NotNull Holder<T> holder) {
		while (true) {
			final Message<T> message;
			try {
				message = mailbox.take();
			} catch (InterruptedException e) {
				Thread.currentThread().interrupt();
				stopped = true;
				return e;
			}
			if (message.type != MessageType.STOP && message.holder != holder) {
				log.debug("connection worker {} ignoring {} for a previous connection", id, message.type);
				continue;
			}
			switch (message.type) {
				case STOP:
					return null;
				case FAILURE:
					return message.cause;
				case PING:
					try {
						connector.ping(holder.getConnection());
					} catch (Exception e) {
						return e;
					}
					pool.pingCompleted(holder);
					break;
			}
		}
	}

	@Nullable
	private T connect() {
		try {
			final T connection = connector.connect();
			//noinspection ConstantConditions
			if (connection == null) {
				throw new IllegalStateException("Connector returned no connection");
			}
			failedAttempts = 0;
			return connection;
		} catch (Exception e) {
			failedAttempts++;
			log.error("connection worker {} not able to connect (attempt {}). This might be a temporary issue due to external reasons (a server rejecting a connection for example).",
					id, failedAttempts, e);
			return null;
		}
	}

	private void disconnect(@NotNull T connection) {
		try {
			connector.disconnect(connection);
		} catch (Exception e) {
			log.error("error disconnecting connection of worker {} already removed from the pool, ignoring it from now on...", id, e);
		}
	}

	/**
	 * Waits out the reconnect delay, waking up early for a stop message.
	 *
	 * @return false if the worker was stopped in the meantime
	 */
	private boolean backOff() {
		final long delayMs = backoffMs(failedAttempts);
		log.debug("connection worker {} reconnecting in {}ms", id, delayMs);
		final long until = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(delayMs);
		try {
			long remaining;
			while (!stopped && (remaining = until - System.nanoTime()) > 0) {
				final Message<T> message = mailbox.poll(remaining, TimeUnit.NANOSECONDS);
				if (message != null && message.type == MessageType.STOP) {
					return false;
				}
			}
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			stopped = true;
		}
		return !stopped;
	}

	/**
	 * Doubles from the configured minimum with every failed attempt, capped at the maximum.
	 */
	long backoffMs(int attempts) {
		final long minMs = pool.getPoolConfig().getBackoffMin().getDurationMs();
		final long maxMs = pool.getPoolConfig().getBackoffMax().getDurationMs();
		long delayMs = minMs;
		for (int i = 1; i < attempts && delayMs < maxMs; i++) {
			delayMs *= 2;
		}
		return Math.min(delayMs, maxMs);
	}

	@Override
	public String toString() {
		return "ConnectionWorker(id=" + id + ")";
	}

	private enum MessageType {
		PING, FAILURE, STOP
	}

	@RequiredArgsConstructor
	private static final class Message<T> {
		@NotNull private final MessageType type;
		@Nullable private final Holder<T> holder;
		@Nullable private final Throwable cause;
	}
}
