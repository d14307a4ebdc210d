package org.bbottema.connectionbroker;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import lombok.Builder;
import lombok.Value;
import lombok.experimental.NonFinal;
import org.bbottema.connectionbroker.util.Timeout;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;

@NonFinal@Value
@SuppressFBWarnings(value = "RCN_REDUNDANT_NULLCHECK_OF_NONNULL_VALUE", justification = "Generated code")
public class PoolConfig {
	
	static final int DEFAULT_POOL_SIZE = 1;
	static final Timeout DEFAULT_TIMEOUT = Timeout.ofSeconds(15);
	static final Timeout DEFAULT_QUEUE_TARGET = Timeout.ofMillis(50);
	static final Timeout DEFAULT_QUEUE_INTERVAL = Timeout.ofMillis(1000);
	static final Timeout DEFAULT_IDLE_INTERVAL = Timeout.ofMillis(1000);
	static final Timeout DEFAULT_BACKOFF_MIN = Timeout.ofMillis(1000);
	static final Timeout DEFAULT_BACKOFF_MAX = Timeout.ofSeconds(30);
	
	/**
	 * Number of connection workers, and so the maximum number of connections that can be checked out at the same time.
	 */
	private final int poolSize;
	/**
	 * Whether checkouts queue up when all connections are in use, or fail fast with {@link PoolBusyException}. Can be
	 * overridden per checkout.
	 */
	private final boolean queue;
	/**
	 * How long a queued checkout waits before giving up with {@link CheckoutTimeoutException}. Can be overridden per checkout.
	 */
	@NotNull private final Timeout timeout;
	/**
	 * Queue delay the pool aims to stay under. See {@link org.bbottema.connectionbroker.codel.ControlledDelay}.
	 */
	@NotNull private final Timeout queueTarget;
	/**
	 * How long the queue delay has to stay above {@link #queueTarget} before new checkouts get shed.
	 */
	@NotNull private final Timeout queueInterval;
	/**
	 * Connections idle for longer than this get pinged by their worker. {@link Timeout#DISABLED} turns pinging off.
	 */
	@NotNull private final Timeout idleInterval;
	/**
	 * First delay before a worker reconnects after its connection failed. Doubles with every failed attempt.
	 */
	@NotNull private final Timeout backoffMin;
	/**
	 * Upper bound of the reconnect delay.
	 */
	@NotNull private final Timeout backoffMax;
	/**
	 * Optional custom thread factory, in case you need to manage your own thread production.
	 * <p>
	 * It will be used instead of {@link Executors#defaultThreadFactory()} to create the connection worker threads, the
	 * housekeeper thread and the shutdown sequence.
	 */
	@NotNull private final ThreadFactory threadFactory;
	
	@Builder
	@SuppressWarnings("unused")
	private PoolConfig(@Nullable Integer poolSize, @Nullable Boolean queue, @Nullable Timeout timeout,
			@Nullable Timeout queueTarget, @Nullable Timeout queueInterval, @Nullable Timeout idleInterval,
			@Nullable Timeout backoffMin, @Nullable Timeout backoffMax, @Nullable ThreadFactory threadFactory) {
		this.poolSize = (poolSize != null) ? poolSize : DEFAULT_POOL_SIZE;
		this.queue = (queue != null) ? queue : true;
		this.timeout = (timeout != null) ? timeout : DEFAULT_TIMEOUT;
		this.queueTarget = (queueTarget != null) ? queueTarget : DEFAULT_QUEUE_TARGET;
		this.queueInterval = (queueInterval != null) ? queueInterval : DEFAULT_QUEUE_INTERVAL;
		this.idleInterval = (idleInterval != null) ? idleInterval : DEFAULT_IDLE_INTERVAL;
		this.backoffMin = (backoffMin != null) ? backoffMin : DEFAULT_BACKOFF_MIN;
		this.backoffMax = (backoffMax != null) ? backoffMax : DEFAULT_BACKOFF_MAX;
		this.threadFactory = (threadFactory != null) ? threadFactory : Executors.defaultThreadFactory();
		
		if (this.poolSize <= 0) {
			throw new IllegalArgumentException("Pool size should be at least one");
		}
		if (this.queueTarget.isDisabled() || this.queueInterval.isDisabled()) {
			throw new IllegalArgumentException("Queue target and queue interval must be positive");
		}
		if (this.backoffMin.isDisabled()) {
			throw new IllegalArgumentException("Minimum reconnect backoff must be positive");
		}
		if (this.backoffMax.getDurationMs() < this.backoffMin.getDurationMs()) {
			throw new IllegalArgumentException("Maximum reconnect backoff cannot be smaller than the minimum backoff");
		}
	}
}
