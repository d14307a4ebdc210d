package org.bbottema.connectionbroker;

import lombok.Value;
import lombok.experimental.NonFinal;
import org.jetbrains.annotations.NotNull;

/**
 * Snapshot of a pool, taken atomically with respect to checkouts and checkins.
 */
@NonFinal@Value
public class PoolMetrics {
	@NotNull private final PoolStatus status;
	private final int poolSize;
	/**
	 * Holders registered by a worker and not failed since: available, checked out or being pinged.
	 */
	private final int currentlyConnected;
	private final int currentlyAvailable;
	private final int currentlyCheckedOut;
	private final int currentlyWaitingCount;
	private final long minimumQueueDelayMs;
	private final boolean dropping;
	private final long totalCheckouts;
	private final long totalQueuedCheckouts;
	private final long totalBusyRejections;
	private final long totalOverloadRejections;
	private final long totalTimeouts;
	private final long totalConnectionsLost;
	private final long totalDeadlineReclaims;
}
