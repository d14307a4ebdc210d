/*
 * Copyright (C) 2019 Benny Bottema (benny@bennybottema.com)
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *         http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.bbottema.connectionbroker.codel;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.bbottema.connectionbroker.util.Timeout;
import org.jetbrains.annotations.NotNull;

/**
 * Controlled-delay (CoDel) overload estimator for the checkout queue.
 * <p>
 * The pool feeds it the time every served checkout spent waiting ({@link #sample(long, long)}, zero for checkouts served
 * without queueing) and asks it whether a checkout that would have to queue should be rejected instead
 * ({@link #shouldDrop(long)}).
 * <p>
 * Congestion is declared once the queue delay has stayed at or above {@code target} for a full {@code interval}, which is
 * the same as the minimum delay of that interval exceeding the target. From then on every request that would have to queue
 * is dropped, until a single sample under the target ends the congestion and the dropping phase. While dropping, the drop
 * count advances on the control law schedule of {@code interval / sqrt(dropCount)}, so a quick relapse resumes at a higher
 * count instead of starting over.
 * <p>
 * Not thread-safe: all calls happen under the pool's coordinator lock. Times are {@link System#nanoTime()} values.
 */
@Slf4j
public class ControlledDelay {

	/**
	 * Re-entering the dropping phase within this many intervals of the last scheduled drop resumes near the previous drop
	 * rate instead of starting over.
	 */
	private static final int DROP_RATE_MEMORY_INTERVALS = 16;

	@Getter private final long targetNanos;
	@Getter private final long intervalNanos;

	private boolean aboveTarget;
	private long firstAboveTime;
	private boolean congested;

	@Getter private boolean dropping;
	@Getter private int dropCount;
	private long dropNext;

	private boolean windowStarted;
	private long windowEnd;
	private long windowMinimum;

	public ControlledDelay(@NotNull Timeout target, @NotNull Timeout interval) {
		if (target.isDisabled() || interval.isDisabled()) {
			throw new IllegalArgumentException("queue target and queue interval must be positive");
		}
		this.targetNanos = target.toNanos();
		this.intervalNanos = interval.toNanos();
	}

	/**
	 * Records how long a checkout waited before it was served.
	 */
	public void sample(long delayNanos, long nowNanos) {
		updateWindowMinimum(delayNanos, nowNanos);

		if (delayNanos < targetNanos) {
			aboveTarget = false;
			congested = false;
			if (dropping) {
				dropping = false;
				log.info("queue delay back under target of {}ms, no longer shedding checkouts", targetNanos / 1_000_000);
			}
		} else if (!aboveTarget) {
			aboveTarget = true;
			firstAboveTime = nowNanos + intervalNanos;
		} else if (nowNanos - firstAboveTime >= 0) {
			congested = true;
		}
	}

	/**
	 * Decides whether a checkout that would otherwise be queued must be rejected now. Only to be asked for checkouts that
	 * cannot be served right away; immediate service never drops.
	 */
	public boolean shouldDrop(long nowNanos) {
		// no sample under the target for a full interval, the queue is stuck above it
		if (aboveTarget && nowNanos - firstAboveTime >= 0) {
			congested = true;
		}

		if (!congested) {
			dropping = false;
			return false;
		}

		if (!dropping) {
			dropping = true;
			dropCount = (dropCount > 2 && nowNanos - dropNext < DROP_RATE_MEMORY_INTERVALS * intervalNanos)
					? dropCount - 2
					: 1;
			dropNext = controlLaw(nowNanos);
			log.info("queue delay above target of {}ms for a full interval of {}ms, shedding checkouts",
					targetNanos / 1_000_000, intervalNanos / 1_000_000);
			return true;
		}

		while (nowNanos - dropNext >= 0) {
			dropCount++;
			dropNext = controlLaw(dropNext);
		}
		return true;
	}

	/**
	 * @return the smallest delay sampled in the current interval window, or zero if nothing has been sampled yet.
	 */
	public long getMinimumDelayNanos() {
		return windowStarted ? windowMinimum : 0;
	}

	private void updateWindowMinimum(long delayNanos, long nowNanos) {
		if (!windowStarted || nowNanos - windowEnd >= 0) {
			windowStarted = true;
			windowEnd = nowNanos + intervalNanos;
			windowMinimum = delayNanos;
		} else if (delayNanos < windowMinimum) {
			windowMinimum = delayNanos;
		}
	}

	private long controlLaw(long fromNanos) {
		return fromNanos + (long) (intervalNanos / Math.sqrt(dropCount));
	}
}
