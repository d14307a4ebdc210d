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
package org.bbottema.connectionbroker.util;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import lombok.Value;
import org.jetbrains.annotations.NotNull;

import java.util.concurrent.TimeUnit;

/**
 * A duration as it appears in the pool's configuration: checkout timeouts, checkout deadlines, controlled-delay thresholds
 * and housekeeping intervals.
 */
@Value
@SuppressFBWarnings(value = "RCN_REDUNDANT_NULLCHECK_OF_NONNULL_VALUE", justification = "Generated code")
public final class Timeout {
	
	/**
	 * Waits as long as it takes. Converts to {@link Long#MAX_VALUE} nanoseconds.
	 */
	public static final Timeout WAIT_FOREVER = new Timeout(Long.MAX_VALUE, TimeUnit.DAYS);
	/**
	 * Used for intervals that can be switched off, such as idle pinging.
	 */
	public static final Timeout DISABLED = new Timeout(0, TimeUnit.MILLISECONDS);
	
	private final long duration;
	@NotNull private final TimeUnit timeUnit;
	private final long durationMs;
	
	public Timeout(long duration, @NotNull TimeUnit timeUnit) {
		if (duration < 0) {
			throw new IllegalArgumentException("A timeout cannot be negative: " + duration + " " + timeUnit);
		}
		this.duration = duration;
		this.timeUnit = timeUnit;
		this.durationMs = timeUnit.toMillis(duration);
	}
	
	@NotNull
	public static Timeout ofMillis(long durationMs) {
		return new Timeout(durationMs, TimeUnit.MILLISECONDS);
	}
	
	@NotNull
	public static Timeout ofSeconds(long durationSeconds) {
		return new Timeout(durationSeconds, TimeUnit.SECONDS);
	}
	
	/**
	 * Saturates at {@link Long#MAX_VALUE}, so {@link #WAIT_FOREVER} is safe to use in deadline arithmetic as long as it is
	 * checked with {@link #isForever()} first.
	 */
	public long toNanos() {
		return timeUnit.toNanos(duration);
	}
	
	public boolean isForever() {
		return toNanos() == Long.MAX_VALUE;
	}
	
	public boolean isDisabled() {
		return duration == 0;
	}
	
	@Override
	public String toString() {
		return isForever() ? "forever" : durationMs + "ms";
	}
}
