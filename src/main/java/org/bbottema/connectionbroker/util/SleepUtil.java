package org.bbottema.connectionbroker.util;

import lombok.experimental.UtilityClass;

@UtilityClass
public final class SleepUtil {
	/**
	 * @return false if the sleep was cut short by an interrupt, in which case the interrupt flag is restored.
	 */
	public static boolean sleep(final long durationMs) {
		try {
			Thread.sleep(durationMs);
			return true;
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			return false;
		}
	}
}
