package org.bbottema.connectionbroker;

/**
 * READY: the queue holds only available connections, at least one. BUSY: the queue holds only waiting checkouts, possibly
 * none. The queue never mixes the two.
 */
public enum PoolStatus {
	READY, BUSY
}
