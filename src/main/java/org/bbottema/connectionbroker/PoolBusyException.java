package org.bbottema.connectionbroker;

/**
 * No connection is available and the checkout was not allowed to queue.
 */
public class PoolBusyException extends PoolException {
	
	PoolBusyException(int poolSize) {
		super("All " + poolSize + " connection(s) are in use and queueing was disabled for this checkout");
	}
}
