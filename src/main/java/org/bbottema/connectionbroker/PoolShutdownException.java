package org.bbottema.connectionbroker;

public class PoolShutdownException extends PoolException {
	
	PoolShutdownException() {
		super("Pool has been shutdown");
	}
}
