package org.bbottema.connectionbroker;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

@RequiredArgsConstructor
@ToString
class TestConnection {
	@Getter private final int id;
	private final AtomicBoolean closed = new AtomicBoolean();
	private final AtomicInteger pings = new AtomicInteger();
	
	boolean isClosed() {
		return closed.get();
	}
	
	int getPingCount() {
		return pings.get();
	}
	
	void ping() {
		pings.incrementAndGet();
	}
	
	void close() {
		closed.set(true);
	}
}
