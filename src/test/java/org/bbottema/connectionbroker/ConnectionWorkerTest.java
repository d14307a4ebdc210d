package org.bbottema.connectionbroker;

import org.bbottema.connectionbroker.util.Timeout;
import org.jetbrains.annotations.NotNull;
import org.junit.After;
import org.junit.Test;

import java.io.IOException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static java.util.concurrent.TimeUnit.SECONDS;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;
import static org.bbottema.connectionbroker.ConnectionPoolTestHelper.awaitAvailable;
import static org.bbottema.connectionbroker.ConnectionPoolTestHelper.awaitConnected;
import static org.bbottema.connectionbroker.ConnectionPoolTestHelper.configWithoutPings;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.atLeast;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.verify;

public class ConnectionWorkerTest {
	
	private ConnectionPool<TestConnection> pool;
	
	@After
	public void tearDown() throws Exception {
		if (pool != null) {
			pool.stop().get(5, TimeUnit.SECONDS);
		}
	}
	
	@Test
	public void lostConnectionRevokesHandleUntilWorkerReconnects() throws Exception {
		final TestConnector connector = new TestConnector();
		pool = ConnectionPool.start(configWithoutPings(2).backoffMin(Timeout.ofSeconds(1)).backoffMax(Timeout.ofSeconds(2)).build(), connector);
		awaitAvailable(pool, 2);
		
		final CheckoutHandle<TestConnection> handle = pool.checkout();
		final TestConnection lost = handle.getConnection();
		handle.getHolder().getWorker().reportFailure(new IOException("connection reset by peer"));
		
		await().atMost(5, SECONDS).until(handle::isRevoked);
		assertThatThrownBy(handle::getConnection)
				.isInstanceOf(ConnectionLostException.class)
				.hasCauseInstanceOf(IOException.class);
		assertThat(handle.getRevocationCause()).isInstanceOf(ConnectionLostException.class);
		
		PoolMetrics metrics = pool.getPoolMetrics();
		assertThat(metrics.getCurrentlyConnected()).isEqualTo(1);
		assertThat(metrics.getCurrentlyCheckedOut()).isZero();
		assertThat(metrics.getCurrentlyAvailable()).isEqualTo(1);
		assertThat(metrics.getTotalConnectionsLost()).isEqualTo(1);
		
		// the pool already took it back, checking in tells the caller why
		assertThatThrownBy(handle::checkin)
				.isInstanceOf(ConnectionLostException.class)
				.hasCauseInstanceOf(IOException.class);
		assertThatThrownBy(handle::checkin).isInstanceOf(ConnectionLostException.class);
		assertThat(pool.getPoolMetrics().getCurrentlyAvailable()).isEqualTo(1);
		
		awaitConnected(pool, 2);
		awaitAvailable(pool, 2);
		assertThat(connector.disconnected).contains(lost);
		assertThat(lost.isClosed()).isTrue();
		assertThat(connector.connections).hasSize(3);
	}
	
	@Test
	public void failedIdleConnectionIsPurgedFromTheQueue() throws Exception {
		final TestConnector connector = new TestConnector();
		pool = ConnectionPool.start(configWithoutPings(1).backoffMin(Timeout.ofSeconds(1)).backoffMax(Timeout.ofSeconds(2)).build(), connector);
		awaitAvailable(pool, 1);
		
		pool.getWorkers().get(0).reportFailure(new IOException("server closed the connection"));
		awaitConnected(pool, 0);
		
		PoolMetrics metrics = pool.getPoolMetrics();
		assertThat(metrics.getStatus()).isEqualTo(PoolStatus.BUSY);
		assertThat(metrics.getCurrentlyAvailable()).isZero();
		assertThat(metrics.getTotalConnectionsLost()).isZero();
		assertThatThrownBy(() -> pool.checkout(false, Timeout.ofSeconds(1)))
				.isInstanceOf(PoolBusyException.class);
		
		// a queued checkout is served by the replacement connection
		final CheckoutHandle<TestConnection> handle = pool.checkout(true, Timeout.ofSeconds(5));
		assertThat(handle.getConnection()).isNotSameAs(connector.connections.get(0));
		assertThat(handle.getConnection().isClosed()).isFalse();
		// the fresh connection went straight to the waiter
		assertThat(handle.idleMsBeforeCheckout()).isBetween(0L, 500L);
		handle.checkin();
	}
	
	@Test
	public void callerCanGiveUpABrokenConnection() throws Exception {
		final TestConnector connector = new TestConnector();
		pool = ConnectionPool.start(configWithoutPings(1).build(), connector);
		awaitAvailable(pool, 1);
		
		final CheckoutHandle<TestConnection> handle = pool.checkout();
		final TestConnection broken = handle.getConnection();
		handle.disconnect(new IOException("unexpected end of stream"));
		
		assertThat(handle.isCheckedOut()).isFalse();
		assertThatThrownBy(handle::checkin).isInstanceOf(AlreadyCheckedInException.class);
		
		final CheckoutHandle<TestConnection> replacement = pool.checkout(true, Timeout.ofSeconds(5));
		assertThat(replacement.getConnection()).isNotSameAs(broken);
		assertThat(replacement.idleMsBeforeCheckout()).isBetween(0L, 500L);
		await().atMost(5, SECONDS).until(broken::isClosed);
		replacement.checkin();
		assertThat(pool.getPoolMetrics().getTotalConnectionsLost()).isZero();
	}
	
	@Test
	public void connectFailuresAreRetriedWithBackoff() {
		final TestConnector connector = new TestConnector();
		connector.connectFailuresLeft.set(2);
		pool = ConnectionPool.start(configWithoutPings(1).build(), connector);
		
		awaitAvailable(pool, 1);
		assertThat(connector.connectAttempts.get()).isEqualTo(3);
		assertThat(connector.connections).hasSize(1);
	}
	
	@Test
	public void backoffDoublesUpToTheMaximum() {
		pool = ConnectionPool.start(configWithoutPings(1)
				.backoffMin(Timeout.ofMillis(100))
				.backoffMax(Timeout.ofMillis(1000))
				.build(), new TestConnector());
		final ConnectionWorker<TestConnection> worker = pool.getWorkers().get(0);
		
		assertThat(worker.backoffMs(1)).isEqualTo(100);
		assertThat(worker.backoffMs(2)).isEqualTo(200);
		assertThat(worker.backoffMs(3)).isEqualTo(400);
		assertThat(worker.backoffMs(4)).isEqualTo(800);
		assertThat(worker.backoffMs(5)).isEqualTo(1000);
		assertThat(worker.backoffMs(64)).isEqualTo(1000);
	}
	
	@Test
	public void idleConnectionsArePinged() throws Exception {
		final TestConnector connector = spy(new TestConnector());
		pool = ConnectionPool.start(PoolConfig.builder()
				.poolSize(2)
				.idleInterval(Timeout.ofMillis(30))
				.build(), connector);
		
		verify(connector, timeout(2000).atLeast(4)).ping(any(TestConnection.class));
		awaitAvailable(pool, 2);
		assertThat(pool.getPoolMetrics().getCurrentlyConnected()).isEqualTo(2);
		assertThat(connector.disconnected).isEmpty();
		for (TestConnection connection : connector.connections) {
			assertThat(connection.getPingCount()).isPositive();
		}
	}
	
	@Test
	public void failedPingReplacesTheConnection() throws Exception {
		final TestConnector connector = new TestConnector();
		pool = ConnectionPool.start(configWithoutPings(1)
				.idleInterval(Timeout.ofMillis(30))
				.build(), connector);
		awaitAvailable(pool, 1);
		final TestConnection original = connector.connections.get(0);
		
		connector.failPings.set(true);
		await().atMost(5, SECONDS).until(original::isClosed);
		connector.failPings.set(false);
		
		awaitAvailable(pool, 1);
		final CheckoutHandle<TestConnection> handle = pool.checkout();
		assertThat(handle.getConnection()).isNotSameAs(original);
		handle.checkin();
	}
	
	@Test
	public void workerStopsReconnectingOnceShutdownStarted() throws Exception {
		final CountDownLatch connecting = new CountDownLatch(1);
		final CountDownLatch connectReleased = new CountDownLatch(1);
		final CountDownLatch shutdownSequenceGate = new CountDownLatch(1);
		final TestConnector connector = new TestConnector() {
			@NotNull
			@Override
			public TestConnection connect() throws IOException {
				connecting.countDown();
				try {
					connectReleased.await();
				} catch (InterruptedException e) {
					Thread.currentThread().interrupt();
					throw new IOException("interrupted while connecting", e);
				}
				return super.connect();
			}
		};
		// worker, housekeeper, then the shutdown sequence, which is held back until the gate opens
		final AtomicInteger threadsCreated = new AtomicInteger();
		final ThreadFactory threadFactory = new ThreadFactory() {
			@Override
			public Thread newThread(@NotNull final Runnable r) {
				if (threadsCreated.incrementAndGet() != 3) {
					return new Thread(r);
				}
				return new Thread(new Runnable() {
					public void run() {
						try {
							shutdownSequenceGate.await();
						} catch (InterruptedException e) {
							Thread.currentThread().interrupt();
						}
						r.run();
					}
				});
			}
		};
		pool = ConnectionPool.start(configWithoutPings(1).threadFactory(threadFactory).build(), connector);
		assertThat(connecting.await(5, SECONDS)).isTrue();
		
		final Future<Void> shutdownResult = pool.stop();
		connectReleased.countDown();
		
		// the connection finished after shutdown started, so it is dropped right away and not replaced
		await().atMost(5, SECONDS).until(() -> connector.disconnected.size() == 1);
		TimeUnit.MILLISECONDS.sleep(100);
		assertThat(connector.connectAttempts.get()).isEqualTo(1);
		assertThat(connector.disconnected).hasSize(1);
		
		shutdownSequenceGate.countDown();
		shutdownResult.get(5, SECONDS);
	}
}
