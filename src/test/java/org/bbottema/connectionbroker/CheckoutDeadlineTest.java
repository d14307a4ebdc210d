package org.bbottema.connectionbroker;

import org.bbottema.connectionbroker.util.Timeout;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static java.util.concurrent.TimeUnit.SECONDS;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;
import static org.bbottema.connectionbroker.ConnectionPoolTestHelper.awaitAvailable;
import static org.bbottema.connectionbroker.ConnectionPoolTestHelper.awaitWaiting;
import static org.bbottema.connectionbroker.ConnectionPoolTestHelper.configWithoutPings;

public class CheckoutDeadlineTest {
	
	private ConnectionPool<TestConnection> pool;
	private ExecutorService es;
	
	@Before
	public void setup() {
		pool = ConnectionPool.start(configWithoutPings(1).build(), new TestConnector());
		es = Executors.newSingleThreadExecutor();
		awaitAvailable(pool, 1);
	}
	
	@After
	public void tearDown() throws Exception {
		es.shutdownNow();
		pool.stop().get(5, TimeUnit.SECONDS);
	}
	
	@Test
	public void overdueCheckoutIsReclaimedAndHandedToTheNextWaiter() throws Exception {
		final CheckoutHandle<TestConnection> slow = pool.checkout(CheckoutOptions.builder()
				.deadline(Timeout.ofMillis(50))
				.build());
		final TestConnection connection = slow.getConnection();
		
		Future<CheckoutHandle<TestConnection>> next = es.submit(() -> pool.checkout(true, Timeout.ofSeconds(5)));
		awaitWaiting(pool, 1);
		
		final CheckoutHandle<TestConnection> handle = next.get(2, TimeUnit.SECONDS);
		assertThat(handle.getConnection()).isSameAs(connection);
		assertThat(slow.isRevoked()).isTrue();
		assertThatThrownBy(slow::getConnection).isInstanceOf(CheckoutDeadlineExceededException.class);
		assertThat(pool.getPoolMetrics().getTotalDeadlineReclaims()).isEqualTo(1);
		
		// late checkin of the reclaimed handle is refused and does not disturb the new owner
		assertThatThrownBy(slow::checkin).isInstanceOf(CheckoutDeadlineExceededException.class);
		assertThat(handle.idleMsBeforeCheckout()).isBetween(0L, 500L);
		assertThat(handle.isCheckedOut()).isTrue();
		assertThat(pool.getPoolMetrics().getCurrentlyCheckedOut()).isEqualTo(1);
		
		// no deadline on the second checkout
		TimeUnit.MILLISECONDS.sleep(100);
		assertThat(handle.isCheckedOut()).isTrue();
		handle.checkin();
	}
	
	@Test
	public void overdueCheckoutWithoutWaitersBecomesAvailable() throws Exception {
		final CheckoutHandle<TestConnection> slow = pool.checkout(CheckoutOptions.builder()
				.deadline(Timeout.ofMillis(30))
				.build());
		
		await().atMost(5, SECONDS).until(slow::isRevoked);
		awaitAvailable(pool, 1);
		assertThat(pool.getPoolMetrics().getStatus()).isEqualTo(PoolStatus.READY);
		assertThat(slow.getRevocationCause()).isInstanceOf(CheckoutDeadlineExceededException.class);
	}
}
