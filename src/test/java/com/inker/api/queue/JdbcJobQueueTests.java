package com.inker.api.queue;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.jdbc.datasource.DriverManagerDataSource;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

class JdbcJobQueueTests extends JobQueueContractTests {

	private JdbcClient db;

	@Override
	protected JobQueue createQueue() {
		var dataSource = new DriverManagerDataSource("jdbc:h2:mem:queue-" + UUID.randomUUID()
				+ ";MODE=PostgreSQL;DATABASE_TO_LOWER=TRUE;DEFAULT_NULL_ORDERING=HIGH;DB_CLOSE_DELAY=-1", "sa", "");
		this.db = JdbcClient.create(dataSource);
		return new JdbcJobQueue(dataSource, this.db, new TransactionTemplate(new DataSourceTransactionManager(dataSource)),
				this.idGenerator, this.clock, MAX_ATTEMPTS);
	}

	@Test
	void expiredLeasesAreRedelivered() {
		var handle = this.queue.enqueue(WorkItem.of("job-1"));
		this.queue.dequeue(LEASE).orElseThrow();
		this.clock.advance(LEASE.minusSeconds(1));
		Assertions.assertTrue(this.queue.dequeue(LEASE).isEmpty(), "the lease still holds");
		this.clock.advance(Duration.ofSeconds(2));
		var again = this.queue.dequeue(LEASE).orElseThrow();
		Assertions.assertEquals(handle, again.handle());
		Assertions.assertEquals(2, again.attempt());
	}

	@Test
	void exhaustedLeasesAreDeadLettered() {
		this.queue.enqueue(WorkItem.of("job-1"));
		var next = this.queue.enqueue(WorkItem.of("job-2"));
		for (var attempt = 1; attempt <= MAX_ATTEMPTS; attempt++) {
			var delivery = this.queue.dequeue(LEASE).orElseThrow();
			Assertions.assertEquals("job-1", delivery.item().jobId());
			this.clock.advance(LEASE.plusSeconds(1));
		}
		var delivery = this.queue.dequeue(LEASE).orElseThrow();
		Assertions.assertEquals(next, delivery.handle(), "the exhausted item is skipped");
		Assertions.assertEquals(new QueueStats(0, 1, 1), this.queue.stats());
		Assertions.assertEquals("dead", this.db.sql("select state from queue_item where job_id = 'job-1'")
			.query(String.class)
			.single());
	}

	@Test
	void failuresAreRecorded() {
		this.queue.enqueue(WorkItem.of("job-1"));
		var delivery = this.queue.dequeue(LEASE).orElseThrow();
		this.queue.fail(delivery.handle(), "the scorer timed out");
		Assertions.assertEquals("the scorer timed out",
				this.db.sql("select last_error from queue_item where handle = ?")
					.params(delivery.handle())
					.query(String.class)
					.single());
	}

	@Test
	void concurrentWorkersNeverShareAnItem() throws Exception {
		var items = 20;
		for (var i = 0; i < items; i++)
			this.queue.enqueue(WorkItem.of("job-" + i));
		var start = new CountDownLatch(1);
		Callable<HashSet<String>> worker = () -> {
			start.await();
			var seen = new HashSet<String>();
			for (var delivery = this.queue.dequeue(LEASE); delivery.isPresent(); delivery = this.queue
				.dequeue(LEASE)) {
				seen.add(delivery.get().item().jobId());
				this.queue.ack(delivery.get().handle());
			}
			return seen;
		};
		var executor = Executors.newFixedThreadPool(4);
		try {
			var futures = new ArrayList<Future<HashSet<String>>>();
			for (var i = 0; i < 4; i++)
				futures.add(executor.submit(worker));
			start.countDown();
			var all = new HashSet<String>();
			var total = 0;
			for (var future : futures) {
				var seen = future.get(30, TimeUnit.SECONDS);
				total += seen.size();
				all.addAll(seen);
			}
			Assertions.assertEquals(items, all.size(), "every item was delivered");
			Assertions.assertEquals(items, total, "and no item was delivered twice");
		}
		finally {
			executor.shutdownNow();
		}
	}

}
