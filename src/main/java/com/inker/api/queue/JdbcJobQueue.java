package com.inker.api.queue;

import com.inker.api.BackendUnavailableException;
import com.inker.api.utils.DateUtils;
import com.inker.api.utils.JdbcUtils;
import com.inker.api.utils.JsonUtils;
import org.flywaydb.core.Flyway;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.transaction.support.TransactionTemplate;
import org.springframework.util.IdGenerator;

import javax.sql.DataSource;
import java.time.Clock;
import java.time.Duration;
import java.util.HashMap;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

/**
 * a queue in the {@code queue_item} table. Workers lease rows with
 * {@code select ... for update skip locked}, so concurrent pollers never block on, or
 * receive, the same row. A lease that expires makes its row eligible again.
 */
class JdbcJobQueue implements JobQueue {

	static final String MIGRATIONS = "classpath:db/migration/queue";

	static final String SCHEMA_HISTORY_TABLE = "queue_schema_version";

	static final String READY = "ready";

	static final String LEASED = "leased";

	static final String DEAD = "dead";

	private final Logger log = LoggerFactory.getLogger(getClass());

	private final AtomicBoolean initialized = new AtomicBoolean();

	private final DataSource dataSource;

	private final JdbcClient db;

	private final TransactionTemplate tx;

	private final IdGenerator idGenerator;

	private final Clock clock;

	private final int maxAttempts;

	JdbcJobQueue(DataSource dataSource, JdbcClient db, TransactionTemplate tx, IdGenerator idGenerator, Clock clock,
			int maxAttempts) {
		this.dataSource = dataSource;
		this.db = db;
		this.tx = tx;
		this.idGenerator = idGenerator;
		this.clock = clock;
		this.maxAttempts = maxAttempts;
	}

	@Override
	public synchronized void initialize() {
		if (this.initialized.get())
			return;
		var result = Flyway.configure() //
			.dataSource(this.dataSource) //
			.locations(MIGRATIONS) //
			.table(SCHEMA_HISTORY_TABLE) //
			.baselineOnMigrate(true) //
			.baselineVersion("0") //
			.load() //
			.migrate();
		this.initialized.set(true);
		this.log.info("applied {} queue migration(s)", result.migrationsExecuted);
	}

	@Override
	public String enqueue(WorkItem item) {
		var handle = this.idGenerator.generateId().toString();
		var now = DateUtils.forInstant(DateUtils.now(this.clock));
		this.call("enqueue " + item.jobId(), () -> this.db.sql("""
				insert into queue_item (handle, job_id, payload, priority, state, attempts, enqueued_at, updated_at)
				values (?, ?, ?, ?, ?, 0, ?, ?)
				""") //
			.params(handle, item.jobId(), JsonUtils.write(item), item.priority(), READY, now, now) //
			.update());
		this.log.debug("enqueued {} as {}", item, handle);
		return handle;
	}

	@Override
	public Optional<Delivery> dequeue(Duration visibilityTimeout) {
		return this.call("dequeue", () -> this.tx.execute(status -> {
			var now = DateUtils.now(this.clock);
			while (true) {
				var candidate = this.db.sql("""
						select handle, payload, attempts from queue_item
						where state = ? or (state = ? and lease_expires_at < ?)
						order by priority desc, seq
						limit 1
						for update skip locked
						""") //
					.params(READY, LEASED, DateUtils.forInstant(now)) //
					.query((rs, rowNum) -> new Candidate(rs.getString("handle"),
							JsonUtils.read(rs.getString("payload"), WorkItem.class), rs.getInt("attempts"))) //
					.optional();
				if (candidate.isEmpty())
					return Optional.<Delivery>empty();
				var row = candidate.get();
				if (row.attempts() >= this.maxAttempts) {
					// an expired lease on an item that has used up its deliveries
					this.db
						.sql("update queue_item set state = ?, lease_expires_at = null, updated_at = ? where handle = ?")
						.params(DEAD, DateUtils.forInstant(now), row.handle())
						.update();
					this.log.warn("dead-lettered {} after {} deliveries without an acknowledgement", row.item(),
							row.attempts());
					continue;
				}
				var leaseExpiresAt = now.plus(visibilityTimeout);
				this.db.sql("""
						update queue_item set state = ?, attempts = ?, lease_expires_at = ?, updated_at = ?
						where handle = ?
						""") //
					.params(LEASED, row.attempts() + 1, DateUtils.forInstant(leaseExpiresAt),
							DateUtils.forInstant(now), row.handle()) //
					.update();
				return Optional.of(new Delivery(row.handle(), row.item(), row.attempts() + 1, leaseExpiresAt));
			}
		}));
	}

	@Override
	public void ack(String handle) {
		this.call("ack " + handle, () -> this.db //
			.sql("delete from queue_item where handle = ? and state = ?") //
			.params(handle, LEASED) //
			.update());
	}

	@Override
	public void fail(String handle, String error) {
		this.call("fail " + handle, () -> this.tx.execute(status -> {
			var attempts = this.db //
				.sql("select attempts from queue_item where handle = ? and state = ? for update") //
				.params(handle, LEASED) //
				.query(Integer.class) //
				.optional();
			if (attempts.isEmpty())
				return 0;
			var next = attempts.get() < this.maxAttempts ? READY : DEAD;
			if (DEAD.equals(next))
				this.log.warn("dead-lettering {} after {} attempts: {}", handle, attempts.get(), error);
			return this.db.sql("""
					update queue_item set state = ?, lease_expires_at = null, last_error = ?, updated_at = ?
					where handle = ?
					""") //
				.params(next, error, DateUtils.forInstant(DateUtils.now(this.clock)), handle) //
				.update();
		}));
	}

	@Override
	public boolean healthCheck() {
		try {
			return this.db.sql("select count(*) from queue_item where 1 = 0").query(Long.class).single() == 0;
		} //
		catch (DataAccessException e) {
			this.log.warn("the queue database is unreachable", e);
			return false;
		}
	}

	@Override
	public QueueStats stats() {
		var counts = new HashMap<String, Long>();
		this.call("read the queue statistics", () -> {
			this.db.sql("select state, count(*) as c from queue_item group by state").query(rs -> {
				counts.put(rs.getString("state"), rs.getLong("c"));
			});
			return counts;
		});
		return new QueueStats(counts.getOrDefault(READY, 0L), counts.getOrDefault(LEASED, 0L),
				counts.getOrDefault(DEAD, 0L));
	}

	private <T> T call(String what, Supplier<T> supplier) {
		try {
			return supplier.get();
		} //
		catch (DataAccessException e) {
			if (JdbcUtils.isRetryable(e))
				throw new BackendUnavailableException("couldn't " + what + ": the queue database is unavailable", e);
			throw e;
		}
	}

	private record Candidate(String handle, WorkItem item, int attempts) {
	}

}
