package com.inker.api.queue;

import com.inker.api.BackendUnavailableException;
import com.inker.api.utils.DateUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ClassPathResource;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.InvalidDataAccessApiUsageException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.RedisScript;
import org.springframework.util.IdGenerator;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * a queue in redis.
 *
 * <ul>
 * <li>{@code <prefix>:pending}: a list of handles, pushed on the left and popped on the
 * right</li>
 * <li>{@code <prefix>:item:<handle>}: a hash with the job id, priority and attempt
 * count</li>
 * <li>{@code <prefix>:processing}: a sorted set of leased handles scored by the epoch
 * millisecond their lease expires</li>
 * <li>{@code <prefix>:dead}: a list of dead-lettered handles, expiring after the
 * configured dead letter ttl</li>
 * </ul>
 *
 * Priorities are recorded but not honoured: every item goes through one FIFO list. Each
 * operation that touches more than one key runs as a lua script, so it applies entirely
 * or not at all.
 */
class RedisJobQueue implements JobQueue {

	static final RedisScript<Long> ENQUEUE = script("enqueue", Long.class);

	@SuppressWarnings("rawtypes")
	static final RedisScript<List> DEQUEUE = script("dequeue", List.class);

	static final RedisScript<Long> ACK = script("ack", Long.class);

	static final RedisScript<Long> FAIL = script("fail", Long.class);

	private final Logger log = LoggerFactory.getLogger(getClass());

	private final StringRedisTemplate redis;

	private final IdGenerator idGenerator;

	private final Clock clock;

	private final int maxAttempts;

	private final Duration deadLetterTtl;

	private final String pendingKey;

	private final String processingKey;

	private final String deadKey;

	private final String itemKeyPrefix;

	RedisJobQueue(StringRedisTemplate redis, IdGenerator idGenerator, Clock clock, String keyPrefix, int maxAttempts,
			Duration deadLetterTtl) {
		this.redis = redis;
		this.idGenerator = idGenerator;
		this.clock = clock;
		this.maxAttempts = maxAttempts;
		this.deadLetterTtl = deadLetterTtl;
		this.pendingKey = keyPrefix + ":pending";
		this.processingKey = keyPrefix + ":processing";
		this.deadKey = keyPrefix + ":dead";
		this.itemKeyPrefix = keyPrefix + ":item:";
	}

	@Override
	public void initialize() {
		this.log.info("using the redis queue at {}", this.pendingKey);
	}

	@Override
	public String enqueue(WorkItem item) {
		var handle = this.idGenerator.generateId().toString();
		this.call("enqueue " + item.jobId(), () -> this.redis.execute(ENQUEUE,
				List.of(this.itemKey(handle), this.pendingKey), handle, item.jobId(), Integer.toString(item.priority())));
		this.log.debug("enqueued {} as {}", item, handle);
		return handle;
	}

	/*
	 * reclaiming expired leases, popping the next handle and leasing it run as one script,
	 * so a handle is always in either the pending list or the processing set
	 */
	@Override
	public Optional<Delivery> dequeue(Duration visibilityTimeout) {
		var now = DateUtils.now(this.clock);
		var leaseExpiresAt = now.plus(visibilityTimeout);
		List<?> result = this.call("dequeue",
				() -> this.redis.execute(DEQUEUE, List.of(this.pendingKey, this.processingKey, this.deadKey),
						this.itemKeyPrefix, Long.toString(now.toEpochMilli()),
						Long.toString(leaseExpiresAt.toEpochMilli()), Integer.toString(this.maxAttempts),
						Long.toString(this.deadLetterTtl.toSeconds())));
		if (result == null || result.isEmpty())
			return Optional.empty();
		var handle = String.valueOf(result.get(0));
		if (result.size() < 4) {
			this.log.warn("dropping the orphaned handle {}", handle);
			return Optional.empty();
		}
		var item = new WorkItem(String.valueOf(result.get(1)), Integer.parseInt(String.valueOf(result.get(2))));
		var attempt = Integer.parseInt(String.valueOf(result.get(3)));
		return Optional.of(new Delivery(handle, item, attempt, leaseExpiresAt));
	}

	@Override
	public void ack(String handle) {
		this.call("ack " + handle,
				() -> this.redis.execute(ACK, List.of(this.processingKey, this.itemKey(handle)), handle));
	}

	@Override
	public void fail(String handle, String error) {
		var outcome = this.call("fail " + handle,
				() -> this.redis.execute(FAIL,
						List.of(this.processingKey, this.pendingKey, this.deadKey, this.itemKey(handle)), handle,
						error == null ? "" : error, Integer.toString(this.maxAttempts),
						Long.toString(this.deadLetterTtl.toSeconds())));
		if (outcome != null && outcome == 1)
			this.log.warn("dead-lettered {} after {} attempts: {}", handle, this.maxAttempts, error);
	}

	@Override
	public boolean healthCheck() {
		try {
			this.redis.hasKey(this.pendingKey);
			return true;
		} //
		catch (DataAccessException e) {
			this.log.warn("redis is unreachable", e);
			return false;
		}
	}

	@Override
	public QueueStats stats() {
		return this.call("read the queue statistics", () -> new QueueStats(
				orZero(this.redis.opsForList().size(this.pendingKey)),
				orZero(this.redis.opsForZSet().size(this.processingKey)),
				orZero(this.redis.opsForList().size(this.deadKey))));
	}

	private String itemKey(String handle) {
		return this.itemKeyPrefix + handle;
	}

	private <T> T call(String what, Supplier<T> supplier) {
		try {
			return supplier.get();
		} //
		catch (InvalidDataAccessApiUsageException e) {
			throw e;
		} //
		catch (DataAccessException e) {
			throw new BackendUnavailableException("couldn't " + what + ": redis is unavailable", e);
		}
	}

	private static <T> RedisScript<T> script(String name, Class<T> resultType) {
		return RedisScript.of(new ClassPathResource("redis/queue/" + name + ".lua"), resultType);
	}

	private static long orZero(Long value) {
		return value == null ? 0 : value;
	}

}
