package com.inker.api.queue;

import com.inker.api.utils.DateUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.IdGenerator;

import java.time.Clock;
import java.time.Duration;
import java.util.Comparator;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.PriorityBlockingQueue;
import java.util.concurrent.atomic.AtomicLong;

/**
 * a single-process queue. A dequeued item leaves the pending queue at once and is never
 * handed out again unless it is explicitly {@link #fail(String, String) failed}: an
 * expired lease is simply forgotten.
 */
public class InMemoryJobQueue implements JobQueue {

	private final Logger log = LoggerFactory.getLogger(getClass());

	private final PriorityBlockingQueue<Entry> pending = new PriorityBlockingQueue<>(16,
			Comparator.comparingInt((Entry e) -> -e.item().priority()).thenComparingLong(Entry::seq));

	private final Map<String, Entry> inFlight = new ConcurrentHashMap<>();

	private final ConcurrentLinkedQueue<Entry> dead = new ConcurrentLinkedQueue<>();

	private final AtomicLong sequence = new AtomicLong();

	private final IdGenerator idGenerator;

	private final Clock clock;

	private final int maxAttempts;

	public InMemoryJobQueue(IdGenerator idGenerator, Clock clock, int maxAttempts) {
		this.idGenerator = idGenerator;
		this.clock = clock;
		this.maxAttempts = maxAttempts;
	}

	@Override
	public void initialize() {
		this.log.info("initialized the in-memory queue");
	}

	@Override
	public String enqueue(WorkItem item) {
		var entry = new Entry(this.idGenerator.generateId().toString(), item, 0, this.sequence.incrementAndGet());
		this.pending.add(entry);
		this.log.debug("enqueued {} as {}", item, entry.handle());
		return entry.handle();
	}

	@Override
	public Optional<Delivery> dequeue(Duration visibilityTimeout) {
		var entry = this.pending.poll();
		if (entry == null)
			return Optional.empty();
		var delivered = new Entry(entry.handle(), entry.item(), entry.attempts() + 1, entry.seq());
		this.inFlight.put(delivered.handle(), delivered);
		return Optional.of(new Delivery(delivered.handle(), delivered.item(), delivered.attempts(),
				DateUtils.now(this.clock).plus(visibilityTimeout)));
	}

	@Override
	public void ack(String handle) {
		this.inFlight.remove(handle);
	}

	@Override
	public void fail(String handle, String error) {
		var entry = this.inFlight.remove(handle);
		if (entry == null)
			return;
		if (entry.attempts() < this.maxAttempts) {
			this.pending.add(entry);
		}
		else {
			this.log.warn("dead-lettering {} after {} attempts: {}", entry.item(), entry.attempts(), error);
			this.dead.add(entry);
		}
	}

	@Override
	public boolean healthCheck() {
		return true;
	}

	@Override
	public QueueStats stats() {
		return new QueueStats(this.pending.size(), this.inFlight.size(), this.dead.size());
	}

	private record Entry(String handle, WorkItem item, int attempts, long seq) {
	}

}
