package com.inker.api.queue;

import java.time.Duration;
import java.util.Optional;

/**
 * hands work items to workers.
 *
 * <p>
 * The persistent implementations lease each delivery for a visibility timeout: an item
 * that isn't acknowledged in time becomes deliverable again, so delivery is
 * at-least-once and consumers must tolerate seeing the same job twice. The in-memory
 * implementation never re-delivers an expired lease.
 * </p>
 */
public interface JobQueue {

	void initialize();

	/**
	 * @return a handle identifying the item
	 * @throws com.inker.api.BackendUnavailableException if the queue can't be reached
	 */
	String enqueue(WorkItem item);

	Optional<Delivery> dequeue(Duration visibilityTimeout);

	/**
	 * removes a delivered item for good. Unknown or already acknowledged handles are
	 * ignored.
	 */
	void ack(String handle);

	/**
	 * gives a delivered item back: it's made visible again until it has been delivered
	 * {@code maxAttempts} times, and dead-lettered after that. Unknown handles are
	 * ignored.
	 */
	void fail(String handle, String error);

	boolean healthCheck();

	QueueStats stats();

}
