package com.inker.api;

import org.jspecify.annotations.Nullable;
import org.springframework.util.Assert;

import java.time.Instant;
import java.util.List;

/**
 * a unit of pipeline work. Instances are immutable: every lifecycle move returns a new
 * {@code Job} with a bumped {@link #version()}, which storage uses for optimistic
 * concurrency.
 *
 * <p>
 * A job carries a {@link #result()} only when {@link JobStatus#COMPLETED completed} and
 * an {@link #error()} only when {@link JobStatus#FAILED failed}; the constructor refuses
 * anything else.
 * </p>
 */
public record Job(String id, @Nullable String correlationId, JobStatus status, List<String> topics,
		List<String> sources, int numCandidates, int maxResults, Instant createdAt, Instant updatedAt,
		@Nullable Instant startedAt, @Nullable Instant completedAt, @Nullable JobResult result,
		@Nullable JobError error, long version) {

	public Job {
		Assert.hasText(id, "the job id must not be empty");
		Assert.notNull(status, "the job status must not be null");
		Assert.notNull(createdAt, "the createdAt timestamp must not be null");
		Assert.notNull(updatedAt, "the updatedAt timestamp must not be null");
		Assert.state((result != null) == (status == JobStatus.COMPLETED),
				() -> "job [" + id + "] may carry a result only when completed, but it is " + status.value());
		Assert.state((error != null) == (status == JobStatus.FAILED),
				() -> "job [" + id + "] may carry an error only when failed, but it is " + status.value());
		topics = topics == null ? List.of() : List.copyOf(topics);
		sources = sources == null ? List.of() : List.copyOf(sources);
	}

	public static Job pending(String id, @Nullable String correlationId, List<String> topics, List<String> sources,
			int numCandidates, int maxResults, Instant now) {
		return new Job(id, correlationId, JobStatus.PENDING, topics, sources, numCandidates, maxResults, now, now, null,
				null, null, null, 0);
	}

	/**
	 * moves an in-flight job to the next pipeline stage.
	 */
	public Job transitionTo(JobStatus next, Instant now) {
		Assert.isTrue(!next.isTerminal(), "use complete() or fail() to finish a job");
		this.checkTransition(next);
		var started = this.startedAt == null ? now : this.startedAt;
		return new Job(this.id, this.correlationId, next, this.topics, this.sources, this.numCandidates,
				this.maxResults, this.createdAt, now, started, null, null, null, this.version + 1);
	}

	public Job complete(JobResult result, Instant now) {
		Assert.notNull(result, "a completed job needs a result");
		this.checkTransition(JobStatus.COMPLETED);
		return new Job(this.id, this.correlationId, JobStatus.COMPLETED, this.topics, this.sources, this.numCandidates,
				this.maxResults, this.createdAt, now, this.startedAt, now, result, null, this.version + 1);
	}

	public Job fail(JobError error, Instant now) {
		Assert.notNull(error, "a failed job needs an error");
		this.checkTransition(JobStatus.FAILED);
		return new Job(this.id, this.correlationId, JobStatus.FAILED, this.topics, this.sources, this.numCandidates,
				this.maxResults, this.createdAt, now, this.startedAt, now, null, error, this.version + 1);
	}

	private void checkTransition(JobStatus next) {
		if (this.status.isTerminal())
			throw new TerminalStateException(this.id, this.status, next);
		if (!this.status.canTransitionTo(next))
			throw new InvalidTransitionException("job", this.id, this.status, next);
	}

}
