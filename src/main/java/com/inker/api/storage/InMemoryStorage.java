package com.inker.api.storage;

import com.inker.api.ApprovalStatus;
import com.inker.api.BlogPost;
import com.inker.api.BlogPostUpdate;
import com.inker.api.DuplicateJobException;
import com.inker.api.HistoryAction;
import com.inker.api.Job;
import com.inker.api.JobHistoryEntry;
import com.inker.api.JobStats;
import com.inker.api.JobStatus;
import com.inker.api.NewBlogPost;
import com.inker.api.NewHistoryEntry;
import com.inker.api.NotFoundException;
import com.inker.api.StaleStateException;
import com.inker.api.ValidationException;
import com.inker.api.utils.DateUtils;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.Assert;
import org.springframework.util.IdGenerator;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Predicate;

/**
 * keeps everything in concurrent maps. Writes to a single post or job go through
 * {@link ConcurrentHashMap#compute}, which serialises them per key.
 */
public class InMemoryStorage implements Storage {

	private final Logger log = LoggerFactory.getLogger(getClass());

	private final Map<String, BlogPost> posts = new ConcurrentHashMap<>();

	private final Map<String, String> postIdsByJobId = new ConcurrentHashMap<>();

	private final Map<String, Job> jobs = new ConcurrentHashMap<>();

	private final Map<String, String> jobIdsByCorrelationId = new ConcurrentHashMap<>();

	private final List<JobHistoryEntry> history = new ArrayList<>();

	private final AtomicBoolean initialized = new AtomicBoolean();

	private final IdGenerator idGenerator;

	private final Clock clock;

	public InMemoryStorage(IdGenerator idGenerator, Clock clock) {
		this.idGenerator = idGenerator;
		this.clock = clock;
	}

	@Override
	public void initialize() {
		if (this.initialized.compareAndSet(false, true))
			this.log.info("initialized the in-memory storage");
	}

	@Override
	public String schemaVersion() {
		return "memory";
	}

	@Override
	public boolean healthCheck() {
		return true;
	}

	@Override
	public BlogPost createPost(NewBlogPost newPost) {
		var post = PostTransitions.newPost(this.nextId(), newPost, this.now());
		if (post.jobId() != null && this.postIdsByJobId.putIfAbsent(post.jobId(), post.id()) != null)
			throw new ValidationException("job [" + post.jobId() + "] already has a post");
		this.posts.put(post.id(), post);
		this.changed();
		return post;
	}

	@Override
	public Optional<BlogPost> getPost(String id) {
		return Optional.ofNullable(this.posts.get(id));
	}

	@Override
	public Optional<BlogPost> getPostByJobId(String jobId) {
		return Optional.ofNullable(this.postIdsByJobId.get(jobId)).map(this.posts::get);
	}

	@Override
	public Optional<BlogPost> updatePost(String id, BlogPostUpdate update) {
		Assert.notNull(update, "the update must not be null");
		var updated = this.posts.computeIfPresent(id, (key, post) -> {
			var merged = PostTransitions.merge(post, update, this.now());
			var resubmission = PostTransitions.resubmission(post, merged);
			if (resubmission != null)
				this.append(resubmission);
			return merged;
		});
		if (updated != null)
			this.changed();
		return Optional.ofNullable(updated);
	}

	@Override
	public boolean deletePost(String id) {
		var removed = this.posts.remove(id);
		if (removed == null)
			return false;
		if (removed.jobId() != null)
			this.postIdsByJobId.remove(removed.jobId(), id);
		this.changed();
		return true;
	}

	@Override
	public List<BlogPost> listPosts(@Nullable ApprovalStatus status, @Nullable String topic, int limit, int offset) {
		PostTransitions.checkPage(limit, offset);
		Predicate<BlogPost> matches = post -> (status == null || post.approvalStatus() == status)
				&& (topic == null || topic.equals(post.topic()));
		return this.posts.values()
			.stream()
			.filter(matches)
			.sorted(Comparator.comparing(BlogPost::createdAt).reversed())
			.skip(offset)
			.limit(PostTransitions.pageSize(limit))
			.toList();
	}

	@Override
	public Optional<PostTransition> approvePost(String id, @Nullable String actor, @Nullable String feedback,
			Map<String, String> metadata) {
		return this.transition(id, HistoryAction.APPROVED, actor, feedback, metadata);
	}

	@Override
	public Optional<PostTransition> rejectPost(String id, @Nullable String actor, String feedback,
			Map<String, String> metadata) {
		return this.transition(id, HistoryAction.REJECTED, actor, feedback, metadata);
	}

	@Override
	public Optional<PostTransition> requestRevision(String id, @Nullable String actor, String feedback,
			Map<String, String> metadata) {
		return this.transition(id, HistoryAction.REVISION_REQUESTED, actor, feedback, metadata);
	}

	@Override
	public Optional<PostTransition> publishPost(String id, @Nullable String actor, Map<String, String> metadata) {
		return this.transition(id, HistoryAction.PUBLISHED, actor, null, metadata);
	}

	private Optional<PostTransition> transition(String id, HistoryAction action, @Nullable String actor,
			@Nullable String feedback, Map<String, String> metadata) {
		var result = new AtomicReference<PostTransition>();
		this.posts.computeIfPresent(id, (key, post) -> {
			var next = PostTransitions.apply(post, action, feedback, this.now());
			var entry = this.append(PostTransitions.historyFor(post, next, action, actor, feedback, metadata));
			result.set(new PostTransition(next, post.approvalStatus(), entry));
			return next;
		});
		if (result.get() != null)
			this.changed();
		return Optional.ofNullable(result.get());
	}

	@Override
	public Job createJob(Job job) {
		Assert.notNull(job, "the job must not be null");
		if (job.correlationId() == null) {
			this.putNewJob(job);
		}
		else {
			this.jobIdsByCorrelationId.compute(job.correlationId(), (key, holderId) -> {
				if (holderId != null) {
					var holder = this.jobs.get(holderId);
					if (holder != null && holder.status() != JobStatus.FAILED)
						throw new DuplicateJobException(key, holderId);
				}
				this.putNewJob(job);
				return job.id();
			});
		}
		this.changed();
		return job;
	}

	private void putNewJob(Job job) {
		Assert.state(this.jobs.putIfAbsent(job.id(), job) == null, () -> "job [" + job.id() + "] already exists");
	}

	@Override
	public Optional<Job> getJob(String id) {
		return Optional.ofNullable(this.jobs.get(id));
	}

	@Override
	public Optional<Job> getJobByCorrelationId(String correlationId) {
		return Optional.ofNullable(this.jobIdsByCorrelationId.get(correlationId)).map(this.jobs::get);
	}

	@Override
	public Job updateJob(Job job) {
		Assert.notNull(job, "the job must not be null");
		this.jobs.compute(job.id(), (key, stored) -> {
			if (stored == null)
				throw new NotFoundException("job", key);
			if (stored.version() != job.version() - 1)
				throw new StaleStateException("job", key);
			return job;
		});
		this.changed();
		return job;
	}

	@Override
	public List<Job> listJobs(@Nullable JobStatus status, int limit, int offset) {
		PostTransitions.checkPage(limit, offset);
		return this.jobs.values()
			.stream()
			.filter(job -> status == null || job.status() == status)
			.sorted(Comparator.comparing(Job::createdAt).reversed())
			.skip(offset)
			.limit(PostTransitions.pageSize(limit))
			.toList();
	}

	@Override
	public JobHistoryEntry addHistoryEntry(NewHistoryEntry entry) {
		var saved = this.append(entry);
		this.changed();
		return saved;
	}

	private JobHistoryEntry append(NewHistoryEntry entry) {
		var saved = new JobHistoryEntry(this.nextId(), entry.jobId(), entry.postId(), entry.action(),
				entry.previousStatus(), entry.newStatus(), entry.actor(), entry.feedback(), entry.metadata(),
				this.now());
		synchronized (this.history) {
			this.history.add(saved);
		}
		return saved;
	}

	@Override
	public List<JobHistoryEntry> getJobHistory(String jobId) {
		return this.history(entry -> entry.jobId().equals(jobId));
	}

	@Override
	public List<JobHistoryEntry> getPostHistory(String postId) {
		return this.history(entry -> Objects.equals(entry.postId(), postId));
	}

	private List<JobHistoryEntry> history(Predicate<JobHistoryEntry> predicate) {
		synchronized (this.history) {
			return this.history.stream().filter(predicate).toList();
		}
	}

	@Override
	public JobStats getStats() {
		return StorageStatistics.of(List.copyOf(this.jobs.values()), List.copyOf(this.posts.values()));
	}

	/**
	 * called after every successful write.
	 */
	protected void changed() {
	}

	Snapshot snapshot() {
		synchronized (this.history) {
			return new Snapshot(List.copyOf(this.posts.values()), List.copyOf(this.jobs.values()),
					Map.copyOf(this.jobIdsByCorrelationId), List.copyOf(this.history));
		}
	}

	void restore(Snapshot snapshot) {
		snapshot.posts().forEach(post -> {
			this.posts.put(post.id(), post);
			if (post.jobId() != null)
				this.postIdsByJobId.put(post.jobId(), post.id());
		});
		snapshot.jobs().forEach(job -> this.jobs.put(job.id(), job));
		this.jobIdsByCorrelationId.putAll(snapshot.correlations());
		synchronized (this.history) {
			this.history.addAll(snapshot.history());
		}
	}

	private String nextId() {
		return this.idGenerator.generateId().toString();
	}

	private Instant now() {
		return DateUtils.now(this.clock);
	}

	/**
	 * everything this storage holds, in a shape Jackson can write and read back.
	 */
	record Snapshot(List<BlogPost> posts, List<Job> jobs, Map<String, String> correlations,
			List<JobHistoryEntry> history) {

		Snapshot {
			posts = posts == null ? List.of() : posts;
			jobs = jobs == null ? List.of() : jobs;
			correlations = correlations == null ? Map.of() : correlations;
			history = history == null ? List.of() : history;
		}

	}

}
