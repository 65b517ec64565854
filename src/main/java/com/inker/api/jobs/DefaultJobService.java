package com.inker.api.jobs;

import com.inker.api.BackendUnavailableException;
import com.inker.api.DuplicateJobException;
import com.inker.api.HistoryAction;
import com.inker.api.Job;
import com.inker.api.JobError;
import com.inker.api.JobHistoryEntry;
import com.inker.api.JobResult;
import com.inker.api.JobStats;
import com.inker.api.JobStatus;
import com.inker.api.NewBlogPost;
import com.inker.api.NewHistoryEntry;
import com.inker.api.NotFoundException;
import com.inker.api.StaleStateException;
import com.inker.api.ValidationException;
import com.inker.api.pipeline.ArticleSourceType;
import com.inker.api.pipeline.GenerationException;
import com.inker.api.pipeline.Pipeline;
import com.inker.api.pipeline.PipelineProperties;
import com.inker.api.pipeline.ScoredPost;
import com.inker.api.pipeline.ScoringException;
import com.inker.api.queue.JobQueue;
import com.inker.api.queue.WorkItem;
import com.inker.api.storage.Storage;
import com.inker.api.utils.DateUtils;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.util.IdGenerator;

import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Service
class DefaultJobService implements JobService {

	static final int MIN_CANDIDATES = 1;

	static final int MAX_CANDIDATES = 10;

	private final Logger log = LoggerFactory.getLogger(getClass());

	private final Storage storage;

	private final JobQueue queue;

	private final Pipeline pipeline;

	private final PipelineProperties defaults;

	private final IdGenerator idGenerator;

	private final Clock clock;

	private final JobMetrics metrics;

	DefaultJobService(Storage storage, JobQueue queue, Pipeline pipeline, PipelineProperties defaults,
			IdGenerator idGenerator, Clock clock, JobMetrics metrics) {
		this.storage = storage;
		this.queue = queue;
		this.pipeline = pipeline;
		this.defaults = defaults;
		this.idGenerator = idGenerator;
		this.clock = clock;
		this.metrics = metrics;
	}

	@Override
	public SubmissionResult submit(JobSubmission submission) {
		if (submission == null)
			throw new ValidationException("a submission is required");
		var numCandidates = submission.numCandidates() == null ? this.defaults.defaultNumCandidates()
				: submission.numCandidates();
		var maxResults = submission.maxResults() == null ? this.defaults.defaultMaxResults()
				: submission.maxResults();
		var sources = validate(submission, numCandidates, maxResults);
		var correlationId = submission.correlationId() == null || submission.correlationId().isBlank() ? null
				: submission.correlationId().trim();

		if (correlationId != null) {
			var existing = this.storage.getJobByCorrelationId(correlationId);
			if (existing.isPresent() && existing.get().status() != JobStatus.FAILED)
				return this.duplicate(existing.get());
		}

		var job = Job.pending(this.idGenerator.generateId().toString(), correlationId, submission.topics(), sources,
				numCandidates, maxResults, this.now());
		try {
			this.storage.createJob(job);
		} //
		catch (DuplicateJobException e) {
			this.log.debug("lost the race for correlation id [{}] to job [{}]", correlationId, e.getExistingJobId());
			return this.storage.getJob(e.getExistingJobId())
				.map(this::duplicate)
				.orElseThrow(() -> e);
		}
		this.storage.addHistoryEntry(NewHistoryEntry.forJob(job.id(), HistoryAction.SUBMITTED, null,
				JobStatus.PENDING, correlationId == null ? Map.of() : Map.of("correlation_id", correlationId)));

		try {
			this.queue.enqueue(WorkItem.of(job.id()));
		} //
		catch (RuntimeException e) {
			// an unqueued job would hold its correlation id forever
			this.log.warn("couldn't queue job [{}], marking it failed", job.id(), e);
			this.fail(job, JobError.of(JobError.QUEUE_UNAVAILABLE, e));
			if (e instanceof BackendUnavailableException unavailable)
				throw unavailable;
			throw new BackendUnavailableException("couldn't queue job [" + job.id() + "]", e);
		}
		this.metrics.submitted(false);
		this.log.info("submitted job [{}] for topics {}", job.id(), job.topics());
		return new SubmissionResult(job.id(), correlationId, JobStatus.PENDING, false, "job submitted");
	}

	private static List<String> validate(JobSubmission submission, int numCandidates, int maxResults) {
		for (var topic : submission.topics())
			if (topic == null || topic.isBlank())
				throw new ValidationException("topics must not be blank");
		if (numCandidates < MIN_CANDIDATES || numCandidates > MAX_CANDIDATES)
			throw new ValidationException("numCandidates must be between %d and %d, but was %d"
				.formatted(MIN_CANDIDATES, MAX_CANDIDATES, numCandidates));
		if (maxResults <= 0)
			throw new ValidationException("maxResults must be positive, but was " + maxResults);
		for (var source : submission.sources())
			if (!ArticleSourceType.isKnown(source))
				throw new ValidationException("[" + source + "] is not a known article source");
		return submission.sources().stream().map(source -> ArticleSourceType.of(source).name()).toList();
	}

	private SubmissionResult duplicate(Job existing) {
		this.metrics.submitted(true);
		return new SubmissionResult(existing.id(), existing.correlationId(), existing.status(), true,
				"a job with this correlation id already exists");
	}

	@Override
	public void execute(String jobId) {
		var job = this.storage.getJob(jobId).orElseThrow(() -> new NotFoundException("job", jobId));
		if (job.status().isTerminal()) {
			this.log.info("job [{}] is already {}, there's nothing to do", jobId, job.status().value());
			return;
		}
		if (job.status() != JobStatus.PENDING) {
			this.log.warn("job [{}] was redelivered while {}, its previous worker must have died", jobId,
					job.status().value());
			this.fail(job, new JobError(JobError.WORKER_LOST,
					"the job was interrupted while " + job.status().value(), null));
			return;
		}

		var topics = job.topics().isEmpty() ? this.defaults.defaultTopics() : job.topics();
		var sources = job.sources().isEmpty() ? this.defaults.defaultSources()
				: job.sources().stream().map(ArticleSourceType::of).toList();
		var maxResults = job.maxResults();
		var numCandidates = job.numCandidates();

		job = this.advance(job, JobStatus.FETCHING);
		this.storage.addHistoryEntry(NewHistoryEntry.forJob(job.id(), HistoryAction.STARTED, JobStatus.PENDING,
				JobStatus.FETCHING, Map.of()));
		try {
			var articles = this.metrics.stage(JobStatus.FETCHING,
					() -> this.pipeline.fetcher().fetchAll(topics, sources, maxResults));
			if (articles == null || articles.isEmpty()) {
				this.fail(job, new JobError(JobError.NO_ARTICLES, "no articles were found for " + topics, null));
				return;
			}

			job = this.advance(job, JobStatus.GENERATING);
			var candidates = this.metrics.stage(JobStatus.GENERATING,
					() -> this.pipeline.generator().generate(articles, numCandidates));
			if (candidates == null || candidates.isEmpty()) {
				this.fail(job, new JobError(JobError.NO_CANDIDATES, "no candidate posts were generated", null));
				return;
			}

			job = this.advance(job, JobStatus.SCORING);
			var scored = this.metrics.stage(JobStatus.SCORING, () -> this.pipeline.scorer().score(candidates));
			var winner = (scored == null ? List.<ScoredPost>of() : scored).stream()
				.max(Comparator.comparingDouble(s -> s.score().total()))
				.orElseThrow(() -> new ScoringException("the scorer returned no scores"));

			job = this.advance(job, JobStatus.REFINING);
			var markdown = this.metrics.stage(JobStatus.REFINING, () -> this.pipeline.refiner().refine(winner));
			var candidate = winner.candidate();
			var post = this.storage.createPost(new NewBlogPost(candidate.title(), markdown, candidate.topic(),
					candidate.sources(), job.id(), winner.score(),
					Map.of("articles_fetched", Integer.toString(articles.size()), "candidates_generated",
							Integer.toString(candidates.size()))));
			var result = new JobResult(post.id(), post.title(), post.wordCount(), winner.score(), articles.size(),
					candidates.size());
			job = this.storage.updateJob(job.complete(result, this.now()));
			this.metrics.finished(job);
			this.storage.addHistoryEntry(new NewHistoryEntry(job.id(), post.id(), HistoryAction.COMPLETED,
					JobStatus.REFINING.value(), JobStatus.COMPLETED.value(), "system", null,
					Map.of("post_id", post.id(), "word_count", Integer.toString(post.wordCount()))));
			this.log.info("job [{}] produced post [{}] '{}'", job.id(), post.id(), post.title());
		} //
		catch (GenerationException e) {
			this.fail(job, JobError.of(JobError.GENERATION_ERROR, e));
		} //
		catch (ScoringException e) {
			this.fail(job, JobError.of(JobError.SCORING_ERROR, e));
		} //
		catch (BackendUnavailableException | StaleStateException e) {
			// leave the job to the queue: the delivery is failed and a later one finds it
			// mid-pipeline
			throw e;
		} //
		catch (RuntimeException e) {
			this.fail(job, JobError.of(JobError.PIPELINE_ERROR, e));
		}
	}

	private Job advance(Job job, JobStatus next) {
		this.log.debug("job [{}] {} -> {}", job.id(), job.status().value(), next.value());
		return this.storage.updateJob(job.transitionTo(next, this.now()));
	}

	private void fail(Job job, JobError error) {
		var failed = this.storage.updateJob(job.fail(error, this.now()));
		var metadata = new HashMap<String, String>();
		metadata.put("code", error.code());
		metadata.put("message", error.message());
		if (error.detail() != null)
			metadata.put("detail", error.detail());
		this.storage.addHistoryEntry(
				NewHistoryEntry.forJob(failed.id(), HistoryAction.FAILED, job.status(), JobStatus.FAILED, metadata));
		this.metrics.finished(failed);
		this.log.warn("job [{}] failed while {}: {} ({})", job.id(), job.status().value(), error.message(),
				error.code());
	}

	@Override
	public Optional<Job> getJob(String jobId) {
		return this.storage.getJob(jobId);
	}

	@Override
	public Optional<Job> getJobByCorrelationId(String correlationId) {
		return this.storage.getJobByCorrelationId(correlationId);
	}

	@Override
	public JobStatusView getJobStatus(String jobId) {
		Optional<Job> job;
		try {
			job = this.storage.getJob(jobId);
		} //
		catch (BackendUnavailableException e) {
			this.log.warn("couldn't read the status of job [{}]", jobId, e);
			return new JobStatusView(jobId, JobStatusView.UNKNOWN, null, null, null,
					"the job store is unavailable, try again later");
		}
		return job.map(DefaultJobService::statusView).orElseThrow(() -> new NotFoundException("job", jobId));
	}

	private static JobStatusView statusView(Job job) {
		var message = switch (job.status()) {
			case PENDING -> "waiting for a worker";
			case COMPLETED -> "finished";
			case FAILED -> job.error() == null ? "failed" : job.error().message();
			default -> job.status().value();
		};
		return new JobStatusView(job.id(), job.status().value(), job.updatedAt(), job.result(), job.error(),
				message);
	}

	@Override
	public List<Job> listJobs(@Nullable JobStatus status, int limit, int offset) {
		return this.storage.listJobs(status, limit, offset);
	}

	@Override
	public Optional<PostPreview> getPreview(String jobId) {
		return this.storage.getJob(jobId)
			.filter(job -> job.result() != null)
			.flatMap(job -> this.storage.getPost(job.result().postId())
				.map(post -> new PostPreview(job.id(), post.id(), post.title(), post.content(), post.wordCount(),
						post.scoring() == null ? 0 : post.scoring().total(), post.sources(),
						post.approvalStatus())));
	}

	@Override
	public List<JobHistoryEntry> getJobHistory(String jobId) {
		return this.storage.getJobHistory(jobId);
	}

	@Override
	public JobStats getStats() {
		return this.storage.getStats();
	}

	private Instant now() {
		return DateUtils.now(this.clock);
	}

}
