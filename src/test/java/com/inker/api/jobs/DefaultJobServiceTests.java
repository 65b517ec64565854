package com.inker.api.jobs;

import com.inker.api.BackendUnavailableException;
import com.inker.api.HistoryAction;
import com.inker.api.Job;
import com.inker.api.JobError;
import com.inker.api.JobHistoryEntry;
import com.inker.api.JobStatus;
import com.inker.api.NotFoundException;
import com.inker.api.Scoring;
import com.inker.api.ValidationException;
import com.inker.api.pipeline.Article;
import com.inker.api.pipeline.ArticleFetcher;
import com.inker.api.pipeline.ArticleSourceType;
import com.inker.api.pipeline.CandidateGenerator;
import com.inker.api.pipeline.CandidatePost;
import com.inker.api.pipeline.CandidateScorer;
import com.inker.api.pipeline.GenerationException;
import com.inker.api.pipeline.Pipeline;
import com.inker.api.pipeline.PipelineProperties;
import com.inker.api.pipeline.ScoredPost;
import com.inker.api.pipeline.ScoringException;
import com.inker.api.pipeline.WinnerRefiner;
import com.inker.api.queue.InMemoryJobQueue;
import com.inker.api.queue.JobQueue;
import com.inker.api.storage.InMemoryStorage;
import com.inker.api.storage.Storage;
import com.inker.api.utils.MutableClock;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.util.AlternativeJdkIdGenerator;
import org.springframework.util.IdGenerator;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.when;

class DefaultJobServiceTests {

	private final MutableClock clock = MutableClock.startingAt("2024-01-01T00:00:00Z");

	private final IdGenerator idGenerator = new AlternativeJdkIdGenerator();

	private final Storage storage = new InMemoryStorage(this.idGenerator, this.clock);

	private final JobQueue queue = new InMemoryJobQueue(this.idGenerator, this.clock, 3);

	private final SimpleMeterRegistry registry = new SimpleMeterRegistry();

	private final PipelineProperties defaults = new PipelineProperties(List.of("agentic AI"),
			List.of(ArticleSourceType.HACKER_NEWS), 3, 10);

	private ArticleFetcher fetcher = (topics, sources, maxResults) -> topics.stream()
		.map(topic -> new Article(topic + " is everywhere", "https://example.com/" + topic.length(),
				ArticleSourceType.HACKER_NEWS, "summary", topic, null))
		.toList();

	private CandidateGenerator generator = (articles, numCandidates) -> {
		var candidates = new ArrayList<CandidatePost>();
		for (var i = 1; i <= numCandidates; i++)
			candidates.add(new CandidatePost("Candidate " + i, "candidate number " + i + " says hello",
					List.of(articles.get(0).url()), articles.get(0).topic()));
		return candidates;
	};

	private CandidateScorer scorer = candidates -> candidates.stream()
		.map(candidate -> {
			var total = candidate.title().endsWith("2") ? 9.0 : 5.0;
			return new ScoredPost(candidate, new Scoring(total, total, total, total, total, total, "scored"));
		})
		.toList();

	private WinnerRefiner refiner = winner -> winner.candidate().content() + " (refined)";

	private JobService service() {
		return this.service(this.queue);
	}

	private JobService service(JobQueue queue) {
		return new DefaultJobService(this.storage, queue,
				new Pipeline(this.fetcher, this.generator, this.scorer, this.refiner), this.defaults,
				this.idGenerator, this.clock, new JobMetrics(this.registry));
	}

	private Job run(JobSubmission submission) {
		var service = this.service();
		var result = service.submit(submission);
		service.execute(result.jobId());
		return this.storage.getJob(result.jobId()).orElseThrow();
	}

	private List<HistoryAction> actions(String jobId) {
		return this.storage.getJobHistory(jobId).stream().map(JobHistoryEntry::action).toList();
	}

	@Test
	void aJobRunsToAPost() {
		var service = this.service();
		var submitted = service.submit(new JobSubmission(List.of("AI security"), List.of("web"), 3, 5, null));
		Assertions.assertEquals(JobStatus.PENDING, submitted.status());
		Assertions.assertFalse(submitted.duplicate());
		Assertions.assertEquals(1, this.queue.stats().pending(), "the job should be queued");

		this.clock.advance(Duration.ofSeconds(30));
		service.execute(submitted.jobId());

		var job = this.storage.getJob(submitted.jobId()).orElseThrow();
		Assertions.assertEquals(JobStatus.COMPLETED, job.status());
		Assertions.assertEquals(List.of("WEB"), job.sources(), "sources are normalised");
		Assertions.assertNotNull(job.startedAt());
		Assertions.assertNotNull(job.completedAt());
		var result = job.result();
		Assertions.assertEquals("Candidate 2", result.title(), "the best scored candidate wins");
		Assertions.assertEquals(1, result.articlesFetched());
		Assertions.assertEquals(3, result.candidatesGenerated());

		var post = this.storage.getPost(result.postId()).orElseThrow();
		Assertions.assertEquals(job.id(), post.jobId());
		Assertions.assertEquals("candidate number 2 says hello (refined)", post.content());
		Assertions.assertEquals(9.0, post.scoring().total());
		Assertions.assertEquals("1", post.metadata().get("articles_fetched"));
		Assertions.assertEquals("3", post.metadata().get("candidates_generated"));

		Assertions.assertEquals(List.of(HistoryAction.SUBMITTED, HistoryAction.STARTED, HistoryAction.COMPLETED),
				this.actions(job.id()));
		var completed = this.storage.getJobHistory(job.id()).get(2);
		Assertions.assertEquals(post.id(), completed.postId());
		Assertions.assertEquals(post.id(), completed.metadata().get("post_id"));

		var preview = service.getPreview(job.id()).orElseThrow();
		Assertions.assertEquals(post.content(), preview.markdown());
		Assertions.assertEquals(9.0, preview.score());

		var status = service.getJobStatus(job.id());
		Assertions.assertEquals("completed", status.status());
		Assertions.assertEquals(result, status.result());
	}

	@Test
	void emptySubmissionsUseTheDefaults() {
		var fetched = new AtomicReference<List<String>>();
		var sources = new AtomicReference<Collection<ArticleSourceType>>();
		var delegate = this.fetcher;
		this.fetcher = (topics, types, maxResults) -> {
			fetched.set(topics);
			sources.set(types);
			return delegate.fetchAll(topics, types, maxResults);
		};
		var job = this.run(new JobSubmission(null, null, null, null, null));
		Assertions.assertEquals(JobStatus.COMPLETED, job.status());
		Assertions.assertEquals(List.of("agentic AI"), fetched.get());
		Assertions.assertEquals(List.of(ArticleSourceType.HACKER_NEWS), List.copyOf(sources.get()));
		Assertions.assertEquals(3, job.numCandidates());
		Assertions.assertEquals(10, job.maxResults());
	}

	@Test
	void correlationIdsMakeSubmissionIdempotent() {
		var service = this.service();
		var first = service.submit(JobSubmission.of("weekly-digest", "ai"));
		var second = service.submit(JobSubmission.of("weekly-digest", "security"));
		Assertions.assertTrue(second.duplicate());
		Assertions.assertEquals(first.jobId(), second.jobId());
		Assertions.assertEquals(1, this.queue.stats().pending(), "the duplicate wasn't queued");
		Assertions.assertEquals(1, this.storage.listJobs(null, 10, 0).size());
		Assertions.assertEquals(first.jobId(), service.getJobByCorrelationId("weekly-digest").orElseThrow().id());
	}

	@Test
	void aFailedJobReleasesItsCorrelationId() {
		this.fetcher = (topics, sources, maxResults) -> List.of();
		var failed = this.run(JobSubmission.of("weekly-digest", "ai"));
		Assertions.assertEquals(JobStatus.FAILED, failed.status());
		var again = this.service().submit(JobSubmission.of("weekly-digest", "ai"));
		Assertions.assertFalse(again.duplicate());
		Assertions.assertNotEquals(failed.id(), again.jobId());
	}

	@Test
	void malformedSubmissionsAreRefused() {
		var service = this.service();
		Assertions.assertThrows(ValidationException.class,
				() -> service.submit(new JobSubmission(List.of("ai"), null, 0, null, null)));
		Assertions.assertThrows(ValidationException.class,
				() -> service.submit(new JobSubmission(List.of("ai"), null, 11, null, null)));
		Assertions.assertThrows(ValidationException.class,
				() -> service.submit(new JobSubmission(List.of("ai"), null, null, 0, null)));
		Assertions.assertThrows(ValidationException.class,
				() -> service.submit(new JobSubmission(List.of(" "), null, null, null, null)));
		Assertions.assertThrows(ValidationException.class,
				() -> service.submit(new JobSubmission(List.of("ai"), List.of("reddit"), null, null, null)));
		Assertions.assertTrue(this.storage.listJobs(null, 10, 0).isEmpty(), "nothing was stored");
		Assertions.assertEquals(0, this.queue.stats().pending(), "nothing was queued");
	}

	@Test
	void noArticles() {
		this.fetcher = (topics, sources, maxResults) -> List.of();
		var job = this.run(JobSubmission.of(null, "ai"));
		Assertions.assertEquals(JobError.NO_ARTICLES, job.error().code());
		Assertions.assertEquals(List.of(HistoryAction.SUBMITTED, HistoryAction.STARTED, HistoryAction.FAILED),
				this.actions(job.id()));
		var failure = this.storage.getJobHistory(job.id()).get(2);
		Assertions.assertEquals("fetching", failure.previousStatus());
		Assertions.assertEquals(JobError.NO_ARTICLES, failure.metadata().get("code"));
	}

	@Test
	void noCandidates() {
		this.generator = (articles, numCandidates) -> List.of();
		var job = this.run(JobSubmission.of(null, "ai"));
		Assertions.assertEquals(JobError.NO_CANDIDATES, job.error().code());
		Assertions.assertTrue(this.storage.listPosts(null, null, 10, 0).isEmpty(), "no post was written");
	}

	@Test
	void generationErrors() {
		this.generator = (articles, numCandidates) -> {
			throw new GenerationException("the model returned garbage");
		};
		var job = this.run(JobSubmission.of(null, "ai"));
		Assertions.assertEquals(JobError.GENERATION_ERROR, job.error().code());
		Assertions.assertEquals("the model returned garbage", job.error().message());
		Assertions.assertEquals(GenerationException.class.getName(), job.error().detail());
	}

	@Test
	void scoringErrors() {
		this.scorer = candidates -> {
			throw new ScoringException("the judge is asleep");
		};
		Assertions.assertEquals(JobError.SCORING_ERROR, this.run(JobSubmission.of(null, "ai")).error().code());
		this.scorer = candidates -> List.of();
		Assertions.assertEquals(JobError.SCORING_ERROR, this.run(JobSubmission.of(null, "ai")).error().code(),
				"no scores at all is a scoring error too");
	}

	@Test
	void anythingElseIsAPipelineError() {
		this.refiner = winner -> {
			throw new IllegalStateException("template missing");
		};
		var job = this.run(JobSubmission.of(null, "ai"));
		Assertions.assertEquals(JobError.PIPELINE_ERROR, job.error().code());
		var status = this.service().getJobStatus(job.id());
		Assertions.assertEquals("failed", status.status());
		Assertions.assertEquals("template missing", status.message());
	}

	@Test
	void anUnreachableQueueFailsTheSubmission() {
		var down = Mockito.mock(JobQueue.class);
		when(down.enqueue(any())).thenThrow(new BackendUnavailableException("redis is down", new RuntimeException()));
		var service = this.service(down);
		Assertions.assertThrows(BackendUnavailableException.class,
				() -> service.submit(JobSubmission.of("weekly-digest", "ai")));
		var job = this.storage.getJobByCorrelationId("weekly-digest").orElseThrow();
		Assertions.assertEquals(JobStatus.FAILED, job.status());
		Assertions.assertEquals(JobError.QUEUE_UNAVAILABLE, job.error().code());
		var retried = this.service().submit(JobSubmission.of("weekly-digest", "ai"));
		Assertions.assertFalse(retried.duplicate(), "the correlation id is free again");
	}

	@Test
	void anyEnqueueFailureFailsTheSubmission() {
		var broken = Mockito.mock(JobQueue.class);
		when(broken.enqueue(any())).thenThrow(new QueryTimeoutException("redis command timed out"));
		var service = this.service(broken);
		var exception = Assertions.assertThrows(BackendUnavailableException.class,
				() -> service.submit(JobSubmission.of("daily-digest", "ai")));
		Assertions.assertTrue(exception.isRetryable());
		Assertions.assertInstanceOf(QueryTimeoutException.class, exception.getCause());
		var job = this.storage.getJobByCorrelationId("daily-digest").orElseThrow();
		Assertions.assertEquals(JobStatus.FAILED, job.status(), "the job must not stay pending with nothing queued");
		Assertions.assertEquals(JobError.QUEUE_UNAVAILABLE, job.error().code());
		var retried = this.service().submit(JobSubmission.of("daily-digest", "ai"));
		Assertions.assertFalse(retried.duplicate(), "the correlation id is free again");
		Assertions.assertNotEquals(job.id(), retried.jobId());
	}

	@Test
	void jobsAreMetered() {
		var service = this.service();
		var first = service.submit(JobSubmission.of("metered", "ai"));
		service.submit(JobSubmission.of("metered", "ai"));
		this.clock.advance(Duration.ofSeconds(30));
		service.execute(first.jobId());
		this.fetcher = (topics, sources, maxResults) -> List.of();
		this.run(JobSubmission.of(null, "ai"));

		Assertions.assertEquals(2, this.registry.get(JobMetrics.SUBMITTED).tag("duplicate", "false").counter().count());
		Assertions.assertEquals(1, this.registry.get(JobMetrics.SUBMITTED).tag("duplicate", "true").counter().count());
		Assertions.assertEquals(1,
				this.registry.get(JobMetrics.FINISHED).tags("status", "completed", "code", "none").counter().count());
		Assertions.assertEquals(1, this.registry.get(JobMetrics.FINISHED)
			.tags("status", "failed", "code", JobError.NO_ARTICLES)
			.counter()
			.count());
		var duration = this.registry.get(JobMetrics.DURATION).tag("status", "completed").timer();
		Assertions.assertEquals(1, duration.count());
		Assertions.assertEquals(0, duration.totalTime(TimeUnit.SECONDS), "the stages ran on a frozen clock");
		for (var stage : List.of("fetching", "generating", "scoring", "refining"))
			Assertions.assertTrue(this.registry.get(JobMetrics.STAGE).tag("stage", stage).timer().count() >= 1,
					"the " + stage + " stage should be timed");
	}

	@Test
	void aRedeliveredJobFoundMidPipelineIsFailed() {
		var service = this.service();
		var submitted = service.submit(JobSubmission.of(null, "ai"));
		var job = this.storage.getJob(submitted.jobId()).orElseThrow();
		this.storage.updateJob(job.transitionTo(JobStatus.FETCHING, this.clock.instant()));
		service.execute(job.id());
		var lost = this.storage.getJob(job.id()).orElseThrow();
		Assertions.assertEquals(JobStatus.FAILED, lost.status());
		Assertions.assertEquals(JobError.WORKER_LOST, lost.error().code());
	}

	@Test
	void finishedJobsAreLeftAlone() {
		var job = this.run(JobSubmission.of(null, "ai"));
		var history = this.storage.getJobHistory(job.id());
		this.service().execute(job.id());
		Assertions.assertEquals(job, this.storage.getJob(job.id()).orElseThrow());
		Assertions.assertEquals(history, this.storage.getJobHistory(job.id()));
		Assertions.assertThrows(NotFoundException.class, () -> this.service().execute("nope"));
	}

	@Test
	void statusOfAnUnknownJob() {
		Assertions.assertThrows(NotFoundException.class, () -> this.service().getJobStatus("nope"));
	}

	@Test
	void statusWhileTheStorageIsDown() {
		var storage = Mockito.mock(Storage.class);
		when(storage.getJob(anyString()))
			.thenThrow(new BackendUnavailableException("the database is down", new RuntimeException()));
		var service = new DefaultJobService(storage, this.queue,
				new Pipeline(this.fetcher, this.generator, this.scorer, this.refiner), this.defaults,
				this.idGenerator, this.clock, new JobMetrics(this.registry));
		var status = service.getJobStatus("job-1");
		Assertions.assertEquals(JobStatusView.UNKNOWN, status.status());
		Assertions.assertEquals("job-1", status.jobId());
	}

}
