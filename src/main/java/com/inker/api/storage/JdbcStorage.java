package com.inker.api.storage;

import com.inker.api.ApprovalStatus;
import com.inker.api.BackendUnavailableException;
import com.inker.api.BlogPost;
import com.inker.api.BlogPostUpdate;
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
import com.inker.api.Scoring;
import com.inker.api.StaleStateException;
import com.inker.api.ValidationException;
import com.inker.api.utils.DateUtils;
import com.inker.api.utils.JdbcUtils;
import com.inker.api.utils.JsonUtils;
import org.flywaydb.core.Flyway;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.transaction.support.TransactionTemplate;
import org.springframework.util.Assert;
import org.springframework.util.IdGenerator;

import javax.sql.DataSource;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * keeps jobs, posts and history in a relational database. The DDL lives in Flyway
 * migrations under {@value #MIGRATIONS}, tracked in their own history table so that
 * the queue tables can share the same database.
 */
class JdbcStorage implements Storage {

	static final String MIGRATIONS = "classpath:db/migration/storage";

	static final String SCHEMA_HISTORY_TABLE = "storage_schema_version";

	private static final int MAX_CLAIM_ATTEMPTS = 3;

	private final Logger log = LoggerFactory.getLogger(getClass());

	private final AtomicReference<String> schemaVersion = new AtomicReference<>();

	private final RowMapper<BlogPost> postRowMapper = (rs, rowNum) -> new BlogPost(rs.getString("id"),
			rs.getString("title"), rs.getString("content"), rs.getInt("word_count"), rs.getString("topic"),
			JdbcUtils.stringList(rs, "sources"), rs.getString("job_id"), json(rs.getString("scoring"), Scoring.class),
			JdbcUtils.stringMap(rs, "metadata"), ApprovalStatus.of(rs.getString("approval_status")),
			rs.getString("approval_feedback"), JdbcUtils.instant(rs, "created_at"),
			JdbcUtils.instant(rs, "updated_at"), JdbcUtils.instant(rs, "approved_at"),
			JdbcUtils.instant(rs, "published_at"));

	private final RowMapper<Job> jobRowMapper = (rs, rowNum) -> new Job(rs.getString("id"),
			rs.getString("correlation_id"), JobStatus.of(rs.getString("status")), JdbcUtils.stringList(rs, "topics"),
			JdbcUtils.stringList(rs, "sources"), rs.getInt("num_candidates"), rs.getInt("max_results"),
			JdbcUtils.instant(rs, "created_at"), JdbcUtils.instant(rs, "updated_at"),
			JdbcUtils.instant(rs, "started_at"), JdbcUtils.instant(rs, "completed_at"),
			json(rs.getString("result"), JobResult.class), json(rs.getString("error"), JobError.class),
			rs.getLong("version"));

	private final RowMapper<JobHistoryEntry> historyRowMapper = (rs, rowNum) -> new JobHistoryEntry(
			rs.getString("id"), rs.getString("job_id"), rs.getString("post_id"),
			HistoryAction.of(rs.getString("action")), rs.getString("previous_status"), rs.getString("new_status"),
			rs.getString("actor"), rs.getString("feedback"), JdbcUtils.stringMap(rs, "metadata"),
			JdbcUtils.instant(rs, "created_at"));

	private final DataSource dataSource;

	private final JdbcClient db;

	private final TransactionTemplate tx;

	private final IdGenerator idGenerator;

	private final Clock clock;

	JdbcStorage(DataSource dataSource, JdbcClient db, TransactionTemplate tx, IdGenerator idGenerator, Clock clock) {
		this.dataSource = dataSource;
		this.db = db;
		this.tx = tx;
		this.idGenerator = idGenerator;
		this.clock = clock;
	}

	@Override
	public synchronized void initialize() {
		if (this.schemaVersion.get() != null)
			return;
		var flyway = Flyway.configure() //
			.dataSource(this.dataSource) //
			.locations(MIGRATIONS) //
			.table(SCHEMA_HISTORY_TABLE) //
			.baselineOnMigrate(true) //
			.baselineVersion("0") //
			.load();
		var result = flyway.migrate();
		var current = flyway.info().current();
		this.schemaVersion.set(current == null ? "0" : current.getVersion().getVersion());
		this.log.info("applied {} storage migration(s), the schema is at version {}", result.migrationsExecuted,
				this.schemaVersion.get());
	}

	@Override
	public String schemaVersion() {
		var version = this.schemaVersion.get();
		Assert.state(version != null, "the storage hasn't been initialized");
		return version;
	}

	@Override
	public boolean healthCheck() {
		try {
			return this.db.sql("select 1").query(Integer.class).single() == 1;
		} //
		catch (DataAccessException e) {
			this.log.warn("the storage database is unreachable", e);
			return false;
		}
	}

	// posts

	@Override
	public BlogPost createPost(NewBlogPost newPost) {
		var post = PostTransitions.newPost(this.nextId(), newPost, this.now());
		return this.call("create a post", () -> {
			try {
				this.db.sql("""
						insert into blog_post (id, title, content, word_count, topic, sources, job_id, scoring, metadata,
						 approval_status, approval_feedback, created_at, updated_at, approved_at, published_at)
						values (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
						""")
					.params(post.id(), post.title(), post.content(), post.wordCount(), post.topic(),
							JsonUtils.write(post.sources()), post.jobId(),
							post.scoring() == null ? null : JsonUtils.write(post.scoring()),
							JsonUtils.write(post.metadata()), post.approvalStatus().value(), post.approvalFeedback(),
							DateUtils.forInstant(post.createdAt()), DateUtils.forInstant(post.updatedAt()), null, null)
					.update();
			} //
			catch (DuplicateKeyException e) {
				throw new ValidationException("job [" + post.jobId() + "] already has a post");
			}
			return post;
		});
	}

	@Override
	public Optional<BlogPost> getPost(String id) {
		return this.call("read a post", () -> this.db //
			.sql("select * from blog_post where id = ?") //
			.params(id) //
			.query(this.postRowMapper) //
			.optional());
	}

	@Override
	public Optional<BlogPost> getPostByJobId(String jobId) {
		return this.call("read a post", () -> this.db //
			.sql("select * from blog_post where job_id = ?") //
			.params(jobId) //
			.query(this.postRowMapper) //
			.optional());
	}

	@Override
	public Optional<BlogPost> updatePost(String id, BlogPostUpdate update) {
		Assert.notNull(update, "the update must not be null");
		return this.call("update a post", () -> this.tx.execute(status -> {
			var found = this.lockPost(id);
			if (found.isEmpty())
				return Optional.<BlogPost>empty();
			var post = found.get();
			var merged = PostTransitions.merge(post, update, this.now());
			this.db.sql("""
					update blog_post set title = ?, content = ?, word_count = ?, topic = ?, sources = ?,
					 metadata = ?, approval_status = ?, updated_at = ?
					where id = ?
					""")
				.params(merged.title(), merged.content(), merged.wordCount(), merged.topic(),
						JsonUtils.write(merged.sources()), JsonUtils.write(merged.metadata()),
						merged.approvalStatus().value(), DateUtils.forInstant(merged.updatedAt()), id)
				.update();
			var resubmission = PostTransitions.resubmission(post, merged);
			if (resubmission != null)
				this.insertHistory(resubmission);
			return Optional.of(merged);
		}));
	}

	@Override
	public boolean deletePost(String id) {
		return this.call("delete a post", () -> this.db //
			.sql("delete from blog_post where id = ?") //
			.params(id) //
			.update() > 0);
	}

	@Override
	public List<BlogPost> listPosts(@Nullable ApprovalStatus status, @Nullable String topic, int limit, int offset) {
		PostTransitions.checkPage(limit, offset);
		if (limit == 0)
			return List.of();
		var where = new ArrayList<String>();
		var params = new ArrayList<Object>();
		if (status != null) {
			where.add("approval_status = ?");
			params.add(status.value());
		}
		if (topic != null) {
			where.add("topic = ?");
			params.add(topic);
		}
		params.add(PostTransitions.pageSize(limit));
		params.add(offset);
		var sql = "select * from blog_post " + whereClause(where) + " order by created_at desc, id limit ? offset ?";
		return this.call("list posts", () -> this.db.sql(sql).params(params).query(this.postRowMapper).list());
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

	/*
	 * concurrent callers serialise on the row lock and re-check the committed state
	 */
	private Optional<PostTransition> transition(String id, HistoryAction action, @Nullable String actor,
			@Nullable String feedback, Map<String, String> metadata) {
		return this.call("change the approval status of a post", () -> this.tx.execute(status -> {
			var found = this.lockPost(id);
			if (found.isEmpty())
				return Optional.<PostTransition>empty();
			var post = found.get();
			var next = PostTransitions.apply(post, action, feedback, this.now());
			var updated = this.db.sql("""
					update blog_post set approval_status = ?, approval_feedback = ?, approved_at = ?,
					 published_at = ?, updated_at = ?
					where id = ? and approval_status = ?
					""")
				.params(next.approvalStatus().value(), next.approvalFeedback(),
						DateUtils.forInstant(next.approvedAt()), DateUtils.forInstant(next.publishedAt()),
						DateUtils.forInstant(next.updatedAt()), id, post.approvalStatus().value())
				.update();
			if (updated != 1)
				throw new StaleStateException("post", id);
			var entry = this
				.insertHistory(PostTransitions.historyFor(post, next, action, actor, feedback, metadata));
			return Optional.of(new PostTransition(next, post.approvalStatus(), entry));
		}));
	}

	private Optional<BlogPost> lockPost(String id) {
		return this.db //
			.sql("select * from blog_post where id = ? for update") //
			.params(id) //
			.query(this.postRowMapper) //
			.optional();
	}

	// jobs

	@Override
	public Job createJob(Job job) {
		Assert.notNull(job, "the job must not be null");
		for (var attempt = 1;; attempt++) {
			try {
				return this.call("create a job", () -> this.tx.execute(status -> this.insertJob(job)));
			} //
			catch (DuplicateKeyException e) {
				// somebody claimed the correlation id between our read and our insert
				if (attempt >= MAX_CLAIM_ATTEMPTS)
					throw e;
				this.log.debug("lost the race for correlation id [{}], retrying", job.correlationId());
			}
		}
	}

	private Job insertJob(Job job) {
		this.db.sql("""
				insert into job (id, correlation_id, status, topics, sources, num_candidates, max_results,
				 created_at, updated_at, started_at, completed_at, result, error, version)
				values (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
				""")
			.params(job.id(), job.correlationId(), job.status().value(), JsonUtils.write(job.topics()),
					JsonUtils.write(job.sources()), job.numCandidates(), job.maxResults(),
					DateUtils.forInstant(job.createdAt()), DateUtils.forInstant(job.updatedAt()),
					DateUtils.forInstant(job.startedAt()), DateUtils.forInstant(job.completedAt()),
					job.result() == null ? null : JsonUtils.write(job.result()),
					job.error() == null ? null : JsonUtils.write(job.error()), job.version())
			.update();
		if (job.correlationId() == null)
			return job;
		var holderId = this.db //
			.sql("select job_id from job_correlation where correlation_id = ? for update") //
			.params(job.correlationId()) //
			.query(String.class) //
			.optional();
		if (holderId.isEmpty()) {
			this.db.sql("insert into job_correlation (correlation_id, job_id) values (?, ?)")
				.params(job.correlationId(), job.id())
				.update();
			return job;
		}
		var holderStatus = this.db //
			.sql("select status from job where id = ?") //
			.params(holderId.get()) //
			.query((rs, rowNum) -> JobStatus.of(rs.getString("status"))) //
			.single();
		if (holderStatus != JobStatus.FAILED)
			throw new DuplicateJobException(job.correlationId(), holderId.get());
		this.db.sql("update job_correlation set job_id = ? where correlation_id = ? and job_id = ?")
			.params(job.id(), job.correlationId(), holderId.get())
			.update();
		return job;
	}

	@Override
	public Optional<Job> getJob(String id) {
		return this.call("read a job", () -> this.db //
			.sql("select * from job where id = ?") //
			.params(id) //
			.query(this.jobRowMapper) //
			.optional());
	}

	@Override
	public Optional<Job> getJobByCorrelationId(String correlationId) {
		return this.call("read a job", () -> this.db //
			.sql("select j.* from job j join job_correlation c on c.job_id = j.id where c.correlation_id = ?") //
			.params(correlationId) //
			.query(this.jobRowMapper) //
			.optional());
	}

	@Override
	public Job updateJob(Job job) {
		Assert.notNull(job, "the job must not be null");
		var updated = this.call("update a job", () -> this.db.sql("""
				update job set status = ?, updated_at = ?, started_at = ?, completed_at = ?, result = ?, error = ?,
				 version = ?
				where id = ? and version = ?
				""")
			.params(job.status().value(), DateUtils.forInstant(job.updatedAt()),
					DateUtils.forInstant(job.startedAt()), DateUtils.forInstant(job.completedAt()),
					job.result() == null ? null : JsonUtils.write(job.result()),
					job.error() == null ? null : JsonUtils.write(job.error()), job.version(), job.id(),
					job.version() - 1)
			.update());
		if (updated == 0) {
			if (this.getJob(job.id()).isEmpty())
				throw new NotFoundException("job", job.id());
			throw new StaleStateException("job", job.id());
		}
		return job;
	}

	@Override
	public List<Job> listJobs(@Nullable JobStatus status, int limit, int offset) {
		PostTransitions.checkPage(limit, offset);
		if (limit == 0)
			return List.of();
		var where = new ArrayList<String>();
		var params = new ArrayList<Object>();
		if (status != null) {
			where.add("status = ?");
			params.add(status.value());
		}
		params.add(PostTransitions.pageSize(limit));
		params.add(offset);
		var sql = "select * from job " + whereClause(where) + " order by created_at desc, id limit ? offset ?";
		return this.call("list jobs", () -> this.db.sql(sql).params(params).query(this.jobRowMapper).list());
	}

	// history

	@Override
	public JobHistoryEntry addHistoryEntry(NewHistoryEntry entry) {
		return this.call("append to the history", () -> this.insertHistory(entry));
	}

	private JobHistoryEntry insertHistory(NewHistoryEntry entry) {
		var saved = new JobHistoryEntry(this.nextId(), entry.jobId(), entry.postId(), entry.action(),
				entry.previousStatus(), entry.newStatus(), entry.actor(), entry.feedback(), entry.metadata(),
				this.now());
		this.db.sql("""
				insert into job_history (id, job_id, post_id, action, previous_status, new_status, actor, feedback,
				 metadata, created_at)
				values (?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
				""")
			.params(saved.id(), saved.jobId(), saved.postId(), saved.action().value(), saved.previousStatus(),
					saved.newStatus(), saved.actor(), saved.feedback(), JsonUtils.write(saved.metadata()),
					DateUtils.forInstant(saved.createdAt()))
			.update();
		return saved;
	}

	@Override
	public List<JobHistoryEntry> getJobHistory(String jobId) {
		return this.call("read the history", () -> this.db //
			.sql("select * from job_history where job_id = ? order by seq") //
			.params(jobId) //
			.query(this.historyRowMapper) //
			.list());
	}

	@Override
	public List<JobHistoryEntry> getPostHistory(String postId) {
		return this.call("read the history", () -> this.db //
			.sql("select * from job_history where post_id = ? order by seq") //
			.params(postId) //
			.query(this.historyRowMapper) //
			.list());
	}

	@Override
	public JobStats getStats() {
		return this.call("compute statistics", () -> {
			var jobs = this.countBy("select status as k, count(*) as c from job group by status");
			var posts = this.countBy(
					"select approval_status as k, count(*) as c from blog_post group by approval_status");
			var published = this.db.sql("select count(*) from blog_post where published_at is not null")
				.query(Long.class)
				.single();
			var approvalHours = this.db
				.sql("select created_at, approved_at from blog_post where approved_at is not null")
				.query((rs, rowNum) -> DateUtils.hoursBetween(JdbcUtils.instant(rs, "created_at"),
						JdbcUtils.instant(rs, "approved_at")))
				.list()
				.stream()
				.mapToDouble(Double::doubleValue)
				.average();
			var totalJobs = jobs.values().stream().mapToLong(Long::longValue).sum();
			var completed = jobs.getOrDefault(JobStatus.COMPLETED.value(), 0L);
			var failed = jobs.getOrDefault(JobStatus.FAILED.value(), 0L);
			var totalPosts = posts.values().stream().mapToLong(Long::longValue).sum();
			var approved = posts.getOrDefault(ApprovalStatus.APPROVED.value(), 0L);
			return new JobStats(totalJobs, totalJobs - completed - failed, completed, failed, totalPosts,
					posts.getOrDefault(ApprovalStatus.PENDING.value(), 0L), approved,
					posts.getOrDefault(ApprovalStatus.REJECTED.value(), 0L),
					posts.getOrDefault(ApprovalStatus.REVISION_REQUESTED.value(), 0L), published,
					JobStats.percentage(approved, totalPosts), approvalHours);
		});
	}

	private Map<String, Long> countBy(String sql) {
		var counts = new HashMap<String, Long>();
		this.db.sql(sql).query(rs -> {
			counts.put(rs.getString("k"), rs.getLong("c"));
		});
		return counts;
	}

	private <T> T call(String what, Supplier<T> supplier) {
		try {
			return supplier.get();
		} //
		catch (DataAccessException e) {
			if (JdbcUtils.isRetryable(e))
				throw new BackendUnavailableException("couldn't " + what + ": the storage database is unavailable", e);
			throw e;
		}
	}

	private static String whereClause(List<String> predicates) {
		return predicates.isEmpty() ? "" : "where " + String.join(" and ", predicates);
	}

	private static <T> @Nullable T json(@Nullable String json, Class<T> type) {
		return json == null ? null : JsonUtils.read(json, type);
	}

	private String nextId() {
		return this.idGenerator.generateId().toString();
	}

	private Instant now() {
		return DateUtils.now(this.clock);
	}

}
