package com.inker.api.storage;

import com.inker.api.ApprovalStatus;
import com.inker.api.BlogPost;
import com.inker.api.BlogPostUpdate;
import com.inker.api.InvalidTransitionException;
import com.inker.api.Job;
import com.inker.api.JobHistoryEntry;
import com.inker.api.JobStats;
import com.inker.api.JobStatus;
import com.inker.api.NewBlogPost;
import com.inker.api.NewHistoryEntry;
import org.jspecify.annotations.Nullable;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * durable home of jobs, posts and the audit history.
 *
 * <p>
 * Lookups never throw for a miss: they return an empty {@link Optional}. Every approval
 * operation checks the post's current state, writes the new state and appends exactly
 * one {@link JobHistoryEntry} as a single unit. An illegal move raises
 * {@link InvalidTransitionException} and writes nothing. Conflicting writes to the same
 * post or job are serialised, so of two racing approvals exactly one wins.
 * </p>
 */
public interface Storage {

	/**
	 * the most rows any list operation returns, whatever the caller asks for.
	 */
	int MAX_PAGE_SIZE = 1000;

	/**
	 * prepares the backend (schema migrations, directories, snapshots). Safe to call more
	 * than once.
	 */
	void initialize();

	String schemaVersion();

	/**
	 * @return {@code false} if the backend can't be reached. Never throws.
	 */
	boolean healthCheck();

	// posts

	BlogPost createPost(NewBlogPost post);

	Optional<BlogPost> getPost(String id);

	Optional<BlogPost> getPostByJobId(String jobId);

	/**
	 * merges the non-null fields of the update into the post. Revising the content of a
	 * post whose revision was requested puts it back in the {@link ApprovalStatus#PENDING
	 * pending} queue and records that in the history.
	 */
	Optional<BlogPost> updatePost(String id, BlogPostUpdate update);

	boolean deletePost(String id);

	List<BlogPost> listPosts(@Nullable ApprovalStatus status, @Nullable String topic, int limit, int offset);

	Optional<PostTransition> approvePost(String id, @Nullable String actor, @Nullable String feedback,
			Map<String, String> metadata);

	Optional<PostTransition> rejectPost(String id, @Nullable String actor, String feedback,
			Map<String, String> metadata);

	Optional<PostTransition> requestRevision(String id, @Nullable String actor, String feedback,
			Map<String, String> metadata);

	Optional<PostTransition> publishPost(String id, @Nullable String actor, Map<String, String> metadata);

	default Optional<PostTransition> approvePost(String id, @Nullable String actor, @Nullable String feedback) {
		return this.approvePost(id, actor, feedback, Map.of());
	}

	default Optional<PostTransition> rejectPost(String id, @Nullable String actor, String feedback) {
		return this.rejectPost(id, actor, feedback, Map.of());
	}

	default Optional<PostTransition> requestRevision(String id, @Nullable String actor, String feedback) {
		return this.requestRevision(id, actor, feedback, Map.of());
	}

	default Optional<PostTransition> publishPost(String id, @Nullable String actor) {
		return this.publishPost(id, actor, Map.of());
	}

	// jobs

	/**
	 * stores a new job and, if it has one, claims its correlation id.
	 * @throws com.inker.api.DuplicateJobException if a job that hasn't failed already
	 * holds the correlation id
	 */
	Job createJob(Job job);

	Optional<Job> getJob(String id);

	/**
	 * @return the job currently holding the correlation id, failed or not
	 */
	Optional<Job> getJobByCorrelationId(String correlationId);

	/**
	 * replaces the stored job with {@code job}, provided the stored copy is the version
	 * immediately before it.
	 * @throws com.inker.api.StaleStateException if another writer got there first
	 * @throws com.inker.api.NotFoundException if there is no such job
	 */
	Job updateJob(Job job);

	List<Job> listJobs(@Nullable JobStatus status, int limit, int offset);

	// history

	JobHistoryEntry addHistoryEntry(NewHistoryEntry entry);

	List<JobHistoryEntry> getJobHistory(String jobId);

	List<JobHistoryEntry> getPostHistory(String postId);

	JobStats getStats();

}
