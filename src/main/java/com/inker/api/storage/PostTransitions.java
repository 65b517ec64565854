package com.inker.api.storage;

import com.inker.api.ApprovalStatus;
import com.inker.api.BlogPost;
import com.inker.api.BlogPostUpdate;
import com.inker.api.HistoryAction;
import com.inker.api.InvalidTransitionException;
import com.inker.api.NewBlogPost;
import com.inker.api.NewHistoryEntry;
import com.inker.api.ValidationException;
import org.jspecify.annotations.Nullable;

import java.time.Instant;
import java.util.Map;

/**
 * the post rules every backend shares: validation on create, the merge on update and
 * the approval state machine. Backends only decide how to make each step atomic.
 */
abstract class PostTransitions {

	static final String PUBLISHED = "published";

	static BlogPost newPost(String id, NewBlogPost post, Instant now) {
		if (post == null)
			throw new ValidationException("a post is required");
		requireText(post.title(), "title");
		requireText(post.content(), "content");
		requireText(post.topic(), "topic");
		return new BlogPost(id, post.title(), post.content(), BlogPost.countWords(post.content()), post.topic(),
				post.sources(), post.jobId(), post.scoring(), post.metadata(), ApprovalStatus.PENDING, null, now, now,
				null, null);
	}

	static BlogPost merge(BlogPost post, BlogPostUpdate update, Instant now) {
		if (update.title() != null)
			requireText(update.title(), "title");
		if (update.content() != null)
			requireText(update.content(), "content");
		if (update.topic() != null)
			requireText(update.topic(), "topic");
		var content = update.content() != null ? update.content() : post.content();
		var status = update.changesContent() && post.approvalStatus() == ApprovalStatus.REVISION_REQUESTED
				? ApprovalStatus.PENDING : post.approvalStatus();
		return new BlogPost(post.id(), update.title() != null ? update.title() : post.title(), content,
				BlogPost.countWords(content), update.topic() != null ? update.topic() : post.topic(),
				update.sources() != null ? update.sources() : post.sources(), post.jobId(), post.scoring(),
				update.metadata() != null ? update.metadata() : post.metadata(), status, post.approvalFeedback(),
				post.createdAt(), now, post.approvedAt(), post.publishedAt());
	}

	/**
	 * @return the entry to append when an update sends a revised post back for review, or
	 * {@code null} if the update didn't change its status
	 */
	static @Nullable NewHistoryEntry resubmission(BlogPost before, BlogPost after) {
		if (before.approvalStatus() == after.approvalStatus())
			return null;
		return new NewHistoryEntry(historyJobId(after), after.id(), HistoryAction.SUBMITTED,
				before.approvalStatus().value(), after.approvalStatus().value(), null, null,
				Map.of("reason", "content revised"));
	}

	/**
	 * applies an approval action to the post, or throws if the post's current state
	 * doesn't allow it.
	 */
	static BlogPost apply(BlogPost post, HistoryAction action, @Nullable String feedback, Instant now) {
		var current = post.approvalStatus();
		return switch (action) {
			case APPROVED -> {
				check(post, ApprovalStatus.APPROVED);
				yield with(post, ApprovalStatus.APPROVED, feedback, now, now, null);
			}
			case REJECTED -> {
				requireText(feedback, "feedback");
				check(post, ApprovalStatus.REJECTED);
				yield with(post, ApprovalStatus.REJECTED, feedback, now, post.approvedAt(), null);
			}
			case REVISION_REQUESTED -> {
				requireText(feedback, "feedback");
				check(post, ApprovalStatus.REVISION_REQUESTED);
				yield with(post, ApprovalStatus.REVISION_REQUESTED, feedback, now, post.approvedAt(), null);
			}
			case PUBLISHED -> {
				if (current != ApprovalStatus.APPROVED || post.publishedAt() != null)
					throw new InvalidTransitionException(
							"post [%s] is %s and cannot be published".formatted(post.id(),
									post.publishedAt() != null ? PUBLISHED : current.value()),
							post.publishedAt() != null ? PUBLISHED : current.value(), PUBLISHED);
				yield with(post, ApprovalStatus.APPROVED, post.approvalFeedback(), now, post.approvedAt(), now);
			}
			default -> throw new IllegalArgumentException("[" + action + "] is not an approval action");
		};
	}

	static NewHistoryEntry historyFor(BlogPost before, BlogPost after, HistoryAction action, @Nullable String actor,
			@Nullable String feedback, Map<String, String> metadata) {
		var next = action == HistoryAction.PUBLISHED ? PUBLISHED : after.approvalStatus().value();
		return new NewHistoryEntry(historyJobId(after), after.id(), action, before.approvalStatus().value(), next,
				actor, feedback, metadata);
	}

	/**
	 * posts created outside a job record their history under their own id.
	 */
	static String historyJobId(BlogPost post) {
		return post.jobId() != null ? post.jobId() : post.id();
	}

	static void checkPage(int limit, int offset) {
		if (limit < 0)
			throw new ValidationException("limit must not be negative, but was " + limit);
		if (offset < 0)
			throw new ValidationException("offset must not be negative, but was " + offset);
	}

	static int pageSize(int limit) {
		return Math.min(limit, Storage.MAX_PAGE_SIZE);
	}

	private static void check(BlogPost post, ApprovalStatus next) {
		if (!post.approvalStatus().canTransitionTo(next))
			throw new InvalidTransitionException("post", post.id(), post.approvalStatus(), next);
	}

	private static BlogPost with(BlogPost post, ApprovalStatus status, @Nullable String feedback, Instant now,
			@Nullable Instant approvedAt, @Nullable Instant publishedAt) {
		return new BlogPost(post.id(), post.title(), post.content(), post.wordCount(), post.topic(), post.sources(),
				post.jobId(), post.scoring(), post.metadata(), status, feedback, post.createdAt(), now, approvedAt,
				publishedAt);
	}

	private static void requireText(@Nullable String value, String field) {
		if (value == null || value.isBlank())
			throw new ValidationException(field + " must not be blank");
	}

}
