package com.inker.api.feedback;

import com.inker.api.ApprovalStatus;
import com.inker.api.BlogPost;
import com.inker.api.JobHistoryEntry;
import org.jspecify.annotations.Nullable;

import java.util.List;
import java.util.Optional;

/**
 * the editorial workflow: editors approve, reject or send back generated posts, and
 * approved posts get published. Each decision is written to the audit history along
 * with any categories and ratings the editor supplied.
 *
 * <p>
 * Every decision operation throws {@link com.inker.api.NotFoundException} for an unknown
 * post and {@link com.inker.api.InvalidTransitionException} when the post's current
 * status doesn't allow the move.
 * </p>
 */
public interface FeedbackService {

	FeedbackResponse approvePost(ApprovalRequest request);

	/**
	 * @throws com.inker.api.ValidationException if the feedback is blank
	 */
	FeedbackResponse rejectPost(RejectionRequest request);

	/**
	 * @throws com.inker.api.ValidationException if the feedback is blank
	 */
	FeedbackResponse requestRevision(RevisionRequest request);

	FeedbackResponse publishPost(String postId, @Nullable String actor);

	Optional<BlogPost> getPost(String postId);

	List<BlogPost> listPosts(@Nullable ApprovalStatus status, @Nullable String topic, int limit, int offset);

	List<JobHistoryEntry> getPostHistory(String postId);

	List<FeedbackEntry> getPostFeedback(String postId);

	FeedbackStats getFeedbackStats();

	/**
	 * @return approved and rejected posts, newest first
	 */
	List<LearningExample> getLearningData(int limit);

}
