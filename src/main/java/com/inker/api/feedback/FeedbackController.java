package com.inker.api.feedback;

import com.inker.api.ApprovalStatus;
import com.inker.api.HistoryAction;
import com.inker.api.graphql.GraphqlViews;
import com.inker.api.graphql.HistoryEntryView;
import com.inker.api.graphql.PostView;
import com.inker.api.utils.DateUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.graphql.data.method.annotation.Argument;
import org.springframework.graphql.data.method.annotation.MutationMapping;
import org.springframework.graphql.data.method.annotation.QueryMapping;
import org.springframework.stereotype.Controller;

import java.time.OffsetDateTime;
import java.util.Collection;
import java.util.List;

@Controller
class FeedbackController {

	private final Logger log = LoggerFactory.getLogger(getClass());

	private final FeedbackService feedbackService;

	FeedbackController(FeedbackService feedbackService) {
		this.feedbackService = feedbackService;
	}

	@MutationMapping
	FeedbackResponse approvePost(@Argument ApprovalRequest request) {
		return this.feedbackService.approvePost(request);
	}

	@MutationMapping
	FeedbackResponse rejectPost(@Argument RejectionRequest request) {
		return this.feedbackService.rejectPost(request);
	}

	@MutationMapping
	FeedbackResponse requestRevision(@Argument RevisionRequest request) {
		return this.feedbackService.requestRevision(request);
	}

	@MutationMapping
	FeedbackResponse publishPost(@Argument String postId, @Argument String actor) {
		return this.feedbackService.publishPost(postId, actor);
	}

	@QueryMapping
	PostView post(@Argument String id) {
		return this.feedbackService.getPost(id).map(PostView::of).orElse(null);
	}

	@QueryMapping
	Collection<PostView> posts(@Argument ApprovalStatus status, @Argument String topic, @Argument int limit,
			@Argument int offset) {
		return this.feedbackService.listPosts(status, topic, limit, offset).stream().map(PostView::of).toList();
	}

	@QueryMapping
	Collection<HistoryEntryView> postHistory(@Argument String postId) {
		return this.feedbackService.getPostHistory(postId).stream().map(HistoryEntryView::of).toList();
	}

	@QueryMapping
	Collection<ClientFeedbackEntry> postFeedback(@Argument String postId) {
		return this.feedbackService.getPostFeedback(postId).stream().map(ClientFeedbackEntry::of).toList();
	}

	@QueryMapping
	ClientFeedbackStats feedbackStats() {
		var stats = this.feedbackService.getFeedbackStats();
		this.log.debug("feedbackStats: {}", stats);
		return ClientFeedbackStats.of(stats);
	}

	@QueryMapping
	Collection<LearningExample> learningData(@Argument int limit) {
		return this.feedbackService.getLearningData(limit);
	}

	record ClientFeedbackEntry(String id, String postId, String jobId, HistoryAction action, String feedback,
			List<FeedbackCategory> categories, List<FeedbackRating> ratings, String actor, String postTopic,
			Integer postWordCount, Double postScore, OffsetDateTime createdAt) {

		static ClientFeedbackEntry of(FeedbackEntry entry) {
			return new ClientFeedbackEntry(entry.id(), entry.postId(), entry.jobId(), entry.action(),
					entry.feedback(), entry.categories(), entry.ratings(), entry.actor(), entry.postTopic(),
					entry.postWordCount(), entry.postScoring() == null ? null : entry.postScoring().total(),
					DateUtils.forInstant(entry.createdAt()));
		}

	}

	record ClientTopicFeedback(String topic, long total, long approved, long rejected, long revisionRequested,
			Double approvalRate) {
	}

	record ClientCategoryAverage(FeedbackCategory category, double average) {
	}

	record ClientFeedbackStats(long totalFeedback, long approvals, long rejections, long revisions,
			Double approvalRate, Double averageTimeToDecisionHours, List<ClientCategoryAverage> averageRatings,
			List<FeedbackCategory> commonRejectionCategories, List<ClientTopicFeedback> byTopic,
			Double averageScoreApproved, Double averageScoreRejected) {

		static ClientFeedbackStats of(FeedbackStats stats) {
			var ratings = stats.averageRatings()
				.entrySet()
				.stream()
				.map(e -> new ClientCategoryAverage(e.getKey(), e.getValue()))
				.toList();
			var topics = stats.byTopic()
				.entrySet()
				.stream()
				.map(e -> new ClientTopicFeedback(e.getKey(), e.getValue().total(), e.getValue().approved(),
						e.getValue().rejected(), e.getValue().revisionRequested(),
						GraphqlViews.nullable(e.getValue().approvalRate())))
				.toList();
			return new ClientFeedbackStats(stats.totalFeedback(), stats.approvals(), stats.rejections(),
					stats.revisions(), GraphqlViews.nullable(stats.approvalRate()),
					GraphqlViews.nullable(stats.averageTimeToDecisionHours()), ratings,
					stats.commonRejectionCategories(), topics, GraphqlViews.nullable(stats.averageScoreApproved()),
					GraphqlViews.nullable(stats.averageScoreRejected()));
		}

	}

}
