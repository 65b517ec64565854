package com.inker.api.feedback;

import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;

/**
 * editorial outcomes across every post, derived on demand.
 * @param approvalRate percent of posts approved, empty when there are none
 * @param averageRatings mean editor rating per category, for categories that were rated
 * @param commonRejectionCategories categories named on rejections and revision
 * requests, most frequent first
 * @param averageScoreApproved mean weighted score of approved posts
 * @param averageScoreRejected mean weighted score of rejected posts
 */
public record FeedbackStats(long totalFeedback, long approvals, long rejections, long revisions,
		OptionalDouble approvalRate, OptionalDouble averageTimeToDecisionHours,
		Map<FeedbackCategory, Double> averageRatings, List<FeedbackCategory> commonRejectionCategories,
		Map<String, TopicFeedback> byTopic, OptionalDouble averageScoreApproved,
		OptionalDouble averageScoreRejected) {

	public record TopicFeedback(long total, long approved, long rejected, long revisionRequested,
			OptionalDouble approvalRate) {
	}

}
