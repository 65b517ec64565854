package com.inker.api.feedback;

import com.inker.api.ApprovalStatus;
import com.inker.api.Scoring;
import org.jspecify.annotations.Nullable;

/**
 * a decided post paired with its outcome, for tuning generation against what editors
 * accept.
 */
public record LearningExample(String postId, String title, String topic, ApprovalStatus outcome,
		@Nullable String feedback, int wordCount, @Nullable Scoring scoring, @Nullable Double weightedScore) {
}
