package com.inker.api.feedback;

import com.inker.api.HistoryAction;
import com.inker.api.Scoring;
import org.jspecify.annotations.Nullable;

import java.time.Instant;
import java.util.List;

/**
 * one editorial decision on a post, rebuilt from the audit history together with the
 * post attributes worth learning from.
 */
public record FeedbackEntry(String id, String postId, @Nullable String jobId, HistoryAction action,
		@Nullable String feedback, List<FeedbackCategory> categories, List<FeedbackRating> ratings,
		@Nullable String actor, @Nullable Scoring postScoring, @Nullable String postTopic,
		@Nullable Integer postWordCount, Instant createdAt) {
}
