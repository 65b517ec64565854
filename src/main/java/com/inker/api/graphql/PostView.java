package com.inker.api.graphql;

import com.inker.api.ApprovalStatus;
import com.inker.api.BlogPost;
import com.inker.api.Scoring;
import com.inker.api.utils.DateUtils;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;

public record PostView(String id, String title, String content, int wordCount, String topic, List<String> sources,
		String jobId, Scoring scoring, Map<String, String> metadata, ApprovalStatus approvalStatus,
		String approvalFeedback, boolean published, OffsetDateTime createdAt, OffsetDateTime updatedAt,
		OffsetDateTime approvedAt, OffsetDateTime publishedAt) {

	public static PostView of(BlogPost post) {
		return new PostView(post.id(), post.title(), post.content(), post.wordCount(), post.topic(), post.sources(),
				post.jobId(), post.scoring(), post.metadata(), post.approvalStatus(), post.approvalFeedback(),
				post.publishedAt() != null, DateUtils.forInstant(post.createdAt()),
				DateUtils.forInstant(post.updatedAt()), DateUtils.forInstant(post.approvedAt()),
				DateUtils.forInstant(post.publishedAt()));
	}

}
