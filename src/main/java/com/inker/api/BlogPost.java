package com.inker.api;

import org.jspecify.annotations.Nullable;
import org.springframework.util.Assert;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * the durable artifact a completed job produces. {@link #jobId()} is a back-reference,
 * not ownership: deleting the post leaves the job and its history alone.
 */
public record BlogPost(String id, String title, String content, int wordCount, String topic, List<String> sources,
		@Nullable String jobId, @Nullable Scoring scoring, Map<String, String> metadata,
		ApprovalStatus approvalStatus, @Nullable String approvalFeedback, Instant createdAt, Instant updatedAt,
		@Nullable Instant approvedAt, @Nullable Instant publishedAt) {

	public BlogPost {
		Assert.hasText(id, "the post id must not be empty");
		Assert.notNull(approvalStatus, "the approval status must not be null");
		Assert.state(publishedAt == null || approvalStatus == ApprovalStatus.APPROVED,
				() -> "post [" + id + "] can only be published once approved");
		sources = sources == null ? List.of() : List.copyOf(sources);
		metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
	}

	/**
	 * whitespace-separated tokens, which is what every backend stores as the word count.
	 */
	public static int countWords(String content) {
		if (content == null || content.isBlank())
			return 0;
		return content.trim().split("\\s+").length;
	}

}
