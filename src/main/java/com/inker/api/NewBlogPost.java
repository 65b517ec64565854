package com.inker.api;

import org.jspecify.annotations.Nullable;

import java.util.List;
import java.util.Map;

/**
 * what a caller supplies to create a {@link BlogPost}. Storage assigns the id, the
 * timestamps, the word count and the initial {@link ApprovalStatus#PENDING} status.
 */
public record NewBlogPost(String title, String content, String topic, List<String> sources, @Nullable String jobId,
		@Nullable Scoring scoring, Map<String, String> metadata) {

	public NewBlogPost {
		sources = sources == null ? List.of() : List.copyOf(sources);
		metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
	}

}
