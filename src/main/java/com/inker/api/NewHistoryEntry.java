package com.inker.api;

import org.jspecify.annotations.Nullable;
import org.springframework.util.Assert;

import java.util.Map;

public record NewHistoryEntry(String jobId, @Nullable String postId, HistoryAction action,
		@Nullable String previousStatus, @Nullable String newStatus, @Nullable String actor,
		@Nullable String feedback, Map<String, String> metadata) {

	public NewHistoryEntry {
		Assert.hasText(jobId, "a history entry must reference a job");
		Assert.notNull(action, "a history entry needs an action");
		metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
	}

	public static NewHistoryEntry forJob(String jobId, HistoryAction action, @Nullable JobStatus previous,
			@Nullable JobStatus next, Map<String, String> metadata) {
		return new NewHistoryEntry(jobId, null, action, previous == null ? null : previous.value(),
				next == null ? null : next.value(), "system", null, metadata);
	}

}
