package com.inker.api;

import org.jspecify.annotations.Nullable;

import java.time.Instant;
import java.util.Map;

/**
 * one immutable line in the audit log. Entries are appended, never updated or removed.
 */
public record JobHistoryEntry(String id, String jobId, @Nullable String postId, HistoryAction action,
		@Nullable String previousStatus, @Nullable String newStatus, @Nullable String actor,
		@Nullable String feedback, Map<String, String> metadata, Instant createdAt) {

	public JobHistoryEntry {
		metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
	}

}
