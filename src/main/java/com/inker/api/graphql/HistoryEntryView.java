package com.inker.api.graphql;

import com.inker.api.HistoryAction;
import com.inker.api.JobHistoryEntry;
import com.inker.api.utils.DateUtils;

import java.time.OffsetDateTime;
import java.util.Map;

public record HistoryEntryView(String id, String jobId, String postId, HistoryAction action, String previousStatus,
		String newStatus, String actor, String feedback, Map<String, String> metadata, OffsetDateTime createdAt) {

	public static HistoryEntryView of(JobHistoryEntry entry) {
		return new HistoryEntryView(entry.id(), entry.jobId(), entry.postId(), entry.action(),
				entry.previousStatus(), entry.newStatus(), entry.actor(), entry.feedback(), entry.metadata(),
				DateUtils.forInstant(entry.createdAt()));
	}

}
