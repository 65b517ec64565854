package com.inker.api.feedback;

import com.inker.api.ApprovalStatus;

/**
 * @param newStatus the post's approval status after the change, or {@code published}
 * @param historyEntryId the audit entry that recorded the change
 */
public record FeedbackResponse(String postId, ApprovalStatus previousStatus, String newStatus,
		String historyEntryId) {
}
