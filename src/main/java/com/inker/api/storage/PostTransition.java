package com.inker.api.storage;

import com.inker.api.ApprovalStatus;
import com.inker.api.BlogPost;
import com.inker.api.JobHistoryEntry;

/**
 * the outcome of an approval operation: the post as it now is, the status it had before
 * and the history entry that recorded the move.
 */
public record PostTransition(BlogPost post, ApprovalStatus previousStatus, JobHistoryEntry historyEntry) {
}
