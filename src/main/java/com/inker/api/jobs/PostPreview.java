package com.inker.api.jobs;

import com.inker.api.ApprovalStatus;

import java.util.List;

public record PostPreview(String jobId, String postId, String title, String markdown, int wordCount, double score,
		List<String> sources, ApprovalStatus approvalStatus) {
}
