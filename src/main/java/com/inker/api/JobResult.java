package com.inker.api;

import org.springframework.util.Assert;

/**
 * what a {@link JobStatus#COMPLETED completed} job produced: a reference to the
 * persisted {@link BlogPost}, its scoring and the pipeline counters.
 */
public record JobResult(String postId, String title, int wordCount, Scoring scoring, int articlesFetched,
		int candidatesGenerated) {

	public JobResult {
		Assert.hasText(postId, "the postId must not be empty");
	}

}
