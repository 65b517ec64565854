package com.inker.api.queue;

import org.springframework.util.Assert;

/**
 * a request to run a job. Items with a higher {@code priority} are delivered first;
 * within one priority they come out in the order they went in.
 */
public record WorkItem(String jobId, int priority) {

	public WorkItem {
		Assert.hasText(jobId, "a work item must reference a job");
	}

	public static WorkItem of(String jobId) {
		return new WorkItem(jobId, 0);
	}

}
