package com.inker.api.jobs;

import com.inker.api.JobError;
import com.inker.api.JobResult;
import org.jspecify.annotations.Nullable;

import java.time.Instant;

/**
 * what a client polling a job sees. {@code status} is one of the job statuses or
 * {@value #UNKNOWN} when the storage backend couldn't be reached.
 */
public record JobStatusView(String jobId, String status, @Nullable Instant updatedAt, @Nullable JobResult result,
		@Nullable JobError error, String message) {

	public static final String UNKNOWN = "unknown";

}
