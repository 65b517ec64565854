package com.inker.api.jobs;

import com.inker.api.JobStatus;
import org.jspecify.annotations.Nullable;

/**
 * @param duplicate {@code true} if the correlation id matched a job that was already
 * submitted, in which case no new job was created and nothing was enqueued
 */
public record SubmissionResult(String jobId, @Nullable String correlationId, JobStatus status, boolean duplicate,
		String message) {
}
