package com.inker.api.jobs;

import com.inker.api.Job;
import com.inker.api.JobHistoryEntry;
import com.inker.api.JobStats;
import com.inker.api.JobStatus;
import org.jspecify.annotations.Nullable;

import java.util.List;
import java.util.Optional;

/**
 * submits jobs, runs them through the pipeline and answers questions about them.
 */
public interface JobService {

	/**
	 * validates and stores the submission as a pending job, then queues it. A
	 * submission whose correlation id is held by a job that hasn't failed returns that
	 * job instead.
	 * @throws com.inker.api.ValidationException if the submission is malformed
	 * @throws com.inker.api.BackendUnavailableException if the job couldn't be queued;
	 * the job is marked failed so the correlation id can be reused
	 */
	SubmissionResult submit(JobSubmission submission);

	/**
	 * runs a pending job through every stage. A job that already finished is left alone;
	 * one caught mid-pipeline (its worker died) is failed.
	 */
	void execute(String jobId);

	Optional<Job> getJob(String jobId);

	Optional<Job> getJobByCorrelationId(String correlationId);

	/**
	 * never throws for an unavailable backend: the view says {@code unknown} instead.
	 * @throws com.inker.api.NotFoundException if there is no such job
	 */
	JobStatusView getJobStatus(String jobId);

	List<Job> listJobs(@Nullable JobStatus status, int limit, int offset);

	Optional<PostPreview> getPreview(String jobId);

	List<JobHistoryEntry> getJobHistory(String jobId);

	JobStats getStats();

}
