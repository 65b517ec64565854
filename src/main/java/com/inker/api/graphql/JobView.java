package com.inker.api.graphql;

import com.inker.api.Job;
import com.inker.api.JobError;
import com.inker.api.JobResult;
import com.inker.api.JobStatus;
import com.inker.api.utils.DateUtils;

import java.time.OffsetDateTime;
import java.util.List;

public record JobView(String id, String correlationId, JobStatus status, List<String> topics, List<String> sources,
		int numCandidates, int maxResults, OffsetDateTime createdAt, OffsetDateTime updatedAt,
		OffsetDateTime startedAt, OffsetDateTime completedAt, JobResult result, JobError error, long version) {

	public static JobView of(Job job) {
		return new JobView(job.id(), job.correlationId(), job.status(), job.topics(), job.sources(),
				job.numCandidates(), job.maxResults(), DateUtils.forInstant(job.createdAt()),
				DateUtils.forInstant(job.updatedAt()), DateUtils.forInstant(job.startedAt()),
				DateUtils.forInstant(job.completedAt()), job.result(), job.error(), job.version());
	}

}
