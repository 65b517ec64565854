package com.inker.api.jobs;

import com.inker.api.JobStats;
import com.inker.api.JobStatus;
import com.inker.api.graphql.GraphqlViews;
import com.inker.api.graphql.HistoryEntryView;
import com.inker.api.graphql.JobView;
import com.inker.api.utils.DateUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.graphql.data.method.annotation.Argument;
import org.springframework.graphql.data.method.annotation.MutationMapping;
import org.springframework.graphql.data.method.annotation.QueryMapping;
import org.springframework.stereotype.Controller;

import java.time.OffsetDateTime;
import java.util.Collection;

@Controller
class JobsController {

	private final Logger log = LoggerFactory.getLogger(getClass());

	private final JobService jobService;

	JobsController(JobService jobService) {
		this.jobService = jobService;
	}

	@MutationMapping
	SubmissionResult submitJob(@Argument JobSubmission submission) {
		var result = this.jobService.submit(submission);
		this.log.info("submitJob: {}", result);
		return result;
	}

	@QueryMapping
	JobView job(@Argument String id) {
		return this.jobService.getJob(id).map(JobView::of).orElse(null);
	}

	@QueryMapping
	JobView jobByCorrelationId(@Argument String correlationId) {
		return this.jobService.getJobByCorrelationId(correlationId).map(JobView::of).orElse(null);
	}

	@QueryMapping
	ClientJobStatus jobStatus(@Argument String id) {
		var view = this.jobService.getJobStatus(id);
		return new ClientJobStatus(view.jobId(), view.status(), DateUtils.forInstant(view.updatedAt()),
				view.message());
	}

	@QueryMapping
	Collection<JobView> jobs(@Argument JobStatus status, @Argument int limit, @Argument int offset) {
		return this.jobService.listJobs(status, limit, offset).stream().map(JobView::of).toList();
	}

	@QueryMapping
	Collection<HistoryEntryView> jobHistory(@Argument String jobId) {
		return this.jobService.getJobHistory(jobId).stream().map(HistoryEntryView::of).toList();
	}

	@QueryMapping
	PostPreview preview(@Argument String jobId) {
		return this.jobService.getPreview(jobId).orElse(null);
	}

	@QueryMapping
	ClientStats stats() {
		return ClientStats.of(this.jobService.getStats());
	}

	record ClientJobStatus(String jobId, String status, OffsetDateTime updatedAt, String message) {
	}

	record ClientStats(long totalJobs, long pendingJobs, long completedJobs, long failedJobs, long totalPosts,
			long pendingApproval, long approvedPosts, long rejectedPosts, long revisionRequested,
			long publishedPosts, Double approvalRate, Double avgApprovalTimeHours) {

		static ClientStats of(JobStats stats) {
			return new ClientStats(stats.totalJobs(), stats.pendingJobs(), stats.completedJobs(),
					stats.failedJobs(), stats.totalPosts(), stats.pendingApproval(), stats.approvedPosts(),
					stats.rejectedPosts(), stats.revisionRequested(), stats.publishedPosts(),
					GraphqlViews.nullable(stats.approvalRate()), GraphqlViews.nullable(stats.avgApprovalTimeHours()));
		}

	}

}
