package com.inker.api.storage;

import com.inker.api.ApprovalStatus;
import com.inker.api.BlogPost;
import com.inker.api.Job;
import com.inker.api.JobStats;
import com.inker.api.JobStatus;
import com.inker.api.utils.DateUtils;

import java.util.Collection;
import java.util.OptionalDouble;

abstract class StorageStatistics {

	static JobStats of(Collection<Job> jobs, Collection<BlogPost> posts) {
		var completed = jobs.stream().filter(j -> j.status() == JobStatus.COMPLETED).count();
		var failed = jobs.stream().filter(j -> j.status() == JobStatus.FAILED).count();
		var pending = jobs.size() - completed - failed;
		var approved = count(posts, ApprovalStatus.APPROVED);
		var published = posts.stream().filter(p -> p.publishedAt() != null).count();
		return new JobStats(jobs.size(), pending, completed, failed, posts.size(), count(posts, ApprovalStatus.PENDING),
				approved, count(posts, ApprovalStatus.REJECTED), count(posts, ApprovalStatus.REVISION_REQUESTED),
				published, JobStats.percentage(approved, posts.size()), averageApprovalHours(posts));
	}

	static OptionalDouble averageApprovalHours(Collection<BlogPost> posts) {
		return posts.stream()
			.filter(p -> p.approvedAt() != null)
			.mapToDouble(p -> DateUtils.hoursBetween(p.createdAt(), p.approvedAt()))
			.average();
	}

	private static long count(Collection<BlogPost> posts, ApprovalStatus status) {
		return posts.stream().filter(p -> p.approvalStatus() == status).count();
	}

}
