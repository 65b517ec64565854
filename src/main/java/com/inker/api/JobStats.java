package com.inker.api;

import java.util.OptionalDouble;

/**
 * counts and rates across every job and post in storage. The two rates are empty when
 * their denominator is zero.
 */
public record JobStats(long totalJobs, long pendingJobs, long completedJobs, long failedJobs, long totalPosts,
		long pendingApproval, long approvedPosts, long rejectedPosts, long revisionRequested, long publishedPosts,
		OptionalDouble approvalRate, OptionalDouble avgApprovalTimeHours) {

	public static OptionalDouble percentage(long part, long whole) {
		return whole == 0 ? OptionalDouble.empty() : OptionalDouble.of(part * 100.0 / whole);
	}

}
