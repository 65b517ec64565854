package com.inker.api.jobs;

import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * a request to run the pipeline. Empty {@code topics} or {@code sources} and
 * {@code null} counts fall back to the configured defaults.
 * @param correlationId a caller-chosen key; submitting twice with the same key yields
 * one job unless the first one failed
 */
public record JobSubmission(@Nullable List<String> topics, @Nullable List<String> sources,
		@Nullable Integer numCandidates, @Nullable Integer maxResults, @Nullable String correlationId) {

	public JobSubmission {
		topics = topics == null ? List.of() : List.copyOf(topics);
		sources = sources == null ? List.of() : List.copyOf(sources);
	}

	public static JobSubmission of(String correlationId, String... topics) {
		return new JobSubmission(List.of(topics), List.of(), null, null, correlationId);
	}

}
