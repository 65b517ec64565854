package com.inker.api.pipeline;

/**
 * the four stages a job runs, in order.
 */
public record Pipeline(ArticleFetcher fetcher, CandidateGenerator generator, CandidateScorer scorer,
		WinnerRefiner refiner) {
}
