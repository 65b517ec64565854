package com.inker.api;

/**
 * the per-dimension scores a candidate post received, plus the weighted total and the
 * scorer's reasoning.
 */
public record Scoring(double relevance, double originality, double depth, double clarity, double engagement,
		double total, String reasoning) {
}
