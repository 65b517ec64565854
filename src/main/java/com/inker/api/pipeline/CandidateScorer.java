package com.inker.api.pipeline;

import java.util.List;

@FunctionalInterface
public interface CandidateScorer {

	/**
	 * @return the candidates with their scores, best first
	 * @throws ScoringException if scoring fails
	 */
	List<ScoredPost> score(List<CandidatePost> candidates);

}
