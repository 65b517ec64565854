package com.inker.api.pipeline;

import java.util.List;

@FunctionalInterface
public interface CandidateGenerator {

	/**
	 * @throws GenerationException if the model's output can't be turned into candidates
	 */
	List<CandidatePost> generate(List<Article> articles, int numCandidates);

}
