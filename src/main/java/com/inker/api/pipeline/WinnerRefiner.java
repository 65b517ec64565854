package com.inker.api.pipeline;

/**
 * polishes the winning candidate into the final markdown, front-matter included.
 */
@FunctionalInterface
public interface WinnerRefiner {

	String refine(ScoredPost winner);

}
