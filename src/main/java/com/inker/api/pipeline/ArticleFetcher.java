package com.inker.api.pipeline;

import java.util.Collection;
import java.util.List;

@FunctionalInterface
public interface ArticleFetcher {

	/**
	 * gathers up to {@code maxResults} articles per topic from each of the given sources.
	 * A source that fails contributes nothing rather than failing the whole fetch.
	 */
	List<Article> fetchAll(List<String> topics, Collection<ArticleSourceType> sources, int maxResults);

}
