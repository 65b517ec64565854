package com.inker.api.pipeline;

import java.util.List;

/**
 * one place articles come from. Register implementations as beans; the
 * {@link CompositeArticleFetcher} picks them up by {@link #type()}.
 */
public interface ArticleSource {

	ArticleSourceType type();

	List<Article> fetch(String topic, int maxResults);

}
