package com.inker.api.pipeline;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

class CompositeArticleFetcher implements ArticleFetcher {

	private final Logger log = LoggerFactory.getLogger(getClass());

	private final Map<ArticleSourceType, ArticleSource> sources = new EnumMap<>(ArticleSourceType.class);

	CompositeArticleFetcher(Collection<ArticleSource> sources) {
		for (var source : sources) {
			var previous = this.sources.put(source.type(), source);
			if (previous != null)
				throw new IllegalStateException("there are two article sources for " + source.type() + ": "
						+ previous.getClass().getName() + " and " + source.getClass().getName());
		}
		this.log.info("article sources: {}", this.sources.keySet());
	}

	@Override
	public List<Article> fetchAll(List<String> topics, Collection<ArticleSourceType> types, int maxResults) {
		var articles = new ArrayList<Article>();
		for (var type : types) {
			var source = this.sources.get(type);
			if (source == null) {
				this.log.warn("no article source is configured for {}", type.value());
				continue;
			}
			for (var topic : topics) {
				try {
					var fetched = source.fetch(topic, maxResults);
					this.log.debug("fetched {} articles about '{}' from {}", fetched.size(), topic, type.value());
					articles.addAll(fetched);
				} //
				catch (RuntimeException e) {
					this.log.warn("couldn't fetch articles about '{}' from {}", topic, type.value(), e);
				}
			}
		}
		return articles;
	}

}
