package com.inker.api.pipeline;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.function.BiFunction;

class CompositeArticleFetcherTest {

	private static ArticleSource source(ArticleSourceType type, BiFunction<String, Integer, List<Article>> fetch) {
		return new ArticleSource() {

			@Override
			public ArticleSourceType type() {
				return type;
			}

			@Override
			public List<Article> fetch(String topic, int maxResults) {
				return fetch.apply(topic, maxResults);
			}
		};
	}

	private static Article article(String topic, ArticleSourceType type) {
		return new Article(topic + " news", "https://example.com/" + topic, type, "summary", topic, null);
	}

	@Test
	void fetchesEveryTopicFromEverySource() {
		var fetcher = new CompositeArticleFetcher(List.of(
				source(ArticleSourceType.HACKER_NEWS,
						(topic, max) -> List.of(article(topic, ArticleSourceType.HACKER_NEWS))),
				source(ArticleSourceType.WEB, (topic, max) -> List.of(article(topic, ArticleSourceType.WEB)))));
		var articles = fetcher.fetchAll(List.of("ai", "security"),
				List.of(ArticleSourceType.HACKER_NEWS, ArticleSourceType.WEB), 5);
		Assertions.assertEquals(4, articles.size());
	}

	@Test
	void aFailingOrMissingSourceIsSkipped() {
		var fetcher = new CompositeArticleFetcher(List.of(
				source(ArticleSourceType.HACKER_NEWS, (topic, max) -> {
					throw new IllegalStateException("rate limited");
				}), source(ArticleSourceType.WEB, (topic, max) -> List.of(article(topic, ArticleSourceType.WEB)))));
		var articles = fetcher.fetchAll(List.of("ai"), List.of(ArticleSourceType.values()), 5);
		Assertions.assertEquals(1, articles.size(), "only the web source delivered");
		Assertions.assertEquals(ArticleSourceType.WEB, articles.get(0).source());
	}

	@Test
	void sourceTypesMustBeUnique() {
		var web = source(ArticleSourceType.WEB, (topic, max) -> List.of());
		Assertions.assertThrows(IllegalStateException.class, () -> new CompositeArticleFetcher(List.of(web, web)));
	}

	@Test
	void sourceTypesParseEitherWay() {
		Assertions.assertEquals(ArticleSourceType.HACKER_NEWS, ArticleSourceType.of("hacker_news"));
		Assertions.assertTrue(ArticleSourceType.isKnown("YouTube"));
		Assertions.assertFalse(ArticleSourceType.isKnown("reddit"));
	}

}
