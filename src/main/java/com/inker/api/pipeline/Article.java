package com.inker.api.pipeline;

import org.jspecify.annotations.Nullable;

/**
 * a news item, web page or video a candidate post can draw on.
 */
public record Article(String title, String url, ArticleSourceType source, String summary, String topic,
		@Nullable String thumbnail) {
}
