package com.inker.api;

import org.jspecify.annotations.Nullable;

import java.util.List;
import java.util.Map;

/**
 * a partial update to a {@link BlogPost}: {@code null} fields are left as they are. The
 * approval status is deliberately absent; it only moves through the approval operations.
 */
public record BlogPostUpdate(@Nullable String title, @Nullable String content, @Nullable String topic,
		@Nullable List<String> sources, @Nullable Map<String, String> metadata) {

	public static BlogPostUpdate content(String content) {
		return new BlogPostUpdate(null, content, null, null, null);
	}

	public boolean changesContent() {
		return this.content != null;
	}

}
