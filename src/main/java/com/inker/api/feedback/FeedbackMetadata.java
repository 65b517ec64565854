package com.inker.api.feedback;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * categories and ratings travel as plain string metadata on the history entry of the
 * decision they belong to:
 * <pre>
 * categories = quality,clarity
 * rating.clarity = 2
 * rating.clarity.comment = too much jargon
 * </pre>
 */
abstract class FeedbackMetadata {

	static final String CATEGORIES = "categories";

	static final String RATING_PREFIX = "rating.";

	static final String COMMENT_SUFFIX = ".comment";

	static Map<String, String> encode(List<FeedbackCategory> categories, List<FeedbackRating> ratings) {
		var metadata = new HashMap<String, String>();
		if (!categories.isEmpty())
			metadata.put(CATEGORIES,
					String.join(",", categories.stream().distinct().map(FeedbackCategory::value).toList()));
		for (var rating : ratings) {
			var key = RATING_PREFIX + rating.category().value();
			metadata.put(key, Integer.toString(rating.score()));
			if (rating.comment() != null && !rating.comment().isBlank())
				metadata.put(key + COMMENT_SUFFIX, rating.comment());
		}
		return metadata;
	}

	static List<FeedbackCategory> categories(Map<String, String> metadata) {
		var value = metadata.get(CATEGORIES);
		if (value == null || value.isBlank())
			return List.of();
		return Arrays.stream(value.split(",")).map(FeedbackCategory::of).toList();
	}

	static List<FeedbackRating> ratings(Map<String, String> metadata) {
		var ratings = new ArrayList<FeedbackRating>();
		for (var category : FeedbackCategory.values()) {
			var key = RATING_PREFIX + category.value();
			var score = metadata.get(key);
			if (score != null)
				ratings.add(new FeedbackRating(category, Integer.parseInt(score), metadata.get(key + COMMENT_SUFFIX)));
		}
		return ratings;
	}

}
