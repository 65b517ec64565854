package com.inker.api.feedback;

import com.inker.api.ValidationException;
import org.jspecify.annotations.Nullable;

/**
 * an editor's score, from 1 (poor) to 5 (excellent), for one aspect of a post.
 */
public record FeedbackRating(FeedbackCategory category, int score, @Nullable String comment) {

	public static final int MIN_SCORE = 1;

	public static final int MAX_SCORE = 5;

	public FeedbackRating {
		if (category == null)
			throw new ValidationException("a rating needs a category");
		if (score < MIN_SCORE || score > MAX_SCORE)
			throw new ValidationException("ratings run from %d to %d, but got %d for %s".formatted(MIN_SCORE,
					MAX_SCORE, score, category.value()));
	}

}
