package com.inker.api.feedback;

import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * @param feedback what needs to change; mandatory
 */
public record RevisionRequest(String postId, @Nullable String actor, String feedback,
		@Nullable List<FeedbackCategory> categories, @Nullable List<FeedbackRating> ratings) {

	public RevisionRequest {
		categories = categories == null ? List.of() : List.copyOf(categories);
		ratings = ratings == null ? List.of() : List.copyOf(ratings);
	}

}
