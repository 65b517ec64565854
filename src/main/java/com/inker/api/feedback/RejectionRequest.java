package com.inker.api.feedback;

import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * @param feedback why the post was rejected; mandatory
 */
public record RejectionRequest(String postId, @Nullable String actor, String feedback,
		@Nullable List<FeedbackCategory> categories, @Nullable List<FeedbackRating> ratings) {

	public RejectionRequest {
		categories = categories == null ? List.of() : List.copyOf(categories);
		ratings = ratings == null ? List.of() : List.copyOf(ratings);
	}

}
