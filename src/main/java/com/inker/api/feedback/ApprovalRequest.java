package com.inker.api.feedback;

import org.jspecify.annotations.Nullable;

import java.util.List;

public record ApprovalRequest(String postId, @Nullable String actor, @Nullable String feedback,
		@Nullable List<FeedbackRating> ratings) {

	public ApprovalRequest {
		ratings = ratings == null ? List.of() : List.copyOf(ratings);
	}

}
