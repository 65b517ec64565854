package com.inker.api;

import java.util.Locale;
import java.util.Set;

/**
 * editorial state of a {@link BlogPost}. Publication isn't a state of its own: it's the
 * {@link BlogPost#publishedAt()} timestamp, which may only be set on an
 * {@link #APPROVED} post.
 */
public enum ApprovalStatus {

	PENDING, APPROVED, REJECTED, REVISION_REQUESTED;

	public boolean canTransitionTo(ApprovalStatus next) {
		return switch (this) {
			case PENDING -> Set.of(APPROVED, REJECTED, REVISION_REQUESTED).contains(next);
			case REVISION_REQUESTED -> next == PENDING || next == APPROVED;
			case APPROVED, REJECTED -> false;
		};
	}

	public String value() {
		return this.name().toLowerCase(Locale.ROOT);
	}

	public static ApprovalStatus of(String value) {
		return valueOf(value.trim().toUpperCase(Locale.ROOT));
	}

}
