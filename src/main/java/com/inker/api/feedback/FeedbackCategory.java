package com.inker.api.feedback;

import java.util.Locale;

/**
 * what an editor's feedback is about.
 */
public enum FeedbackCategory {

	QUALITY, RELEVANCE, ACCURACY, CLARITY, ENGAGEMENT, LENGTH, STYLE, SOURCES, OTHER;

	public String value() {
		return this.name().toLowerCase(Locale.ROOT);
	}

	public static FeedbackCategory of(String value) {
		return valueOf(value.trim().toUpperCase(Locale.ROOT));
	}

}
