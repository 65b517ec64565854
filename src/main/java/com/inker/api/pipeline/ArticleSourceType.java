package com.inker.api.pipeline;

import java.util.Arrays;
import java.util.Locale;

public enum ArticleSourceType {

	HACKER_NEWS, WEB, YOUTUBE;

	public String value() {
		return this.name().toLowerCase(Locale.ROOT);
	}

	/**
	 * accepts either the constant name or its lowercase form, so {@code hacker_news} and
	 * {@code HACKER_NEWS} both resolve.
	 */
	public static ArticleSourceType of(String value) {
		return valueOf(value.trim().toUpperCase(Locale.ROOT));
	}

	public static boolean isKnown(String value) {
		return value != null && Arrays.stream(values()).anyMatch(t -> t.name().equalsIgnoreCase(value.trim()));
	}

}
