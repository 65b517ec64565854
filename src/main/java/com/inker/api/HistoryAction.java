package com.inker.api;

import java.util.Locale;

public enum HistoryAction {

	SUBMITTED, STARTED, COMPLETED, FAILED, APPROVED, REJECTED, REVISION_REQUESTED, PUBLISHED;

	public String value() {
		return this.name().toLowerCase(Locale.ROOT);
	}

	public static HistoryAction of(String value) {
		return valueOf(value.trim().toUpperCase(Locale.ROOT));
	}

}
