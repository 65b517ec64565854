package com.inker.api;

import org.jspecify.annotations.Nullable;
import org.springframework.util.Assert;

import java.util.Locale;

/**
 * why a job {@link JobStatus#FAILED failed}: a machine-readable code, a human-readable
 * message and, optionally, the type of the underlying exception.
 */
public record JobError(String code, String message, @Nullable String detail) {

	public static final String NO_ARTICLES = "NO_ARTICLES";

	public static final String NO_CANDIDATES = "NO_CANDIDATES";

	public static final String GENERATION_ERROR = "GENERATION_ERROR";

	public static final String SCORING_ERROR = "SCORING_ERROR";

	public static final String PIPELINE_ERROR = "PIPELINE_ERROR";

	public static final String QUEUE_UNAVAILABLE = "QUEUE_UNAVAILABLE";

	public static final String WORKER_LOST = "WORKER_LOST";

	public JobError {
		Assert.hasText(code, "the error code must not be empty");
		message = message == null || message.isBlank() ? code.toLowerCase(Locale.ROOT).replace('_', ' ') : message;
	}

	public static JobError of(String code, Throwable throwable) {
		return new JobError(code, throwable.getMessage(), throwable.getClass().getName());
	}

}
