package com.inker.api;

/**
 * thrown when a job is created with a correlation id that a live (not failed) job
 * already holds.
 */
public class DuplicateJobException extends InkerException {

	private final String existingJobId;

	public DuplicateJobException(String correlationId, String existingJobId) {
		super("job [%s] already holds the correlation id [%s]".formatted(existingJobId, correlationId));
		this.existingJobId = existingJobId;
	}

	public String getExistingJobId() {
		return this.existingJobId;
	}

}
