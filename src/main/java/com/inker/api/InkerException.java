package com.inker.api;

/**
 * root of every failure the orchestration core reports to its callers. Subtypes say
 * whether the caller did something wrong, asked for something that doesn't exist, or
 * simply hit a backend that isn't there right now.
 */
public abstract class InkerException extends RuntimeException {

	protected InkerException(String message) {
		super(message);
	}

	protected InkerException(String message, Throwable cause) {
		super(message, cause);
	}

	/**
	 * @return {@code true} if trying the same call again later might succeed
	 */
	public boolean isRetryable() {
		return false;
	}

}
