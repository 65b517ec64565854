package com.inker.api;

/**
 * the storage or queue backend couldn't be reached. The operation had no effect and may
 * be retried.
 */
public class BackendUnavailableException extends InkerException {

	public BackendUnavailableException(String message, Throwable cause) {
		super(message, cause);
	}

	@Override
	public boolean isRetryable() {
		return true;
	}

}
