package com.inker.api;

/**
 * an optimistic write lost a race: somebody else changed the record between our read
 * and our write.
 */
public class StaleStateException extends InkerException {

	public StaleStateException(String entity, String id) {
		super("%s [%s] was changed concurrently".formatted(entity, id));
	}

	@Override
	public boolean isRetryable() {
		return true;
	}

}
