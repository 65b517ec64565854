package com.inker.api;

/**
 * bad caller input: an empty topic, a non-positive result count, missing mandatory
 * feedback, a negative page size and so on.
 */
public class ValidationException extends InkerException {

	public ValidationException(String message) {
		super(message);
	}

}
