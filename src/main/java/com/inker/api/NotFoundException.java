package com.inker.api;

public class NotFoundException extends InkerException {

	public NotFoundException(String entity, String id) {
		super("couldn't find %s [%s]".formatted(entity, id));
	}

}
