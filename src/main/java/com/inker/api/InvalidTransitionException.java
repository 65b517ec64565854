package com.inker.api;

import java.util.Locale;

/**
 * a state machine (job lifecycle or post approval) was asked to move along an edge it
 * doesn't have.
 */
public class InvalidTransitionException extends InkerException {

	private final String from;

	private final String to;

	public InvalidTransitionException(String entity, String id, Enum<?> from, Enum<?> to) {
		this("%s [%s] cannot move from %s to %s".formatted(entity, id, label(from), label(to)), label(from),
				label(to));
	}

	public InvalidTransitionException(String message, String from, String to) {
		super(message);
		this.from = from;
		this.to = to;
	}

	public String getFrom() {
		return this.from;
	}

	public String getTo() {
		return this.to;
	}

	static String label(Enum<?> e) {
		return e == null ? "none" : e.name().toLowerCase(Locale.ROOT);
	}

}
