package com.inker.api;

import java.util.Locale;

/**
 * the lifecycle of a {@link Job}. The constants are declared in pipeline order: a job
 * only ever moves to the next constant, or to {@link #FAILED} from anywhere that isn't
 * terminal.
 */
public enum JobStatus {

	PENDING, FETCHING, GENERATING, SCORING, REFINING, COMPLETED, FAILED;

	public boolean isTerminal() {
		return this == COMPLETED || this == FAILED;
	}

	public boolean canTransitionTo(JobStatus next) {
		if (this.isTerminal() || next == null)
			return false;
		if (next == FAILED)
			return true;
		return next != COMPLETED ? next.ordinal() == this.ordinal() + 1 : this == REFINING;
	}

	public String value() {
		return this.name().toLowerCase(Locale.ROOT);
	}

	public static JobStatus of(String value) {
		return valueOf(value.trim().toUpperCase(Locale.ROOT));
	}

}
