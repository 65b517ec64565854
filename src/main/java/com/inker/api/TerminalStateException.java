package com.inker.api;

/**
 * a job that already reached {@link JobStatus#COMPLETED} or {@link JobStatus#FAILED} was
 * asked to change.
 */
public class TerminalStateException extends InvalidTransitionException {

	public TerminalStateException(String jobId, JobStatus from, JobStatus to) {
		super("job [%s] is already %s and cannot move to %s".formatted(jobId, label(from), label(to)), label(from),
				label(to));
	}

}
