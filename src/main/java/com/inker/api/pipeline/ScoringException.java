package com.inker.api.pipeline;

public class ScoringException extends PipelineStageException {

	public ScoringException(String message) {
		super(message);
	}

	public ScoringException(String message, Throwable cause) {
		super(message, cause);
	}

}
