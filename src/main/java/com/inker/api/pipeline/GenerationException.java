package com.inker.api.pipeline;

public class GenerationException extends PipelineStageException {

	public GenerationException(String message) {
		super(message);
	}

	public GenerationException(String message, Throwable cause) {
		super(message, cause);
	}

}
