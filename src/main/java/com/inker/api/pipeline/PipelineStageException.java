package com.inker.api.pipeline;

import com.inker.api.InkerException;

/**
 * a pipeline stage couldn't produce its output. The job that ran it fails; nothing is
 * retried.
 */
public class PipelineStageException extends InkerException {

	public PipelineStageException(String message) {
		super(message);
	}

	public PipelineStageException(String message, Throwable cause) {
		super(message, cause);
	}

}
