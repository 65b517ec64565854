package com.inker.api.graphql;

import com.inker.api.DuplicateJobException;
import com.inker.api.InkerException;
import com.inker.api.InvalidTransitionException;
import com.inker.api.NotFoundException;
import com.inker.api.ValidationException;
import graphql.GraphQLError;
import graphql.GraphqlErrorBuilder;
import graphql.schema.DataFetchingEnvironment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.graphql.execution.DataFetcherExceptionResolverAdapter;
import org.springframework.graphql.execution.ErrorType;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * turns the service's exceptions into GraphQL errors: the caller's mistakes are
 * {@code BAD_REQUEST}, misses are {@code NOT_FOUND}, and backend trouble is
 * {@code INTERNAL_ERROR} flagged as retryable.
 */
@Component
class GraphqlExceptionResolver extends DataFetcherExceptionResolverAdapter {

	private final Logger log = LoggerFactory.getLogger(getClass());

	@Override
	protected GraphQLError resolveToSingleError(Throwable ex, DataFetchingEnvironment env) {
		if (!(ex instanceof InkerException inkerException))
			return null;
		var errorType = errorType(inkerException);
		if (errorType == ErrorType.INTERNAL_ERROR)
			this.log.warn("couldn't complete {}", env.getField().getName(), ex);
		return GraphqlErrorBuilder.newError(env) //
			.errorType(errorType) //
			.message(ex.getMessage()) //
			.extensions(Map.of("retryable", inkerException.isRetryable())) //
			.build();
	}

	static ErrorType errorType(InkerException exception) {
		if (exception instanceof NotFoundException)
			return ErrorType.NOT_FOUND;
		if (exception instanceof ValidationException || exception instanceof InvalidTransitionException
				|| exception instanceof DuplicateJobException)
			return ErrorType.BAD_REQUEST;
		return exception.isRetryable() ? ErrorType.INTERNAL_ERROR : ErrorType.BAD_REQUEST;
	}

}
