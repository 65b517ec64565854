package com.inker.api.graphql;

import com.inker.api.BackendUnavailableException;
import com.inker.api.DuplicateJobException;
import com.inker.api.InvalidTransitionException;
import com.inker.api.NotFoundException;
import com.inker.api.StaleStateException;
import com.inker.api.ValidationException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.springframework.graphql.execution.ErrorType;

class GraphqlExceptionResolverTest {

	@Test
	void classification() {
		Assertions.assertEquals(ErrorType.NOT_FOUND, GraphqlExceptionResolver.errorType(new NotFoundException("post", "1")));
		Assertions.assertEquals(ErrorType.BAD_REQUEST,
				GraphqlExceptionResolver.errorType(new ValidationException("limit must not be negative")));
		Assertions.assertEquals(ErrorType.BAD_REQUEST,
				GraphqlExceptionResolver.errorType(new InvalidTransitionException("bad move", "approved", "rejected")));
		Assertions.assertEquals(ErrorType.BAD_REQUEST,
				GraphqlExceptionResolver.errorType(new DuplicateJobException("weekly", "job-1")));
		Assertions.assertEquals(ErrorType.INTERNAL_ERROR, GraphqlExceptionResolver
			.errorType(new BackendUnavailableException("down", new RuntimeException())));
		Assertions.assertEquals(ErrorType.INTERNAL_ERROR,
				GraphqlExceptionResolver.errorType(new StaleStateException("job", "job-1")));
	}

}
