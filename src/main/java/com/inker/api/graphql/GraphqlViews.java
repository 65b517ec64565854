package com.inker.api.graphql;

import java.util.OptionalDouble;

/**
 * helpers for views whose domain types don't map onto GraphQL directly.
 */
public abstract class GraphqlViews {

	public static Double nullable(OptionalDouble value) {
		return value.isPresent() ? value.getAsDouble() : null;
	}

}
