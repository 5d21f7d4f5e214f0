package org.jahia.graphql.complexity;

import graphql.GraphQLException;
import graphql.PublicApi;

/**
 * The complexity check cannot run because it is not wired or configured. Not a {@link graphql.GraphQLError}: it
 * escapes the execution and surfaces as a server error.
 */
@PublicApi
public class QueryComplexityNotConfiguredException extends GraphQLException {

    public QueryComplexityNotConfiguredException(String message) {
        super(message);
    }
}
