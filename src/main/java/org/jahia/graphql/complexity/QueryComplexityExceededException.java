package org.jahia.graphql.complexity;

import graphql.ErrorType;
import graphql.PublicApi;
import graphql.execution.AbortExecutionException;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Rejects a query whose estimated complexity is above the budget. Thrown during validation, graphql-java turns it
 * into the only error of the response; the figures are in the {@code complexity} extension so clients do not have
 * to parse the message.
 */
@PublicApi
public class QueryComplexityExceededException extends AbortExecutionException {

    public static final String EXTENSION_KEY = "complexity";

    private final ComplexityResult result;

    public QueryComplexityExceededException(ComplexityResult result) {
        super(String.format("Complexity of %d is greater than max complexity of %d", result.getCurrent(), result.getMax()));
        this.result = result;
    }

    public ComplexityResult getResult() {
        return result;
    }

    @Override
    public ErrorType getErrorType() {
        return ErrorType.ValidationError;
    }

    @Override
    public Map<String, Object> getExtensions() {
        Map<String, Object> extensions = new LinkedHashMap<>();
        extensions.put(EXTENSION_KEY, result.toSpecification());
        return extensions;
    }
}
