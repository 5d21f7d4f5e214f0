package org.jahia.graphql.complexity;

import graphql.PublicApi;
import graphql.execution.instrumentation.InstrumentationState;

import java.util.Optional;

/**
 * Holds the complexity computed for one execution. A new state is created by
 * {@link QueryComplexityInstrumentation} for every request, so concurrent requests never see each other's
 * results.
 */
@PublicApi
public class QueryComplexityState implements InstrumentationState {

    private volatile ComplexityResult complexityResult;

    void setComplexityResult(ComplexityResult complexityResult) {
        this.complexityResult = complexityResult;
    }

    /**
     * @return the result computed during validation, or empty when the check has not run for this request (for
     * instance because the document failed validation)
     */
    public Optional<ComplexityResult> getComplexityResult() {
        return Optional.ofNullable(complexityResult);
    }
}
