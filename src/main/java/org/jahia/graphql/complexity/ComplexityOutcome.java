package org.jahia.graphql.complexity;

import graphql.Assert;
import graphql.PublicApi;

/**
 * Whether a query fits its complexity budget. Both outcomes carry the computed {@link ComplexityResult}.
 */
@PublicApi
public final class ComplexityOutcome {

    public enum Status {
        PASS,
        VIOLATION
    }

    private final Status status;
    private final ComplexityResult result;

    private ComplexityOutcome(Status status, ComplexityResult result) {
        this.status = status;
        this.result = Assert.assertNotNull(result, () -> "result can't be null");
    }

    public static ComplexityOutcome pass(ComplexityResult result) {
        return new ComplexityOutcome(Status.PASS, result);
    }

    public static ComplexityOutcome violation(ComplexityResult result) {
        return new ComplexityOutcome(Status.VIOLATION, result);
    }

    public Status getStatus() {
        return status;
    }

    public boolean isViolation() {
        return status == Status.VIOLATION;
    }

    public ComplexityResult getResult() {
        return result;
    }

    /**
     * @return the query rejection for a violation
     */
    public QueryComplexityExceededException toException() {
        Assert.assertTrue(isViolation(), () -> "only a violation can be turned into an exception");
        return new QueryComplexityExceededException(result);
    }

    @Override
    public String toString() {
        return "ComplexityOutcome{" + status + ", " + result + '}';
    }
}
