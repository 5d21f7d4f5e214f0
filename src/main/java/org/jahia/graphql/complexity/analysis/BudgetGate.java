package org.jahia.graphql.complexity.analysis;

import graphql.Internal;
import org.jahia.graphql.complexity.ComplexityOutcome;
import org.jahia.graphql.complexity.ComplexityResult;

import static graphql.Assert.assertTrue;

@Internal
public class BudgetGate {

    private final int maxComplexity;

    public BudgetGate(int maxComplexity) {
        assertTrue(maxComplexity >= 0, () -> "maxComplexity must be >= 0");
        this.maxComplexity = maxComplexity;
    }

    public ComplexityOutcome check(int complexity) {
        ComplexityResult result = new ComplexityResult(complexity, maxComplexity);
        return complexity > maxComplexity ? ComplexityOutcome.violation(result) : ComplexityOutcome.pass(result);
    }
}
