package org.jahia.graphql.complexity.directive;

import graphql.PublicApi;

import java.util.Objects;

/**
 * {@code @cost(complexity: Int)}: a constant contributed by the field itself, added to the cost of its selections.
 * When placed on an object type, the constant is added to every field returning that type.
 */
@PublicApi
public final class FixedCost extends CostDirective {

    private final Integer complexity;

    public FixedCost(Integer complexity) {
        this.complexity = complexity;
    }

    /**
     * @return the declared complexity, or null when the directive was applied without a value
     */
    public Integer getComplexity() {
        return complexity;
    }

    public int getComplexityOrDefault(int defaultValue) {
        return valueOrDefault(complexity, defaultValue);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return Objects.equals(complexity, ((FixedCost) o).complexity);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(complexity);
    }

    @Override
    public String toString() {
        return "FixedCost{complexity=" + complexity + '}';
    }
}
