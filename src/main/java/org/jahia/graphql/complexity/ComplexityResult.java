package org.jahia.graphql.complexity;

import graphql.PublicApi;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * The estimated complexity of a query and the budget it was checked against.
 */
@PublicApi
public final class ComplexityResult {

    private final int current;
    private final int max;

    public ComplexityResult(int current, int max) {
        this.current = current;
        this.max = max;
    }

    public int getCurrent() {
        return current;
    }

    public int getMax() {
        return max;
    }

    /**
     * @return {@code {current, max}} as it appears in error and response extensions
     */
    public Map<String, Object> toSpecification() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("current", current);
        map.put("max", max);
        return map;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        ComplexityResult that = (ComplexityResult) o;
        return current == that.current && max == that.max;
    }

    @Override
    public int hashCode() {
        return Objects.hash(current, max);
    }

    @Override
    public String toString() {
        return "ComplexityResult{current=" + current + ", max=" + max + '}';
    }
}
