package org.jahia.graphql.complexity.directive;

import graphql.PublicApi;

/**
 * Ranks cost directives when several candidates compete for the same field, for example the declarations of an
 * interface field on each of its implementations. The highest key wins.
 */
@PublicApi
@FunctionalInterface
public interface CostCompareKey {

    /**
     * -1 when there is no directive, the assumed size of a {@link ListCost} and the complexity of a
     * {@link FixedCost}, unset values counting as 0.
     */
    CostCompareKey DEFAULT = directive -> {
        if (directive == null) {
            return -1;
        }
        if (directive instanceof ListCost) {
            return ((ListCost) directive).getAssumedSizeOrDefault(0);
        }
        return ((FixedCost) directive).getComplexityOrDefault(0);
    };

    /**
     * @param directive the candidate, null meaning "no directive"
     *
     * @return the rank of the candidate
     */
    int keyOf(CostDirective directive);
}
