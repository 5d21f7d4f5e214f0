package org.jahia.graphql.complexity.directive;

import graphql.PublicApi;

/**
 * A cost annotation attached to a schema field or type. There are exactly two kinds, {@link FixedCost} and
 * {@link ListCost}; the constructor is package private so no other kind can exist.
 */
@PublicApi
public abstract class CostDirective {

    CostDirective() {
    }

    static int valueOrDefault(Integer value, int defaultValue) {
        return value == null ? defaultValue : value;
    }
}
