package org.jahia.graphql.complexity.directive;

import graphql.Assert;
import graphql.Internal;

/**
 * Picks the governing directive among candidates: the maximum by {@link CostCompareKey}, the first one winning ties.
 */
@Internal
public class CostDirectiveSelector {

    private final CostCompareKey compareKey;

    public CostDirectiveSelector(CostCompareKey compareKey) {
        this.compareKey = Assert.assertNotNull(compareKey, () -> "compareKey can't be null");
    }

    /**
     * @param candidates the candidates, null elements meaning "no directive"
     *
     * @return the governing directive, or null when there are no candidates or the winner is "no directive"
     */
    public CostDirective select(Iterable<CostDirective> candidates) {
        CostDirective selected = null;
        boolean first = true;
        int selectedKey = 0;
        for (CostDirective candidate : candidates) {
            int key = compareKey.keyOf(candidate);
            if (first || key > selectedKey) {
                selected = candidate;
                selectedKey = key;
                first = false;
            }
        }
        return selected;
    }
}
