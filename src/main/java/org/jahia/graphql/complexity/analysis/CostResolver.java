package org.jahia.graphql.complexity.analysis;

import graphql.Assert;
import graphql.Internal;
import org.jahia.graphql.complexity.directive.CostDirective;
import org.jahia.graphql.complexity.directive.FixedCost;
import org.jahia.graphql.complexity.directive.ListCost;

import java.util.HashSet;
import java.util.Set;

/**
 * Folds a {@link CostTree} into a single complexity, children first.
 * <ul>
 * <li>scope: the sum of its children</li>
 * <li>{@link ListCost}: {@code (addedComplexity + children) * m} summed over the multipliers found in the query,
 * or multiplied by the assumed size when there are none</li>
 * <li>{@link FixedCost}: the directive complexity, or the default cost when unset, plus the children</li>
 * <li>no directive: the default cost plus the children</li>
 * </ul>
 * Fragment references are resolved against the tree's fragment table at each spread site. A fragment spread
 * within its own body counts for nothing. Results saturate at the int bounds instead of overflowing.
 */
@Internal
public class CostResolver {

    private final int defaultCost;

    public CostResolver(int defaultCost) {
        this.defaultCost = defaultCost;
    }

    public int resolve(CostTree tree) {
        Assert.assertNotNull(tree, () -> "tree can't be null");
        return toInt(resolveNode(tree.getRoot(), tree.getFragments(), new HashSet<>()));
    }

    private long resolveElement(CostElement element, FragmentTable fragments, Set<String> resolving) {
        if (element instanceof FragmentReference) {
            String name = ((FragmentReference) element).getName();
            CostNode body = fragments.get(name);
            if (body == null || !resolving.add(name)) {
                return 0;
            }
            try {
                return resolveNode(body, fragments, resolving);
            } finally {
                resolving.remove(name);
            }
        }
        return resolveNode((CostNode) element, fragments, resolving);
    }

    private long resolveNode(CostNode node, FragmentTable fragments, Set<String> resolving) {
        long childrenComplexity = 0;
        for (CostElement child : node.getChildren()) {
            childrenComplexity = add(childrenComplexity, resolveElement(child, fragments, resolving));
        }
        if (node.isScope()) {
            return childrenComplexity;
        }

        CostDirective directive = node.getDirective();
        if (directive instanceof ListCost) {
            long base = add(node.getAddedComplexity(), childrenComplexity);
            if (node.getMultipliers().isEmpty()) {
                return multiply(base, ((ListCost) directive).getAssumedSizeOrDefault(0));
            }
            long complexity = 0;
            for (int multiplier : node.getMultipliers()) {
                complexity = add(complexity, multiply(base, multiplier));
            }
            return complexity;
        }
        if (directive instanceof FixedCost) {
            return add(((FixedCost) directive).getComplexityOrDefault(defaultCost), childrenComplexity);
        }
        return add(defaultCost, childrenComplexity);
    }

    private static long add(long a, long b) {
        return clamp(a + b);
    }

    private static long multiply(long a, long b) {
        // both operands are within the int range, the product fits in a long
        return clamp(a * b);
    }

    private static long clamp(long value) {
        return Math.max(Integer.MIN_VALUE, Math.min(Integer.MAX_VALUE, value));
    }

    private static int toInt(long value) {
        return (int) clamp(value);
    }
}
