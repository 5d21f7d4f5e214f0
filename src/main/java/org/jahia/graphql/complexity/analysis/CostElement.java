package org.jahia.graphql.complexity.analysis;

import graphql.Internal;

/**
 * A child of a {@link CostNode}: either a node built for a selected field, or a {@link FragmentReference} to a
 * fragment body resolved later.
 */
@Internal
public interface CostElement {
}
