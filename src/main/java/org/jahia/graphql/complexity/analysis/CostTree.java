package org.jahia.graphql.complexity.analysis;

import graphql.Internal;

/**
 * The output of {@link CostTreeBuilder}: the root scope of the document and the fragment bodies its
 * {@link FragmentReference}s point to.
 */
@Internal
public final class CostTree {

    private final CostNode root;
    private final FragmentTable fragments;

    CostTree(CostNode root, FragmentTable fragments) {
        this.root = root;
        this.fragments = fragments;
    }

    public CostNode getRoot() {
        return root;
    }

    public FragmentTable getFragments() {
        return fragments;
    }
}
