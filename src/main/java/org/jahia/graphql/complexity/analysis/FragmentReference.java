package org.jahia.graphql.complexity.analysis;

import graphql.Assert;
import graphql.Internal;

/**
 * Placeholder left where a fragment is spread. The fragment body may not have been visited yet, it is looked up
 * by name in the {@link FragmentTable} once the whole document has been traversed.
 */
@Internal
public final class FragmentReference implements CostElement {

    private final String name;

    public FragmentReference(String name) {
        this.name = Assert.assertNotNull(name, () -> "fragment name can't be null");
    }

    public String getName() {
        return name;
    }

    @Override
    public String toString() {
        return "..." + name;
    }
}
