package org.jahia.graphql.complexity.analysis;

import graphql.Internal;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Fragment bodies of one document, by fragment name.
 */
@Internal
public final class FragmentTable {

    private final Map<String, CostNode> fragments = new LinkedHashMap<>();

    void put(String name, CostNode body) {
        fragments.put(name, body);
    }

    /**
     * @return the body of the fragment, or null when the document does not define it
     */
    public CostNode get(String name) {
        return fragments.get(name);
    }

    public Set<String> getNames() {
        return fragments.keySet();
    }
}
