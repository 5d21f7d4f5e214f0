package org.jahia.graphql.complexity.analysis;

import graphql.Internal;
import org.jahia.graphql.complexity.directive.CostDirective;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static graphql.Assert.assertTrue;

/**
 * One selected field, or one synthetic scope (the document root or a fragment body). Nodes are filled while the
 * document is traversed and sealed when the traversal leaves them; a sealed node can no longer change.
 */
@Internal
public final class CostNode implements CostElement {

    private final CostDirective directive;
    private final boolean scope;
    private int addedComplexity;
    private final List<Integer> multipliers = new ArrayList<>();
    private final List<CostElement> children = new ArrayList<>();
    private boolean sealed;

    private CostNode(CostDirective directive, boolean scope) {
        this.directive = directive;
        this.scope = scope;
    }

    /**
     * @return a node that only sums its children, used for the document root and fragment bodies
     */
    public static CostNode newScope() {
        return new CostNode(null, true);
    }

    /**
     * @param directive the governing directive of the field, may be null
     */
    public static CostNode newField(CostDirective directive) {
        return new CostNode(directive, false);
    }

    public CostDirective getDirective() {
        return directive;
    }

    public boolean isScope() {
        return scope;
    }

    public int getAddedComplexity() {
        return addedComplexity;
    }

    public List<Integer> getMultipliers() {
        return Collections.unmodifiableList(multipliers);
    }

    public List<CostElement> getChildren() {
        return Collections.unmodifiableList(children);
    }

    public boolean isSealed() {
        return sealed;
    }

    void addComplexity(int complexity) {
        checkOpen();
        addedComplexity += complexity;
    }

    void addMultiplier(int multiplier) {
        checkOpen();
        multipliers.add(multiplier);
    }

    void addChild(CostElement child) {
        checkOpen();
        children.add(child);
    }

    void seal() {
        sealed = true;
    }

    private void checkOpen() {
        assertTrue(!sealed, () -> "cost node is sealed");
    }

    @Override
    public String toString() {
        return "CostNode{directive=" + directive
                + ", scope=" + scope
                + ", addedComplexity=" + addedComplexity
                + ", multipliers=" + multipliers
                + ", children=" + children + '}';
    }
}
