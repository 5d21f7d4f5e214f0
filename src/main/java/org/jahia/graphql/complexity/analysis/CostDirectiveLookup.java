package org.jahia.graphql.complexity.analysis;

import graphql.Assert;
import graphql.Internal;
import graphql.schema.GraphQLCompositeType;
import graphql.schema.GraphQLFieldDefinition;
import graphql.schema.GraphQLFieldsContainer;
import graphql.schema.GraphQLInterfaceType;
import graphql.schema.GraphQLNamedType;
import graphql.schema.GraphQLObjectType;
import graphql.schema.GraphQLType;
import graphql.schema.GraphQLTypeUtil;
import graphql.schema.GraphQLUnionType;
import org.jahia.graphql.complexity.directive.CostDirective;
import org.jahia.graphql.complexity.directive.CostDirectiveProvider;
import org.jahia.graphql.complexity.directive.CostDirectiveSelector;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Finds the cost directive governing a field selection, fanning out over the implementations of interfaces and
 * the members of unions.
 */
@Internal
public class CostDirectiveLookup {

    private final CostDirectiveProvider provider;
    private final PossibleTypes possibleTypes;
    private final CostDirectiveSelector selector;

    public CostDirectiveLookup(CostDirectiveProvider provider, PossibleTypes possibleTypes, CostDirectiveSelector selector) {
        this.provider = Assert.assertNotNull(provider, () -> "provider can't be null");
        this.possibleTypes = Assert.assertNotNull(possibleTypes, () -> "possibleTypes can't be null");
        this.selector = Assert.assertNotNull(selector, () -> "selector can't be null");
    }

    /**
     * The concrete declarations a selection of {@code fieldName} under {@code parentType} can resolve to: the
     * declaration on every implementation of an interface, on every union member declaring it, or the single
     * declaration of an object type.
     *
     * @return the declarations, empty for an interface without implementations, or null when the field is not
     * declared on the parent type at all
     */
    public List<GraphQLFieldDefinition> declarationSites(GraphQLCompositeType parentType, String fieldName) {
        if (parentType instanceof GraphQLUnionType) {
            List<GraphQLFieldDefinition> sites = collectSites(possibleTypes.membersOf((GraphQLUnionType) parentType), fieldName);
            return sites.isEmpty() ? null : sites;
        }
        if (!(parentType instanceof GraphQLFieldsContainer)) {
            return null;
        }
        GraphQLFieldDefinition declared = ((GraphQLFieldsContainer) parentType).getFieldDefinition(fieldName);
        if (declared == null) {
            return null;
        }
        if (parentType instanceof GraphQLInterfaceType) {
            return collectSites(possibleTypes.implementersOf((GraphQLInterfaceType) parentType), fieldName);
        }
        return Collections.singletonList(declared);
    }

    public CostDirective fieldDirective(List<GraphQLFieldDefinition> declarationSites) {
        List<CostDirective> candidates = new ArrayList<>(declarationSites.size());
        for (GraphQLFieldDefinition site : declarationSites) {
            candidates.add(provider.getFieldDirective(site));
        }
        return selector.select(candidates);
    }

    /**
     * The directive attached to the type a field returns, list and non null wrappers removed. An interface carries no
     * cost itself, the most expensive of its implementations is used instead. A union only counts its own directives,
     * its members are costed through the inline fragments selecting them.
     */
    public CostDirective typeDirective(GraphQLType type) {
        if (type == null) {
            return null;
        }
        GraphQLNamedType namedType = GraphQLTypeUtil.unwrapAll(type);
        if (namedType instanceof GraphQLInterfaceType) {
            return selectAmong(possibleTypes.implementersOf((GraphQLInterfaceType) namedType));
        }
        return provider.getTypeDirective(namedType);
    }

    private CostDirective selectAmong(List<GraphQLObjectType> objectTypes) {
        List<CostDirective> candidates = new ArrayList<>(objectTypes.size());
        for (GraphQLObjectType objectType : objectTypes) {
            candidates.add(provider.getTypeDirective(objectType));
        }
        return selector.select(candidates);
    }

    private static List<GraphQLFieldDefinition> collectSites(List<GraphQLObjectType> objectTypes, String fieldName) {
        List<GraphQLFieldDefinition> sites = new ArrayList<>(objectTypes.size());
        for (GraphQLObjectType objectType : objectTypes) {
            GraphQLFieldDefinition site = objectType.getFieldDefinition(fieldName);
            if (site != null) {
                sites.add(site);
            }
        }
        return sites;
    }
}
