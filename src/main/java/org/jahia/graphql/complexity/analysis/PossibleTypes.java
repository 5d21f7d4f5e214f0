package org.jahia.graphql.complexity.analysis;

import graphql.PublicApi;
import graphql.schema.GraphQLInterfaceType;
import graphql.schema.GraphQLObjectType;
import graphql.schema.GraphQLUnionType;

import java.util.List;

/**
 * The concrete object types a polymorphic type can resolve to.
 */
@PublicApi
public interface PossibleTypes {

    List<GraphQLObjectType> implementersOf(GraphQLInterfaceType interfaceType);

    List<GraphQLObjectType> membersOf(GraphQLUnionType unionType);
}
