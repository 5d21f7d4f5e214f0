package org.jahia.graphql.complexity.directive;

import graphql.PublicApi;
import graphql.schema.GraphQLFieldDefinition;
import graphql.schema.GraphQLNamedType;

/**
 * Reads back the cost directive attached to a schema element. How the directive got there is up to the schema.
 */
@PublicApi
public interface CostDirectiveProvider {

    /**
     * @return the directive on this field declaration, or null
     */
    CostDirective getFieldDirective(GraphQLFieldDefinition fieldDefinition);

    /**
     * @return the directive on this named type itself, or null
     */
    CostDirective getTypeDirective(GraphQLNamedType type);
}
