package org.jahia.graphql.complexity.analysis;

import graphql.Assert;
import graphql.Internal;
import graphql.schema.GraphQLInterfaceType;
import graphql.schema.GraphQLNamedOutputType;
import graphql.schema.GraphQLObjectType;
import graphql.schema.GraphQLSchema;
import graphql.schema.GraphQLUnionType;

import java.util.ArrayList;
import java.util.List;

@Internal
public class SchemaPossibleTypes implements PossibleTypes {

    private final GraphQLSchema schema;

    public SchemaPossibleTypes(GraphQLSchema schema) {
        this.schema = Assert.assertNotNull(schema, () -> "schema can't be null");
    }

    @Override
    public List<GraphQLObjectType> implementersOf(GraphQLInterfaceType interfaceType) {
        return schema.getImplementations(interfaceType);
    }

    @Override
    public List<GraphQLObjectType> membersOf(GraphQLUnionType unionType) {
        List<GraphQLObjectType> members = new ArrayList<>();
        for (GraphQLNamedOutputType type : unionType.getTypes()) {
            // skips unresolved type references
            if (type instanceof GraphQLObjectType) {
                members.add((GraphQLObjectType) type);
            }
        }
        return members;
    }
}
