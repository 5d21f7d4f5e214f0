package org.jahia.graphql.complexity.directive;

import graphql.schema.GraphQLAppliedDirective;
import graphql.schema.GraphQLAppliedDirectiveArgument;
import graphql.schema.GraphQLFieldDefinition;
import graphql.schema.GraphQLObjectType;
import graphql.schema.GraphQLSchema;
import org.jahia.graphql.complexity.TestSchemas;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;

import static graphql.Scalars.GraphQLInt;
import static graphql.Scalars.GraphQLString;
import static org.junit.jupiter.api.Assertions.*;

class AppliedCostDirectiveProviderTest {

    private final AppliedCostDirectiveProvider provider = AppliedCostDirectiveProvider.INSTANCE;

    @Test
    void readsFieldDirectivesFromSdl() {
        GraphQLObjectType query = TestSchemas.library().getQueryType();

        assertEquals(new ListCost(10, Collections.singletonList("limit")), provider.getFieldDirective(query.getFieldDefinition("books")));
        assertEquals(new ListCost(3, Arrays.asList("first", "last")), provider.getFieldDirective(query.getFieldDefinition("window")));
        assertEquals(new ListCost(5, Collections.emptyList()), provider.getFieldDirective(query.getFieldDefinition("search")));
        assertEquals(new FixedCost(200), provider.getFieldDirective(query.getFieldDefinition("ok")));
        assertEquals(new FixedCost(null), provider.getFieldDirective(query.getFieldDefinition("unsetCost")));
        assertNull(provider.getFieldDirective(query.getFieldDefinition("hello")));
    }

    @Test
    void readsTypeDirectivesFromSdl() {
        GraphQLSchema schema = TestSchemas.library();

        assertEquals(new FixedCost(1), provider.getTypeDirective(schema.getObjectType("Book")));
        assertNull(provider.getTypeDirective(schema.getObjectType("Issue")));
        assertNull(provider.getTypeDirective(GraphQLString));
    }

    @Test
    void listCostWinsOverCost() {
        GraphQLSchema schema = TestSchemas.fromSdl(CostDirectives.SDL
                + "type Query { both(first: Int): [String] @cost(complexity: 50) @listCost(assumedSize: 4, arguments: [\"first\"], sizedFields: [\"edges\"]) }");

        CostDirective directive = provider.getFieldDirective(schema.getQueryType().getFieldDefinition("both"));

        assertEquals(new ListCost(4, Collections.singletonList("first"), Collections.singletonList("edges")), directive);
    }

    @Test
    void readsProgrammaticDirectives() {
        GraphQLAppliedDirective cost = GraphQLAppliedDirective.newDirective()
                .name(CostDirectives.COST_NAME)
                .argument(GraphQLAppliedDirectiveArgument.newArgument()
                        .name(CostDirectives.COMPLEXITY_ARGUMENT)
                        .type(GraphQLInt)
                        .valueProgrammatic(7)
                        .build())
                .build();
        GraphQLObjectType query = GraphQLObjectType.newObject()
                .name("Query")
                .field(GraphQLFieldDefinition.newFieldDefinition()
                        .name("expensive")
                        .type(GraphQLString)
                        .withAppliedDirective(cost))
                .build();
        GraphQLSchema schema = GraphQLSchema.newSchema()
                .query(query)
                .additionalDirective(CostDirectives.COST)
                .additionalDirective(CostDirectives.LIST_COST)
                .build();

        assertEquals(new FixedCost(7), provider.getFieldDirective(schema.getQueryType().getFieldDefinition("expensive")));
        assertNotNull(schema.getDirective(CostDirectives.LIST_COST_NAME));
    }
}
