package org.jahia.graphql.complexity.directive;

import graphql.PublicApi;
import graphql.schema.GraphQLArgument;
import graphql.schema.GraphQLDirective;

import static graphql.Scalars.GraphQLInt;
import static graphql.Scalars.GraphQLString;
import static graphql.introspection.Introspection.DirectiveLocation.FIELD_DEFINITION;
import static graphql.introspection.Introspection.DirectiveLocation.OBJECT;
import static graphql.schema.GraphQLList.list;
import static graphql.schema.GraphQLNonNull.nonNull;

/**
 * Definitions of the {@code @cost} and {@code @listCost} schema directives. Add {@link #COST} and
 * {@link #LIST_COST} to a programmatic schema, or prepend {@link #SDL} to an SDL schema.
 */
@PublicApi
public final class CostDirectives {

    public static final String COST_NAME = "cost";
    public static final String LIST_COST_NAME = "listCost";

    public static final String COMPLEXITY_ARGUMENT = "complexity";
    public static final String ASSUMED_SIZE_ARGUMENT = "assumedSize";
    public static final String ARGUMENTS_ARGUMENT = "arguments";
    public static final String SIZED_FIELDS_ARGUMENT = "sizedFields";

    public static final GraphQLDirective COST = GraphQLDirective.newDirective()
            .name(COST_NAME)
            .description("The fixed cost of resolving a field, or of every field returning the annotated type.")
            .argument(GraphQLArgument.newArgument().name(COMPLEXITY_ARGUMENT).type(GraphQLInt))
            .validLocations(FIELD_DEFINITION, OBJECT)
            .build();

    public static final GraphQLDirective LIST_COST = GraphQLDirective.newDirective()
            .name(LIST_COST_NAME)
            .description("Multiplies the cost of a list field's selections by the size of the list.")
            .argument(GraphQLArgument.newArgument().name(ASSUMED_SIZE_ARGUMENT).type(GraphQLInt))
            .argument(GraphQLArgument.newArgument().name(ARGUMENTS_ARGUMENT).type(list(nonNull(GraphQLString))))
            .argument(GraphQLArgument.newArgument().name(SIZED_FIELDS_ARGUMENT).type(list(nonNull(GraphQLString))))
            .validLocations(FIELD_DEFINITION)
            .build();

    public static final String SDL = ""
            + "directive @cost(complexity: Int) on FIELD_DEFINITION | OBJECT\n"
            + "directive @listCost(assumedSize: Int, arguments: [String!], sizedFields: [String!]) on FIELD_DEFINITION\n";

    private CostDirectives() {
    }
}
