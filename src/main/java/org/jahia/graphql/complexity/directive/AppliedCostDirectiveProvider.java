package org.jahia.graphql.complexity.directive;

import graphql.PublicApi;
import graphql.schema.GraphQLAppliedDirective;
import graphql.schema.GraphQLAppliedDirectiveArgument;
import graphql.schema.GraphQLDirectiveContainer;
import graphql.schema.GraphQLFieldDefinition;
import graphql.schema.GraphQLNamedType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

import static org.jahia.graphql.complexity.directive.CostDirectives.ARGUMENTS_ARGUMENT;
import static org.jahia.graphql.complexity.directive.CostDirectives.ASSUMED_SIZE_ARGUMENT;
import static org.jahia.graphql.complexity.directive.CostDirectives.COMPLEXITY_ARGUMENT;
import static org.jahia.graphql.complexity.directive.CostDirectives.COST_NAME;
import static org.jahia.graphql.complexity.directive.CostDirectives.LIST_COST_NAME;
import static org.jahia.graphql.complexity.directive.CostDirectives.SIZED_FIELDS_ARGUMENT;

/**
 * Reads {@code @listCost} and {@code @cost} from the applied directives of graphql-java schema elements. When an
 * element carries both, {@code @listCost} wins.
 */
@PublicApi
public class AppliedCostDirectiveProvider implements CostDirectiveProvider {

    public static final AppliedCostDirectiveProvider INSTANCE = new AppliedCostDirectiveProvider();

    private static final Logger log = LoggerFactory.getLogger(AppliedCostDirectiveProvider.class);

    @Override
    public CostDirective getFieldDirective(GraphQLFieldDefinition fieldDefinition) {
        return fromContainer(fieldDefinition);
    }

    @Override
    public CostDirective getTypeDirective(GraphQLNamedType type) {
        if (type instanceof GraphQLDirectiveContainer) {
            return fromContainer((GraphQLDirectiveContainer) type);
        }
        return null;
    }

    private CostDirective fromContainer(GraphQLDirectiveContainer container) {
        GraphQLAppliedDirective listCost = container.getAppliedDirective(LIST_COST_NAME);
        if (listCost != null) {
            return new ListCost(intArgument(listCost, ASSUMED_SIZE_ARGUMENT),
                    stringsArgument(listCost, ARGUMENTS_ARGUMENT),
                    stringsArgument(listCost, SIZED_FIELDS_ARGUMENT));
        }
        GraphQLAppliedDirective cost = container.getAppliedDirective(COST_NAME);
        if (cost != null) {
            return new FixedCost(intArgument(cost, COMPLEXITY_ARGUMENT));
        }
        return null;
    }

    private static Object argumentValue(GraphQLAppliedDirective directive, String name) {
        GraphQLAppliedDirectiveArgument argument = directive.getArgument(name);
        if (argument == null || !argument.hasSetValue()) {
            return null;
        }
        return argument.getValue();
    }

    private static Integer intArgument(GraphQLAppliedDirective directive, String name) {
        Object value = argumentValue(directive, name);
        if (value instanceof Integer) {
            return (Integer) value;
        }
        if (value instanceof Number) {
            return ((Number) value).intValue();
        }
        if (value != null) {
            log.warn("Ignoring non integer value {} for argument '{}' of @{}", value, name, directive.getName());
        }
        return null;
    }

    private static List<String> stringsArgument(GraphQLAppliedDirective directive, String name) {
        Object value = argumentValue(directive, name);
        if (value instanceof Collection) {
            List<String> strings = new ArrayList<>();
            for (Object item : (Collection<?>) value) {
                if (item != null) {
                    strings.add(item.toString());
                }
            }
            return strings;
        }
        if (value instanceof String) {
            return Collections.singletonList((String) value);
        }
        return Collections.emptyList();
    }
}
