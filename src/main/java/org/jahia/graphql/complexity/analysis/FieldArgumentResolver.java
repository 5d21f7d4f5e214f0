package org.jahia.graphql.complexity.analysis;

import graphql.Internal;
import graphql.language.Argument;
import graphql.language.Field;
import graphql.language.IntValue;
import graphql.language.OperationDefinition;
import graphql.language.Value;
import graphql.language.VariableDefinition;
import graphql.language.VariableReference;

import java.math.BigInteger;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Resolves the integer value of the arguments of a field invocation, before the request is executed.
 * <p>
 * For each argument the first of these wins:
 * <ol>
 * <li>an integer literal written in the query</li>
 * <li>the value bound to the referenced variable in the request, when it is an integer or a string of digits</li>
 * <li>the integer literal default declared for the referenced variable by the operation</li>
 * </ol>
 * A variable bound to anything else is not resolved, its declared default is not used either. Arguments that do
 * not resolve are left out. Values beyond the int range are clamped.
 */
@Internal
public class FieldArgumentResolver {

    private static final Pattern DIGITS = Pattern.compile("[0-9]+");
    private static final BigInteger INT_MIN = BigInteger.valueOf(Integer.MIN_VALUE);
    private static final BigInteger INT_MAX = BigInteger.valueOf(Integer.MAX_VALUE);

    /**
     * @param field     the field invocation
     * @param operation the operation declaring the variables, may be null
     * @param variables the variables bound in the request, may be null
     *
     * @return resolved values by argument name, in the order the arguments are written
     */
    public Map<String, Integer> resolve(Field field, OperationDefinition operation, Map<String, Object> variables) {
        Map<String, Object> boundVariables = variables == null ? Collections.emptyMap() : variables;
        Map<String, Integer> result = new LinkedHashMap<>();
        for (Argument argument : field.getArguments()) {
            Value<?> value = argument.getValue();
            if (value instanceof IntValue) {
                result.put(argument.getName(), clamp(((IntValue) value).getValue()));
                continue;
            }
            if (!(value instanceof VariableReference)) {
                continue;
            }
            String variableName = ((VariableReference) value).getName();
            if (boundVariables.containsKey(variableName)) {
                Integer bound = fromBoundValue(boundVariables.get(variableName));
                if (bound != null) {
                    result.put(argument.getName(), bound);
                }
                continue;
            }
            Integer declaredDefault = declaredDefault(operation, variableName);
            if (declaredDefault != null) {
                result.put(argument.getName(), declaredDefault);
            }
        }
        return result;
    }

    private static Integer declaredDefault(OperationDefinition operation, String variableName) {
        if (operation == null) {
            return null;
        }
        for (VariableDefinition definition : operation.getVariableDefinitions()) {
            if (definition.getName().equals(variableName)) {
                Value<?> defaultValue = definition.getDefaultValue();
                return defaultValue instanceof IntValue ? clamp(((IntValue) defaultValue).getValue()) : null;
            }
        }
        return null;
    }

    private static Integer fromBoundValue(Object value) {
        if (value instanceof Integer || value instanceof Long || value instanceof Short || value instanceof Byte) {
            return clamp(BigInteger.valueOf(((Number) value).longValue()));
        }
        if (value instanceof BigInteger) {
            return clamp((BigInteger) value);
        }
        if (value instanceof String && DIGITS.matcher((String) value).matches()) {
            return clamp(new BigInteger((String) value));
        }
        return null;
    }

    private static int clamp(BigInteger value) {
        return value.max(INT_MIN).min(INT_MAX).intValue();
    }
}
