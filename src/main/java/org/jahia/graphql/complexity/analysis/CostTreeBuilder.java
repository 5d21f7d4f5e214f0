package org.jahia.graphql.complexity.analysis;

import graphql.Assert;
import graphql.Internal;
import graphql.language.Definition;
import graphql.language.Document;
import graphql.language.Field;
import graphql.language.FragmentDefinition;
import graphql.language.FragmentSpread;
import graphql.language.Node;
import graphql.language.OperationDefinition;
import graphql.schema.GraphQLCompositeType;
import graphql.schema.GraphQLFieldDefinition;
import graphql.schema.GraphQLOutputType;
import graphql.schema.GraphQLSchema;
import graphql.validation.DocumentVisitor;
import graphql.validation.LanguageTraversal;
import graphql.validation.TraversalContext;
import org.jahia.graphql.complexity.directive.CostDirective;
import org.jahia.graphql.complexity.directive.FixedCost;
import org.jahia.graphql.complexity.directive.ListCost;

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Walks a query document once and builds its {@link CostTree}.
 * <p>
 * Every selected field gets a {@link CostNode} appended to the node of its enclosing selection. Fragment bodies
 * are built as separate scopes recorded in the {@link FragmentTable}, and fragment spreads only leave a
 * {@link FragmentReference}, so a fragment can be spread before it is defined. Parent and output types are
 * tracked by the graphql-java {@link TraversalContext}, the same way the validation rules see them.
 * <p>
 * Instances are single use.
 */
@Internal
public class CostTreeBuilder implements DocumentVisitor {

    private static final String META_FIELD_PREFIX = "__";

    private final Document document;
    private final TraversalContext typeInfo;
    private final CostDirectiveLookup directiveLookup;
    private final FieldArgumentResolver argumentResolver;
    private final Map<String, Object> variables;
    private final OperationDefinition executedOperation;
    private final Set<String> definedFragments = new HashSet<>();

    private final FragmentTable fragments = new FragmentTable();
    private final Deque<CostNode> scopes = new ArrayDeque<>();
    private final Deque<Node<?>> scopeOwners = new ArrayDeque<>();
    private CostNode root;
    private OperationDefinition currentOperation;
    private Node<?> skippedNode;

    public CostTreeBuilder(GraphQLSchema schema,
                           Document document,
                           CostDirectiveLookup directiveLookup,
                           FieldArgumentResolver argumentResolver,
                           Map<String, Object> variables,
                           String operationName) {
        Assert.assertNotNull(schema, () -> "schema can't be null");
        this.document = Assert.assertNotNull(document, () -> "document can't be null");
        this.typeInfo = new TraversalContext(schema);
        this.directiveLookup = Assert.assertNotNull(directiveLookup, () -> "directiveLookup can't be null");
        this.argumentResolver = Assert.assertNotNull(argumentResolver, () -> "argumentResolver can't be null");
        this.variables = variables == null ? Collections.emptyMap() : variables;
        for (FragmentDefinition fragment : document.getDefinitionsOfType(FragmentDefinition.class)) {
            definedFragments.add(fragment.getName());
        }
        this.executedOperation = findOperation(document, operationName);
    }

    public CostTree build() {
        Assert.assertTrue(root == null, () -> "a CostTreeBuilder can only build once");
        new LanguageTraversal().traverse(document, this);
        Assert.assertTrue(scopes.isEmpty(), () -> "unbalanced cost scopes after traversal");
        return new CostTree(root, fragments);
    }

    @Override
    public void enter(Node node, List<Node> path) {
        typeInfo.enter(node, path);
        if (skippedNode != null) {
            return;
        }
        if (node instanceof Document) {
            root = CostNode.newScope();
            open(node, root);
        } else if (node instanceof OperationDefinition) {
            currentOperation = (OperationDefinition) node;
        } else if (node instanceof Field) {
            enterField((Field) node);
        } else if (node instanceof FragmentDefinition) {
            CostNode body = CostNode.newScope();
            fragments.put(((FragmentDefinition) node).getName(), body);
            open(node, body);
        } else if (node instanceof FragmentSpread) {
            String name = ((FragmentSpread) node).getName();
            if (definedFragments.contains(name)) {
                scopes.peek().addChild(new FragmentReference(name));
            }
        }
    }

    @Override
    public void leave(Node node, List<Node> path) {
        if (skippedNode != null) {
            if (skippedNode == node) {
                skippedNode = null;
            }
        } else {
            if (!scopeOwners.isEmpty() && scopeOwners.peek() == node) {
                scopeOwners.pop();
                scopes.pop().seal();
            }
            if (node instanceof OperationDefinition) {
                currentOperation = null;
            }
        }
        typeInfo.leave(node, path);
    }

    private void enterField(Field field) {
        String fieldName = field.getName();
        GraphQLCompositeType parentType = typeInfo.getParentType();
        if (fieldName.startsWith(META_FIELD_PREFIX) || parentType == null) {
            skippedNode = field;
            return;
        }
        List<GraphQLFieldDefinition> sites = directiveLookup.declarationSites(parentType, fieldName);
        if (sites == null) {
            skippedNode = field;
            return;
        }

        CostDirective directive = directiveLookup.fieldDirective(sites);
        CostNode node = CostNode.newField(directive);

        GraphQLOutputType resultType = typeInfo.getOutputType();
        if (resultType == null && !sites.isEmpty()) {
            // selections directly under a union are not tracked by the traversal context
            resultType = sites.get(0).getType();
        }
        CostDirective resultTypeDirective = directiveLookup.typeDirective(resultType);
        if (resultTypeDirective instanceof FixedCost) {
            node.addComplexity(((FixedCost) resultTypeDirective).getComplexityOrDefault(0));
        }

        if (directive instanceof ListCost) {
            addMultipliers(field, (ListCost) directive, node);
        }

        scopes.peek().addChild(node);
        open(field, node);
    }

    private void addMultipliers(Field field, ListCost directive, CostNode node) {
        if (directive.getScalingArguments().isEmpty()) {
            return;
        }
        OperationDefinition operation = currentOperation != null ? currentOperation : executedOperation;
        Map<String, Integer> arguments = argumentResolver.resolve(field, operation, variables);
        for (Map.Entry<String, Integer> argument : arguments.entrySet()) {
            if (directive.getScalingArguments().contains(argument.getKey())) {
                node.addMultiplier(argument.getValue());
            }
        }
    }

    private void open(Node<?> owner, CostNode node) {
        scopeOwners.push(owner);
        scopes.push(node);
    }

    private static OperationDefinition findOperation(Document document, String operationName) {
        OperationDefinition found = null;
        int count = 0;
        for (Definition<?> definition : document.getDefinitions()) {
            if (!(definition instanceof OperationDefinition)) {
                continue;
            }
            OperationDefinition operation = (OperationDefinition) definition;
            count++;
            if (operationName != null && operationName.equals(operation.getName())) {
                return operation;
            }
            found = operation;
        }
        return operationName == null && count == 1 ? found : null;
    }
}
