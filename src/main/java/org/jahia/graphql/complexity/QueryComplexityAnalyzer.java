package org.jahia.graphql.complexity;

import graphql.Assert;
import graphql.PublicApi;
import graphql.language.Document;
import graphql.schema.GraphQLSchema;
import org.jahia.graphql.complexity.analysis.BudgetGate;
import org.jahia.graphql.complexity.analysis.CostDirectiveLookup;
import org.jahia.graphql.complexity.analysis.CostResolver;
import org.jahia.graphql.complexity.analysis.CostTree;
import org.jahia.graphql.complexity.analysis.CostTreeBuilder;
import org.jahia.graphql.complexity.analysis.FieldArgumentResolver;
import org.jahia.graphql.complexity.analysis.SchemaPossibleTypes;
import org.jahia.graphql.complexity.directive.AppliedCostDirectiveProvider;
import org.jahia.graphql.complexity.directive.CostDirectiveProvider;
import org.jahia.graphql.complexity.directive.CostDirectiveSelector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Estimates the complexity of a query document from the {@code @cost} and {@code @listCost} directives of the
 * schema and the arguments of the request, and checks it against the budget.
 * <p>
 * The analyzer holds no per-request state and can be shared.
 */
@PublicApi
public class QueryComplexityAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(QueryComplexityAnalyzer.class);

    private final QueryComplexityOptions options;
    private final CostDirectiveProvider directiveProvider;
    private final CostDirectiveSelector directiveSelector;
    private final FieldArgumentResolver argumentResolver = new FieldArgumentResolver();
    private final BudgetGate budgetGate;

    public QueryComplexityAnalyzer(QueryComplexityOptions options) {
        this(options, AppliedCostDirectiveProvider.INSTANCE);
    }

    public QueryComplexityAnalyzer(QueryComplexityOptions options, CostDirectiveProvider directiveProvider) {
        if (options == null) {
            throw new QueryComplexityNotConfiguredException("No query complexity options have been provided");
        }
        this.options = options;
        this.directiveProvider = Assert.assertNotNull(directiveProvider, () -> "directiveProvider can't be null");
        this.directiveSelector = new CostDirectiveSelector(options.getCostCompareKey());
        this.budgetGate = new BudgetGate(options.getMaxComplexity());
    }

    public QueryComplexityOptions getOptions() {
        return options;
    }

    /**
     * @param schema        the schema the document is validated against
     * @param document      the parsed document
     * @param variables     the variables of the request, may be null
     * @param operationName the name of the executed operation, may be null
     *
     * @return a pass or a violation, both carrying the computed complexity
     */
    public ComplexityOutcome analyze(GraphQLSchema schema, Document document, Map<String, Object> variables, String operationName) {
        CostDirectiveLookup directiveLookup = new CostDirectiveLookup(directiveProvider, new SchemaPossibleTypes(schema), directiveSelector);
        CostTree tree = new CostTreeBuilder(schema, document, directiveLookup, argumentResolver, variables, operationName).build();
        int complexity = new CostResolver(options.getDefaultCost()).resolve(tree);

        ComplexityOutcome outcome = budgetGate.check(complexity);
        if (outcome.isViolation()) {
            log.debug("Rejecting query: complexity {} is above max complexity {}", complexity, options.getMaxComplexity());
        } else {
            log.debug("Query complexity: {} (max {})", complexity, options.getMaxComplexity());
        }
        return outcome;
    }
}
