package org.jahia.graphql.complexity;

import graphql.ExecutionResult;
import graphql.ExecutionInput;
import graphql.PublicApi;
import graphql.execution.ExecutionContext;
import graphql.execution.instrumentation.InstrumentationContext;
import graphql.execution.instrumentation.InstrumentationState;
import graphql.execution.instrumentation.SimpleInstrumentationContext;
import graphql.execution.instrumentation.SimplePerformantInstrumentation;
import graphql.execution.instrumentation.parameters.InstrumentationCreateStateParameters;
import graphql.execution.instrumentation.parameters.InstrumentationExecuteOperationParameters;
import graphql.execution.instrumentation.parameters.InstrumentationExecutionParameters;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Rejects queries whose estimated complexity is above {@link QueryComplexityOptions#getMaxComplexity()}.
 * <p>
 * The estimate is computed for every request when its operation starts executing, so documents served from a
 * {@link graphql.execution.preparsed.PreparsedDocumentProvider} cache are gated with the variables of the current
 * request. A query over budget is aborted with a {@link QueryComplexityExceededException} before any field is
 * fetched. Documents failing validation never reach execution and are left to the validation errors. When
 * {@link QueryComplexityOptions#isReportComplexity()} is set, the {@code complexity} extension of the response
 * carries the computed {@link ComplexityResult}.
 */
@PublicApi
public class QueryComplexityInstrumentation extends SimplePerformantInstrumentation {

    private final QueryComplexityAnalyzer analyzer;

    public QueryComplexityInstrumentation(QueryComplexityOptions options) {
        this(new QueryComplexityAnalyzer(options));
    }

    public QueryComplexityInstrumentation(QueryComplexityAnalyzer analyzer) {
        if (analyzer == null) {
            throw new QueryComplexityNotConfiguredException("No query complexity analyzer has been provided");
        }
        this.analyzer = analyzer;
    }

    @Override
    public InstrumentationState createState(InstrumentationCreateStateParameters parameters) {
        return new QueryComplexityState();
    }

    @Override
    public InstrumentationContext<ExecutionResult> beginExecuteOperation(InstrumentationExecuteOperationParameters parameters, InstrumentationState state) {
        QueryComplexityState complexityState = ofState(state);
        ExecutionContext executionContext = parameters.getExecutionContext();
        ExecutionInput executionInput = executionContext.getExecutionInput();
        ComplexityOutcome outcome = analyzer.analyze(executionContext.getGraphQLSchema(), executionContext.getDocument(),
                executionInput.getVariables(), executionInput.getOperationName());
        complexityState.setComplexityResult(outcome.getResult());
        if (outcome.isViolation()) {
            throw outcome.toException();
        }
        return SimpleInstrumentationContext.noOp();
    }

    @Override
    public CompletableFuture<ExecutionResult> instrumentExecutionResult(ExecutionResult executionResult, InstrumentationExecutionParameters parameters, InstrumentationState state) {
        if (analyzer.getOptions().isReportComplexity() && state instanceof QueryComplexityState) {
            Optional<ComplexityResult> result = ((QueryComplexityState) state).getComplexityResult();
            if (result.isPresent()) {
                return CompletableFuture.completedFuture(executionResult.transform(builder ->
                        builder.addExtension(QueryComplexityExceededException.EXTENSION_KEY, result.get().toSpecification())));
            }
        }
        return CompletableFuture.completedFuture(executionResult);
    }

    private static QueryComplexityState ofState(InstrumentationState state) {
        if (!(state instanceof QueryComplexityState)) {
            throw new QueryComplexityNotConfiguredException(String.format(
                    "Expected a %s but got %s, make sure the instrumentation state created by %s is passed along",
                    QueryComplexityState.class.getSimpleName(), state, QueryComplexityInstrumentation.class.getSimpleName()));
        }
        return (QueryComplexityState) state;
    }
}
