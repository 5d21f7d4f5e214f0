package org.jahia.graphql.complexity;

import graphql.ErrorType;
import graphql.ExecutionInput;
import graphql.ExecutionResult;
import graphql.GraphQL;
import graphql.GraphQLError;
import graphql.introspection.IntrospectionQuery;
import graphql.execution.instrumentation.InstrumentationState;
import graphql.execution.preparsed.PreparsedDocumentEntry;
import graphql.execution.preparsed.PreparsedDocumentProvider;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

import static org.junit.jupiter.api.Assertions.*;

class QueryComplexityInstrumentationTest {

    private static final int MAX_COMPLEXITY = 200;

    private static GraphQL graphQL(QueryComplexityOptions options) {
        return GraphQL.newGraphQL(TestSchemas.library())
                .instrumentation(new QueryComplexityInstrumentation(options))
                .build();
    }

    private static QueryComplexityOptions options(int maxComplexity, boolean report) {
        return QueryComplexityOptions.newOptions()
                .maxComplexity(maxComplexity)
                .reportComplexity(report)
                .build();
    }

    private static Map<String, Object> complexityExtension(int current, int max) {
        Map<String, Object> complexity = new HashMap<>();
        complexity.put("current", current);
        complexity.put("max", max);
        return complexity;
    }

    private static Object reportedComplexity(ExecutionResult result) {
        return result.getExtensions() == null ? null : result.getExtensions().get("complexity");
    }

    @Test
    void queryOverBudgetIsRejected() {
        ExecutionResult result = graphQL(options(MAX_COMPLEXITY, true)).execute("query { exceedsMaxComplexity }");

        assertEquals(1, result.getErrors().size());
        GraphQLError error = result.getErrors().get(0);
        assertEquals("Complexity of 201 is greater than max complexity of 200", error.getMessage());
        assertEquals(ErrorType.ValidationError, error.getErrorType());
        assertEquals(Collections.singletonMap("complexity", complexityExtension(201, MAX_COMPLEXITY)), error.getExtensions());
        assertNull(result.getData());
    }

    @Test
    void rejectionDoesNotDependOnReporting() {
        ExecutionResult result = graphQL(options(MAX_COMPLEXITY, false)).execute("{ exceedsMaxComplexity }");

        assertEquals(1, result.getErrors().size());
        assertTrue(result.getErrors().get(0) instanceof QueryComplexityExceededException);
    }

    @Test
    void queryAtBudgetIsReported() {
        ExecutionResult result = graphQL(options(MAX_COMPLEXITY, true)).execute("{ ok }");

        assertTrue(result.getErrors().isEmpty());
        assertEquals(complexityExtension(200, MAX_COMPLEXITY), reportedComplexity(result));
    }

    @Test
    void nothingIsReportedWhenReportingIsOff() {
        ExecutionResult result = graphQL(options(MAX_COMPLEXITY, false)).execute("{ ok }");

        assertTrue(result.getErrors().isEmpty());
        assertNull(reportedComplexity(result));
    }

    @Test
    void variablesOfTheRequestScaleLists() {
        GraphQL graphQL = graphQL(options(10_000, true));
        String variableArguments = "query ($input: Int!) { press(limit: $input) { __typename title } }";
        String defaultVariables = "query ($input: Int! = 1000) { press(limit: $input) { __typename title } }";
        String inlineArguments = "query { press(limit: 1000) { __typename title } }";

        ExecutionResult bound = graphQL.execute(ExecutionInput.newExecutionInput()
                .query(variableArguments)
                .variables(Collections.singletonMap("input", 1000))
                .build());
        ExecutionResult defaulted = graphQL.execute(defaultVariables);
        ExecutionResult inline = graphQL.execute(inlineArguments);

        assertEquals(complexityExtension(3000, 10_000), reportedComplexity(bound));
        assertEquals(complexityExtension(3000, 10_000), reportedComplexity(defaulted));
        assertEquals(complexityExtension(3000, 10_000), reportedComplexity(inline));
    }

    @Test
    void cachedDocumentsAreCheckedOnEveryRequest() {
        CachingDocumentProvider documentProvider = new CachingDocumentProvider();
        GraphQL graphQL = GraphQL.newGraphQL(TestSchemas.library())
                .instrumentation(new QueryComplexityInstrumentation(options(MAX_COMPLEXITY, true)))
                .preparsedDocumentProvider(documentProvider)
                .build();
        String query = "query ($n: Int) { shelves(limit: $n) { label code } }";

        ExecutionResult small = graphQL.execute(ExecutionInput.newExecutionInput()
                .query(query)
                .variables(Collections.singletonMap("n", 1))
                .build());
        ExecutionResult large = graphQL.execute(ExecutionInput.newExecutionInput()
                .query(query)
                .variables(Collections.singletonMap("n", 1_000_000))
                .build());

        assertEquals(1, documentProvider.parses.get());
        assertTrue(small.getErrors().isEmpty(), () -> "errors: " + small.getErrors());
        assertEquals(complexityExtension(2, MAX_COMPLEXITY), reportedComplexity(small));
        assertEquals(1, large.getErrors().size());
        assertTrue(large.getErrors().get(0) instanceof QueryComplexityExceededException);
        assertEquals(Collections.singletonMap("complexity", complexityExtension(2_000_000, MAX_COMPLEXITY)),
                large.getErrors().get(0).getExtensions());
        assertEquals(complexityExtension(2_000_000, MAX_COMPLEXITY), reportedComplexity(large));
    }

    @Test
    void introspectionIsNotCounted() {
        QueryComplexityOptions options = QueryComplexityOptions.newOptions()
                .maxComplexity(1)
                .defaultCost(1)
                .build();

        ExecutionResult result = graphQL(options).execute(IntrospectionQuery.INTROSPECTION_QUERY);

        assertTrue(result.getErrors().isEmpty(), () -> "errors: " + result.getErrors());
        assertNull(reportedComplexity(result));
    }

    @Test
    void invalidDocumentsAreLeftToValidation() {
        ExecutionResult result = graphQL(options(0, true)).execute("{ ok unknownField }");

        assertFalse(result.getErrors().isEmpty());
        assertFalse(result.getErrors().get(0) instanceof QueryComplexityExceededException);
        assertEquals(ErrorType.ValidationError, result.getErrors().get(0).getErrorType());
        assertNull(reportedComplexity(result));
    }

    @Test
    void concurrentRequestsKeepTheirOwnResult() throws Exception {
        GraphQL graphQL = graphQL(options(Integer.MAX_VALUE, true));
        ExecutorService executor = Executors.newFixedThreadPool(8);
        try {
            List<Callable<Boolean>> requests = new ArrayList<>();
            for (int i = 1; i <= 64; i++) {
                int limit = i;
                requests.add(() -> {
                    ExecutionResult result = graphQL.execute("{ shelves(limit: " + limit + ") { label } }");
                    return complexityExtension(limit, Integer.MAX_VALUE).equals(reportedComplexity(result));
                });
            }
            for (Future<Boolean> response : executor.invokeAll(requests)) {
                assertTrue(response.get());
            }
        } finally {
            executor.shutdown();
            assertTrue(executor.awaitTermination(10, TimeUnit.SECONDS));
        }
    }

    @Test
    void stateStartsEmpty() {
        InstrumentationState state = new QueryComplexityInstrumentation(options(MAX_COMPLEXITY, true)).createState(null);

        assertTrue(state instanceof QueryComplexityState);
        assertFalse(((QueryComplexityState) state).getComplexityResult().isPresent());
    }

    @Test
    void foreignStateMeansNotConfigured() {
        QueryComplexityInstrumentation instrumentation = new QueryComplexityInstrumentation(options(MAX_COMPLEXITY, true));

        assertThrows(QueryComplexityNotConfiguredException.class, () -> instrumentation.beginExecuteOperation(null, null));
        assertThrows(QueryComplexityNotConfiguredException.class, () -> instrumentation.beginExecuteOperation(null, new InstrumentationState() {
        }));
    }

    @Test
    void missingConfigurationMeansNotConfigured() {
        assertThrows(QueryComplexityNotConfiguredException.class, () -> new QueryComplexityInstrumentation((QueryComplexityOptions) null));
        assertThrows(QueryComplexityNotConfiguredException.class, () -> new QueryComplexityInstrumentation((QueryComplexityAnalyzer) null));
    }

    private static class CachingDocumentProvider implements PreparsedDocumentProvider {

        private final Map<String, PreparsedDocumentEntry> cache = new ConcurrentHashMap<>();
        private final AtomicInteger parses = new AtomicInteger();

        public PreparsedDocumentEntry getDocument(ExecutionInput executionInput, Function<ExecutionInput, PreparsedDocumentEntry> parseAndValidateFunction) {
            return cache.computeIfAbsent(executionInput.getQuery(), query -> {
                parses.incrementAndGet();
                return parseAndValidateFunction.apply(executionInput);
            });
        }

        public CompletableFuture<PreparsedDocumentEntry> getDocumentAsync(ExecutionInput executionInput, Function<ExecutionInput, PreparsedDocumentEntry> parseAndValidateFunction) {
            return CompletableFuture.completedFuture(getDocument(executionInput, parseAndValidateFunction));
        }
    }
}
