package org.jahia.graphql.complexity;

import graphql.Assert;
import graphql.PublicApi;
import org.jahia.graphql.complexity.directive.CostCompareKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Settings of the query complexity check.
 * <ul>
 * <li>{@code maxComplexity}: the budget, required</li>
 * <li>{@code defaultCost}: the cost of a field without cost directive, 0 by default</li>
 * <li>{@code reportComplexity}: whether the computed complexity is added to the response extensions, false by
 * default</li>
 * <li>{@code costCompareKey}: ranks competing directives, {@link CostCompareKey#DEFAULT} by default</li>
 * </ul>
 */
@PublicApi
public class QueryComplexityOptions {

    private static final Logger log = LoggerFactory.getLogger(QueryComplexityOptions.class);

    public static final String MAX_COMPLEXITY_ENV = "GRAPHQL_MAX_QUERY_COMPLEXITY";
    public static final String DEFAULT_COST_ENV = "GRAPHQL_DEFAULT_FIELD_COST";
    public static final String REPORT_COMPLEXITY_ENV = "GRAPHQL_REPORT_QUERY_COMPLEXITY";

    private final int maxComplexity;
    private final int defaultCost;
    private final boolean reportComplexity;
    private final CostCompareKey costCompareKey;

    private QueryComplexityOptions(Builder builder) {
        this.maxComplexity = builder.maxComplexity;
        this.defaultCost = builder.defaultCost;
        this.reportComplexity = builder.reportComplexity;
        this.costCompareKey = builder.costCompareKey;
    }

    public int getMaxComplexity() {
        return maxComplexity;
    }

    public int getDefaultCost() {
        return defaultCost;
    }

    public boolean isReportComplexity() {
        return reportComplexity;
    }

    public CostCompareKey getCostCompareKey() {
        return costCompareKey;
    }

    public QueryComplexityOptions transform(Consumer<Builder> builderConsumer) {
        Builder builder = newOptions()
                .maxComplexity(maxComplexity)
                .defaultCost(defaultCost)
                .reportComplexity(reportComplexity)
                .costCompareKey(costCompareKey);
        builderConsumer.accept(builder);
        return builder.build();
    }

    public static Builder newOptions() {
        return new Builder();
    }

    /**
     * Reads the options from the {@value #MAX_COMPLEXITY_ENV}, {@value #DEFAULT_COST_ENV} and
     * {@value #REPORT_COMPLEXITY_ENV} system environment variables.
     *
     * @throws QueryComplexityNotConfiguredException if {@value #MAX_COMPLEXITY_ENV} is not set to a number
     */
    public static QueryComplexityOptions fromEnvironment() {
        return fromEnvironment(System::getenv);
    }

    static QueryComplexityOptions fromEnvironment(Function<String, String> environment) {
        Integer maxComplexity = getEnvInt(environment, MAX_COMPLEXITY_ENV, null);
        if (maxComplexity == null) {
            throw new QueryComplexityNotConfiguredException(String.format("%s is not set, the query complexity budget is unknown", MAX_COMPLEXITY_ENV));
        }
        QueryComplexityOptions options = newOptions()
                .maxComplexity(maxComplexity)
                .defaultCost(getEnvInt(environment, DEFAULT_COST_ENV, 0))
                .reportComplexity(Boolean.parseBoolean(environment.apply(REPORT_COMPLEXITY_ENV)))
                .build();
        log.debug("Query complexity settings:");
        log.debug("  - max complexity: {}", options.getMaxComplexity());
        log.debug("  - default field cost: {}", options.getDefaultCost());
        log.debug("  - report complexity: {}", options.isReportComplexity());
        return options;
    }

    private static Integer getEnvInt(Function<String, String> environment, String name, Integer defaultValue) {
        String envValue = environment.apply(name);
        Integer value = defaultValue;
        if (envValue != null) {
            try {
                value = Integer.parseInt(envValue.trim());
            } catch (NumberFormatException ignored) {
                log.warn("Invalid number for system env {}: {}", name, envValue);
            }
        }
        return value;
    }

    @Override
    public String toString() {
        return "QueryComplexityOptions{maxComplexity=" + maxComplexity
                + ", defaultCost=" + defaultCost
                + ", reportComplexity=" + reportComplexity + '}';
    }

    public static class Builder {

        private Integer maxComplexity;
        private int defaultCost;
        private boolean reportComplexity;
        private CostCompareKey costCompareKey = CostCompareKey.DEFAULT;

        private Builder() {
        }

        public Builder maxComplexity(int maxComplexity) {
            this.maxComplexity = maxComplexity;
            return this;
        }

        public Builder defaultCost(int defaultCost) {
            this.defaultCost = defaultCost;
            return this;
        }

        public Builder reportComplexity(boolean reportComplexity) {
            this.reportComplexity = reportComplexity;
            return this;
        }

        public Builder costCompareKey(CostCompareKey costCompareKey) {
            this.costCompareKey = Assert.assertNotNull(costCompareKey, () -> "costCompareKey can't be null");
            return this;
        }

        public QueryComplexityOptions build() {
            Assert.assertNotNull(maxComplexity, () -> "maxComplexity is required");
            Assert.assertTrue(maxComplexity >= 0, () -> "maxComplexity must be >= 0");
            return new QueryComplexityOptions(this);
        }
    }
}
