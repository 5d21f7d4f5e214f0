package org.jahia.graphql.complexity.directive;

import graphql.PublicApi;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * {@code @listCost(assumedSize: Int, arguments: [String!], sizedFields: [String!])}: multiplies the cost of a
 * field's selections by the size of the list it returns.
 * <p>
 * The size is taken from the field arguments named in {@link #getScalingArguments()} when the query supplies them,
 * otherwise {@link #getAssumedSize()} is used.
 */
@PublicApi
public final class ListCost extends CostDirective {

    private final Integer assumedSize;
    private final Set<String> scalingArguments;
    private final List<String> sizedFields;

    public ListCost(Integer assumedSize, Collection<String> scalingArguments) {
        this(assumedSize, scalingArguments, Collections.emptyList());
    }

    public ListCost(Integer assumedSize, Collection<String> scalingArguments, List<String> sizedFields) {
        this.assumedSize = assumedSize;
        this.scalingArguments = Collections.unmodifiableSet(withoutNulls(scalingArguments, new LinkedHashSet<>()));
        this.sizedFields = Collections.unmodifiableList(withoutNulls(sizedFields, new ArrayList<>()));
    }

    private static <C extends Collection<String>> C withoutNulls(Collection<String> source, C target) {
        if (source != null) {
            for (String name : source) {
                if (name != null) {
                    target.add(name);
                }
            }
        }
        return target;
    }

    /**
     * @return the declared assumed size, or null when the directive was applied without one
     */
    public Integer getAssumedSize() {
        return assumedSize;
    }

    public int getAssumedSizeOrDefault(int defaultValue) {
        return valueOrDefault(assumedSize, defaultValue);
    }

    public Set<String> getScalingArguments() {
        return scalingArguments;
    }

    /**
     * Carried over from the directive definition so custom {@link CostCompareKey}s can look at it; the estimate
     * itself does not use it.
     */
    public List<String> getSizedFields() {
        return sizedFields;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        ListCost that = (ListCost) o;
        return Objects.equals(assumedSize, that.assumedSize)
                && scalingArguments.equals(that.scalingArguments)
                && sizedFields.equals(that.sizedFields);
    }

    @Override
    public int hashCode() {
        return Objects.hash(assumedSize, scalingArguments, sizedFields);
    }

    @Override
    public String toString() {
        return "ListCost{assumedSize=" + assumedSize + ", scalingArguments=" + scalingArguments
                + ", sizedFields=" + sizedFields + '}';
    }
}
