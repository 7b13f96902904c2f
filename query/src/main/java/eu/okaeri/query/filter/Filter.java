package eu.okaeri.query.filter;

import eu.okaeri.query.filter.condition.Condition;
import lombok.NonNull;

import java.util.Arrays;
import java.util.List;

/**
 * Boolean filter tree. Closed set of shapes: a leaf {@link Condition},
 * an AND/OR {@link CompositeFilter} or a {@link NotFilter}.
 */
public interface Filter {

    static CompositeFilter and(@NonNull Filter... children) {
        return new CompositeFilter(LogicalOperator.AND, Arrays.asList(children));
    }

    static CompositeFilter and(@NonNull List<? extends Filter> children) {
        return new CompositeFilter(LogicalOperator.AND, children);
    }

    static CompositeFilter or(@NonNull Filter... children) {
        return new CompositeFilter(LogicalOperator.OR, Arrays.asList(children));
    }

    static CompositeFilter or(@NonNull List<? extends Filter> children) {
        return new CompositeFilter(LogicalOperator.OR, children);
    }

    static NotFilter not(@NonNull Filter child) {
        return new NotFilter(child);
    }
}
