package eu.okaeri.query.filter;

import eu.okaeri.query.QueryValidationException;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NonNull;
import lombok.ToString;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Conjunction or disjunction over one or more child filters.
 * Child order is kept as given but carries no meaning for the result.
 */
@Getter
@ToString
@EqualsAndHashCode
public class CompositeFilter implements Filter {

    private final LogicalOperator operator;
    private final List<Filter> children;

    public CompositeFilter(@NonNull LogicalOperator operator, @NonNull List<? extends Filter> children) {
        if (children.isEmpty()) {
            throw new QueryValidationException(operator + " filter requires at least one child");
        }
        List<Filter> copy = new ArrayList<>(children.size());
        for (Filter child : children) {
            if (child == null) {
                throw new QueryValidationException(operator + " filter cannot contain null children");
            }
            copy.add(child);
        }
        this.operator = operator;
        this.children = Collections.unmodifiableList(copy);
    }

    public boolean isAnd() {
        return this.operator == LogicalOperator.AND;
    }

    public boolean isOr() {
        return this.operator == LogicalOperator.OR;
    }
}
