package eu.okaeri.query.evaluate;

import eu.okaeri.query.filter.CompositeFilter;
import eu.okaeri.query.filter.Filter;
import eu.okaeri.query.filter.NotFilter;
import eu.okaeri.query.filter.condition.Condition;
import eu.okaeri.query.sort.NullOrdering;
import eu.okaeri.query.sort.Sort;
import eu.okaeri.query.sort.SortDirection;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

import static eu.okaeri.query.value.ValueUtils.compareForSort;
import static eu.okaeri.query.value.ValueUtils.extractValue;

/**
 * Evaluates filters and sorts against rows held in memory.
 * <p>
 * Filter trees are walked with an explicit stack, arbitrarily deep
 * nesting does not grow the call stack. Absent fields evaluate as null.
 */
public class InMemoryFilterEvaluator {

    /**
     * Apply the filter and the sort to a stream of rows.
     */
    public Stream<Map<String, Object>> applyFilter(@NonNull Stream<Map<String, Object>> stream, Filter filter, @NonNull List<Sort> sort) {

        // Apply WHERE clause
        if (filter != null) {
            stream = stream.filter(row -> this.matches(filter, row));
        }

        // Apply ORDER BY
        Comparator<Map<String, Object>> comparator = this.buildComparator(sort);
        if (comparator != null) {
            stream = stream.sorted(comparator);
        }

        return stream;
    }

    /**
     * Evaluate a filter tree against a row.
     */
    public boolean matches(@NonNull Filter filter, @NonNull Map<String, Object> row) {

        Deque<Frame> pending = new ArrayDeque<>();
        Deque<Boolean> results = new ArrayDeque<>();
        pending.push(new Frame(filter, false));

        while (!pending.isEmpty()) {

            Frame frame = pending.pop();
            Filter current = frame.filter;

            if (current instanceof Condition) {
                results.push(this.evaluateCondition((Condition) current, row));
                continue;
            }

            List<Filter> children = children(current);
            if (!frame.expanded) {
                pending.push(new Frame(current, true));
                for (int i = children.size() - 1; i >= 0; i--) {
                    pending.push(new Frame(children.get(i), false));
                }
                continue;
            }

            if (current instanceof NotFilter) {
                results.push(!results.pop());
                continue;
            }

            // children results are on top of the stack, all of them are consumed
            CompositeFilter composite = (CompositeFilter) current;
            boolean result = composite.isAnd();
            for (int i = 0; i < children.size(); i++) {
                boolean child = results.pop();
                result = composite.isAnd() ? (result && child) : (result || child);
            }
            results.push(result);
        }

        return results.pop();
    }

    /**
     * Evaluate a single condition against a row. Field references in
     * operands are resolved against the same row.
     */
    public boolean evaluateCondition(@NonNull Condition condition, @NonNull Map<String, Object> row) {
        Object value = extractValue(row, condition.getField().toParts());
        return condition.predicate(reference -> extractValue(row, reference.asFieldPath().toParts())).check(value);
    }

    /**
     * All leaf conditions of the tree in depth-first order.
     */
    public static List<Condition> conditions(@NonNull Filter filter) {

        List<Condition> conditions = new ArrayList<>();
        Deque<Filter> pending = new ArrayDeque<>();
        pending.push(filter);

        while (!pending.isEmpty()) {
            Filter current = pending.pop();
            if (current instanceof Condition) {
                conditions.add((Condition) current);
                continue;
            }
            List<Filter> children = children(current);
            for (int i = children.size() - 1; i >= 0; i--) {
                pending.push(children.get(i));
            }
        }

        return conditions;
    }

    private static List<Filter> children(Filter filter) {
        if (filter instanceof CompositeFilter) {
            return ((CompositeFilter) filter).getChildren();
        }
        if (filter instanceof NotFilter) {
            return Collections.singletonList(((NotFilter) filter).getChild());
        }
        if (filter instanceof Condition) {
            return Collections.emptyList();
        }
        throw new IllegalArgumentException("Unsupported filter: " + filter.getClass());
    }

    /**
     * Build a comparator for the sort list, null when there is nothing to sort by.
     * With {@link NullOrdering#DEFAULT} nulls sort as the greatest values,
     * last in ascending and first in descending order.
     */
    public Comparator<Map<String, Object>> buildComparator(@NonNull List<Sort> sorts) {
        if (sorts.isEmpty()) {
            return null;
        }

        Comparator<Map<String, Object>> comparator = null;

        for (Sort sort : sorts) {
            List<String> parts = sort.getField().toParts();
            boolean descending = sort.getDirection() == SortDirection.DESC;
            boolean nullsFirst = (sort.getNulls() == NullOrdering.FIRST)
                || ((sort.getNulls() == NullOrdering.DEFAULT) && descending);

            Comparator<Map<String, Object>> fieldComparator = (row1, row2) -> {
                Object val1 = extractValue(row1, parts);
                Object val2 = extractValue(row2, parts);

                if ((val1 == null) && (val2 == null)) {
                    return 0;
                }
                if (val1 == null) {
                    return nullsFirst ? -1 : 1;
                }
                if (val2 == null) {
                    return nullsFirst ? 1 : -1;
                }

                int cmp = compareForSort(val1, val2);
                return descending ? -cmp : cmp;
            };

            if (comparator == null) {
                comparator = fieldComparator;
            } else {
                comparator = comparator.thenComparing(fieldComparator);
            }
        }

        return comparator;
    }

    @RequiredArgsConstructor
    private static class Frame {
        private final Filter filter;
        private final boolean expanded;
    }
}
