package eu.okaeri.query.aggregation;

import eu.okaeri.query.FieldPath;
import eu.okaeri.query.QueryValidationException;
import eu.okaeri.query.filter.Filter;
import lombok.Data;
import lombok.NonNull;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Grouped computation over the filtered rows.
 * <p>
 * An empty {@link #getGroupBy()} forms a single global group. The optional
 * {@link #getHaving()} filter addresses aggregate aliases and group fields of
 * the aggregate output row and is evaluated once per group, after all
 * aggregates of that group are computed, never against raw rows.
 */
@Data
public class Aggregation {

    private final List<FieldPath> groupBy;
    private final List<Aggregate> aggregates;
    private final Filter having;

    public Aggregation(@NonNull List<FieldPath> groupBy, @NonNull List<Aggregate> aggregates, Filter having) {

        Set<String> aliases = new HashSet<>();
        for (Aggregate aggregate : aggregates) {
            if (!aliases.add(aggregate.getAlias())) {
                throw new QueryValidationException("duplicate aggregate alias '" + aggregate.getAlias() + "'");
            }
        }

        // aliases are flat, nested group keys are written under their first segment
        for (FieldPath field : groupBy) {
            if (aliases.contains(field.head())) {
                throw new QueryValidationException("aggregate alias '" + field.head() + "' shadows group by field '" + field.getValue() + "'");
            }
        }

        this.groupBy = Collections.unmodifiableList(new ArrayList<>(groupBy));
        this.aggregates = Collections.unmodifiableList(new ArrayList<>(aggregates));
        this.having = having;
    }

    public static Aggregation of(@NonNull List<String> groupBy, @NonNull List<Aggregate> aggregates) {
        return of(groupBy, aggregates, null);
    }

    public static Aggregation of(@NonNull List<String> groupBy, @NonNull List<Aggregate> aggregates, Filter having) {
        List<FieldPath> paths = new ArrayList<>(groupBy.size());
        for (String field : groupBy) {
            paths.add(FieldPath.of(field));
        }
        return new Aggregation(paths, aggregates, having);
    }

    public boolean isGlobal() {
        return this.groupBy.isEmpty();
    }

    public boolean hasHaving() {
        return this.having != null;
    }
}
