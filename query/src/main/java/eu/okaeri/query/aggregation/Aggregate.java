package eu.okaeri.query.aggregation;

import eu.okaeri.query.FieldPath;
import eu.okaeri.query.QueryValidationException;
import lombok.Data;
import lombok.NonNull;

import java.math.BigDecimal;

/**
 * One aggregate computed per group and bound to {@link #getAlias()}
 * in the aggregate output row.
 */
@Data
public class Aggregate {

    private final AggregateFunction function;
    private final FieldPath field;
    private final Double percentile;
    private final String alias;

    public Aggregate(@NonNull AggregateFunction function, FieldPath field, Double percentile, String alias) {

        if (function.isFieldRequired() && (field == null)) {
            throw new QueryValidationException(function + " aggregate requires a field");
        }

        if (function == AggregateFunction.PERCENTILE) {
            if ((percentile == null) || percentile.isNaN() || (percentile < 0) || (percentile > 100)) {
                throw new QueryValidationException("PERCENTILE aggregate requires a percentile within [0, 100], got " + percentile);
            }
        } else if (percentile != null) {
            throw new QueryValidationException("percentile is only supported by PERCENTILE aggregates, got " + function);
        }

        this.function = function;
        this.field = field;
        this.percentile = percentile;
        this.alias = (alias == null) ? defaultAlias(function, field, percentile) : validateAlias(alias);
    }

    public static Aggregate count() {
        return new Aggregate(AggregateFunction.COUNT, null, null, null);
    }

    public static Aggregate count(@NonNull String alias) {
        return new Aggregate(AggregateFunction.COUNT, null, null, alias);
    }

    public static Aggregate of(@NonNull AggregateFunction function, @NonNull String field) {
        return new Aggregate(function, FieldPath.of(field), null, null);
    }

    public static Aggregate of(@NonNull AggregateFunction function, @NonNull String field, @NonNull String alias) {
        return new Aggregate(function, FieldPath.of(field), null, alias);
    }

    public static Aggregate percentile(@NonNull String field, double percentile) {
        return new Aggregate(AggregateFunction.PERCENTILE, FieldPath.of(field), percentile, null);
    }

    public static Aggregate percentile(@NonNull String field, double percentile, @NonNull String alias) {
        return new Aggregate(AggregateFunction.PERCENTILE, FieldPath.of(field), percentile, alias);
    }

    /**
     * Alias used when none is given: {@code count}, {@code sum_amount},
     * {@code p95_latency_ms}, {@code p99_9_latency_ms}.
     */
    public static String defaultAlias(@NonNull AggregateFunction function, FieldPath field, Double percentile) {

        if (field == null) {
            return function.getAliasPrefix();
        }

        String fieldPart = field.getValue().replace(FieldPath.SEPARATOR, "_");
        if (function == AggregateFunction.PERCENTILE) {
            String rank = BigDecimal.valueOf(percentile).stripTrailingZeros().toPlainString().replace('.', '_');
            return function.getAliasPrefix() + rank + "_" + fieldPart;
        }

        return function.getAliasPrefix() + "_" + fieldPart;
    }

    private static String validateAlias(String alias) {
        if (alias.trim().isEmpty()) {
            throw new QueryValidationException("aggregate alias cannot be empty");
        }
        if (alias.contains(FieldPath.SEPARATOR)) {
            throw new QueryValidationException("aggregate alias '" + alias + "' cannot contain '" + FieldPath.SEPARATOR + "'");
        }
        return alias;
    }
}
