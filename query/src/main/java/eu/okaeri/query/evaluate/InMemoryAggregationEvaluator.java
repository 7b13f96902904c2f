package eu.okaeri.query.evaluate;

import eu.okaeri.query.FieldPath;
import eu.okaeri.query.aggregation.Aggregate;
import eu.okaeri.query.aggregation.Aggregation;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.Set;

import static eu.okaeri.query.value.ValueUtils.extractValue;
import static eu.okaeri.query.value.ValueUtils.isNumeric;
import static eu.okaeri.query.value.ValueUtils.normalizeKey;
import static eu.okaeri.query.value.ValueUtils.putValue;

/**
 * Groups rows and computes aggregates per group.
 * <p>
 * Output rows carry the group fields under their paths and each aggregate
 * under its alias. A global aggregation (no group fields) always yields
 * exactly one row, also for empty input. HAVING is evaluated on the output
 * rows. SUM of no values is 0, the other numeric functions give null.
 * Variance and standard deviation are population statistics, percentiles
 * use linear interpolation between closest ranks.
 */
@RequiredArgsConstructor
public class InMemoryAggregationEvaluator {

    private final @NonNull InMemoryFilterEvaluator filterEvaluator;

    public List<Map<String, Object>> aggregate(@NonNull Aggregation aggregation, @NonNull List<Map<String, Object>> rows) {

        Map<List<Object>, Group> groups = new LinkedHashMap<>();
        if (aggregation.isGlobal()) {
            groups.put(Collections.emptyList(), new Group(Collections.emptyList()));
        }

        for (Map<String, Object> row : rows) {
            List<Object> values = new ArrayList<>(aggregation.getGroupBy().size());
            List<Object> key = new ArrayList<>(aggregation.getGroupBy().size());
            for (FieldPath field : aggregation.getGroupBy()) {
                Object value = extractValue(row, field.toParts());
                values.add(value);
                key.add(normalizeKey(value));
            }
            groups.computeIfAbsent(key, k -> new Group(values)).rows.add(row);
        }

        List<Map<String, Object>> output = new ArrayList<>(groups.size());
        for (Group group : groups.values()) {

            Map<String, Object> result = new LinkedHashMap<>();
            for (int i = 0; i < aggregation.getGroupBy().size(); i++) {
                putValue(result, aggregation.getGroupBy().get(i).toParts(), group.values.get(i));
            }
            for (Aggregate aggregate : aggregation.getAggregates()) {
                result.put(aggregate.getAlias(), this.compute(aggregate, group.rows));
            }

            if (aggregation.hasHaving() && !this.filterEvaluator.matches(aggregation.getHaving(), result)) {
                continue;
            }
            output.add(result);
        }

        return output;
    }

    /**
     * Compute a single aggregate over the rows of one group.
     */
    public Object compute(@NonNull Aggregate aggregate, @NonNull List<Map<String, Object>> rows) {
        switch (aggregate.getFunction()) {
            case COUNT:
                return count(aggregate, rows);
            case COUNT_DISTINCT:
                return countDistinct(aggregate, rows);
            case SUM:
                return Arrays.stream(numbers(aggregate, rows)).sum();
            case AVG:
                return average(numbers(aggregate, rows));
            case MIN:
                return boxed(Arrays.stream(numbers(aggregate, rows)).min());
            case MAX:
                return boxed(Arrays.stream(numbers(aggregate, rows)).max());
            case VARIANCE:
                return variance(numbers(aggregate, rows));
            case STDDEV:
                Double variance = variance(numbers(aggregate, rows));
                return (variance == null) ? null : Math.sqrt(variance);
            case PERCENTILE:
                return percentile(numbers(aggregate, rows), aggregate.getPercentile());
            default:
                throw new IllegalArgumentException("Unsupported aggregate function: " + aggregate.getFunction());
        }
    }

    private static long count(Aggregate aggregate, List<Map<String, Object>> rows) {
        if (aggregate.getField() == null) {
            return rows.size();
        }
        List<String> parts = aggregate.getField().toParts();
        return rows.stream().filter(row -> extractValue(row, parts) != null).count();
    }

    private static long countDistinct(Aggregate aggregate, List<Map<String, Object>> rows) {
        List<String> parts = aggregate.getField().toParts();
        Set<Object> distinct = new HashSet<>();
        for (Map<String, Object> row : rows) {
            Object value = extractValue(row, parts);
            if (value != null) {
                distinct.add(normalizeKey(value));
            }
        }
        return distinct.size();
    }

    private static double[] numbers(Aggregate aggregate, List<Map<String, Object>> rows) {
        List<String> parts = aggregate.getField().toParts();
        return rows.stream()
            .map(row -> extractValue(row, parts))
            .filter(value -> isNumeric(value))
            .mapToDouble(value -> ((Number) value).doubleValue())
            .toArray();
    }

    private static Double boxed(OptionalDouble value) {
        return value.isPresent() ? Double.valueOf(value.getAsDouble()) : null;
    }

    private static Double average(double[] values) {
        return (values.length == 0) ? null : (Arrays.stream(values).sum() / values.length);
    }

    private static Double variance(double[] values) {
        if (values.length == 0) {
            return null;
        }
        double mean = Arrays.stream(values).sum() / values.length;
        double squares = 0;
        for (double value : values) {
            squares += (value - mean) * (value - mean);
        }
        return squares / values.length;
    }

    /**
     * Linear interpolation at rank {@code p / 100 * (n - 1)} of the sorted values.
     */
    public static Double percentile(@NonNull double[] values, double percentile) {
        if (values.length == 0) {
            return null;
        }

        double[] sorted = values.clone();
        Arrays.sort(sorted);

        double rank = (percentile / 100.0) * (sorted.length - 1);
        int lower = (int) Math.floor(rank);
        int upper = (int) Math.ceil(rank);
        double fraction = rank - lower;

        return sorted[lower] + ((sorted[upper] - sorted[lower]) * fraction);
    }

    @RequiredArgsConstructor
    private static class Group {
        private final List<Object> values;
        private final List<Map<String, Object>> rows = new ArrayList<>();
    }
}
