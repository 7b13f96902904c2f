package eu.okaeri.query.aggregation;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum AggregateFunction {

    COUNT(false, "count"),
    SUM(true, "sum"),
    AVG(true, "avg"),
    MIN(true, "min"),
    MAX(true, "max"),
    COUNT_DISTINCT(true, "count_distinct"),
    STDDEV(true, "stddev"),
    VARIANCE(true, "variance"),
    PERCENTILE(true, "p");

    private final boolean fieldRequired;
    /**
     * Prefix of the default output alias.
     */
    private final String aliasPrefix;
}
