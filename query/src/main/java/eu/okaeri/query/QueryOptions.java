package eu.okaeri.query;

import lombok.Data;

/**
 * Execution hints passed to the executor. A {@code timeoutMs} of 0 means
 * no explicit timeout, a null consistency means the executor default.
 */
@Data
public class QueryOptions {

    private final long timeoutMs;
    private final boolean countTotal;
    private final ConsistencyLevel consistency;
    private final boolean explain;

    public QueryOptions(long timeoutMs, boolean countTotal, ConsistencyLevel consistency, boolean explain) {
        if (timeoutMs < 0) {
            throw new QueryValidationException("timeout cannot be negative, got " + timeoutMs);
        }
        this.timeoutMs = timeoutMs;
        this.countTotal = countTotal;
        this.consistency = consistency;
        this.explain = explain;
    }

    public static QueryOptions defaults() {
        return new QueryOptions(0, false, null, false);
    }

    public boolean hasTimeout() {
        return this.timeoutMs > 0;
    }

    public QueryOptions withTimeoutMs(long timeoutMs) {
        return new QueryOptions(timeoutMs, this.countTotal, this.consistency, this.explain);
    }

    public QueryOptions withCountTotal(boolean countTotal) {
        return new QueryOptions(this.timeoutMs, countTotal, this.consistency, this.explain);
    }

    public QueryOptions withConsistency(ConsistencyLevel consistency) {
        return new QueryOptions(this.timeoutMs, this.countTotal, consistency, this.explain);
    }

    public QueryOptions withExplain(boolean explain) {
        return new QueryOptions(this.timeoutMs, this.countTotal, this.consistency, explain);
    }
}
