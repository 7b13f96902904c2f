package eu.okaeri.query.result;

import lombok.Data;
import lombok.NonNull;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Executor estimate of query cost. Cost units are executor specific
 * and only comparable between queries of the same executor.
 */
@Data
public class ExplainResult {

    private static final ExplainResult EMPTY = new ExplainResult(0, 0, Collections.emptyList());

    private final double totalCost;
    private final double estimatedTimeMs;
    private final List<Recommendation> recommendations;

    public ExplainResult(double totalCost, double estimatedTimeMs, @NonNull List<Recommendation> recommendations) {
        this.totalCost = totalCost;
        this.estimatedTimeMs = estimatedTimeMs;
        this.recommendations = Collections.unmodifiableList(new ArrayList<>(recommendations));
    }

    /**
     * Result reported when the executor did not return any explain data.
     */
    public static ExplainResult empty() {
        return EMPTY;
    }

    public boolean isEmpty() {
        return (this.totalCost == 0) && (this.estimatedTimeMs == 0) && this.recommendations.isEmpty();
    }
}
