package eu.okaeri.query.result;

import lombok.Data;
import lombok.NonNull;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * One page of query results. Rows are plain nested maps; aggregated
 * queries return one row per group keyed by group fields and aliases.
 */
@Data
public class QueryResult {

    private final List<Map<String, Object>> rows;
    private final PageInfo pageInfo;
    private final ExplainResult explain;

    public QueryResult(@NonNull List<Map<String, Object>> rows, PageInfo pageInfo, ExplainResult explain) {
        this.rows = Collections.unmodifiableList(new ArrayList<>(rows));
        this.pageInfo = pageInfo;
        this.explain = explain;
    }

    public static QueryResult of(@NonNull List<Map<String, Object>> rows) {
        return new QueryResult(rows, null, null);
    }

    public boolean hasPageInfo() {
        return this.pageInfo != null;
    }

    public boolean hasExplain() {
        return this.explain != null;
    }

    /**
     * @return true only when the server reported more rows and issued a cursor
     */
    public boolean hasMore() {
        return (this.pageInfo != null) && this.pageInfo.isHasMore() && this.pageInfo.hasNextCursor();
    }

    public int size() {
        return this.rows.size();
    }

    public boolean isEmpty() {
        return this.rows.isEmpty();
    }
}
