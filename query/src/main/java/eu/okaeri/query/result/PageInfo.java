package eu.okaeri.query.result;

import eu.okaeri.query.QueryValidationException;
import lombok.Data;

/**
 * Pagination state of a single response. A well-behaved executor reports
 * {@link #isHasMore()} only together with a {@link #getNextCursor()}, the
 * total count is only present when it was requested.
 */
@Data
public class PageInfo {

    private final Long totalCount;
    private final int pageSize;
    private final boolean hasMore;
    private final String nextCursor;

    public PageInfo(Long totalCount, int pageSize, boolean hasMore, String nextCursor) {
        if ((totalCount != null) && (totalCount < 0)) {
            throw new QueryValidationException("total count cannot be negative, got " + totalCount);
        }
        this.totalCount = totalCount;
        this.pageSize = pageSize;
        this.hasMore = hasMore;
        this.nextCursor = nextCursor;
    }

    public static PageInfo last(Long totalCount, int pageSize) {
        return new PageInfo(totalCount, pageSize, false, null);
    }

    public boolean hasTotalCount() {
        return this.totalCount != null;
    }

    public boolean hasNextCursor() {
        return (this.nextCursor != null) && !this.nextCursor.isEmpty();
    }
}
