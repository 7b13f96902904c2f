package eu.okaeri.query.client;

import eu.okaeri.query.Query;
import eu.okaeri.query.QueryBuilder;
import eu.okaeri.query.client.exception.PaginationProtocolException;
import eu.okaeri.query.result.PageInfo;
import eu.okaeri.query.result.QueryResult;
import lombok.NonNull;

import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Lazy, strictly sequential page loop. Each page is requested only when
 * asked for, with the cursor of the previous response. Iteration ends after
 * {@code maxPages} pages or as soon as a response reports no further page.
 * A page that breaks the cursor protocol is still returned, the following
 * call to {@link #next()} reports the violation.
 */
class QueryPageIterator implements Iterator<QueryResult> {

    private static final Logger LOGGER = Logger.getLogger(QueryPageIterator.class.getSimpleName());

    private final QueryClient client;
    private final int maxPages;
    private Query next;
    private PaginationProtocolException violation;
    private int fetched;

    QueryPageIterator(@NonNull QueryClient client, @NonNull Query query, int maxPages) {
        if (maxPages < 1) {
            throw new IllegalArgumentException("Max pages must be >= 1, got " + maxPages);
        }
        this.client = client;
        this.next = query;
        this.maxPages = maxPages;
    }

    @Override
    public boolean hasNext() {
        return (this.violation != null) || ((this.next != null) && (this.fetched < this.maxPages));
    }

    /**
     * @throws PaginationProtocolException if the previous response reported more
     *                                     pages without a new cursor to continue with
     */
    @Override
    public QueryResult next() {

        if (!this.hasNext()) {
            throw new NoSuchElementException();
        }

        if (this.violation != null) {
            PaginationProtocolException violation = this.violation;
            this.violation = null;
            throw violation;
        }

        Query current = this.next;
        this.next = null;

        QueryResult result = this.client.execute(current);
        this.fetched++;

        PageInfo pageInfo = result.getPageInfo();
        LOGGER.info("Fetched page " + this.fetched + " of " + current.getEntity() + " (" + result.size() + " rows"
            + (((pageInfo != null) && pageInfo.hasTotalCount()) ? (", " + pageInfo.getTotalCount() + " total") : "") + ")");

        if ((pageInfo == null) || !pageInfo.isHasMore()) {
            return result;
        }

        String sentCursor = current.hasPagination() ? current.getPagination().getCursor() : null;
        if (!pageInfo.hasNextCursor() || Objects.equals(sentCursor, pageInfo.getNextCursor())) {
            this.violation = new PaginationProtocolException("page " + this.fetched + " of " + current.getEntity()
                + " reports more results without a usable next cursor (" + pageInfo.getNextCursor() + ")");
            return result;
        }

        if (this.fetched < this.maxPages) {
            int pageSize = (pageInfo.getPageSize() > 0) ? pageInfo.getPageSize() : QueryBuilder.DEFAULT_PAGE_SIZE;
            this.next = current.withCursor(pageInfo.getNextCursor(), pageSize);
        } else {
            LOGGER.info("Stopping pagination of " + current.getEntity() + " after " + this.maxPages + " pages");
        }

        return result;
    }
}
