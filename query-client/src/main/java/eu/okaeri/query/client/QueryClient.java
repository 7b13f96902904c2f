package eu.okaeri.query.client;

import eu.okaeri.query.Query;
import eu.okaeri.query.client.exception.PaginationProtocolException;
import eu.okaeri.query.client.exception.QueryException;
import eu.okaeri.query.client.transport.QueryTransport;
import eu.okaeri.query.client.transport.QueryTransportException;
import eu.okaeri.query.client.transport.RequestContext;
import eu.okaeri.query.filter.renderer.DefaultFilterRenderer;
import eu.okaeri.query.filter.renderer.FilterRenderer;
import eu.okaeri.query.result.ExplainResult;
import eu.okaeri.query.result.QueryResult;
import lombok.Getter;
import lombok.NonNull;

import java.time.Duration;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.UUID;
import java.util.function.Supplier;
import java.util.logging.Logger;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Sends queries through a {@link QueryTransport} on behalf of one tenant.
 * <p>
 * Every request carries the tenant id and a fresh request id out of band.
 * The request deadline is the query timeout or, when the query sets none,
 * the client default. Transport failures surface as {@link QueryException}
 * subclasses, retried according to the configured {@link QueryRetry}.
 * <p>
 * Global defaults can be configured via system properties:
 * <ul>
 *   <li>{@code okaeri.query.client.maxPages} - pages fetched by a pagination loop (default: 10)</li>
 *   <li>{@code okaeri.query.client.timeoutMs} - request timeout when the query has none, 0 for none (default: 30000)</li>
 * </ul>
 */
@Getter
public class QueryClient implements AutoCloseable {

    private static final Logger LOGGER = Logger.getLogger(QueryClient.class.getSimpleName());
    private static final boolean DEBUG = Boolean.parseBoolean(System.getProperty("okaeri.query.debug", "false"));

    public static final int DEFAULT_MAX_PAGES =
        Integer.parseInt(System.getProperty("okaeri.query.client.maxPages", "10"));
    public static final Duration DEFAULT_TIMEOUT = Duration.ofMillis(
        Long.parseLong(System.getProperty("okaeri.query.client.timeoutMs", "30000")));

    private final String tenantId;
    private final QueryTransport transport;
    private final Duration timeout;
    private final int maxPages;
    private final QueryRetry retry;
    private final Supplier<String> requestIdSupplier;
    private final FilterRenderer renderer = new DefaultFilterRenderer();

    private QueryClient(Builder builder) {
        this.tenantId = builder.tenantId;
        this.transport = builder.transport;
        this.timeout = builder.timeout;
        this.maxPages = builder.maxPages;
        this.retry = builder.retry;
        this.requestIdSupplier = builder.requestIdSupplier;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Send a single request.
     *
     * @throws QueryException mapped transport failure
     */
    public QueryResult execute(@NonNull Query query) {
        return this.retry.call(query.getEntity(), () -> this.send(query));
    }

    private QueryResult send(Query query) {

        long start = System.currentTimeMillis();
        RequestContext context = new RequestContext(this.tenantId, this.requestIdSupplier.get(), this.timeoutMs(query));
        LOGGER.fine("[" + context.getRequestId() + "] Sending " + this.renderer.renderQuery(query));

        QueryResult result;
        try {
            result = this.transport.send(query, context);
        } catch (QueryTransportException exception) {
            throw TransportErrorMapper.map(exception);
        }

        if (DEBUG) {
            long took = System.currentTimeMillis() - start;
            LOGGER.info("[" + context.getRequestId() + "] Query on " + query.getEntity() + " returned " + result.size() + " rows in " + took + " ms");
        }

        return result;
    }

    private long timeoutMs(Query query) {
        if (query.effectiveOptions().hasTimeout()) {
            return query.effectiveOptions().getTimeoutMs();
        }
        return this.timeout.toMillis();
    }

    /**
     * Lazy sequence of pages, bounded by the client page limit.
     *
     * @throws PaginationProtocolException from {@link Iterator#next()} when a response
     *                                     reports more pages without a usable cursor
     */
    public Iterator<QueryResult> pages(@NonNull Query query) {
        return this.pages(query, this.maxPages);
    }

    public Iterator<QueryResult> pages(@NonNull Query query, int maxPages) {
        return new QueryPageIterator(this, query, maxPages);
    }

    public Stream<QueryResult> paginate(@NonNull Query query) {
        return this.paginate(query, this.maxPages);
    }

    public Stream<QueryResult> paginate(@NonNull Query query, int maxPages) {
        Iterator<QueryResult> pages = this.pages(query, maxPages);
        return StreamSupport.stream(Spliterators.spliteratorUnknownSize(pages, Spliterator.ORDERED | Spliterator.NONNULL), false);
    }

    /**
     * Rows of all pages, fetched lazily as the stream is consumed.
     */
    public Stream<Map<String, Object>> stream(@NonNull Query query) {
        return this.paginate(query).flatMap(page -> page.getRows().stream());
    }

    public List<Map<String, Object>> fetchAll(@NonNull Query query) {
        return this.stream(query).collect(Collectors.toList());
    }

    /**
     * Execute the query with explain enabled and return only the explain block.
     * A response without one yields {@link ExplainResult#empty()}.
     */
    public ExplainResult explain(@NonNull Query query) {
        Query explained = query.withOptions(query.effectiveOptions().withExplain(true));
        QueryResult result = this.execute(explained);
        if (!result.hasExplain()) {
            LOGGER.warning("No explain data returned for query on " + query.getEntity() + ", using an empty explain result");
            return ExplainResult.empty();
        }
        return result.getExplain();
    }

    @Override
    public void close() {
        this.transport.close();
    }

    public static final class Builder {

        private String tenantId;
        private QueryTransport transport;
        private Duration timeout = DEFAULT_TIMEOUT;
        private int maxPages = DEFAULT_MAX_PAGES;
        private QueryRetry retry = QueryRetry.defaults();
        private Supplier<String> requestIdSupplier = () -> UUID.randomUUID().toString();

        private Builder() {
        }

        public Builder tenantId(@NonNull String tenantId) {
            this.tenantId = tenantId;
            return this;
        }

        public Builder transport(@NonNull QueryTransport transport) {
            this.transport = transport;
            return this;
        }

        /**
         * Timeout of requests whose query does not set one.
         */
        public Builder timeout(@NonNull Duration timeout) {
            if (timeout.isNegative()) {
                throw new IllegalArgumentException("Timeout cannot be negative");
            }
            this.timeout = timeout;
            return this;
        }

        public Builder noTimeout() {
            this.timeout = Duration.ZERO;
            return this;
        }

        public Builder maxPages(int maxPages) {
            if (maxPages < 1) {
                throw new IllegalArgumentException("Max pages must be >= 1");
            }
            this.maxPages = maxPages;
            return this;
        }

        public Builder retry(@NonNull QueryRetry retry) {
            this.retry = retry;
            return this;
        }

        public Builder requestIdSupplier(@NonNull Supplier<String> requestIdSupplier) {
            this.requestIdSupplier = requestIdSupplier;
            return this;
        }

        public QueryClient build() {
            if ((this.tenantId == null) || this.tenantId.trim().isEmpty()) {
                throw new IllegalStateException("tenantId is required");
            }
            if (this.transport == null) {
                throw new IllegalStateException("transport is required");
            }
            return new QueryClient(this);
        }
    }
}
