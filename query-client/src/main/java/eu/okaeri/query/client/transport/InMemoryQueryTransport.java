package eu.okaeri.query.client.transport;

import eu.okaeri.query.Query;
import eu.okaeri.query.QueryValidationException;
import eu.okaeri.query.client.codec.JsonQueryCodec;
import eu.okaeri.query.evaluate.EntityNotFoundException;
import eu.okaeri.query.evaluate.InMemoryDataset;
import eu.okaeri.query.evaluate.InMemoryQueryExecutor;
import eu.okaeri.query.result.QueryResult;
import lombok.Getter;
import lombok.NonNull;

import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.logging.Logger;

/**
 * Transport executing queries locally with an {@link InMemoryQueryExecutor}.
 * <p>
 * With a codec the query and the result pass through their JSON wire form,
 * as they would over the network. Calls with a timeout run on a worker
 * thread and fail with {@link TransportStatus#DEADLINE_EXCEEDED} when late.
 */
public class InMemoryQueryTransport implements QueryTransport {

    private static final Logger LOGGER = Logger.getLogger(InMemoryQueryTransport.class.getSimpleName());

    @Getter private final InMemoryQueryExecutor executor;
    private final JsonQueryCodec codec;
    private final ExecutorService worker = Executors.newCachedThreadPool(runnable -> {
        Thread thread = new Thread(runnable, "okaeri-query-in-memory");
        thread.setDaemon(true);
        return thread;
    });

    public InMemoryQueryTransport(@NonNull InMemoryDataset dataset) {
        this(new InMemoryQueryExecutor(dataset), null);
    }

    public InMemoryQueryTransport(@NonNull InMemoryQueryExecutor executor, JsonQueryCodec codec) {
        this.executor = executor;
        this.codec = codec;
    }

    /**
     * Transport sending queries and results through the JSON wire format.
     */
    public static InMemoryQueryTransport overJson(@NonNull InMemoryDataset dataset) {
        return new InMemoryQueryTransport(new InMemoryQueryExecutor(dataset), new JsonQueryCodec());
    }

    @Override
    public QueryResult send(@NonNull Query query, @NonNull RequestContext context) throws QueryTransportException {

        if (!context.hasTimeout()) {
            return this.execute(query);
        }

        Future<QueryResult> future = this.worker.submit(() -> this.execute(query));
        try {
            return future.get(context.getTimeoutMs(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException exception) {
            future.cancel(true);
            throw new QueryTransportException(TransportStatus.DEADLINE_EXCEEDED,
                "query on " + query.getEntity() + " exceeded " + context.getTimeoutMs() + " ms", exception);
        } catch (InterruptedException exception) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            throw new QueryTransportException(TransportStatus.CANCELLED, "interrupted while waiting for query result", exception);
        } catch (ExecutionException exception) {
            Throwable cause = exception.getCause();
            if (cause instanceof QueryTransportException) {
                throw (QueryTransportException) cause;
            }
            throw new QueryTransportException(TransportStatus.INTERNAL, String.valueOf(cause.getMessage()), cause);
        }
    }

    private QueryResult execute(Query query) throws QueryTransportException {
        try {
            if (this.codec == null) {
                return this.executor.execute(query);
            }
            Query received = this.codec.decodeQuery(this.codec.encodeQuery(query));
            return this.codec.decodeResult(this.codec.encodeResult(this.executor.execute(received)));
        } catch (QueryValidationException exception) {
            throw new QueryTransportException(TransportStatus.INVALID_ARGUMENT, exception.getMessage(), exception);
        } catch (EntityNotFoundException exception) {
            throw new QueryTransportException(TransportStatus.NOT_FOUND, exception.getMessage(), exception);
        } catch (RuntimeException exception) {
            LOGGER.warning("In-memory query on " + query.getEntity() + " failed: " + exception);
            throw new QueryTransportException(TransportStatus.INTERNAL, exception.getMessage(), exception);
        }
    }

    @Override
    public void close() {
        this.worker.shutdownNow();
    }
}
