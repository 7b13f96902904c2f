package eu.okaeri.query.client.transport;

import eu.okaeri.query.Query;
import eu.okaeri.query.result.QueryResult;
import lombok.NonNull;

/**
 * Capability of sending one query to an executor and returning its response.
 * Implementations must honour {@link RequestContext#getTimeoutMs()}.
 */
public interface QueryTransport extends AutoCloseable {

    QueryResult send(@NonNull Query query, @NonNull RequestContext context) throws QueryTransportException;

    @Override
    default void close() {
    }
}
