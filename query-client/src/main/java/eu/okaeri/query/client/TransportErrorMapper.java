package eu.okaeri.query.client;

import eu.okaeri.query.client.exception.AccessDeniedException;
import eu.okaeri.query.client.exception.MalformedQueryException;
import eu.okaeri.query.client.exception.QueryException;
import eu.okaeri.query.client.exception.QueryExecutionException;
import eu.okaeri.query.client.exception.QueryTimeoutException;
import eu.okaeri.query.client.exception.RateLimitedException;
import eu.okaeri.query.client.exception.ServiceUnavailableException;
import eu.okaeri.query.client.exception.UnknownEntityException;
import eu.okaeri.query.client.transport.QueryTransportException;
import lombok.NonNull;

/**
 * Converts transport failures into client exceptions, keeping the
 * transport message and the transport exception as the cause.
 */
public final class TransportErrorMapper {

    private TransportErrorMapper() {
    }

    public static QueryException map(@NonNull QueryTransportException exception) {
        String message = exception.getMessage();
        switch (exception.getStatus()) {
            case INVALID_ARGUMENT:
                return new MalformedQueryException(message, exception);
            case NOT_FOUND:
                return new UnknownEntityException(message, exception);
            case PERMISSION_DENIED:
            case UNAUTHENTICATED:
                return new AccessDeniedException(message, exception);
            case DEADLINE_EXCEEDED:
                return new QueryTimeoutException(message, exception);
            case RESOURCE_EXHAUSTED:
                return new RateLimitedException(message, exception);
            case UNAVAILABLE:
                return new ServiceUnavailableException(message, exception);
            default:
                return new QueryExecutionException(message, exception);
        }
    }
}
