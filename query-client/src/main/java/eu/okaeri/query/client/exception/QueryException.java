package eu.okaeri.query.client.exception;

/**
 * Failure reported after a query was sent. Each subclass is one error kind;
 * only timeouts and rate limiting are worth retrying.
 */
public abstract class QueryException extends RuntimeException {

    protected QueryException(String message) {
        super(message);
    }

    protected QueryException(String message, Throwable cause) {
        super(message, cause);
    }

    public boolean isRetryable() {
        return false;
    }
}
