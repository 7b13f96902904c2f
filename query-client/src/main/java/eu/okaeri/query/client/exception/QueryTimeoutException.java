package eu.okaeri.query.client.exception;

/**
 * The request did not complete within its deadline.
 */
public class QueryTimeoutException extends QueryException {

    public QueryTimeoutException(String message) {
        super(message);
    }

    public QueryTimeoutException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
