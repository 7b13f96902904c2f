package eu.okaeri.query;

/**
 * Exception thrown when a query or one of its parts is malformed.
 * Raised synchronously while building, never after a request was sent.
 */
public class QueryValidationException extends IllegalArgumentException {

    public QueryValidationException(String message) {
        super(message);
    }

    public QueryValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
