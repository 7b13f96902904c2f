package eu.okaeri.query.client.exception;

/**
 * The service rejected the query as invalid.
 */
public class MalformedQueryException extends QueryException {

    public MalformedQueryException(String message) {
        super(message);
    }

    public MalformedQueryException(String message, Throwable cause) {
        super(message, cause);
    }
}
