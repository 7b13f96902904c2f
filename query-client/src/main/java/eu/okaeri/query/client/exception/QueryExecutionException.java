package eu.okaeri.query.client.exception;

/**
 * Any other failure, the message is the one reported by the transport.
 */
public class QueryExecutionException extends QueryException {

    public QueryExecutionException(String message) {
        super(message);
    }

    public QueryExecutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
