package eu.okaeri.query.client.exception;

/**
 * A response claimed more pages without a usable continuation cursor.
 */
public class PaginationProtocolException extends QueryException {

    public PaginationProtocolException(String message) {
        super(message);
    }

    public PaginationProtocolException(String message, Throwable cause) {
        super(message, cause);
    }
}
