package eu.okaeri.query.client.exception;

/**
 * Missing or insufficient credentials for the tenant.
 */
public class AccessDeniedException extends QueryException {

    public AccessDeniedException(String message) {
        super(message);
    }

    public AccessDeniedException(String message, Throwable cause) {
        super(message, cause);
    }
}
