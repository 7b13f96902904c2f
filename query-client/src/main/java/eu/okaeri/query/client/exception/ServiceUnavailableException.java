package eu.okaeri.query.client.exception;

/**
 * The service is temporarily unreachable or overloaded.
 */
public class ServiceUnavailableException extends QueryException {

    public ServiceUnavailableException(String message) {
        super(message);
    }

    public ServiceUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
