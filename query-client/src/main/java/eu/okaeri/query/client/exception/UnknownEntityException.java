package eu.okaeri.query.client.exception;

public class UnknownEntityException extends QueryException {

    public UnknownEntityException(String message) {
        super(message);
    }

    public UnknownEntityException(String message, Throwable cause) {
        super(message, cause);
    }
}
