package eu.okaeri.query.client.transport;

import lombok.Getter;
import lombok.NonNull;

/**
 * Failure of a single transport call, mapped to the client error
 * taxonomy by {@link eu.okaeri.query.client.TransportErrorMapper}.
 */
@Getter
public class QueryTransportException extends Exception {

    private final TransportStatus status;

    public QueryTransportException(@NonNull TransportStatus status, String message) {
        super(message);
        this.status = status;
    }

    public QueryTransportException(@NonNull TransportStatus status, String message, Throwable cause) {
        super(message, cause);
        this.status = status;
    }
}
