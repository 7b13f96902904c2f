package eu.okaeri.query.client.transport;

/**
 * Transport level outcome codes, independent of the wire protocol.
 */
public enum TransportStatus {

    OK,
    INVALID_ARGUMENT,
    NOT_FOUND,
    PERMISSION_DENIED,
    UNAUTHENTICATED,
    DEADLINE_EXCEEDED,
    RESOURCE_EXHAUSTED,
    UNAVAILABLE,
    CANCELLED,
    INTERNAL,
    UNKNOWN;

    public static TransportStatus fromHttpStatus(int code) {
        if ((code >= 200) && (code < 300)) {
            return OK;
        }
        switch (code) {
            case 400:
                return INVALID_ARGUMENT;
            case 401:
                return UNAUTHENTICATED;
            case 403:
                return PERMISSION_DENIED;
            case 404:
                return NOT_FOUND;
            case 408:
            case 504:
                return DEADLINE_EXCEEDED;
            case 429:
                return RESOURCE_EXHAUSTED;
            case 503:
                return UNAVAILABLE;
            default:
                return UNKNOWN;
        }
    }
}
