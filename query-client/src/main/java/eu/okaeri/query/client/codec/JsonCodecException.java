package eu.okaeri.query.client.codec;

/**
 * Malformed JSON or a JSON document not matching the wire format.
 */
public class JsonCodecException extends RuntimeException {

    public JsonCodecException(String message) {
        super(message);
    }

    public JsonCodecException(String message, Throwable cause) {
        super(message, cause);
    }
}
