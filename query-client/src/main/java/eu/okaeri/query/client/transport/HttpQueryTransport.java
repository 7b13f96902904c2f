package eu.okaeri.query.client.transport;

import com.fasterxml.jackson.databind.JsonNode;
import eu.okaeri.query.Query;
import eu.okaeri.query.client.codec.JsonCodecException;
import eu.okaeri.query.client.codec.JsonQueryCodec;
import eu.okaeri.query.result.QueryResult;
import lombok.Getter;
import lombok.NonNull;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Transport POSTing JSON encoded queries to {@code <endpoint>/v1/query}.
 * <p>
 * Tenant and request ids travel as {@code tenant-id} and {@code request-id}
 * headers. Non-2xx responses are mapped with {@link TransportStatus#fromHttpStatus(int)},
 * the error message is taken from a {@code message} or {@code error} field
 * of a JSON body when present.
 */
public class HttpQueryTransport implements QueryTransport {

    private static final Logger LOGGER = Logger.getLogger(HttpQueryTransport.class.getSimpleName());
    public static final String QUERY_PATH = "/v1/query";

    @Getter private final URI endpoint;
    private final HttpClient httpClient;
    private final JsonQueryCodec codec;

    public HttpQueryTransport(@NonNull URI endpoint) {
        this(endpoint, HttpClient.newHttpClient(), new JsonQueryCodec());
    }

    public HttpQueryTransport(@NonNull URI endpoint, @NonNull HttpClient httpClient, @NonNull JsonQueryCodec codec) {
        String base = endpoint.toString();
        this.endpoint = URI.create((base.endsWith("/") ? base.substring(0, base.length() - 1) : base) + QUERY_PATH);
        this.httpClient = httpClient;
        this.codec = codec;
    }

    @Override
    public QueryResult send(@NonNull Query query, @NonNull RequestContext context) throws QueryTransportException {

        HttpRequest.Builder request = HttpRequest.newBuilder(this.endpoint)
            .header("Content-Type", "application/json")
            .header("Accept", "application/json")
            .POST(HttpRequest.BodyPublishers.ofString(this.codec.encodeQuery(query), StandardCharsets.UTF_8));

        for (Map.Entry<String, String> entry : context.toMetadata().entrySet()) {
            request.header(entry.getKey(), entry.getValue());
        }

        if (context.hasTimeout()) {
            request.timeout(Duration.ofMillis(context.getTimeoutMs()));
        }

        HttpResponse<String> response;
        try {
            response = this.httpClient.send(request.build(), HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (HttpTimeoutException exception) {
            throw new QueryTransportException(TransportStatus.DEADLINE_EXCEEDED,
                "request " + context.getRequestId() + " exceeded " + context.getTimeoutMs() + " ms", exception);
        } catch (IOException exception) {
            throw new QueryTransportException(TransportStatus.UNAVAILABLE,
                "cannot reach " + this.endpoint + ": " + exception.getMessage(), exception);
        } catch (InterruptedException exception) {
            Thread.currentThread().interrupt();
            throw new QueryTransportException(TransportStatus.CANCELLED, "interrupted while sending request " + context.getRequestId(), exception);
        }

        TransportStatus status = TransportStatus.fromHttpStatus(response.statusCode());
        if (status != TransportStatus.OK) {
            throw new QueryTransportException(status, this.errorMessage(response));
        }

        try {
            return this.codec.decodeResult(response.body());
        } catch (JsonCodecException exception) {
            LOGGER.warning("Malformed response for request " + context.getRequestId() + ": " + exception.getMessage());
            throw new QueryTransportException(TransportStatus.INTERNAL, "malformed response: " + exception.getMessage(), exception);
        }
    }

    private String errorMessage(HttpResponse<String> response) {

        String body = response.body();
        if ((body == null) || body.trim().isEmpty()) {
            return "HTTP " + response.statusCode();
        }

        try {
            JsonNode node = this.codec.getMapper().readTree(body);
            if ((node != null) && node.hasNonNull("message")) {
                return node.get("message").asText();
            }
            if ((node != null) && node.hasNonNull("error")) {
                return node.get("error").asText();
            }
        } catch (IOException exception) {
            LOGGER.fine("Error body of HTTP " + response.statusCode() + " is not json: " + exception.getMessage());
        }

        return body;
    }
}
