package eu.okaeri.query.client.transport;

import lombok.Data;
import lombok.NonNull;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Out of band request metadata sent next to the query body.
 */
@Data
public class RequestContext {

    public static final String TENANT_ID_HEADER = "tenant-id";
    public static final String REQUEST_ID_HEADER = "request-id";

    private final @NonNull String tenantId;
    private final @NonNull String requestId;
    /**
     * Deadline of the call in milliseconds, 0 for none.
     */
    private final long timeoutMs;

    public boolean hasTimeout() {
        return this.timeoutMs > 0;
    }

    public Map<String, String> toMetadata() {
        Map<String, String> metadata = new LinkedHashMap<>();
        metadata.put(TENANT_ID_HEADER, this.tenantId);
        metadata.put(REQUEST_ID_HEADER, this.requestId);
        return metadata;
    }
}
