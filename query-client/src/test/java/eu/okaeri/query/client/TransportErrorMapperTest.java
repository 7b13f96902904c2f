package eu.okaeri.query.client;

import eu.okaeri.query.client.exception.AccessDeniedException;
import eu.okaeri.query.client.exception.MalformedQueryException;
import eu.okaeri.query.client.exception.QueryException;
import eu.okaeri.query.client.exception.QueryExecutionException;
import eu.okaeri.query.client.exception.QueryTimeoutException;
import eu.okaeri.query.client.exception.RateLimitedException;
import eu.okaeri.query.client.exception.ServiceUnavailableException;
import eu.okaeri.query.client.exception.UnknownEntityException;
import eu.okaeri.query.client.transport.QueryTransportException;
import eu.okaeri.query.client.transport.TransportStatus;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class TransportErrorMapperTest {

    private static QueryException map(TransportStatus status) {
        return TransportErrorMapper.map(new QueryTransportException(status, "boom"));
    }

    @Test
    void maps_statuses_to_client_errors() {
        assertThat(map(TransportStatus.INVALID_ARGUMENT)).isInstanceOf(MalformedQueryException.class);
        assertThat(map(TransportStatus.NOT_FOUND)).isInstanceOf(UnknownEntityException.class);
        assertThat(map(TransportStatus.PERMISSION_DENIED)).isInstanceOf(AccessDeniedException.class);
        assertThat(map(TransportStatus.UNAUTHENTICATED)).isInstanceOf(AccessDeniedException.class);
        assertThat(map(TransportStatus.DEADLINE_EXCEEDED)).isInstanceOf(QueryTimeoutException.class);
        assertThat(map(TransportStatus.RESOURCE_EXHAUSTED)).isInstanceOf(RateLimitedException.class);
        assertThat(map(TransportStatus.UNAVAILABLE)).isInstanceOf(ServiceUnavailableException.class);
        assertThat(map(TransportStatus.INTERNAL)).isInstanceOf(QueryExecutionException.class);
        assertThat(map(TransportStatus.UNKNOWN)).isInstanceOf(QueryExecutionException.class);
        assertThat(map(TransportStatus.CANCELLED)).isInstanceOf(QueryExecutionException.class);
    }

    @Test
    void keeps_message_and_cause() {
        QueryTransportException cause = new QueryTransportException(TransportStatus.NOT_FOUND, "unknown entity 'ghosts'");
        QueryException mapped = TransportErrorMapper.map(cause);
        assertThat(mapped).hasMessage("unknown entity 'ghosts'").hasCause(cause);
    }

    @Test
    void only_timeouts_and_rate_limits_are_retryable() {
        for (TransportStatus status : TransportStatus.values()) {
            boolean expected = (status == TransportStatus.DEADLINE_EXCEEDED) || (status == TransportStatus.RESOURCE_EXHAUSTED);
            assertThat(map(status).isRetryable()).as(status.name()).isEqualTo(expected);
        }
    }
}
