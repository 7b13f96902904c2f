package eu.okaeri.query.client;

import eu.okaeri.query.client.exception.QueryException;
import eu.okaeri.query.client.exception.QueryExecutionException;
import lombok.Getter;
import lombok.NonNull;

import java.time.Duration;
import java.util.function.Consumer;
import java.util.function.Supplier;
import java.util.logging.Logger;

/**
 * Retries query calls failing with a retryable {@link QueryException}
 * (timeouts, rate limiting) with exponential backoff. Other failures
 * are rethrown on the first occurrence.
 * <p>
 * Global defaults can be configured via system properties:
 * <ul>
 *   <li>{@code okaeri.query.retry.initialBackoffMs} - initial backoff in milliseconds (default: 200)</li>
 *   <li>{@code okaeri.query.retry.maxBackoffMs} - maximum backoff in milliseconds (default: 5000)</li>
 *   <li>{@code okaeri.query.retry.multiplier} - backoff multiplier (default: 2.0)</li>
 *   <li>{@code okaeri.query.retry.maxAttempts} - attempts including the first one (default: 3)</li>
 * </ul>
 */
@Getter
public final class QueryRetry {

    private static final Logger LOGGER = Logger.getLogger(QueryRetry.class.getSimpleName());

    // Global defaults from system properties
    private static final Duration DEFAULT_INITIAL_BACKOFF = Duration.ofMillis(
        Long.parseLong(System.getProperty("okaeri.query.retry.initialBackoffMs", "200")));
    private static final Duration DEFAULT_MAX_BACKOFF = Duration.ofMillis(
        Long.parseLong(System.getProperty("okaeri.query.retry.maxBackoffMs", "5000")));
    private static final double DEFAULT_MULTIPLIER =
        Double.parseDouble(System.getProperty("okaeri.query.retry.multiplier", "2.0"));
    private static final int DEFAULT_MAX_ATTEMPTS =
        Integer.parseInt(System.getProperty("okaeri.query.retry.maxAttempts", "3"));

    private Duration initialBackoff = DEFAULT_INITIAL_BACKOFF;
    private Duration maxBackoff = DEFAULT_MAX_BACKOFF;
    private double multiplier = DEFAULT_MULTIPLIER;
    private int maxAttempts = DEFAULT_MAX_ATTEMPTS;
    private Consumer<Integer> onRetry;

    private QueryRetry() {
    }

    public static QueryRetry defaults() {
        return new QueryRetry();
    }

    /**
     * Single attempt, failures are rethrown immediately.
     */
    public static QueryRetry none() {
        return new QueryRetry().maxAttempts(1);
    }

    public QueryRetry initialBackoff(@NonNull Duration backoff) {
        this.initialBackoff = backoff;
        return this;
    }

    public QueryRetry maxBackoff(@NonNull Duration backoff) {
        this.maxBackoff = backoff;
        return this;
    }

    public QueryRetry multiplier(double multiplier) {
        if (multiplier < 1.0) {
            throw new IllegalArgumentException("Multiplier must be >= 1.0");
        }
        this.multiplier = multiplier;
        return this;
    }

    public QueryRetry maxAttempts(int maxAttempts) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("Max attempts must be >= 1");
        }
        this.maxAttempts = maxAttempts;
        return this;
    }

    public QueryRetry onRetry(@NonNull Consumer<Integer> callback) {
        this.onRetry = callback;
        return this;
    }

    public <T> T call(@NonNull String contextName, @NonNull Supplier<T> action) {

        Duration currentBackoff = this.initialBackoff;
        int attempt = 0;

        while (true) {
            attempt++;
            try {
                return action.get();
            } catch (QueryException exception) {

                if (!exception.isRetryable() || (attempt >= this.maxAttempts)) {
                    throw exception;
                }

                LOGGER.warning("[" + contextName + "] " + exception.getClass().getSimpleName() + " (attempt " + attempt
                    + " of " + this.maxAttempts + ", waiting " + currentBackoff.toMillis() + " ms): " + exception.getMessage());

                if (this.onRetry != null) {
                    this.onRetry.accept(attempt);
                }

                try {
                    Thread.sleep(currentBackoff.toMillis());
                } catch (InterruptedException interrupted) {
                    Thread.currentThread().interrupt();
                    throw new QueryExecutionException("Retry interrupted for " + contextName, interrupted);
                }

                // Calculate next backoff with exponential increase, capped at maxBackoff
                long nextBackoffMs = (long) (currentBackoff.toMillis() * this.multiplier);
                currentBackoff = Duration.ofMillis(Math.min(nextBackoffMs, this.maxBackoff.toMillis()));
            }
        }
    }
}
