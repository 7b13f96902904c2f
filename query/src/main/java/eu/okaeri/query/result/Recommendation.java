package eu.okaeri.query.result;

import lombok.Data;
import lombok.NonNull;

@Data
public class Recommendation {

    private final @NonNull Severity severity;
    private final @NonNull String description;

    public static Recommendation info(@NonNull String description) {
        return new Recommendation(Severity.INFO, description);
    }

    public static Recommendation warning(@NonNull String description) {
        return new Recommendation(Severity.WARNING, description);
    }

    public static Recommendation critical(@NonNull String description) {
        return new Recommendation(Severity.CRITICAL, description);
    }
}
