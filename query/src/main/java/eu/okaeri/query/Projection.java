package eu.okaeri.query;

import lombok.Data;
import lombok.NonNull;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Either a list of fields to keep or a list of fields to drop, never both.
 */
@Data
public class Projection {

    private final List<FieldPath> include;
    private final List<FieldPath> exclude;

    public Projection(@NonNull List<FieldPath> include, @NonNull List<FieldPath> exclude) {
        if (!include.isEmpty() && !exclude.isEmpty()) {
            throw new QueryValidationException("projection cannot both include " + include + " and exclude " + exclude);
        }
        this.include = Collections.unmodifiableList(new ArrayList<>(include));
        this.exclude = Collections.unmodifiableList(new ArrayList<>(exclude));
    }

    public static Projection include(@NonNull String... fields) {
        return new Projection(paths(fields), Collections.emptyList());
    }

    public static Projection exclude(@NonNull String... fields) {
        return new Projection(Collections.emptyList(), paths(fields));
    }

    private static List<FieldPath> paths(String... fields) {
        List<FieldPath> paths = new ArrayList<>(fields.length);
        for (String field : Arrays.asList(fields)) {
            paths.add(FieldPath.of(field));
        }
        return paths;
    }

    public boolean isInclusive() {
        return !this.include.isEmpty();
    }

    public boolean isEmpty() {
        return this.include.isEmpty() && this.exclude.isEmpty();
    }
}
