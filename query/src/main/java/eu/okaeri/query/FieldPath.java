package eu.okaeri.query;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NonNull;

import java.util.Arrays;
import java.util.List;

/**
 * Dot separated path addressing a field, possibly nested
 * (e.g. {@code address.city}) or inside a joined alias
 * (e.g. {@code customer.id}).
 */
@Getter
@EqualsAndHashCode
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class FieldPath {

    public static final String SEPARATOR = ".";

    private final String value;

    public static FieldPath of(@NonNull String path) {
        String trimmed = path.trim();
        if (trimmed.isEmpty()) {
            throw new QueryValidationException("field path cannot be empty");
        }
        if (trimmed.startsWith(SEPARATOR) || trimmed.endsWith(SEPARATOR) || trimmed.contains(SEPARATOR + SEPARATOR)) {
            throw new QueryValidationException("field path '" + path + "' contains an empty segment");
        }
        return new FieldPath(trimmed);
    }

    public static FieldPath of(@NonNull String... parts) {
        return of(String.join(SEPARATOR, parts));
    }

    public FieldPath sub(@NonNull String part) {
        return of(this.value + SEPARATOR + part);
    }

    public List<String> toParts() {
        return Arrays.asList(this.value.split("\\."));
    }

    public String head() {
        int index = this.value.indexOf(SEPARATOR);
        return (index == -1) ? this.value : this.value.substring(0, index);
    }

    public boolean isNested() {
        return this.value.contains(SEPARATOR);
    }

    @Override
    public String toString() {
        return this.value;
    }
}
