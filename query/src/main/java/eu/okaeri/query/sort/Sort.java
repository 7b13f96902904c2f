package eu.okaeri.query.sort;

import eu.okaeri.query.FieldPath;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NonNull;

/**
 * Single sort key. In a list of sorts the first entry is the primary key
 * and each following entry breaks ties of the previous ones.
 */
@Data
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class Sort {

    private final FieldPath field;
    private final SortDirection direction;
    private final NullOrdering nulls;

    public static Sort of(@NonNull FieldPath field, @NonNull SortDirection direction, @NonNull NullOrdering nulls) {
        return new Sort(field, direction, nulls);
    }

    public static Sort asc(@NonNull String field) {
        return new Sort(FieldPath.of(field), SortDirection.ASC, NullOrdering.DEFAULT);
    }

    public static Sort asc(@NonNull String field, @NonNull NullOrdering nulls) {
        return new Sort(FieldPath.of(field), SortDirection.ASC, nulls);
    }

    public static Sort desc(@NonNull String field) {
        return new Sort(FieldPath.of(field), SortDirection.DESC, NullOrdering.DEFAULT);
    }

    public static Sort desc(@NonNull String field, @NonNull NullOrdering nulls) {
        return new Sort(FieldPath.of(field), SortDirection.DESC, nulls);
    }

    public Sort nullsFirst() {
        return new Sort(this.field, this.direction, NullOrdering.FIRST);
    }

    public Sort nullsLast() {
        return new Sort(this.field, this.direction, NullOrdering.LAST);
    }
}
