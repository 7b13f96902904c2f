package eu.okaeri.query.pagination;

import eu.okaeri.query.QueryValidationException;
import lombok.Data;
import lombok.NonNull;

/**
 * Page size plus an optional continuation point.
 * <p>
 * The cursor is an opaque token issued by the executor and must be passed
 * back unmodified. The offset is a positional fallback that may skip or
 * repeat rows under concurrent writes. Both are alternative modes; cursor
 * continuation is only stable when the result order is deterministic.
 */
@Data
public class Pagination {

    private final int pageSize;
    private final String cursor;
    private final Integer offset;

    public Pagination(int pageSize, String cursor, Integer offset) {
        if (pageSize <= 0) {
            throw new QueryValidationException("page size must be positive, got " + pageSize);
        }
        if ((offset != null) && (offset < 0)) {
            throw new QueryValidationException("offset cannot be negative, got " + offset);
        }
        if ((cursor != null) && cursor.isEmpty()) {
            throw new QueryValidationException("cursor cannot be empty");
        }
        this.pageSize = pageSize;
        this.cursor = cursor;
        this.offset = offset;
    }

    public static Pagination ofSize(int pageSize) {
        return new Pagination(pageSize, null, null);
    }

    public Pagination withCursor(@NonNull String cursor) {
        return new Pagination(this.pageSize, cursor, this.offset);
    }

    public Pagination withOffset(int offset) {
        return new Pagination(this.pageSize, this.cursor, offset);
    }

    public boolean hasCursor() {
        return this.cursor != null;
    }

    public boolean hasOffset() {
        return this.offset != null;
    }
}
