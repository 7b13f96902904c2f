package eu.okaeri.query.value;

import eu.okaeri.query.FieldPath;
import lombok.AccessLevel;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Calendar;
import java.util.Date;

/**
 * Tagged scalar used as a filter operand. Exactly one variant is active,
 * as reported by {@link #getType()}.
 */
@Getter
@EqualsAndHashCode
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
public final class Value {

    private static final Value NULL = new Value(ValueType.NULL, null);
    private static final Value TRUE = new Value(ValueType.BOOLEAN, Boolean.TRUE);
    private static final Value FALSE = new Value(ValueType.BOOLEAN, Boolean.FALSE);

    private final ValueType type;
    private final Object value;

    public static Value string(@NonNull String value) {
        return new Value(ValueType.STRING, value);
    }

    public static Value number(double value) {
        return new Value(ValueType.NUMBER, value);
    }

    public static Value bool(boolean value) {
        return value ? TRUE : FALSE;
    }

    public static Value nullValue() {
        return NULL;
    }

    public static Value field(@NonNull String path) {
        return new Value(ValueType.FIELD_REF, FieldPath.of(path).getValue());
    }

    /**
     * Converts a native scalar into a value. Never fails: booleans and numbers
     * keep their variant, timestamps become ISO-8601 UTC strings ending in
     * {@code Z}, {@code null} becomes the null variant and anything else is
     * stored as its string representation (enums by {@link Enum#name()}).
     *
     * @param object the native scalar, may be null
     * @return matching value
     */
    public static Value of(Object object) {

        if (object == null) {
            return NULL;
        }

        if (object instanceof Value) {
            return (Value) object;
        }

        if (object instanceof Boolean) {
            return bool((Boolean) object);
        }

        if (object instanceof Number) {
            return number(((Number) object).doubleValue());
        }

        if (object instanceof CharSequence) {
            return string(object.toString());
        }

        String timestamp = formatTimestamp(object);
        if (timestamp != null) {
            return string(timestamp);
        }

        if (object instanceof Enum) {
            return string(((Enum<?>) object).name());
        }

        return string(String.valueOf(object));
    }

    private static String formatTimestamp(Object object) {

        Instant instant = null;
        if (object instanceof Instant) {
            instant = (Instant) object;
        } else if (object instanceof OffsetDateTime) {
            instant = ((OffsetDateTime) object).toInstant();
        } else if (object instanceof ZonedDateTime) {
            instant = ((ZonedDateTime) object).toInstant();
        } else if (object instanceof LocalDateTime) {
            // zone-less timestamps are taken as UTC
            instant = ((LocalDateTime) object).toInstant(ZoneOffset.UTC);
        } else if (object instanceof Date) {
            instant = Instant.ofEpochMilli(((Date) object).getTime());
        } else if (object instanceof Calendar) {
            instant = ((Calendar) object).toInstant();
        }

        return (instant == null) ? null : DateTimeFormatter.ISO_INSTANT.format(instant);
    }

    public boolean isNull() {
        return this.type == ValueType.NULL;
    }

    public boolean isFieldRef() {
        return this.type == ValueType.FIELD_REF;
    }

    public String asString() {
        if ((this.type != ValueType.STRING) && (this.type != ValueType.FIELD_REF)) {
            throw new IllegalStateException("value is not a string: " + this);
        }
        return (String) this.value;
    }

    public double asNumber() {
        if (this.type != ValueType.NUMBER) {
            throw new IllegalStateException("value is not a number: " + this);
        }
        return (Double) this.value;
    }

    public boolean asBoolean() {
        if (this.type != ValueType.BOOLEAN) {
            throw new IllegalStateException("value is not a boolean: " + this);
        }
        return (Boolean) this.value;
    }

    public FieldPath asFieldPath() {
        if (this.type != ValueType.FIELD_REF) {
            throw new IllegalStateException("value is not a field reference: " + this);
        }
        return FieldPath.of((String) this.value);
    }

    @Override
    public String toString() {
        switch (this.type) {
            case STRING:
                return "\"" + this.value + "\"";
            case FIELD_REF:
                return "$" + this.value;
            default:
                return String.valueOf(this.value);
        }
    }
}
