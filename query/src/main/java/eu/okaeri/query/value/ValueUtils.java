package eu.okaeri.query.value;

import lombok.NonNull;

import java.lang.reflect.Array;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Utility methods for extracting and comparing values of evaluated rows.
 */
public final class ValueUtils {

    private ValueUtils() {
    }

    /**
     * Extract a value from a nested map using a path.
     *
     * @param map   the map to extract from
     * @param parts the path parts (e.g., ["customer", "address", "city"])
     * @return the value at the path, or null if not found
     */
    public static Object extractValue(Map<?, ?> map, @NonNull List<String> parts) {
        Object current = map;

        for (String part : parts) {
            if (!(current instanceof Map)) {
                return null;
            }
            current = ((Map<?, ?>) current).get(part);
            if (current == null) {
                return null;
            }
        }

        return current;
    }

    /**
     * Put a value into a nested map, creating intermediate maps as needed.
     *
     * @param map   the map to write into
     * @param parts the path parts
     * @param value the value to store
     */
    @SuppressWarnings("unchecked")
    public static void putValue(@NonNull Map<String, Object> map, @NonNull List<String> parts, Object value) {
        Map<String, Object> current = map;

        for (int i = 0; i < (parts.size() - 1); i++) {
            Object next = current.get(parts.get(i));
            if (!(next instanceof Map)) {
                next = new LinkedHashMap<String, Object>();
                current.put(parts.get(i), next);
            }
            current = (Map<String, Object>) next;
        }

        current.put(parts.get(parts.size() - 1), value);
    }

    /**
     * Remove a value from a nested map, leaving intermediate maps in place.
     *
     * @param map   the map to remove from
     * @param parts the path parts
     * @return true if a value was present and removed
     */
    public static boolean removeValue(@NonNull Map<String, Object> map, @NonNull List<String> parts) {
        Object current = map;

        for (int i = 0; i < (parts.size() - 1); i++) {
            if (!(current instanceof Map)) {
                return false;
            }
            current = ((Map<?, ?>) current).get(parts.get(i));
        }

        if (!(current instanceof Map)) {
            return false;
        }
        String last = parts.get(parts.size() - 1);
        Map<?, ?> parent = (Map<?, ?>) current;
        if (!parent.containsKey(last)) {
            return false;
        }
        parent.remove(last);
        return true;
    }

    /**
     * Copy of a row with nested maps and lists copied as well,
     * so that the copy can be modified without touching the source.
     */
    public static Map<String, Object> deepCopy(@NonNull Map<String, Object> map) {
        Map<String, Object> copy = new LinkedHashMap<>(map.size());
        for (Map.Entry<String, Object> entry : map.entrySet()) {
            copy.put(entry.getKey(), copyValue(entry.getValue()));
        }
        return copy;
    }

    @SuppressWarnings("unchecked")
    private static Object copyValue(Object value) {
        if (value instanceof Map) {
            return deepCopy((Map<String, Object>) value);
        }
        if (value instanceof Collection) {
            List<Object> copy = new ArrayList<>(((Collection<?>) value).size());
            for (Object element : (Collection<?>) value) {
                copy.add(copyValue(element));
            }
            return copy;
        }
        return value;
    }

    /**
     * Native Java form of a literal value. Field references have no literal
     * form and must be resolved by the caller.
     *
     * @param value the value to convert
     * @return String, Double, Boolean or null
     */
    public static Object toNative(@NonNull Value value) {
        if (value.isFieldRef()) {
            throw new IllegalArgumentException("field reference " + value + " must be resolved against a row");
        }
        return value.getValue();
    }

    /**
     * Compare two values for equality with type coercion.
     * Numbers compare numerically regardless of their boxed type,
     * numeric strings compare equal to matching numbers.
     * Values of unrelated types are never equal.
     *
     * @param value1 first value
     * @param value2 second value
     * @return true if values are equal
     */
    public static boolean compareEquals(Object value1, Object value2) {
        // Both null
        if ((value1 == null) && (value2 == null)) {
            return true;
        }

        // One null
        if ((value1 == null) || (value2 == null)) {
            return false;
        }

        // Both numbers - compare as double
        if ((value1 instanceof Number) && (value2 instanceof Number)) {
            return ((Number) value1).doubleValue() == ((Number) value2).doubleValue();
        }

        // Same type - use equals
        if (value1.getClass() == value2.getClass()) {
            return value1.equals(value2);
        }

        // String and number - compare numerically
        if (((value1 instanceof CharSequence) || (value1 instanceof Number)) && ((value2 instanceof CharSequence) || (value2 instanceof Number))) {
            BigDecimal left = parseDecimal(value1);
            BigDecimal right = parseDecimal(value2);
            return (left != null) && (right != null) && (left.compareTo(right) == 0);
        }

        // Enum and string - compare by name
        if ((value1 instanceof Enum) || (value2 instanceof Enum)) {
            return Objects.equals(asText(value1), asText(value2));
        }

        if ((value1 instanceof CharSequence) && (value2 instanceof CharSequence)) {
            return value1.toString().equals(value2.toString());
        }

        return false;
    }

    /**
     * Compare two values by their natural order.
     * Numbers compare numerically, strings lexicographically (numeric strings
     * against numbers compare numerically). ISO-8601 timestamps order correctly
     * as strings.
     *
     * @param value1 first value
     * @param value2 second value
     * @return comparison result, or null if the values have no common order
     */
    public static Integer compareOrdered(Object value1, Object value2) {

        if ((value1 == null) || (value2 == null)) {
            return null;
        }

        if ((value1 instanceof Number) && (value2 instanceof Number)) {
            return Double.compare(((Number) value1).doubleValue(), ((Number) value2).doubleValue());
        }

        if ((value1 instanceof CharSequence) && (value2 instanceof CharSequence)) {
            return value1.toString().compareTo(value2.toString());
        }

        if (((value1 instanceof CharSequence) || (value1 instanceof Number)) && ((value2 instanceof CharSequence) || (value2 instanceof Number))) {
            BigDecimal left = parseDecimal(value1);
            BigDecimal right = parseDecimal(value2);
            return ((left == null) || (right == null)) ? null : left.compareTo(right);
        }

        if ((value1 instanceof Boolean) && (value2 instanceof Boolean)) {
            return Boolean.compare((Boolean) value1, (Boolean) value2);
        }

        return null;
    }

    /**
     * Compare two values for sorting. Nulls are not handled here,
     * the caller decides on their placement.
     * <p>
     * The order is total over mixed types: numbers come first, then strings,
     * then booleans, then anything else. Numeric strings sort as strings,
     * unlike {@link #compareOrdered(Object, Object)}.
     *
     * @param value1 first value, not null
     * @param value2 second value, not null
     * @return negative if value1 < value2, 0 if equal, positive if value1 > value2
     */
    public static int compareForSort(@NonNull Object value1, @NonNull Object value2) {

        int rank1 = sortRank(value1);
        int rank2 = sortRank(value2);
        if (rank1 != rank2) {
            return Integer.compare(rank1, rank2);
        }

        switch (rank1) {
            case 0:
                return Double.compare(((Number) value1).doubleValue(), ((Number) value2).doubleValue());
            case 1:
                return asText(value1).compareTo(asText(value2));
            case 2:
                return Boolean.compare((Boolean) value1, (Boolean) value2);
            default:
                int byType = value1.getClass().getName().compareTo(value2.getClass().getName());
                return (byType != 0) ? byType : String.valueOf(value1).compareTo(String.valueOf(value2));
        }
    }

    private static int sortRank(Object value) {
        if (value instanceof Number) {
            return 0;
        }
        if ((value instanceof CharSequence) || (value instanceof Enum)) {
            return 1;
        }
        if (value instanceof Boolean) {
            return 2;
        }
        return 3;
    }

    /**
     * @return true for numeric values; booleans and numeric strings are not numeric
     */
    public static boolean isNumeric(Object value) {
        return (value instanceof Number) && !Double.isNaN(((Number) value).doubleValue());
    }

    /**
     * View arrays and collections as a list, anything else as null.
     */
    public static List<Object> asList(Object value) {

        if (value instanceof List) {
            return Collections.unmodifiableList((List<?>) value);
        }

        if (value instanceof Collection) {
            return new ArrayList<>((Collection<?>) value);
        }

        if ((value != null) && value.getClass().isArray()) {
            int length = Array.getLength(value);
            List<Object> list = new ArrayList<>(length);
            for (int i = 0; i < length; i++) {
                list.add(Array.get(value, i));
            }
            return list;
        }

        return null;
    }

    /**
     * Canonical form used for grouping and distinct counting,
     * so that 1, 1L and 1.0 collapse into a single key.
     */
    public static Object normalizeKey(Object value) {
        if (value instanceof Number) {
            return ((Number) value).doubleValue();
        }
        if (value instanceof CharSequence) {
            return value.toString();
        }
        if (value instanceof Enum) {
            return ((Enum<?>) value).name();
        }
        return value;
    }

    private static String asText(Object value) {
        return (value instanceof Enum) ? ((Enum<?>) value).name() : String.valueOf(value);
    }

    private static BigDecimal parseDecimal(Object value) {
        try {
            return new BigDecimal(String.valueOf(value).trim());
        } catch (NumberFormatException ignored) {
            return null;
        }
    }
}
