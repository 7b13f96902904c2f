package eu.okaeri.query.value;

import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Month;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;

class ValueUtilsTest {

    @Nested
    class ExtractValue {

        @Test
        void returns_nested_value() {
            Map<String, Object> map = Map.of("user", Map.of("profile", Map.of("name", "alice")));
            assertThat(ValueUtils.extractValue(map, List.of("user", "profile", "name"))).isEqualTo("alice");
        }

        @Test
        void returns_null_when_path_not_found() {
            Map<String, Object> map = Map.of("name", "alice");
            assertThat(ValueUtils.extractValue(map, List.of("missing"))).isNull();
            assertThat(ValueUtils.extractValue(map, List.of("name", "first"))).isNull();
        }
    }

    @Nested
    class PutAndRemoveValue {

        @Test
        void put_creates_intermediate_maps() {
            Map<String, Object> map = new LinkedHashMap<>();
            ValueUtils.putValue(map, List.of("address", "city"), "Krakow");
            assertThat(map).isEqualTo(Map.of("address", Map.of("city", "Krakow")));
        }

        @Test
        void remove_leaves_siblings() {
            Map<String, Object> map = new LinkedHashMap<>();
            ValueUtils.putValue(map, List.of("address", "city"), "Krakow");
            ValueUtils.putValue(map, List.of("address", "zip"), "30-001");

            assertThat(ValueUtils.removeValue(map, List.of("address", "city"))).isTrue();
            assertThat(ValueUtils.removeValue(map, List.of("address", "city"))).isFalse();
            assertThat(map).isEqualTo(Map.of("address", Map.of("zip", "30-001")));
        }

        @Test
        void deep_copy_is_detached() {
            Map<String, Object> nested = new LinkedHashMap<>(Map.of("city", "Krakow"));
            Map<String, Object> map = new LinkedHashMap<>();
            map.put("address", nested);
            map.put("tags", new ArrayList<>(List.of("a")));

            Map<String, Object> copy = ValueUtils.deepCopy(map);
            nested.put("city", "Gdansk");

            assertThat(copy).isEqualTo(Map.of("address", Map.of("city", "Krakow"), "tags", List.of("a")));
        }
    }

    @Nested
    class CompareEquals {

        @Test
        void numbers_compare_numerically() {
            assertThat(ValueUtils.compareEquals(1, 1.0)).isTrue();
            assertThat(ValueUtils.compareEquals(1L, 1.0f)).isTrue();
            assertThat(ValueUtils.compareEquals(1, 1.1)).isFalse();
        }

        @Test
        void numeric_strings_equal_numbers() {
            assertThat(ValueUtils.compareEquals("42", 42.0)).isTrue();
            assertThat(ValueUtils.compareEquals("abc", 42.0)).isFalse();
        }

        @Test
        void enums_equal_their_names() {
            assertThat(ValueUtils.compareEquals(Month.MAY, "MAY")).isTrue();
            assertThat(ValueUtils.compareEquals("JUNE", Month.MAY)).isFalse();
        }

        @Test
        void nulls() {
            assertThat(ValueUtils.compareEquals(null, null)).isTrue();
            assertThat(ValueUtils.compareEquals(null, 1)).isFalse();
        }
    }

    @Nested
    class CompareOrdered {

        @Test
        void returns_null_without_common_order() {
            assertThat(ValueUtils.compareOrdered("abc", 1.0)).isNull();
            assertThat(ValueUtils.compareOrdered(true, 1.0)).isNull();
            assertThat(ValueUtils.compareOrdered(null, 1.0)).isNull();
        }

        @Test
        void orders_iso_timestamps_as_strings() {
            assertThat(ValueUtils.compareOrdered("2024-01-15T10:30:00Z", "2024-02-01T00:00:00Z")).isNegative();
        }

        @Test
        void sort_ranks_types_before_values() {
            assertThat(ValueUtils.compareForSort(2, 10)).isNegative();
            assertThat(ValueUtils.compareForSort(10, "9")).isNegative();
            assertThat(ValueUtils.compareForSort("zzz", true)).isNegative();
            assertThat(ValueUtils.compareForSort(false, Map.of())).isNegative();
            assertThat(ValueUtils.compareForSort(9, 9.0)).isZero();
        }

        @Test
        void sort_is_total_over_mixed_numbers_and_numeric_strings() {

            List<Object> values = new ArrayList<>();
            for (int i = 0; i < 200; i++) {
                values.add((i % 2 == 0) ? (Object) i : (Object) String.valueOf(i));
            }

            Random random = new Random(42);
            for (int round = 0; round < 50; round++) {
                Collections.shuffle(values, random);
                List<Object> sorted = new ArrayList<>(values);
                sorted.sort(ValueUtils::compareForSort);
                assertThat(sorted.get(0)).isEqualTo(0);
                assertThat(sorted.get(99)).isEqualTo(198);
                assertThat(sorted.get(100)).isEqualTo("1");
                assertThat(sorted.get(101)).isEqualTo("101");
            }
        }
    }

    @Test
    void as_list_accepts_arrays_and_collections() {
        assertThat(ValueUtils.asList(new int[]{1, 2})).containsExactly(1, 2);
        assertThat(ValueUtils.asList(List.of("a"))).containsExactly("a");
        assertThat(ValueUtils.asList("a")).isNull();
    }

    @Test
    void normalize_key_collapses_numeric_types() {
        assertThat(ValueUtils.normalizeKey(1)).isEqualTo(ValueUtils.normalizeKey(1.0));
        assertThat(ValueUtils.normalizeKey(Month.MAY)).isEqualTo("MAY");
    }
}
