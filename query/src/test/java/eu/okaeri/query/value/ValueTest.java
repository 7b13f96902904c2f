package eu.okaeri.query.value;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.ZoneId;
import java.util.Date;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ValueTest {

    @Test
    void of_keeps_booleans() {
        Value value = Value.of(true);
        assertThat(value.getType()).isEqualTo(ValueType.BOOLEAN);
        assertThat(value.asBoolean()).isTrue();
    }

    @Test
    void of_keeps_numbers() {
        assertThat(Value.of(3.14).getType()).isEqualTo(ValueType.NUMBER);
        assertThat(Value.of(3.14).asNumber()).isEqualTo(3.14);
        assertThat(Value.of(7).asNumber()).isEqualTo(7.0);
        assertThat(Value.of(7L)).isEqualTo(Value.of(7));
        assertThat(Value.of(2.5f).asNumber()).isEqualTo(2.5);
    }

    @Test
    void of_keeps_strings() {
        Value value = Value.of("x");
        assertThat(value.getType()).isEqualTo(ValueType.STRING);
        assertThat(value.asString()).isEqualTo("x");
    }

    @Test
    void of_maps_null_to_null_variant() {
        assertThat(Value.of(null).getType()).isEqualTo(ValueType.NULL);
        assertThat(Value.of(null).isNull()).isTrue();
        assertThat(Value.of(null)).isEqualTo(Value.nullValue());
    }

    @Test
    void of_formats_timestamps_as_utc_iso_strings() {
        assertThat(Value.of(Instant.parse("2024-01-15T10:30:00Z")).asString()).isEqualTo("2024-01-15T10:30:00Z");
        assertThat(Value.of(LocalDateTime.of(2024, 1, 15, 10, 30)).asString()).isEqualTo("2024-01-15T10:30:00Z");
        assertThat(Value.of(OffsetDateTime.of(2024, 1, 15, 12, 30, 0, 0, ZoneOffset.ofHours(2))).asString()).isEqualTo("2024-01-15T10:30:00Z");
        assertThat(Value.of(ZonedDateTime.of(2024, 1, 15, 11, 30, 0, 0, ZoneId.of("Europe/Warsaw"))).asString()).isEqualTo("2024-01-15T10:30:00Z");
        assertThat(Value.of(new Date(0)).asString()).isEqualTo("1970-01-01T00:00:00Z");
        assertThat(Value.of(Instant.now()).asString()).endsWith("Z");
    }

    @Test
    void of_stringifies_everything_else() {
        UUID uuid = UUID.fromString("5b3d1c2e-8f6a-4d7b-9c0e-1a2b3c4d5e6f");
        assertThat(Value.of(uuid)).isEqualTo(Value.string("5b3d1c2e-8f6a-4d7b-9c0e-1a2b3c4d5e6f"));
        assertThat(Value.of(TimeUnit.SECONDS)).isEqualTo(Value.string("SECONDS"));
        assertThat(Value.of(List.of(1, 2))).isEqualTo(Value.string("[1, 2]"));
        assertThat(Value.of(new StringBuilder("abc"))).isEqualTo(Value.string("abc"));
    }

    @Test
    void of_is_deterministic() {
        Instant instant = Instant.parse("2024-06-01T00:00:00Z");
        assertThat(Value.of(instant)).isEqualTo(Value.of(instant));
        assertThat(Value.of(42)).isEqualTo(Value.of(42));
        assertThat(Value.of(Value.string("a"))).isEqualTo(Value.string("a"));
    }

    @Test
    void field_reference_is_not_a_string_literal() {
        Value reference = Value.field("customer.id");
        assertThat(reference.isFieldRef()).isTrue();
        assertThat(reference).isNotEqualTo(Value.string("customer.id"));
        assertThat(reference.asFieldPath().toParts()).containsExactly("customer", "id");
        assertThat(reference.toString()).isEqualTo("$customer.id");
    }

    @Test
    void accessors_reject_other_variants() {
        assertThatThrownBy(() -> Value.string("1").asNumber()).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> Value.number(1).asBoolean()).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> Value.bool(true).asString()).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> Value.string("a").asFieldPath()).isInstanceOf(IllegalStateException.class);
    }
}
