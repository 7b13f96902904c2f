package eu.okaeri.query.evaluate;

import eu.okaeri.query.filter.Filter;
import eu.okaeri.query.filter.condition.Condition;
import eu.okaeri.query.filter.condition.Operator;
import eu.okaeri.query.sort.NullOrdering;
import eu.okaeri.query.sort.Sort;
import eu.okaeri.query.value.Value;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static eu.okaeri.query.evaluate.Rows.row;
import static eu.okaeri.query.filter.Filter.and;
import static eu.okaeri.query.filter.Filter.not;
import static eu.okaeri.query.filter.Filter.or;
import static eu.okaeri.query.filter.condition.Condition.*;
import static org.assertj.core.api.Assertions.assertThat;

class InMemoryFilterEvaluatorTest {

    private final InMemoryFilterEvaluator evaluator = new InMemoryFilterEvaluator();

    private final Map<String, Object> alice = row(
        "name", "Alice",
        "age", 31,
        "status", "active",
        "address", Map.of("city", "Warsaw", "zip", "00-001"),
        "tags", List.of("admin", "beta")
    );

    @Test
    void and_requires_every_child() {
        assertThat(this.evaluator.matches(and(eq("status", "active"), gte("age", 18)), this.alice)).isTrue();
        assertThat(this.evaluator.matches(and(eq("status", "active"), gte("age", 40)), this.alice)).isFalse();
        assertThat(this.evaluator.matches(and(gte("age", 40), eq("status", "active")), this.alice)).isFalse();
    }

    @Test
    void and_of_conditions_equals_separate_checks() {
        List<Condition> conditions = List.of(eq("status", "active"), lt("age", 35), arrayContains("tags", "beta"));
        boolean separately = conditions.stream().allMatch(condition -> this.evaluator.evaluateCondition(condition, this.alice));
        assertThat(this.evaluator.matches(Filter.and(conditions), this.alice)).isEqualTo(separately).isTrue();
    }

    @Test
    void or_and_not() {
        assertThat(this.evaluator.matches(or(eq("status", "banned"), eq("name", "Alice")), this.alice)).isTrue();
        assertThat(this.evaluator.matches(or(eq("status", "banned"), eq("name", "Bob")), this.alice)).isFalse();
        assertThat(this.evaluator.matches(not(eq("status", "banned")), this.alice)).isTrue();
        assertThat(this.evaluator.matches(not(not(eq("status", "banned"))), this.alice)).isFalse();
        assertThat(this.evaluator.matches(and(or(eq("age", 1), eq("age", 31)), not(isNull("name"))), this.alice)).isTrue();
    }

    @Test
    void nested_and_missing_fields() {
        assertThat(this.evaluator.matches(eq("address.city", "Warsaw"), this.alice)).isTrue();
        assertThat(this.evaluator.matches(isNull("address.country"), this.alice)).isTrue();
        assertThat(this.evaluator.matches(isNull("missing.deeply.nested"), this.alice)).isTrue();
        assertThat(this.evaluator.matches(eq("missing", "x"), this.alice)).isFalse();
        assertThat(this.evaluator.matches(notIn("missing", "x"), this.alice)).isTrue();
    }

    @Test
    void deep_trees_do_not_overflow() {
        Filter filter = eq("status", "active");
        for (int i = 0; i < 10_000; i++) {
            filter = and(filter);
        }
        assertThat(this.evaluator.matches(filter, this.alice)).isTrue();
        assertThat(InMemoryFilterEvaluator.conditions(filter)).containsExactly(eq("status", "active"));

        Filter negated = eq("status", "active");
        for (int i = 0; i < 10_001; i++) {
            negated = not(negated);
        }
        assertThat(this.evaluator.matches(negated, this.alice)).isFalse();
    }

    @Test
    void field_references_resolve_against_row() {
        Map<String, Object> order = row("customer_id", 7, "customer", Map.of("id", 7), "limit", 10, "spent", 12);
        assertThat(this.evaluator.matches(fieldEq("customer_id", "customer.id"), order)).isTrue();
        assertThat(this.evaluator.matches(Condition.of("spent", Operator.GT, Value.field("limit")), order)).isTrue();
        assertThat(this.evaluator.matches(fieldEq("customer_id", "missing.id"), order)).isFalse();
    }

    @Test
    void conditions_are_listed_depth_first() {
        Filter filter = and(eq("a", 1), or(eq("b", 2), not(eq("c", 3))), eq("d", 4));
        assertThat(InMemoryFilterEvaluator.conditions(filter)).extracting(condition -> condition.getField().getValue())
            .containsExactly("a", "b", "c", "d");
    }

    @Test
    void sorts_with_ties_and_nulls() {

        List<Map<String, Object>> rows = List.of(
            row("name", "c", "score", 2),
            row("name", "a", "score", null),
            row("name", "b", "score", 2),
            row("name", "d", "score", 5)
        );

        assertThat(names(rows, Sort.asc("score"), Sort.asc("name"))).containsExactly("b", "c", "d", "a");
        assertThat(names(rows, Sort.desc("score"), Sort.asc("name"))).containsExactly("a", "d", "b", "c");
        assertThat(names(rows, Sort.asc("score", NullOrdering.FIRST), Sort.desc("name"))).containsExactly("a", "c", "b", "d");
        assertThat(names(rows, Sort.desc("score", NullOrdering.LAST), Sort.asc("name"))).containsExactly("d", "b", "c", "a");
    }

    @Test
    void sorts_mixed_type_field() {

        List<Map<String, Object>> rows = new ArrayList<>();
        for (int i = 0; i < 200; i++) {
            rows.add(row("name", "row-" + i, "v", (i % 3 == 0) ? (Object) String.valueOf(i) : (Object) i));
        }
        rows.add(row("name", "flag", "v", true));
        Collections.shuffle(rows, new Random(7));

        List<Object> values = this.evaluator.applyFilter(rows.stream(), null, List.of(Sort.asc("v")))
            .map(row -> row.get("v"))
            .collect(Collectors.toList());

        assertThat(values).hasSize(201);
        assertThat(values.get(0)).isEqualTo(1);
        assertThat(values.get(132)).isEqualTo(199);
        assertThat(values.get(133)).isEqualTo("0");
        assertThat(values.get(200)).isEqualTo(true);
    }

    @Test
    void empty_sort_gives_no_comparator() {
        Comparator<Map<String, Object>> comparator = this.evaluator.buildComparator(List.of());
        assertThat(comparator).isNull();
    }

    @Test
    void apply_filter_filters_and_sorts() {
        Stream<Map<String, Object>> stream = Stream.of(row("n", 3), row("n", 1), row("n", 2), row("n", 10));
        List<Object> result = this.evaluator.applyFilter(stream, lt("n", 5), List.of(Sort.desc("n")))
            .map(row -> row.get("n"))
            .collect(Collectors.toList());
        assertThat(result).containsExactly(3, 2, 1);
    }

    private List<Object> names(List<Map<String, Object>> rows, Sort... sorts) {
        return this.evaluator.applyFilter(rows.stream(), null, List.of(sorts))
            .map(row -> row.get("name"))
            .collect(Collectors.toList());
    }
}
