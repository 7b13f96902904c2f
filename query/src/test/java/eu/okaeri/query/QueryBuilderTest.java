package eu.okaeri.query;

import eu.okaeri.query.aggregation.Aggregate;
import eu.okaeri.query.aggregation.AggregateFunction;
import eu.okaeri.query.aggregation.Aggregation;
import eu.okaeri.query.filter.CompositeFilter;
import eu.okaeri.query.filter.Filter;
import eu.okaeri.query.filter.LogicalOperator;
import eu.okaeri.query.filter.condition.Condition;
import eu.okaeri.query.filter.condition.Operator;
import eu.okaeri.query.pagination.Pagination;
import eu.okaeri.query.relation.JoinType;
import eu.okaeri.query.relation.Relation;
import eu.okaeri.query.search.SearchType;
import eu.okaeri.query.sort.Sort;
import eu.okaeri.query.value.Value;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class QueryBuilderTest {

    @Test
    void builds_filtered_sorted_paginated_query() {

        Query query = Query.builder("users")
            .eq("status", "active")
            .gte("age", 18)
            .sortDesc("created_at")
            .limit(50)
            .build();

        assertThat(query.getEntity()).isEqualTo("users");
        assertThat(query.getFilter()).isInstanceOf(CompositeFilter.class);

        CompositeFilter filter = (CompositeFilter) query.getFilter();
        assertThat(filter.getOperator()).isEqualTo(LogicalOperator.AND);
        assertThat(filter.getChildren()).containsExactly(Condition.eq("status", "active"), Condition.gte("age", 18));

        assertThat(query.getSort()).containsExactly(Sort.desc("created_at"));
        assertThat(query.getPagination()).isEqualTo(Pagination.ofSize(50));
        assertThat(query.getProjection()).isNull();
        assertThat(query.getAggregation()).isNull();
        assertThat(query.getSearch()).isNull();
        assertThat(query.getOptions()).isNull();
        assertThat(query.getRelations()).isEmpty();
    }

    @Test
    void single_filter_is_not_wrapped() {
        Query query = Query.builder("users").eq("status", "active").build();
        assertThat(query.getFilter()).isEqualTo(Condition.eq("status", "active"));
    }

    @Test
    void single_child_composites_are_collapsed() {

        Condition active = Condition.eq("status", "active");
        assertThat(Query.builder("users").where(Filter.and(active)).build().getFilter()).isEqualTo(active);
        assertThat(Query.builder("users").where(Filter.or(Filter.and(active))).build().getFilter()).isEqualTo(active);

        Filter combined = Query.builder("users").where(Filter.or(active)).lt("age", 65).build().getFilter();
        assertThat(((CompositeFilter) combined).getChildren()).containsExactly(active, Condition.lt("age", 65));
    }

    @Test
    void no_filter_gives_null() {
        Query query = Query.builder("users").build();
        assertThat(query.getFilter()).isNull();
        assertThat(query.hasFilter()).isFalse();
    }

    @Test
    void filters_keep_call_order() {
        Filter first = Condition.isNotNull("email");
        Filter second = Filter.or(Condition.eq("role", "admin"), Condition.eq("role", "owner"));
        Query query = Query.builder("users").where(first).where(second).lt("age", 65).build();
        assertThat(((CompositeFilter) query.getFilter()).getChildren()).containsExactly(first, second, Condition.lt("age", 65));
    }

    @Test
    void build_is_repeatable_and_keeps_state() {

        QueryBuilder builder = Query.builder("users").eq("status", "active").sortAsc("name");
        Query first = builder.build();
        Query second = builder.build();
        assertThat(first).isEqualTo(second);

        Query third = builder.eq("verified", true).build();
        assertThat(((CompositeFilter) third.getFilter()).getChildren()).hasSize(2);
        assertThat(third.getSort()).containsExactly(Sort.asc("name"));
    }

    @Test
    void duplicate_sorts_are_kept() {
        Query query = Query.builder("users").sortAsc("name").sortAsc("name").sortDesc("id").build();
        assertThat(query.getSort()).containsExactly(Sort.asc("name"), Sort.asc("name"), Sort.desc("id"));
    }

    @Test
    void default_page_size_is_injected() {
        Query query = Query.builder("users").build();
        assertThat(query.getPagination()).isEqualTo(Pagination.ofSize(QueryBuilder.DEFAULT_PAGE_SIZE));
        assertThat(QueryBuilder.DEFAULT_PAGE_SIZE).isEqualTo(50);
    }

    @Test
    void aggregation_gets_no_default_pagination() {
        Query query = Query.builder("orders").count().build();
        assertThat(query.getPagination()).isNull();
        assertThat(query.getAggregation().isGlobal()).isTrue();

        Query limited = Query.builder("orders").groupBy("status").count().limit(10).build();
        assertThat(limited.getPagination()).isEqualTo(Pagination.ofSize(10));
    }

    @Test
    void cursor_without_limit_uses_default_page_size() {
        Query query = Query.builder("users").cursor("abc").build();
        assertThat(query.getPagination()).isEqualTo(new Pagination(QueryBuilder.DEFAULT_PAGE_SIZE, "abc", null));

        Query offset = Query.builder("users").limit(5).offset(20).build();
        assertThat(offset.getPagination()).isEqualTo(new Pagination(5, null, 20));
    }

    @Test
    void last_projection_wins() {
        Query query = Query.builder("users").include("id", "name").exclude("password").build();
        assertThat(query.getProjection()).isEqualTo(Projection.exclude("password"));
        assertThat(query.hasProjection()).isTrue();
    }

    @Test
    void options_are_merged() {

        Query query = Query.builder("users")
            .timeout(Duration.ofSeconds(2))
            .countTotal()
            .consistency(ConsistencyLevel.STRONG)
            .explain()
            .build();

        assertThat(query.getOptions()).isEqualTo(new QueryOptions(2000, true, ConsistencyLevel.STRONG, true));
        assertThat(Query.builder("users").build().effectiveOptions()).isEqualTo(QueryOptions.defaults());
    }

    @Test
    void values_are_coerced() {
        Instant instant = Instant.parse("2024-01-02T03:04:05Z");
        Condition condition = (Condition) Query.builder("events").gt("at", instant).build().getFilter();
        assertThat(condition.getOperand()).isEqualTo(Value.string("2024-01-02T03:04:05Z"));

        Condition number = (Condition) Query.builder("events").eq("count", 3).build().getFilter();
        assertThat(number.getOperand()).isEqualTo(Value.number(3));
    }

    @Test
    void invalid_parts_are_rejected() {
        assertThatThrownBy(() -> Query.builder(" ").build()).isInstanceOf(QueryValidationException.class);
        assertThatThrownBy(() -> Query.builder("users").limit(0).build()).isInstanceOf(QueryValidationException.class);
        assertThatThrownBy(() -> Query.builder("users").offset(-1).build()).isInstanceOf(QueryValidationException.class);
        assertThatThrownBy(() -> Query.builder("users").timeout(-5)).isInstanceOf(QueryValidationException.class);
        assertThatThrownBy(() -> Query.builder("users").count().count().build()).isInstanceOf(QueryValidationException.class);
        assertThatThrownBy(() -> Query.builder("users").gt("age", null)).isInstanceOf(QueryValidationException.class);
    }

    @Test
    void joins_reference_aliased_fields() {

        Query query = Query.builder("orders")
            .join(Relation.inner("customers", "customer", "customer_id", "id"))
            .eq("customer.country", "PL")
            .build();

        Relation relation = query.getRelations().get(0);
        assertThat(relation.getType()).isEqualTo(JoinType.INNER);
        Condition on = (Condition) relation.getOn();
        assertThat(on.getOperator()).isEqualTo(Operator.EQ);
        assertThat(on.getOperand()).isEqualTo(Value.field("customer.id"));
        assertThat(on.hasFieldReferences()).isTrue();

        assertThatThrownBy(() -> Query.builder("orders")
            .join(Relation.inner("customers", "customer", "customer_id", "id"))
            .join(Relation.leftOuter("customers", "customer", "customer_id", "id"))
            .build()).isInstanceOf(QueryValidationException.class);
    }

    @Test
    void builds_grouped_aggregation() {

        Query query = Query.builder("sales")
            .gte("sold_at", "2024-01-01")
            .groupBy("category")
            .count()
            .sum("amount")
            .avg("amount", "avg_amount")
            .percentile("amount", 95)
            .having(Condition.gt("sum_amount", 10000))
            .sortDesc("sum_amount")
            .build();

        Aggregation aggregation = query.getAggregation();
        assertThat(aggregation.getGroupBy()).containsExactly(FieldPath.of("category"));
        assertThat(aggregation.getAggregates()).extracting(Aggregate::getAlias)
            .containsExactly("count", "sum_amount", "avg_amount", "p95_amount");
        assertThat(aggregation.getAggregates().get(1).getFunction()).isEqualTo(AggregateFunction.SUM);
        assertThat(aggregation.getHaving()).isEqualTo(Condition.gt("sum_amount", 10000));
        assertThat(query.getPagination()).isNull();
    }

    @Test
    void aggregation_replaces_previous_configuration() {
        Aggregation replacement = Aggregation.of(List.of("region"), List.of(Aggregate.of(AggregateFunction.MAX, "amount")));
        Query query = Query.builder("sales").groupBy("category").count().aggregation(replacement).build();
        assertThat(query.getAggregation()).isEqualTo(replacement);
    }

    @Test
    void builds_searches() {

        Query text = Query.builder("products").searchFullText("wireless headphones", "name", "description").build();
        assertThat(text.getSearch().getType()).isEqualTo(SearchType.FULL_TEXT);
        assertThat(text.getSearch().getFields()).containsExactly("name", "description");
        assertThat(text.getSearch().getMinScore()).isZero();

        Query hybrid = Query.builder("products")
            .searchHybrid("headphones", List.of("name"), "embedding", List.of(1f, 0f), 0.5)
            .build();
        assertThat(hybrid.getSearch().getDimensions()).isEqualTo(2);
        assertThat(hybrid.getSearch().getMinScore()).isEqualTo(0.5);

        assertThatThrownBy(() -> Query.builder("products").searchSemantic("embedding", List.of(), 0))
            .isInstanceOf(QueryValidationException.class);
    }
}
