package eu.okaeri.query;

import eu.okaeri.query.aggregation.Aggregate;
import eu.okaeri.query.aggregation.AggregateFunction;
import eu.okaeri.query.aggregation.Aggregation;
import eu.okaeri.query.filter.CompositeFilter;
import eu.okaeri.query.filter.Filter;
import eu.okaeri.query.filter.condition.Condition;
import eu.okaeri.query.pagination.Pagination;
import eu.okaeri.query.relation.Relation;
import eu.okaeri.query.search.Search;
import eu.okaeri.query.search.SearchType;
import eu.okaeri.query.sort.NullOrdering;
import eu.okaeri.query.sort.Sort;
import lombok.NonNull;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;

/**
 * Fluent assembler of {@link Query} instances.
 * <p>
 * Normalization performed by {@link #build()}:
 * <ul>
 *   <li>filters are collected in call order: none gives no filter, one is used as is,
 *   two or more are wrapped in a single AND keeping call order; an AND/OR holding a
 *   single child is replaced by that child</li>
 *   <li>sorts are kept in call order, without deduplication</li>
 *   <li>when no page size, cursor or offset was set and no aggregation was configured,
 *   a pagination with {@link #DEFAULT_PAGE_SIZE} is added; aggregations get none</li>
 *   <li>projection, aggregation, search and options are present only when configured,
 *   the last call wins</li>
 * </ul>
 * Calling {@link #build()} does not reset the builder, building twice without changes
 * gives equal queries. Builders are not thread-safe.
 * <p>
 * Global defaults can be configured via system properties:
 * <ul>
 *   <li>{@code okaeri.query.defaultPageSize} - page size injected when none was set (default: 50)</li>
 * </ul>
 */
public class QueryBuilder {

    public static final int DEFAULT_PAGE_SIZE = Integer.parseInt(System.getProperty("okaeri.query.defaultPageSize", "50"));

    private final String entity;
    private final List<Filter> filters = new ArrayList<>();
    private final List<Sort> sorts = new ArrayList<>();
    private final List<Relation> relations = new ArrayList<>();
    private Projection projection;
    private Search search;

    private Integer pageSize;
    private String cursor;
    private Integer offset;

    private boolean aggregating;
    private final List<String> groupBy = new ArrayList<>();
    private final List<Aggregate> aggregates = new ArrayList<>();
    private Filter having;

    private QueryOptions options;

    public QueryBuilder(@NonNull String entity) {
        this.entity = entity;
    }

    // Filters

    public QueryBuilder where(@NonNull Filter filter) {
        this.filters.add(filter);
        return this;
    }

    public QueryBuilder where(@NonNull Filter... filters) {
        this.filters.addAll(Arrays.asList(filters));
        return this;
    }

    public QueryBuilder eq(@NonNull String field, Object value) {
        return this.where(Condition.eq(field, value));
    }

    public QueryBuilder ne(@NonNull String field, Object value) {
        return this.where(Condition.ne(field, value));
    }

    public QueryBuilder lt(@NonNull String field, Object value) {
        return this.where(Condition.lt(field, value));
    }

    public QueryBuilder lte(@NonNull String field, Object value) {
        return this.where(Condition.lte(field, value));
    }

    public QueryBuilder gt(@NonNull String field, Object value) {
        return this.where(Condition.gt(field, value));
    }

    public QueryBuilder gte(@NonNull String field, Object value) {
        return this.where(Condition.gte(field, value));
    }

    public QueryBuilder in(@NonNull String field, @NonNull Collection<?> values) {
        return this.where(Condition.in(field, values));
    }

    public QueryBuilder in(@NonNull String field, @NonNull Object... values) {
        return this.where(Condition.in(field, values));
    }

    public QueryBuilder notIn(@NonNull String field, @NonNull Collection<?> values) {
        return this.where(Condition.notIn(field, values));
    }

    public QueryBuilder notIn(@NonNull String field, @NonNull Object... values) {
        return this.where(Condition.notIn(field, values));
    }

    public QueryBuilder contains(@NonNull String field, @NonNull String substring) {
        return this.where(Condition.contains(field, substring));
    }

    public QueryBuilder contains(@NonNull String field, @NonNull String substring, boolean caseSensitive) {
        return this.where(Condition.contains(field, substring, caseSensitive));
    }

    public QueryBuilder startsWith(@NonNull String field, @NonNull String prefix) {
        return this.where(Condition.startsWith(field, prefix));
    }

    public QueryBuilder endsWith(@NonNull String field, @NonNull String suffix) {
        return this.where(Condition.endsWith(field, suffix));
    }

    public QueryBuilder matches(@NonNull String field, @NonNull String regex) {
        return this.where(Condition.matches(field, regex));
    }

    public QueryBuilder isNull(@NonNull String field) {
        return this.where(Condition.isNull(field));
    }

    public QueryBuilder isNotNull(@NonNull String field) {
        return this.where(Condition.isNotNull(field));
    }

    public QueryBuilder arrayContains(@NonNull String field, Object element) {
        return this.where(Condition.arrayContains(field, element));
    }

    public QueryBuilder arrayContainsAny(@NonNull String field, @NonNull Collection<?> elements) {
        return this.where(Condition.arrayContainsAny(field, elements));
    }

    // Sorting

    public QueryBuilder sort(@NonNull Sort... sorts) {
        this.sorts.addAll(Arrays.asList(sorts));
        return this;
    }

    public QueryBuilder sortAsc(@NonNull String field) {
        return this.sort(Sort.asc(field));
    }

    public QueryBuilder sortAsc(@NonNull String field, @NonNull NullOrdering nulls) {
        return this.sort(Sort.asc(field, nulls));
    }

    public QueryBuilder sortDesc(@NonNull String field) {
        return this.sort(Sort.desc(field));
    }

    public QueryBuilder sortDesc(@NonNull String field, @NonNull NullOrdering nulls) {
        return this.sort(Sort.desc(field, nulls));
    }

    // Projection

    public QueryBuilder projection(@NonNull Projection projection) {
        this.projection = projection;
        return this;
    }

    public QueryBuilder include(@NonNull String... fields) {
        return this.projection(Projection.include(fields));
    }

    public QueryBuilder exclude(@NonNull String... fields) {
        return this.projection(Projection.exclude(fields));
    }

    // Pagination

    public QueryBuilder limit(int pageSize) {
        this.pageSize = pageSize;
        return this;
    }

    public QueryBuilder cursor(@NonNull String cursor) {
        this.cursor = cursor;
        return this;
    }

    /**
     * Positional pagination, prefer {@link #cursor(String)} for stable iteration.
     */
    public QueryBuilder offset(int offset) {
        this.offset = offset;
        return this;
    }

    public QueryBuilder pagination(@NonNull Pagination pagination) {
        this.pageSize = pagination.getPageSize();
        this.cursor = pagination.getCursor();
        this.offset = pagination.getOffset();
        return this;
    }

    // Search

    public QueryBuilder search(@NonNull Search search) {
        this.search = search;
        return this;
    }

    public QueryBuilder searchFullText(@NonNull String query, @NonNull String... fields) {
        return this.search(Search.fullText(query, Arrays.asList(fields)));
    }

    public QueryBuilder searchFullText(@NonNull String query, @NonNull List<String> fields, double minScore) {
        return this.search(Search.builder()
            .type(SearchType.FULL_TEXT)
            .query(query)
            .fields(fields)
            .minScore(minScore)
            .build());
    }

    public QueryBuilder searchSemantic(@NonNull String vectorField, @NonNull List<Float> embedding, double minScore) {
        return this.search(Search.builder()
            .type(SearchType.SEMANTIC)
            .vectorField(vectorField)
            .embedding(embedding)
            .minScore(minScore)
            .build());
    }

    public QueryBuilder searchHybrid(@NonNull String query, @NonNull List<String> fields, @NonNull String vectorField,
                                     @NonNull List<Float> embedding, double minScore) {
        return this.search(Search.builder()
            .type(SearchType.HYBRID)
            .query(query)
            .fields(fields)
            .vectorField(vectorField)
            .embedding(embedding)
            .minScore(minScore)
            .build());
    }

    // Aggregation

    /**
     * Replaces any aggregation configured so far.
     */
    public QueryBuilder aggregation(@NonNull Aggregation aggregation) {
        this.aggregating = true;
        this.groupBy.clear();
        aggregation.getGroupBy().forEach(field -> this.groupBy.add(field.getValue()));
        this.aggregates.clear();
        this.aggregates.addAll(aggregation.getAggregates());
        this.having = aggregation.getHaving();
        return this;
    }

    public QueryBuilder groupBy(@NonNull String... fields) {
        this.aggregating = true;
        this.groupBy.addAll(Arrays.asList(fields));
        return this;
    }

    public QueryBuilder aggregate(@NonNull Aggregate aggregate) {
        this.aggregating = true;
        this.aggregates.add(aggregate);
        return this;
    }

    public QueryBuilder count() {
        return this.aggregate(Aggregate.count());
    }

    public QueryBuilder count(@NonNull String alias) {
        return this.aggregate(Aggregate.count(alias));
    }

    public QueryBuilder countDistinct(@NonNull String field) {
        return this.aggregate(Aggregate.of(AggregateFunction.COUNT_DISTINCT, field));
    }

    public QueryBuilder countDistinct(@NonNull String field, @NonNull String alias) {
        return this.aggregate(Aggregate.of(AggregateFunction.COUNT_DISTINCT, field, alias));
    }

    public QueryBuilder sum(@NonNull String field) {
        return this.aggregate(Aggregate.of(AggregateFunction.SUM, field));
    }

    public QueryBuilder sum(@NonNull String field, @NonNull String alias) {
        return this.aggregate(Aggregate.of(AggregateFunction.SUM, field, alias));
    }

    public QueryBuilder avg(@NonNull String field) {
        return this.aggregate(Aggregate.of(AggregateFunction.AVG, field));
    }

    public QueryBuilder avg(@NonNull String field, @NonNull String alias) {
        return this.aggregate(Aggregate.of(AggregateFunction.AVG, field, alias));
    }

    public QueryBuilder min(@NonNull String field) {
        return this.aggregate(Aggregate.of(AggregateFunction.MIN, field));
    }

    public QueryBuilder min(@NonNull String field, @NonNull String alias) {
        return this.aggregate(Aggregate.of(AggregateFunction.MIN, field, alias));
    }

    public QueryBuilder max(@NonNull String field) {
        return this.aggregate(Aggregate.of(AggregateFunction.MAX, field));
    }

    public QueryBuilder max(@NonNull String field, @NonNull String alias) {
        return this.aggregate(Aggregate.of(AggregateFunction.MAX, field, alias));
    }

    public QueryBuilder stddev(@NonNull String field) {
        return this.aggregate(Aggregate.of(AggregateFunction.STDDEV, field));
    }

    public QueryBuilder stddev(@NonNull String field, @NonNull String alias) {
        return this.aggregate(Aggregate.of(AggregateFunction.STDDEV, field, alias));
    }

    public QueryBuilder variance(@NonNull String field) {
        return this.aggregate(Aggregate.of(AggregateFunction.VARIANCE, field));
    }

    public QueryBuilder variance(@NonNull String field, @NonNull String alias) {
        return this.aggregate(Aggregate.of(AggregateFunction.VARIANCE, field, alias));
    }

    public QueryBuilder percentile(@NonNull String field, double percentile) {
        return this.aggregate(Aggregate.percentile(field, percentile));
    }

    public QueryBuilder percentile(@NonNull String field, double percentile, @NonNull String alias) {
        return this.aggregate(Aggregate.percentile(field, percentile, alias));
    }

    /**
     * Filter on the aggregate output, conditions address aggregate aliases.
     */
    public QueryBuilder having(@NonNull Filter having) {
        this.aggregating = true;
        this.having = having;
        return this;
    }

    // Relations

    public QueryBuilder join(@NonNull Relation relation) {
        this.relations.add(relation);
        return this;
    }

    /**
     * Replaces all relations configured so far.
     */
    public QueryBuilder relations(@NonNull Relation... relations) {
        this.relations.clear();
        this.relations.addAll(Arrays.asList(relations));
        return this;
    }

    // Options

    public QueryBuilder options(@NonNull QueryOptions options) {
        this.options = options;
        return this;
    }

    public QueryBuilder timeout(long timeoutMs) {
        this.options = this.currentOptions().withTimeoutMs(timeoutMs);
        return this;
    }

    public QueryBuilder timeout(@NonNull Duration timeout) {
        return this.timeout(timeout.toMillis());
    }

    public QueryBuilder explain() {
        return this.explain(true);
    }

    public QueryBuilder explain(boolean enabled) {
        this.options = this.currentOptions().withExplain(enabled);
        return this;
    }

    /**
     * Requests the total number of matching rows, may require a full scan.
     */
    public QueryBuilder countTotal() {
        return this.countTotal(true);
    }

    public QueryBuilder countTotal(boolean enabled) {
        this.options = this.currentOptions().withCountTotal(enabled);
        return this;
    }

    public QueryBuilder consistency(@NonNull ConsistencyLevel consistency) {
        this.options = this.currentOptions().withConsistency(consistency);
        return this;
    }

    private QueryOptions currentOptions() {
        return (this.options == null) ? QueryOptions.defaults() : this.options;
    }

    /**
     * @throws QueryValidationException when any part of the query is malformed
     */
    public Query build() {

        Filter filter = null;
        if (this.filters.size() == 1) {
            filter = collapse(this.filters.get(0));
        } else if (this.filters.size() > 1) {
            List<Filter> collapsed = new ArrayList<>(this.filters.size());
            for (Filter accumulated : this.filters) {
                collapsed.add(collapse(accumulated));
            }
            filter = Filter.and(collapsed);
        }

        Aggregation aggregation = this.aggregating
            ? Aggregation.of(this.groupBy, this.aggregates, this.having)
            : null;

        Pagination pagination = null;
        if ((this.pageSize != null) || (this.cursor != null) || (this.offset != null)) {
            int size = (this.pageSize != null) ? this.pageSize : DEFAULT_PAGE_SIZE;
            pagination = new Pagination(size, this.cursor, this.offset);
        } else if (aggregation == null) {
            pagination = Pagination.ofSize(DEFAULT_PAGE_SIZE);
        }

        return new Query(this.entity, filter, this.sorts, this.projection, pagination,
            aggregation, this.search, this.relations, this.options);
    }

    // and/or over a single child is that child
    private static Filter collapse(Filter filter) {
        while ((filter instanceof CompositeFilter) && (((CompositeFilter) filter).getChildren().size() == 1)) {
            filter = ((CompositeFilter) filter).getChildren().get(0);
        }
        return filter;
    }
}
