package eu.okaeri.query;

import eu.okaeri.query.aggregation.Aggregation;
import eu.okaeri.query.filter.Filter;
import eu.okaeri.query.pagination.Pagination;
import eu.okaeri.query.relation.Relation;
import eu.okaeri.query.search.Search;
import eu.okaeri.query.sort.Sort;
import lombok.Data;
import lombok.NonNull;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Immutable read query against a single entity. Every part other than the
 * entity name is optional; absent parts are null (sorts and relations empty).
 * Instances are safe to share between threads.
 */
@Data
public class Query {

    private final String entity;
    private final Filter filter;
    private final List<Sort> sort;
    private final Projection projection;
    private final Pagination pagination;
    private final Aggregation aggregation;
    private final Search search;
    private final List<Relation> relations;
    private final QueryOptions options;

    public Query(@NonNull String entity, Filter filter, @NonNull List<Sort> sort, Projection projection, Pagination pagination,
                 Aggregation aggregation, Search search, @NonNull List<Relation> relations, QueryOptions options) {

        if (entity.trim().isEmpty()) {
            throw new QueryValidationException("entity name cannot be empty");
        }

        Set<String> aliases = new HashSet<>();
        for (Relation relation : relations) {
            if (relation.getAlias().equals(entity)) {
                throw new QueryValidationException("relation alias '" + relation.getAlias() + "' collides with the queried entity");
            }
            if (!aliases.add(relation.getAlias())) {
                throw new QueryValidationException("duplicate relation alias '" + relation.getAlias() + "'");
            }
        }

        this.entity = entity;
        this.filter = filter;
        this.sort = Collections.unmodifiableList(new ArrayList<>(sort));
        this.projection = projection;
        this.pagination = pagination;
        this.aggregation = aggregation;
        this.search = search;
        this.relations = Collections.unmodifiableList(new ArrayList<>(relations));
        this.options = options;
    }

    public static QueryBuilder builder(@NonNull String entity) {
        return new QueryBuilder(entity);
    }

    public boolean hasFilter() {
        return this.filter != null;
    }

    public boolean hasSort() {
        return !this.sort.isEmpty();
    }

    public boolean hasProjection() {
        return (this.projection != null) && !this.projection.isEmpty();
    }

    public boolean hasPagination() {
        return this.pagination != null;
    }

    public boolean hasAggregation() {
        return this.aggregation != null;
    }

    public boolean hasSearch() {
        return this.search != null;
    }

    public boolean hasRelations() {
        return !this.relations.isEmpty();
    }

    public boolean hasOptions() {
        return this.options != null;
    }

    /**
     * @return options of this query, or the defaults when none were set
     */
    public QueryOptions effectiveOptions() {
        return (this.options == null) ? QueryOptions.defaults() : this.options;
    }

    public Query withPagination(Pagination pagination) {
        return new Query(this.entity, this.filter, this.sort, this.projection, pagination,
            this.aggregation, this.search, this.relations, this.options);
    }

    public Query withOptions(QueryOptions options) {
        return new Query(this.entity, this.filter, this.sort, this.projection, this.pagination,
            this.aggregation, this.search, this.relations, options);
    }

    /**
     * Copy of this query continuing at the given cursor. Queries without
     * pagination get one with the server default page size expressed by
     * {@code pageSize}.
     */
    public Query withCursor(@NonNull String cursor, int pageSize) {
        Pagination next = (this.pagination == null)
            ? new Pagination(pageSize, cursor, null)
            : new Pagination(this.pagination.getPageSize(), cursor, null);
        return this.withPagination(next);
    }
}
