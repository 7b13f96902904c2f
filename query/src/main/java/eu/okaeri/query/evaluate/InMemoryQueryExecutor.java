package eu.okaeri.query.evaluate;

import eu.okaeri.query.FieldPath;
import eu.okaeri.query.Projection;
import eu.okaeri.query.Query;
import eu.okaeri.query.QueryOptions;
import eu.okaeri.query.QueryValidationException;
import eu.okaeri.query.filter.condition.Condition;
import eu.okaeri.query.filter.condition.Operator;
import eu.okaeri.query.filter.renderer.DefaultFilterRenderer;
import eu.okaeri.query.filter.renderer.FilterRenderer;
import eu.okaeri.query.pagination.Pagination;
import eu.okaeri.query.relation.Relation;
import eu.okaeri.query.result.ExplainResult;
import eu.okaeri.query.result.PageInfo;
import eu.okaeri.query.result.QueryResult;
import eu.okaeri.query.result.Recommendation;
import eu.okaeri.query.search.Search;
import eu.okaeri.query.value.ValueUtils;
import lombok.Getter;
import lombok.NonNull;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Base64;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;
import java.util.stream.Collectors;

import static eu.okaeri.query.value.ValueUtils.extractValue;
import static eu.okaeri.query.value.ValueUtils.putValue;

/**
 * Reference executor evaluating queries against an {@link InMemoryDataset}.
 * <p>
 * Stages run in a fixed order: relations, filter, search, aggregation,
 * sort, total count, pagination, projection. Search hits carry their score
 * under {@link #SCORE_FIELD} and are ranked by it when no sort is given.
 * Cursors are opaque to callers and encode the position of the next page.
 */
public class InMemoryQueryExecutor {

    private static final Logger LOGGER = Logger.getLogger(InMemoryQueryExecutor.class.getSimpleName());
    private static final boolean DEBUG = Boolean.parseBoolean(System.getProperty("okaeri.query.debug", "false"));

    public static final String SCORE_FIELD = "_score";
    public static final int LARGE_OFFSET = 1000;

    private static final String CURSOR_PREFIX = "offset:";
    private static final double MS_PER_COST_UNIT = 0.001;

    @Getter private final InMemoryDataset dataset;
    private final InMemoryFilterEvaluator filterEvaluator;
    private final InMemoryRelationResolver relationResolver;
    private final InMemoryAggregationEvaluator aggregationEvaluator;
    private final InMemorySearchScorer searchScorer;
    private final FilterRenderer renderer = new DefaultFilterRenderer();

    public InMemoryQueryExecutor(@NonNull InMemoryDataset dataset) {
        this(dataset, new InMemorySearchScorer());
    }

    public InMemoryQueryExecutor(@NonNull InMemoryDataset dataset, @NonNull InMemorySearchScorer searchScorer) {
        this.dataset = dataset;
        this.filterEvaluator = new InMemoryFilterEvaluator();
        this.relationResolver = new InMemoryRelationResolver(this.filterEvaluator);
        this.aggregationEvaluator = new InMemoryAggregationEvaluator(this.filterEvaluator);
        this.searchScorer = searchScorer;
    }

    /**
     * @throws EntityNotFoundException  if the queried or a related entity is unknown
     * @throws QueryValidationException if the cursor or the search embedding is invalid
     */
    public QueryResult execute(@NonNull Query query) {

        long start = System.currentTimeMillis();
        QueryOptions options = query.effectiveOptions();

        List<Map<String, Object>> rows = this.dataset.rows(query.getEntity());
        double cost = rows.size();

        for (Relation relation : query.getRelations()) {
            List<Map<String, Object>> related = this.dataset.rows(relation.getEntity());
            cost += (double) rows.size() * related.size();
            rows = this.relationResolver.join(rows, relation, related);
        }

        if (query.hasFilter()) {
            cost += rows.size() * InMemoryFilterEvaluator.conditions(query.getFilter()).size();
            rows = rows.stream()
                .filter(row -> this.filterEvaluator.matches(query.getFilter(), row))
                .collect(Collectors.toList());
        }

        if (query.hasSearch()) {
            cost += rows.size() * (double) (query.getSearch().getFields().size() + query.getSearch().getDimensions());
            rows = this.search(query.getSearch(), rows);
        }

        if (query.hasAggregation()) {
            cost += rows.size() * (double) Math.max(1, query.getAggregation().getAggregates().size());
            rows = this.aggregationEvaluator.aggregate(query.getAggregation(), rows);
        }

        Comparator<Map<String, Object>> comparator = this.filterEvaluator.buildComparator(query.getSort());
        if ((comparator == null) && query.hasSearch() && !query.hasAggregation()) {
            comparator = Comparator.comparing((Map<String, Object> row) -> (Double) row.get(SCORE_FIELD), Comparator.reverseOrder());
        }
        if (comparator != null) {
            rows = new ArrayList<>(rows);
            rows.sort(comparator);
            cost += rows.size() * Math.max(1, Math.log(Math.max(1, rows.size())));
        }

        Long totalCount = options.isCountTotal() ? Long.valueOf(rows.size()) : null;

        PageInfo pageInfo;
        Pagination pagination = query.getPagination();
        if (pagination == null) {
            pageInfo = PageInfo.last(totalCount, rows.size());
        } else {
            int from = pagination.hasCursor()
                ? decodeCursor(pagination.getCursor())
                : (pagination.hasOffset() ? pagination.getOffset() : 0);
            int to = (int) Math.min((long) from + pagination.getPageSize(), rows.size());
            boolean hasMore = to < rows.size();
            rows = (from >= rows.size()) ? new ArrayList<>() : rows.subList(from, to);
            pageInfo = new PageInfo(totalCount, pagination.getPageSize(), hasMore, hasMore ? encodeCursor(to) : null);
        }

        List<Map<String, Object>> page = new ArrayList<>(rows.size());
        for (Map<String, Object> row : rows) {
            page.add(project(query.getProjection(), row));
        }

        ExplainResult explain = options.isExplain() ? this.explain(query, cost) : null;

        if (DEBUG) {
            long took = System.currentTimeMillis() - start;
            LOGGER.info("[" + this.renderer.renderQuery(query) + "] In-memory query returned " + page.size() + " rows in " + took + " ms");
        }

        return new QueryResult(page, pageInfo, explain);
    }

    private List<Map<String, Object>> search(Search search, List<Map<String, Object>> rows) {
        List<Map<String, Object>> hits = new ArrayList<>();
        for (Map<String, Object> row : rows) {
            double score = this.searchScorer.score(search, row);
            if (!this.searchScorer.passes(search, score)) {
                continue;
            }
            Map<String, Object> hit = new LinkedHashMap<>(row);
            hit.put(SCORE_FIELD, score);
            hits.add(hit);
        }
        return hits;
    }

    private static Map<String, Object> project(Projection projection, Map<String, Object> row) {

        Map<String, Object> source = ValueUtils.deepCopy(row);
        if ((projection == null) || projection.isEmpty()) {
            return source;
        }

        if (projection.isInclusive()) {
            Map<String, Object> projected = new LinkedHashMap<>();
            for (FieldPath field : projection.getInclude()) {
                List<String> parts = field.toParts();
                if (hasPath(source, parts)) {
                    putValue(projected, parts, extractValue(source, parts));
                }
            }
            return projected;
        }

        for (FieldPath field : projection.getExclude()) {
            ValueUtils.removeValue(source, field.toParts());
        }
        return source;
    }

    private static boolean hasPath(Map<String, Object> row, List<String> parts) {
        Map<?, ?> parent = (parts.size() == 1) ? row : asMap(extractValue(row, parts.subList(0, parts.size() - 1)));
        return (parent != null) && parent.containsKey(parts.get(parts.size() - 1));
    }

    private static Map<?, ?> asMap(Object value) {
        return (value instanceof Map) ? (Map<?, ?>) value : null;
    }

    private ExplainResult explain(Query query, double cost) {

        List<Recommendation> recommendations = new ArrayList<>();
        Pagination pagination = query.getPagination();

        if ((pagination != null) && pagination.hasCursor() && !query.hasSort()) {
            recommendations.add(Recommendation.warning("cursor pagination without sort, page boundaries follow the natural row order"));
        }

        if ((pagination != null) && pagination.hasOffset() && (pagination.getOffset() > LARGE_OFFSET)) {
            recommendations.add(Recommendation.warning("offset " + pagination.getOffset() + " skips rows one by one, prefer cursor pagination"));
        }

        if (query.hasFilter()) {
            for (Condition condition : InMemoryFilterEvaluator.conditions(query.getFilter())) {
                if (condition.getOperator() == Operator.MATCHES) {
                    recommendations.add(Recommendation.info("regex filter on " + condition.getField() + " is evaluated against every row"));
                }
            }
        }

        if (query.effectiveOptions().isCountTotal()) {
            recommendations.add(Recommendation.info("count_total counts all matching rows on every page"));
        }

        if (!query.hasFilter() && !query.hasSearch() && !query.hasAggregation() && !query.hasPagination()) {
            recommendations.add(Recommendation.warning("unbounded scan of " + query.getEntity() + ", add a filter or pagination"));
        }

        return new ExplainResult(cost, cost * MS_PER_COST_UNIT, recommendations);
    }

    static String encodeCursor(int position) {
        byte[] raw = (CURSOR_PREFIX + position).getBytes(StandardCharsets.UTF_8);
        return Base64.getUrlEncoder().withoutPadding().encodeToString(raw);
    }

    static int decodeCursor(@NonNull String cursor) {

        String decoded;
        try {
            decoded = new String(Base64.getUrlDecoder().decode(cursor), StandardCharsets.UTF_8);
        } catch (IllegalArgumentException exception) {
            throw new QueryValidationException("malformed cursor '" + cursor + "'", exception);
        }

        if (!decoded.startsWith(CURSOR_PREFIX)) {
            throw new QueryValidationException("malformed cursor '" + cursor + "'");
        }

        try {
            int position = Integer.parseInt(decoded.substring(CURSOR_PREFIX.length()));
            if (position < 0) {
                throw new QueryValidationException("malformed cursor '" + cursor + "'");
            }
            return position;
        } catch (NumberFormatException exception) {
            throw new QueryValidationException("malformed cursor '" + cursor + "'", exception);
        }
    }
}
