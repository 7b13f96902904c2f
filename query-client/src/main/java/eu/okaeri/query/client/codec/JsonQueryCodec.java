package eu.okaeri.query.client.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import eu.okaeri.query.ConsistencyLevel;
import eu.okaeri.query.FieldPath;
import eu.okaeri.query.Projection;
import eu.okaeri.query.Query;
import eu.okaeri.query.QueryOptions;
import eu.okaeri.query.aggregation.Aggregate;
import eu.okaeri.query.aggregation.AggregateFunction;
import eu.okaeri.query.aggregation.Aggregation;
import eu.okaeri.query.filter.CompositeFilter;
import eu.okaeri.query.filter.Filter;
import eu.okaeri.query.filter.LogicalOperator;
import eu.okaeri.query.filter.NotFilter;
import eu.okaeri.query.filter.condition.Condition;
import eu.okaeri.query.filter.condition.OperandArity;
import eu.okaeri.query.filter.condition.Operator;
import eu.okaeri.query.pagination.Pagination;
import eu.okaeri.query.relation.JoinType;
import eu.okaeri.query.relation.Relation;
import eu.okaeri.query.result.ExplainResult;
import eu.okaeri.query.result.PageInfo;
import eu.okaeri.query.result.QueryResult;
import eu.okaeri.query.result.Recommendation;
import eu.okaeri.query.result.Severity;
import eu.okaeri.query.search.Search;
import eu.okaeri.query.search.SearchType;
import eu.okaeri.query.sort.NullOrdering;
import eu.okaeri.query.sort.Sort;
import eu.okaeri.query.sort.SortDirection;
import eu.okaeri.query.value.Value;
import lombok.Getter;
import lombok.NonNull;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * JSON wire format of queries and results.
 * <p>
 * Field names are snake_case, enums are written by constant name. Filters
 * are objects with exactly one of {@code condition}, {@code and}, {@code or}
 * or {@code not}; values are objects with exactly one of {@code string_value},
 * {@code number_value}, {@code bool_value}, {@code null_value} or
 * {@code field_ref}. Absent query parts are omitted.
 */
public class JsonQueryCodec {

    private static final TypeReference<Map<String, Object>> ROW_TYPE = new TypeReference<Map<String, Object>>() {
    };

    @Getter private final ObjectMapper mapper;

    public JsonQueryCodec() {
        this(new ObjectMapper());
    }

    public JsonQueryCodec(@NonNull ObjectMapper mapper) {
        this.mapper = mapper;
    }

    // Query

    public String encodeQuery(@NonNull Query query) {
        return this.write(this.queryToTree(query));
    }

    public Query decodeQuery(@NonNull String json) {
        return this.treeToQuery(this.read(json));
    }

    public ObjectNode queryToTree(@NonNull Query query) {

        ObjectNode node = this.mapper.createObjectNode();
        node.put("entity", query.getEntity());

        if (query.hasFilter()) {
            node.set("filter", this.filterToTree(query.getFilter()));
        }

        if (query.hasSort()) {
            ArrayNode sort = node.putArray("sort");
            for (Sort order : query.getSort()) {
                sort.addObject()
                    .put("field", order.getField().getValue())
                    .put("direction", order.getDirection().name())
                    .put("nulls", order.getNulls().name());
            }
        }

        if (query.getProjection() != null) {
            ObjectNode projection = node.putObject("projection");
            putPaths(projection.putArray("include"), query.getProjection().getInclude());
            putPaths(projection.putArray("exclude"), query.getProjection().getExclude());
        }

        if (query.hasPagination()) {
            Pagination pagination = query.getPagination();
            ObjectNode paginationNode = node.putObject("pagination").put("page_size", pagination.getPageSize());
            if (pagination.hasCursor()) {
                paginationNode.put("cursor", pagination.getCursor());
            }
            if (pagination.hasOffset()) {
                paginationNode.put("offset", pagination.getOffset());
            }
        }

        if (query.hasAggregation()) {
            node.set("aggregation", this.aggregationToTree(query.getAggregation()));
        }

        if (query.hasSearch()) {
            node.set("search", this.searchToTree(query.getSearch()));
        }

        if (query.hasRelations()) {
            ArrayNode relations = node.putArray("relation");
            for (Relation relation : query.getRelations()) {
                ObjectNode relationNode = relations.addObject()
                    .put("entity", relation.getEntity())
                    .put("alias", relation.getAlias())
                    .put("type", relation.getType().name());
                relationNode.set("on", this.filterToTree(relation.getOn()));
                relationNode.put("eager", relation.isEager());
            }
        }

        if (query.hasOptions()) {
            QueryOptions options = query.getOptions();
            ObjectNode optionsNode = node.putObject("options")
                .put("timeout_ms", options.getTimeoutMs())
                .put("count_total", options.isCountTotal())
                .put("explain", options.isExplain());
            if (options.getConsistency() != null) {
                optionsNode.put("consistency", options.getConsistency().name());
            }
        }

        return node;
    }

    public Query treeToQuery(@NonNull JsonNode node) {

        String entity = requireText(node, "entity");
        Filter filter = node.hasNonNull("filter") ? this.treeToFilter(node.get("filter")) : null;

        List<Sort> sort = new ArrayList<>();
        for (JsonNode order : node.path("sort")) {
            sort.add(Sort.of(
                FieldPath.of(requireText(order, "field")),
                enumValue(SortDirection.class, order, "direction", SortDirection.ASC),
                enumValue(NullOrdering.class, order, "nulls", NullOrdering.DEFAULT)));
        }

        Projection projection = null;
        if (node.hasNonNull("projection")) {
            JsonNode projectionNode = node.get("projection");
            projection = new Projection(paths(projectionNode.path("include")), paths(projectionNode.path("exclude")));
        }

        Pagination pagination = null;
        if (node.hasNonNull("pagination")) {
            JsonNode paginationNode = node.get("pagination");
            pagination = new Pagination(
                paginationNode.path("page_size").asInt(),
                textOrNull(paginationNode, "cursor"),
                paginationNode.hasNonNull("offset") ? paginationNode.get("offset").asInt() : null);
        }

        Aggregation aggregation = node.hasNonNull("aggregation") ? this.treeToAggregation(node.get("aggregation")) : null;
        Search search = node.hasNonNull("search") ? this.treeToSearch(node.get("search")) : null;

        List<Relation> relations = new ArrayList<>();
        for (JsonNode relation : node.path("relation")) {
            relations.add(new Relation(
                requireText(relation, "entity"),
                requireText(relation, "alias"),
                enumValue(JoinType.class, relation, "type", JoinType.INNER),
                this.treeToFilter(relation.path("on")),
                relation.path("eager").asBoolean(false)));
        }

        QueryOptions options = null;
        if (node.hasNonNull("options")) {
            JsonNode optionsNode = node.get("options");
            options = new QueryOptions(
                optionsNode.path("timeout_ms").asLong(0),
                optionsNode.path("count_total").asBoolean(false),
                enumValue(ConsistencyLevel.class, optionsNode, "consistency", null),
                optionsNode.path("explain").asBoolean(false));
        }

        return new Query(entity, filter, sort, projection, pagination, aggregation, search, relations, options);
    }

    // Filter

    public ObjectNode filterToTree(@NonNull Filter filter) {

        ObjectNode node = this.mapper.createObjectNode();

        if (filter instanceof Condition) {
            Condition condition = (Condition) filter;
            ObjectNode conditionNode = node.putObject("condition")
                .put("field", condition.getField().getValue())
                .put("operator", condition.getOperator().name());
            OperandArity arity = condition.getOperator().getArity();
            if (arity == OperandArity.SINGLE) {
                conditionNode.set("value", this.valueToTree(condition.getOperand()));
            } else if (arity == OperandArity.LIST) {
                ArrayNode values = conditionNode.putArray("values");
                for (Value value : condition.getOperands()) {
                    values.add(this.valueToTree(value));
                }
            }
            conditionNode.put("case_sensitive", condition.isCaseSensitive());
            return node;
        }

        if (filter instanceof CompositeFilter) {
            CompositeFilter composite = (CompositeFilter) filter;
            ArrayNode children = node.putObject(composite.isAnd() ? "and" : "or").putArray("conditions");
            for (Filter child : composite.getChildren()) {
                children.add(this.filterToTree(child));
            }
            return node;
        }

        if (filter instanceof NotFilter) {
            node.putObject("not").set("filter", this.filterToTree(((NotFilter) filter).getChild()));
            return node;
        }

        throw new IllegalArgumentException("cannot encode filter " + filter + " [" + filter.getClass() + "]");
    }

    public Filter treeToFilter(@NonNull JsonNode node) {

        if (node.hasNonNull("condition")) {
            JsonNode conditionNode = node.get("condition");
            Operator operator = enumValue(Operator.class, conditionNode, "operator", null);
            if (operator == null) {
                throw new JsonCodecException("condition without operator: " + conditionNode);
            }
            List<Value> operands = new ArrayList<>();
            if (operator.getArity() == OperandArity.SINGLE) {
                operands.add(this.treeToValue(conditionNode.path("value")));
            } else if (operator.getArity() == OperandArity.LIST) {
                for (JsonNode value : conditionNode.path("values")) {
                    operands.add(this.treeToValue(value));
                }
            }
            return new Condition(
                FieldPath.of(requireText(conditionNode, "field")),
                operator,
                operands,
                conditionNode.path("case_sensitive").asBoolean(true));
        }

        if (node.hasNonNull("and")) {
            return new CompositeFilter(LogicalOperator.AND, this.treeToFilters(node.get("and").path("conditions")));
        }

        if (node.hasNonNull("or")) {
            return new CompositeFilter(LogicalOperator.OR, this.treeToFilters(node.get("or").path("conditions")));
        }

        if (node.hasNonNull("not")) {
            return new NotFilter(this.treeToFilter(node.get("not").path("filter")));
        }

        throw new JsonCodecException("filter must have one of condition, and, or, not: " + node);
    }

    private List<Filter> treeToFilters(JsonNode array) {
        List<Filter> filters = new ArrayList<>();
        for (JsonNode child : array) {
            filters.add(this.treeToFilter(child));
        }
        return filters;
    }

    // Value

    public ObjectNode valueToTree(@NonNull Value value) {
        ObjectNode node = this.mapper.createObjectNode();
        switch (value.getType()) {
            case STRING:
                return node.put("string_value", value.asString());
            case NUMBER:
                return node.put("number_value", value.asNumber());
            case BOOLEAN:
                return node.put("bool_value", value.asBoolean());
            case NULL:
                return node.put("null_value", 0);
            case FIELD_REF:
                return node.put("field_ref", value.asString());
            default:
                throw new IllegalArgumentException("Unsupported value type: " + value.getType());
        }
    }

    public Value treeToValue(@NonNull JsonNode node) {
        if (node.has("string_value")) {
            return Value.string(node.get("string_value").asText());
        }
        if (node.has("number_value")) {
            return Value.number(node.get("number_value").asDouble());
        }
        if (node.has("bool_value")) {
            return Value.bool(node.get("bool_value").asBoolean());
        }
        if (node.has("null_value")) {
            return Value.nullValue();
        }
        if (node.has("field_ref")) {
            return Value.field(node.get("field_ref").asText());
        }
        throw new JsonCodecException("value must have one of string_value, number_value, bool_value, null_value, field_ref: " + node);
    }

    // Aggregation and search

    private ObjectNode aggregationToTree(Aggregation aggregation) {
        ObjectNode node = this.mapper.createObjectNode();
        putPaths(node.putArray("group_by"), aggregation.getGroupBy());
        ArrayNode aggregates = node.putArray("aggregates");
        for (Aggregate aggregate : aggregation.getAggregates()) {
            ObjectNode aggregateNode = aggregates.addObject().put("function", aggregate.getFunction().name());
            if (aggregate.getField() != null) {
                aggregateNode.put("field", aggregate.getField().getValue());
            }
            if (aggregate.getPercentile() != null) {
                aggregateNode.put("percentile", aggregate.getPercentile());
            }
            aggregateNode.put("alias", aggregate.getAlias());
        }
        if (aggregation.hasHaving()) {
            node.set("having", this.filterToTree(aggregation.getHaving()));
        }
        return node;
    }

    private Aggregation treeToAggregation(JsonNode node) {
        List<Aggregate> aggregates = new ArrayList<>();
        for (JsonNode aggregate : node.path("aggregates")) {
            AggregateFunction function = enumValue(AggregateFunction.class, aggregate, "function", null);
            if (function == null) {
                throw new JsonCodecException("aggregate without function: " + aggregate);
            }
            String field = textOrNull(aggregate, "field");
            aggregates.add(new Aggregate(
                function,
                (field == null) ? null : FieldPath.of(field),
                aggregate.hasNonNull("percentile") ? aggregate.get("percentile").asDouble() : null,
                textOrNull(aggregate, "alias")));
        }
        Filter having = node.hasNonNull("having") ? this.treeToFilter(node.get("having")) : null;
        return new Aggregation(paths(node.path("group_by")), aggregates, having);
    }

    private ObjectNode searchToTree(Search search) {
        ObjectNode node = this.mapper.createObjectNode();
        if (search.getQuery() != null) {
            node.put("query", search.getQuery());
        }
        node.put("type", search.getType().name());
        ArrayNode fields = node.putArray("fields");
        search.getFields().forEach(fields::add);
        if (search.getVectorField() != null) {
            node.put("vector_field", search.getVectorField());
        }
        ArrayNode embedding = node.putArray("embedding");
        search.getEmbedding().forEach(embedding::add);
        node.put("min_score", search.getMinScore());
        ObjectNode boost = node.putObject("boost");
        search.getBoost().forEach(boost::put);
        return node;
    }

    private Search treeToSearch(JsonNode node) {

        SearchType type = enumValue(SearchType.class, node, "type", null);
        if (type == null) {
            throw new JsonCodecException("search without type: " + node);
        }

        List<String> fields = new ArrayList<>();
        node.path("fields").forEach(field -> fields.add(field.asText()));

        List<Float> embedding = new ArrayList<>();
        node.path("embedding").forEach(component -> embedding.add(component.floatValue()));

        Map<String, Double> boost = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> entries = node.path("boost").fields();
        while (entries.hasNext()) {
            Map.Entry<String, JsonNode> entry = entries.next();
            boost.put(entry.getKey(), entry.getValue().asDouble());
        }

        return Search.builder()
            .query(textOrNull(node, "query"))
            .type(type)
            .fields(fields)
            .vectorField(textOrNull(node, "vector_field"))
            .embedding(embedding.isEmpty() ? null : embedding)
            .minScore(node.path("min_score").asDouble(0))
            .boosts(boost)
            .build();
    }

    // Result

    public String encodeResult(@NonNull QueryResult result) {

        ObjectNode node = this.mapper.createObjectNode();
        node.set("results", this.mapper.valueToTree(result.getRows()));

        if (result.hasPageInfo()) {
            PageInfo pageInfo = result.getPageInfo();
            ObjectNode pagination = node.putObject("pagination");
            if (pageInfo.hasTotalCount()) {
                pagination.put("total_count", pageInfo.getTotalCount());
            }
            pagination.put("page_size", pageInfo.getPageSize());
            pagination.put("has_more", pageInfo.isHasMore());
            if (pageInfo.getNextCursor() != null) {
                pagination.put("next_cursor", pageInfo.getNextCursor());
            }
        }

        if (result.hasExplain()) {
            ExplainResult explain = result.getExplain();
            ObjectNode explainNode = node.putObject("explain");
            explainNode.putObject("cost")
                .put("total_cost", explain.getTotalCost())
                .put("estimated_time_ms", explain.getEstimatedTimeMs());
            ArrayNode recommendations = explainNode.putArray("recommendations");
            for (Recommendation recommendation : explain.getRecommendations()) {
                recommendations.addObject()
                    .put("severity", recommendation.getSeverity().name())
                    .put("description", recommendation.getDescription());
            }
        }

        return this.write(node);
    }

    public QueryResult decodeResult(@NonNull String json) {

        JsonNode node = this.read(json);

        List<Map<String, Object>> rows = new ArrayList<>();
        for (JsonNode row : node.path("results")) {
            if (!row.isObject()) {
                throw new JsonCodecException("result row must be an object, got " + row);
            }
            rows.add(this.mapper.convertValue(row, ROW_TYPE));
        }

        PageInfo pageInfo = null;
        if (node.hasNonNull("pagination")) {
            JsonNode pagination = node.get("pagination");
            pageInfo = new PageInfo(
                pagination.hasNonNull("total_count") ? pagination.get("total_count").asLong() : null,
                pagination.path("page_size").asInt(rows.size()),
                pagination.path("has_more").asBoolean(false),
                textOrNull(pagination, "next_cursor"));
        }

        ExplainResult explain = null;
        if (node.hasNonNull("explain")) {
            JsonNode explainNode = node.get("explain");
            List<Recommendation> recommendations = new ArrayList<>();
            for (JsonNode recommendation : explainNode.path("recommendations")) {
                recommendations.add(new Recommendation(
                    enumValue(Severity.class, recommendation, "severity", Severity.INFO),
                    recommendation.path("description").asText("")));
            }
            explain = new ExplainResult(
                explainNode.path("cost").path("total_cost").asDouble(0),
                explainNode.path("cost").path("estimated_time_ms").asDouble(0),
                recommendations);
        }

        return new QueryResult(rows, pageInfo, explain);
    }

    // Helpers

    private String write(JsonNode node) {
        try {
            return this.mapper.writeValueAsString(node);
        } catch (JsonProcessingException exception) {
            throw new JsonCodecException("cannot write json", exception);
        }
    }

    private JsonNode read(String json) {
        JsonNode node;
        try {
            node = this.mapper.readTree(json);
        } catch (JsonProcessingException exception) {
            throw new JsonCodecException("malformed json: " + exception.getOriginalMessage(), exception);
        }
        if ((node == null) || !node.isObject()) {
            throw new JsonCodecException("expected a json object");
        }
        return node;
    }

    private static void putPaths(ArrayNode array, List<FieldPath> paths) {
        for (FieldPath path : paths) {
            array.add(path.getValue());
        }
    }

    private static List<FieldPath> paths(JsonNode array) {
        if (!array.isArray()) {
            return Collections.emptyList();
        }
        List<FieldPath> paths = new ArrayList<>();
        for (JsonNode path : array) {
            paths.add(FieldPath.of(path.asText()));
        }
        return paths;
    }

    private static String requireText(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if ((value == null) || !value.isTextual()) {
            throw new JsonCodecException("missing text field '" + field + "' in " + node);
        }
        return value.asText();
    }

    private static String textOrNull(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return ((value == null) || value.isNull()) ? null : value.asText();
    }

    private static <E extends Enum<E>> E enumValue(Class<E> type, JsonNode node, String field, E defaultValue) {
        String name = textOrNull(node, field);
        if (name == null) {
            return defaultValue;
        }
        try {
            return Enum.valueOf(type, name);
        } catch (IllegalArgumentException exception) {
            throw new JsonCodecException("unknown " + type.getSimpleName() + " '" + name + "'", exception);
        }
    }
}
