package eu.okaeri.query.client.codec;

import com.fasterxml.jackson.databind.JsonNode;
import eu.okaeri.query.ConsistencyLevel;
import eu.okaeri.query.Query;
import eu.okaeri.query.filter.Filter;
import eu.okaeri.query.filter.condition.Condition;
import eu.okaeri.query.relation.Relation;
import eu.okaeri.query.result.ExplainResult;
import eu.okaeri.query.result.PageInfo;
import eu.okaeri.query.result.QueryResult;
import eu.okaeri.query.result.Recommendation;
import eu.okaeri.query.result.Severity;
import eu.okaeri.query.search.Search;
import eu.okaeri.query.search.SearchType;
import eu.okaeri.query.sort.NullOrdering;
import eu.okaeri.query.value.Value;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JsonQueryCodecTest {

    private final JsonQueryCodec codec = new JsonQueryCodec();

    @Test
    void encodes_filter_tree() {

        Query query = Query.builder("users")
            .eq("status", "active")
            .where(Filter.not(Condition.in("role", "guest", "bot")))
            .build();

        JsonNode filter = this.codec.queryToTree(query).get("filter");
        JsonNode first = filter.get("and").get("conditions").get(0).get("condition");
        assertThat(first.get("field").asText()).isEqualTo("status");
        assertThat(first.get("operator").asText()).isEqualTo("EQ");
        assertThat(first.get("value").get("string_value").asText()).isEqualTo("active");
        assertThat(first.get("case_sensitive").asBoolean()).isTrue();

        JsonNode negated = filter.get("and").get("conditions").get(1).get("not").get("filter").get("condition");
        assertThat(negated.get("operator").asText()).isEqualTo("IN");
        assertThat(negated.get("values")).hasSize(2);
        assertThat(negated.has("value")).isFalse();
    }

    @Test
    void encodes_values() {
        assertThat(this.codec.valueToTree(Value.of(null)).get("null_value").asInt()).isZero();
        assertThat(this.codec.valueToTree(Value.of(2.5)).get("number_value").asDouble()).isEqualTo(2.5);
        assertThat(this.codec.valueToTree(Value.of(true)).get("bool_value").asBoolean()).isTrue();
        assertThat(this.codec.valueToTree(Value.field("customer.id")).get("field_ref").asText()).isEqualTo("customer.id");
    }

    @Test
    void complex_query_survives_the_wire() {

        Query query = Query.builder("orders")
            .join(Relation.leftOuter("customers", "customer", "customer_id", "id"))
            .where(Filter.or(Condition.contains("note", "gift", false), Condition.isNull("note")))
            .gte("total", 10.5)
            .sortDesc("total", NullOrdering.LAST)
            .sortAsc("id")
            .include("id", "total", "customer.country")
            .limit(25)
            .cursor("b2Zmc2V0OjI1")
            .groupBy("customer.country")
            .count()
            .percentile("total", 99.9)
            .having(Condition.gt("count", 1))
            .search(Search.builder()
                .type(SearchType.HYBRID)
                .query("gift card")
                .field("note")
                .boost("note", 2.0)
                .vectorField("embedding")
                .embedding(List.of(0.25f, -0.5f))
                .minScore(0.3)
                .build())
            .timeout(1500)
            .countTotal()
            .consistency(ConsistencyLevel.EVENTUAL)
            .build();

        JsonNode tree = this.codec.queryToTree(query);
        assertThat(tree.has("relations")).isFalse();
        assertThat(tree.get("relation").get(0).get("alias").asText()).isEqualTo("customer");
        assertThat(tree.get("relation").get(0).get("type").asText()).isEqualTo("LEFT_OUTER");

        assertThat(this.codec.decodeQuery(this.codec.encodeQuery(query))).isEqualTo(query);
    }

    @Test
    void decodes_results() {

        String json = "{\"results\":[{\"id\":1,\"name\":\"Alice\",\"address\":{\"city\":\"Warsaw\"}}],"
            + "\"pagination\":{\"total_count\":10,\"page_size\":1,\"has_more\":true,\"next_cursor\":\"abc\"},"
            + "\"explain\":{\"cost\":{\"total_cost\":12.5,\"estimated_time_ms\":0.0125},"
            + "\"recommendations\":[{\"severity\":\"WARNING\",\"description\":\"unbounded scan\"}]}}";

        QueryResult result = this.codec.decodeResult(json);

        assertThat(result.getRows()).containsExactly(Map.of("id", 1, "name", "Alice", "address", Map.of("city", "Warsaw")));
        assertThat(result.getPageInfo()).isEqualTo(new PageInfo(10L, 1, true, "abc"));
        assertThat(result.getExplain().getTotalCost()).isEqualTo(12.5);
        assertThat(result.getExplain().getRecommendations()).containsExactly(new Recommendation(Severity.WARNING, "unbounded scan"));
    }

    @Test
    void absent_blocks_decode_to_null() {
        QueryResult result = this.codec.decodeResult("{\"results\":[]}");
        assertThat(result.getRows()).isEmpty();
        assertThat(result.getPageInfo()).isNull();
        assertThat(result.getExplain()).isNull();
    }

    @Test
    void result_survives_the_wire() {
        QueryResult result = new QueryResult(
            List.of(Map.of("id", 7, "score", 0.5)),
            new PageInfo(null, 20, false, null),
            new ExplainResult(3.0, 0.003, List.of(Recommendation.info("count_total counts all matching rows"))));
        assertThat(this.codec.decodeResult(this.codec.encodeResult(result))).isEqualTo(result);
    }

    @Test
    void malformed_input_is_rejected() {
        assertThatThrownBy(() -> this.codec.decodeQuery("{not json")).isInstanceOf(JsonCodecException.class);
        assertThatThrownBy(() -> this.codec.decodeQuery("[]")).isInstanceOf(JsonCodecException.class);
        assertThatThrownBy(() -> this.codec.decodeQuery("{\"filter\":{}}")).isInstanceOf(JsonCodecException.class);
        assertThatThrownBy(() -> this.codec.decodeQuery("{\"entity\":\"users\",\"filter\":{\"condition\":"
            + "{\"field\":\"age\",\"operator\":\"ROUGHLY\",\"value\":{\"number_value\":3}}}}"))
            .isInstanceOf(JsonCodecException.class)
            .hasMessageContaining("ROUGHLY");
        assertThatThrownBy(() -> this.codec.decodeResult("{\"results\":[1]}")).isInstanceOf(JsonCodecException.class);
    }
}
