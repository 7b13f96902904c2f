package eu.okaeri.query.filter;

import eu.okaeri.query.Query;
import eu.okaeri.query.filter.renderer.DefaultFilterRenderer;
import eu.okaeri.query.filter.renderer.DefaultStringRenderer;
import eu.okaeri.query.relation.Relation;
import eu.okaeri.query.sort.NullOrdering;
import eu.okaeri.query.sort.Sort;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestInstance;

import java.util.List;

import static eu.okaeri.query.filter.Filter.and;
import static eu.okaeri.query.filter.Filter.not;
import static eu.okaeri.query.filter.Filter.or;
import static eu.okaeri.query.filter.condition.Condition.*;
import static org.assertj.core.api.Assertions.assertThat;

@TestInstance(TestInstance.Lifecycle.PER_CLASS)
public class FilterRenderingTest {

    private DefaultFilterRenderer renderer;

    @BeforeAll
    public void prepare() {
        this.renderer = new DefaultFilterRenderer(new DefaultStringRenderer());
    }

    @Test
    public void test_condition_0() {
        String filter = this.renderer.renderFilter(eq("age", 55)); // age equal to 55
        assertThat(filter).isEqualTo("(age == 55)");
    }

    @Test
    public void test_condition_1() {
        String filter = this.renderer.renderFilter(and(gte("distance", 100), lte("distance", 1000))); // distance between 100 and 1000
        assertThat(filter).isEqualTo("((distance >= 100) && (distance <= 1000))");
    }

    @Test
    public void test_condition_2() {
        String filter = this.renderer.renderFilter(or(
            and(gte("distance", 100), lte("distance", 1000)),
            eq("age", 55)
        ));
        assertThat(filter).isEqualTo("(((distance >= 100) && (distance <= 1000)) || (age == 55))");
    }

    @Test
    public void test_condition_3() {
        String filter = this.renderer.renderFilter(and(
            eq("status", "active"),
            not(or(eq("role", "guest"), isNull("email")))
        ));
        assertThat(filter).isEqualTo("((status == \"active\") && !((role == \"guest\") || (email isNull)))");
    }

    @Test
    public void test_single_child_composite() {
        assertThat(this.renderer.renderFilter(and(eq("a", 1)))).isEqualTo("(a == 1)");
    }

    @Test
    public void test_list_operands() {
        assertThat(this.renderer.renderFilter(in("role", "admin", "owner"))).isEqualTo("(role in [\"admin\", \"owner\"])");
        assertThat(this.renderer.renderFilter(notIn("id", 1, 2))).isEqualTo("(id notIn [1, 2])");
        assertThat(this.renderer.renderFilter(in("id", List.of()))).isEqualTo("(id in [])");
    }

    @Test
    public void test_operands() {
        assertThat(this.renderer.renderFilter(eq("x", 1.2))).isEqualTo("(x == 1.2)");
        assertThat(this.renderer.renderFilter(eq("x", 5.1231231231))).isEqualTo("(x == 5.1231231231)");
        assertThat(this.renderer.renderFilter(eq("x", -3L))).isEqualTo("(x == -3)");
        assertThat(this.renderer.renderFilter(eq("x", true))).isEqualTo("(x == true)");
        assertThat(this.renderer.renderFilter(eq("x", null))).isEqualTo("(x == null)");
        assertThat(this.renderer.renderFilter(eq("x", "a\"b\n"))).isEqualTo("(x == \"a\\\"b\\n\")");
        assertThat(this.renderer.renderFilter(fieldEq("customer_id", "customer.id"))).isEqualTo("(customer_id == $customer.id)");
    }

    @Test
    public void test_case_insensitive() {
        assertThat(this.renderer.renderFilter(contains("name", "ali", false))).isEqualTo("(name contains \"ali\" /i)");
        assertThat(this.renderer.renderFilter(startsWith("name", "Al"))).isEqualTo("(name startsWith \"Al\")");
    }

    @Test
    public void test_sort() {
        String sort = this.renderer.renderSort(List.of(Sort.desc("created_at"), Sort.asc("name", NullOrdering.FIRST)));
        assertThat(sort).isEqualTo("created_at DESC, name ASC NULLS FIRST");
    }

    @Test
    public void test_query() {
        Query query = Query.builder("users")
            .eq("status", "active")
            .sortDesc("created_at")
            .limit(20)
            .build();
        assertThat(this.renderer.renderQuery(query)).isEqualTo("users WHERE (status == \"active\") ORDER BY created_at DESC LIMIT 20");
    }

    @Test
    public void test_query_with_join_and_aggregation() {
        Query query = Query.builder("orders")
            .join(Relation.leftOuter("customers", "customer", "customer_id", "id"))
            .groupBy("customer.country")
            .count()
            .build();
        assertThat(this.renderer.renderQuery(query)).isEqualTo(
            "orders LEFT OUTER JOIN customers AS customer ON (customer_id == $customer.id) GROUP BY customer.country AGGREGATE count");
    }
}
