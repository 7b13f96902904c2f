package eu.okaeri.query.filter.renderer;

import eu.okaeri.query.Query;
import eu.okaeri.query.filter.Filter;
import eu.okaeri.query.filter.LogicalOperator;
import eu.okaeri.query.filter.condition.Condition;
import eu.okaeri.query.filter.condition.Operator;
import eu.okaeri.query.sort.Sort;
import eu.okaeri.query.value.Value;
import lombok.NonNull;

import java.util.List;

/**
 * Human readable rendering of query parts, used for logging and debugging.
 */
public interface FilterRenderer {

    String renderFilter(@NonNull Filter filter);

    String renderOperator(@NonNull LogicalOperator operator);

    String renderOperator(@NonNull Operator operator);

    String renderCondition(@NonNull Condition condition);

    String renderOperand(@NonNull Value operand);

    String renderSort(@NonNull List<Sort> sort);

    String renderQuery(@NonNull Query query);
}
