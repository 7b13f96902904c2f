package eu.okaeri.query.filter.renderer;

import eu.okaeri.query.Query;
import eu.okaeri.query.aggregation.Aggregate;
import eu.okaeri.query.filter.CompositeFilter;
import eu.okaeri.query.filter.Filter;
import eu.okaeri.query.filter.LogicalOperator;
import eu.okaeri.query.filter.NotFilter;
import eu.okaeri.query.filter.condition.Condition;
import eu.okaeri.query.filter.condition.OperandArity;
import eu.okaeri.query.filter.condition.Operator;
import eu.okaeri.query.relation.Relation;
import eu.okaeri.query.sort.NullOrdering;
import eu.okaeri.query.sort.Sort;
import eu.okaeri.query.value.Value;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;

import java.math.BigDecimal;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Renders filters as {@code ((age >= 18) && (status == "active"))}.
 * Case-insensitive conditions are suffixed with {@code /i}, field
 * references are rendered as {@code $path}.
 */
@RequiredArgsConstructor
public class DefaultFilterRenderer implements FilterRenderer {

    protected final @NonNull StringRenderer stringRenderer;

    public DefaultFilterRenderer() {
        this.stringRenderer = new DefaultStringRenderer();
    }

    @Override
    public String renderFilter(@NonNull Filter filter) {

        if (filter instanceof Condition) {
            return this.renderCondition((Condition) filter);
        }

        if (filter instanceof NotFilter) {
            return "!" + this.renderFilter(((NotFilter) filter).getChild());
        }

        if (filter instanceof CompositeFilter) {
            CompositeFilter composite = (CompositeFilter) filter;
            String expression = composite.getChildren().stream()
                .map(this::renderFilter)
                .collect(Collectors.joining(this.renderOperator(composite.getOperator())));
            return (composite.getChildren().size() == 1)
                ? expression
                : ("(" + expression + ")");
        }

        throw new IllegalArgumentException("cannot render filter " + filter + " [" + filter.getClass() + "]");
    }

    @Override
    public String renderOperator(@NonNull LogicalOperator operator) {
        if (operator == LogicalOperator.AND) {
            return " && ";
        }
        if (operator == LogicalOperator.OR) {
            return " || ";
        }
        throw new IllegalArgumentException("Unsupported operator: " + operator);
    }

    @Override
    public String renderOperator(@NonNull Operator operator) {
        return operator.getSymbol();
    }

    @Override
    public String renderCondition(@NonNull Condition condition) {

        StringBuilder builder = new StringBuilder("(")
            .append(condition.getField().getValue())
            .append(" ")
            .append(this.renderOperator(condition.getOperator()));

        OperandArity arity = condition.getOperator().getArity();
        if (arity == OperandArity.SINGLE) {
            builder.append(" ").append(this.renderOperand(condition.getOperand()));
        } else if (arity == OperandArity.LIST) {
            builder.append(" [")
                .append(condition.getOperands().stream().map(this::renderOperand).collect(Collectors.joining(", ")))
                .append("]");
        }

        if (!condition.isCaseSensitive()) {
            builder.append(" /i");
        }

        return builder.append(")").toString();
    }

    @Override
    public String renderOperand(@NonNull Value operand) {
        switch (operand.getType()) {
            case NULL:
                return "null";
            case BOOLEAN:
                return String.valueOf(operand.asBoolean());
            case FIELD_REF:
                return "$" + operand.asString();
            case STRING:
                return this.stringRenderer.render(operand.asString());
            case NUMBER:
                return this.renderNumber(operand.asNumber());
            default:
                throw new IllegalArgumentException("cannot render operand " + operand);
        }
    }

    protected String renderNumber(double number) {
        if (Double.isNaN(number) || Double.isInfinite(number)) {
            return String.valueOf(number);
        }
        if ((number == Math.rint(number)) && (Math.abs(number) < Long.MAX_VALUE)) {
            return String.valueOf((long) number);
        }
        return new BigDecimal(String.valueOf(number)).toPlainString();
    }

    @Override
    public String renderSort(@NonNull List<Sort> sort) {
        return sort.stream()
            .map(order -> {
                String rendered = order.getField().getValue() + " " + order.getDirection().name();
                return (order.getNulls() == NullOrdering.DEFAULT)
                    ? rendered
                    : (rendered + " NULLS " + order.getNulls().name());
            })
            .collect(Collectors.joining(", "));
    }

    @Override
    public String renderQuery(@NonNull Query query) {

        StringBuilder builder = new StringBuilder(query.getEntity());

        for (Relation relation : query.getRelations()) {
            builder.append(" ").append(relation.getType().name().replace('_', ' '))
                .append(" JOIN ").append(relation.getEntity())
                .append(" AS ").append(relation.getAlias())
                .append(" ON ").append(this.renderFilter(relation.getOn()));
        }

        if (query.hasSearch()) {
            builder.append(" SEARCH ").append(query.getSearch().getType());
            if (query.getSearch().getQuery() != null) {
                builder.append(" ").append(this.stringRenderer.render(query.getSearch().getQuery()));
            }
        }

        if (query.hasFilter()) {
            builder.append(" WHERE ").append(this.renderFilter(query.getFilter()));
        }

        if (query.hasAggregation()) {
            if (!query.getAggregation().isGlobal()) {
                builder.append(" GROUP BY ").append(query.getAggregation().getGroupBy().stream()
                    .map(Object::toString)
                    .collect(Collectors.joining(", ")));
            }
            builder.append(" AGGREGATE ").append(query.getAggregation().getAggregates().stream()
                .map(Aggregate::getAlias)
                .collect(Collectors.joining(", ")));
            if (query.getAggregation().hasHaving()) {
                builder.append(" HAVING ").append(this.renderFilter(query.getAggregation().getHaving()));
            }
        }

        if (query.hasSort()) {
            builder.append(" ORDER BY ").append(this.renderSort(query.getSort()));
        }

        if (query.hasPagination()) {
            builder.append(" LIMIT ").append(query.getPagination().getPageSize());
            if (query.getPagination().hasOffset()) {
                builder.append(" OFFSET ").append(query.getPagination().getOffset());
            }
            if (query.getPagination().hasCursor()) {
                builder.append(" AFTER ").append(this.stringRenderer.render(query.getPagination().getCursor()));
            }
        }

        return builder.toString();
    }
}
