package eu.okaeri.query.filter.condition;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Leaf condition operators. Constant names are part of the wire contract.
 */
@Getter
@RequiredArgsConstructor
public enum Operator {

    EQ(OperandArity.SINGLE, "==", true),
    NE(OperandArity.SINGLE, "!=", true),
    LT(OperandArity.SINGLE, "<", false),
    LTE(OperandArity.SINGLE, "<=", false),
    GT(OperandArity.SINGLE, ">", false),
    GTE(OperandArity.SINGLE, ">=", false),
    CONTAINS(OperandArity.SINGLE, "contains", true),
    STARTS_WITH(OperandArity.SINGLE, "startsWith", true),
    ENDS_WITH(OperandArity.SINGLE, "endsWith", true),
    MATCHES(OperandArity.SINGLE, "matches", true),
    ARRAY_CONTAINS(OperandArity.SINGLE, "arrayContains", false),
    ARRAY_CONTAINS_ANY(OperandArity.LIST, "arrayContainsAny", false),
    IN(OperandArity.LIST, "in", false),
    NOT_IN(OperandArity.LIST, "notIn", false),
    IS_NULL(OperandArity.NONE, "isNull", false),
    IS_NOT_NULL(OperandArity.NONE, "isNotNull", false);

    private final OperandArity arity;
    private final String symbol;
    /**
     * Whether the case sensitivity flag applies to this operator.
     */
    private final boolean caseAware;

    public boolean isOrdering() {
        return (this == LT) || (this == LTE) || (this == GT) || (this == GTE);
    }

    /**
     * Operators whose single operand must be a string.
     */
    public boolean isTextual() {
        return (this == CONTAINS) || (this == STARTS_WITH) || (this == ENDS_WITH) || (this == MATCHES);
    }
}
