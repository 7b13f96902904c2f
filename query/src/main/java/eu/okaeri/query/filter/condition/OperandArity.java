package eu.okaeri.query.filter.condition;

public enum OperandArity {
    NONE,
    SINGLE,
    LIST
}
