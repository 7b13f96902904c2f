package eu.okaeri.query.filter;

public enum LogicalOperator {
    AND,
    OR
}
