package eu.okaeri.query.result;

public enum Severity {
    INFO,
    WARNING,
    CRITICAL
}
