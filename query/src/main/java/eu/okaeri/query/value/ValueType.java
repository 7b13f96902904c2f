package eu.okaeri.query.value;

public enum ValueType {
    STRING,
    NUMBER,
    BOOLEAN,
    NULL,
    /**
     * Reference to another field, resolved against the evaluated row
     * instead of being compared as a literal (join conditions).
     */
    FIELD_REF
}
