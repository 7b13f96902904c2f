package eu.okaeri.query.sort;

public enum NullOrdering {
    /**
     * Placement chosen by the executor.
     */
    DEFAULT,
    FIRST,
    LAST
}
