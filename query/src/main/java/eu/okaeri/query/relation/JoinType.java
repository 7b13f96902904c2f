package eu.okaeri.query.relation;

public enum JoinType {
    /**
     * Primary rows without a matching related row are dropped.
     */
    INNER,
    /**
     * Primary rows without a matching related row are kept with the alias set to null.
     */
    LEFT_OUTER
}
