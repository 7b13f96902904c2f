package eu.okaeri.query.sort;

public enum SortDirection {
    ASC,
    DESC
}
