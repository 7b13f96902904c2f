package eu.okaeri.query.search;

public enum SearchType {
    FULL_TEXT,
    SEMANTIC,
    HYBRID;

    public boolean usesText() {
        return this != SEMANTIC;
    }

    public boolean usesVector() {
        return this != FULL_TEXT;
    }
}
