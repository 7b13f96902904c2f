package eu.okaeri.query;

public enum ConsistencyLevel {
    EVENTUAL,
    STRONG,
    LINEARIZABLE
}
