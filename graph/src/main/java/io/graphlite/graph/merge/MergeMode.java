package io.graphlite.graph.merge;

public enum MergeMode {
    /** Classify only; never writes. */
    DRY_RUN,
    /** Classify and apply every ADDED / FAST_FORWARD object in one transaction. */
    EXECUTE
}
