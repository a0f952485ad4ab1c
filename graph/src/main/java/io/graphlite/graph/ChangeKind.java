package io.graphlite.graph;

/** What produced a new object version. */
public enum ChangeKind {
    CREATED,
    UPDATED,
    DELETED,
    RESTORED,
    MERGED
}
