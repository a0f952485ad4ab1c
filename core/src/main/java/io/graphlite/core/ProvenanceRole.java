package io.graphlite.core;

/** Which side of a merge a contributing version came from. */
public enum ProvenanceRole {
    TARGET, SOURCE, BASE
}
