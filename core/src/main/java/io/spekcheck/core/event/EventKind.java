package io.spekcheck.core.event;

/** Kinds of structural change published by paths, setups and collections. */
public enum EventKind {
    /** A key was added to a collection. */
    ADD,
    /** A value was replaced, or a path or setup was modified. */
    CHANGE,
    /** A key was removed from a collection. */
    DELETE,
    /** A collection was emptied. */
    CLEAR
}
