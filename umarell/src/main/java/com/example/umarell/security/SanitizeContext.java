package com.example.umarell.security;

/** Target a user-influenced string is about to be embedded in. */
public enum SanitizeContext {
    /** Inside a single-quoted Cypher string literal. */
    GRAPH_LITERAL,
    /** Inside a Flux regex literal ({@code /.../}), matched literally. */
    REGEX_FRAGMENT,
    /** Inside a double-quoted Flux string literal. */
    FLUX_STRING,
    /** A Flux duration used as a range start, e.g. {@code -1h}. */
    TIME_RANGE
}
