package org.spicenum.number.api;

/**
 * Classifies why a numeric literal could not be resolved.
 */
public enum NumberErrorKind {
    /** The input had no characters at all. */
    EMPTY,
    /** The numeric body is malformed, or was rejected by the double parser. */
    INVALID_SYNTAX,
    /** A magnitude suffix letter was present but is not a known SI prefix. */
    INVALID_MULTIPLIER
}
