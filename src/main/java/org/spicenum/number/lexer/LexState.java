package org.spicenum.number.lexer;

/**
 * The states of the {@link LiteralResolver} while it scans a single literal.
 */
enum LexState {
    /** Nothing consumed yet; a sign or a digit is expected. */
    START,
    /** Inside the mantissa; the last character was a sign or a digit. */
    INTEGER_PART,
    /** A decimal point was consumed by the immediately preceding step. */
    FRACTION_PART,
    /** The exponent marker was consumed; a sign or a digit is expected. */
    EXPONENT_START,
    /** Inside the exponent digits. */
    EXPONENT_DIGITS
}
