package org.spicenum.number.api;

import java.util.Objects;

/**
 * A numeric value as written in a SPICE circuit description.
 * <p>
 * Instances are normally obtained from
 * {@link org.spicenum.number.lexer.LiteralResolver#resolve(String)}. The resolved
 * {@code value} is used for equality and ordering, the original spelling in {@code raw}
 * is kept verbatim so the literal can be written back exactly as it was read.
 * Two literals such as {@code 1k} and {@code 1000} are therefore equal.
 *
 * @param value The magnitude-adjusted value, e.g. {@code 1230.0} for {@code 1.23k}.
 * @param raw The complete, unmodified input text.
 */
public record SpiceNumber(double value, String raw) implements Comparable<SpiceNumber> {

    /** The default number: {@code 0.0}, written as {@code "0"}. */
    public static final SpiceNumber DEFAULT = new SpiceNumber(0.0, "0");

    public SpiceNumber {
        Objects.requireNonNull(raw, "raw");
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SpiceNumber other)) return false;
        // Primitive comparison: 0.0 and -0.0 are equal.
        return value == other.value;
    }

    @Override
    public int hashCode() {
        // -0.0 must hash like 0.0 to stay consistent with equals.
        return Double.hashCode(value == 0.0 ? 0.0 : value);
    }

    @Override
    public int compareTo(SpiceNumber other) {
        if (value < other.value) return -1;
        if (value > other.value) return 1;
        return 0;
    }

    /**
     * @return The original text of the literal.
     */
    @Override
    public String toString() {
        return raw;
    }
}
