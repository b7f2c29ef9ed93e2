package org.spicenum.number.lexer;

/**
 * The SI prefixes that may follow a numeric literal to scale its value.
 * Symbols are case-insensitive.
 *
 * <pre>
 * | Symbol | Prefix | Exponent |
 * |--------|--------|----------|
 * | T      | Tera   | E+12     |
 * | G      | Giga   | E+09     |
 * | X, Meg | Mega   | E+06     |
 * | K      | Kilo   | E+03     |
 * | M      | Milli  | E-03     |
 * | U      | Micro  | E-06     |
 * | N      | Nano   | E-09     |
 * | P      | Pico   | E-12     |
 * | F      | Femto  | E-15     |
 * </pre>
 */
public enum MagnitudeSuffix {
    TERA('T', "T", "Tera", 12, 1e12),
    GIGA('G', "G", "Giga", 9, 1e9),
    MEGA('X', "X, Meg", "Mega", 6, 1e6),
    KILO('K', "K", "Kilo", 3, 1e3),
    MILLI('M', "M", "Milli", -3, 1e-3),
    MICRO('U', "U", "Micro", -6, 1e-6),
    NANO('N', "N", "Nano", -9, 1e-9),
    PICO('P', "P", "Pico", -12, 1e-12),
    FEMTO('F', "F", "Femto", -15, 1e-15);

    private final char letter;
    private final String notation;
    private final String prefix;
    private final int exponent;
    private final double multiplier;

    MagnitudeSuffix(char letter, String notation, String prefix, int exponent, double multiplier) {
        this.letter = letter;
        this.notation = notation;
        this.prefix = prefix;
        this.exponent = exponent;
        this.multiplier = multiplier;
    }

    /**
     * Looks up the suffix introduced by the given upper-case letter.
     * {@code 'M'} always maps to {@link #MILLI}; telling it apart from "Meg" needs
     * the characters that follow and is left to the caller.
     *
     * @param upperCaseLetter An upper-case ASCII letter.
     * @return The matching suffix, or {@code null} if the letter is not a known prefix.
     */
    public static MagnitudeSuffix fromLetter(int upperCaseLetter) {
        for (MagnitudeSuffix suffix : values()) {
            if (suffix.letter == upperCaseLetter) {
                return suffix;
            }
        }
        return null;
    }

    /** @return All accepted spellings, e.g. {@code "X, Meg"}. */
    public String notation() {
        return notation;
    }

    /** @return The SI prefix name, e.g. {@code "Kilo"}. */
    public String prefix() {
        return prefix;
    }

    /** @return The decimal exponent, e.g. {@code 3} for Kilo. */
    public int exponent() {
        return exponent;
    }

    /** @return The factor the numeric body is multiplied with. */
    public double multiplier() {
        return multiplier;
    }
}
