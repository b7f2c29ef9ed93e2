package org.spicenum.number.lexer;

import org.spicenum.number.api.NumberErrorKind;
import org.spicenum.number.api.NumberParseException;
import org.spicenum.number.api.SpiceNumber;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.PrimitiveIterator;

/**
 * Resolves SPICE numeric literals such as {@code 1.23k}, {@code -4E-08} or {@code 7343Meg}
 * into {@link SpiceNumber}s.
 * <p>
 * The literal is scanned once, code point by code point. The scan collects the numeric body
 * (sign, digits, decimal point, exponent) into a buffer and stops at the first magnitude
 * suffix letter, which is mapped to a {@link MagnitudeSuffix}. Anything after the suffix is
 * ignored, so {@code 1.23pFarad} is simply {@code 1.23e-12}. The buffer is finally handed to
 * {@link Double#parseDouble(String)}.
 * <p>
 * The scanner only checks that a decimal point does not directly follow another one.
 * Whether the body as a whole is a well-formed number (e.g. {@code 1.2.3}) is decided by the
 * double parser. Suffix letters after an exponent are not interpreted: {@code 123e3F} is
 * {@code 123e3}.
 * <p>
 * This class is stateless and safe to use from any thread.
 */
public final class LiteralResolver {

    private static final Logger LOG = LoggerFactory.getLogger(LiteralResolver.class);

    private LiteralResolver() {}

    /**
     * Resolves a single literal.
     *
     * @param input The literal, without surrounding whitespace.
     * @return The resolved number; its {@code raw} text is {@code input} unchanged.
     * @throws NumberParseException if the input is empty, malformed, or has an unknown suffix.
     */
    public static SpiceNumber resolve(String input) throws NumberParseException {
        Objects.requireNonNull(input, "input");
        PrimitiveIterator.OfInt chars = input.codePoints().iterator();
        StringBuilder buffer = new StringBuilder();
        LexState state = LexState.START;
        double multiplier = 1.0;

        scan:
        while (true) {
            if (!chars.hasNext()) {
                if (buffer.length() > 0) break;
                throw fail(NumberErrorKind.EMPTY, input);
            }
            int c = chars.nextInt();

            switch (state) {
                case START, EXPONENT_START -> {
                    if (c != '+' && c != '-' && !isDigit(c)) {
                        throw fail(NumberErrorKind.INVALID_SYNTAX, input);
                    }
                    buffer.appendCodePoint(c);
                    state = state == LexState.START ? LexState.INTEGER_PART : LexState.EXPONENT_DIGITS;
                }
                case INTEGER_PART, FRACTION_PART -> {
                    if (isDigit(c)) {
                        buffer.appendCodePoint(c);
                        state = LexState.INTEGER_PART;
                    } else if (c == '.') {
                        if (state == LexState.FRACTION_PART) {
                            throw fail(NumberErrorKind.INVALID_SYNTAX, input);
                        }
                        buffer.appendCodePoint(c);
                        state = LexState.FRACTION_PART;
                    } else if (c == 'e' || c == 'E') {
                        buffer.appendCodePoint(c);
                        state = LexState.EXPONENT_START;
                    } else if (isAsciiLetter(c)) {
                        multiplier = resolveSuffix(c, chars, input).multiplier();
                        break scan;
                    } else {
                        throw fail(NumberErrorKind.INVALID_SYNTAX, input);
                    }
                }
                case EXPONENT_DIGITS -> {
                    if (!isDigit(c)) break scan;
                    buffer.appendCodePoint(c);
                }
            }
        }

        double value;
        try {
            value = Double.parseDouble(buffer.toString());
        } catch (NumberFormatException e) {
            LOG.debug("Numeric body '{}' of literal '{}' rejected by double parser", buffer, input);
            throw new NumberParseException(NumberErrorKind.INVALID_SYNTAX, input, e);
        }
        return new SpiceNumber(value * multiplier, input);
    }

    /**
     * Maps the first suffix letter to its magnitude. An {@code M} is "Meg" if the next two
     * code points read {@code EG} in any case, otherwise "milli". Those two code points are
     * consumed in both cases.
     */
    private static MagnitudeSuffix resolveSuffix(int letter, PrimitiveIterator.OfInt rest, String input)
            throws NumberParseException {
        MagnitudeSuffix suffix = MagnitudeSuffix.fromLetter(toAsciiUpperCase(letter));
        if (suffix == null) {
            throw fail(NumberErrorKind.INVALID_MULTIPLIER, input);
        }
        if (suffix == MagnitudeSuffix.MILLI && "EG".equals(take(rest, 2))) {
            return MagnitudeSuffix.MEGA;
        }
        return suffix;
    }

    /** Reads up to {@code count} code points, upper-casing ASCII letters. */
    private static String take(PrimitiveIterator.OfInt chars, int count) {
        StringBuilder sb = new StringBuilder(count);
        for (int i = 0; i < count && chars.hasNext(); i++) {
            sb.appendCodePoint(toAsciiUpperCase(chars.nextInt()));
        }
        return sb.toString();
    }

    private static NumberParseException fail(NumberErrorKind kind, String input) {
        LOG.debug("Rejected literal '{}': {}", input, kind);
        return new NumberParseException(kind, input);
    }

    private static boolean isDigit(int c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isAsciiLetter(int c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
    }

    private static int toAsciiUpperCase(int c) {
        return (c >= 'a' && c <= 'z') ? c - ('a' - 'A') : c;
    }
}
