package org.spicenum.number.api;

import org.spicenum.number.internal.i18n.Messages;

/**
 * Thrown when a numeric literal cannot be resolved into a {@link SpiceNumber}.
 * <p>
 * Every instance carries exactly one {@link NumberErrorKind}. The message is the localized
 * description of that kind; the rejected input is available through {@link #getInput()}.
 */
public class NumberParseException extends Exception {

    private final NumberErrorKind kind;
    private final String input;

    /**
     * Constructs a new parse exception.
     * @param kind The classification of the failure.
     * @param input The complete input that was rejected.
     */
    public NumberParseException(NumberErrorKind kind, String input) {
        this(kind, input, null);
    }

    /**
     * Constructs a new parse exception with an underlying cause.
     * @param kind The classification of the failure.
     * @param input The complete input that was rejected.
     * @param cause The cause, e.g. the {@link NumberFormatException} of the double parser.
     */
    public NumberParseException(NumberErrorKind kind, String input, Throwable cause) {
        super(Messages.describe(kind), cause);
        this.kind = kind;
        this.input = input;
    }

    /**
     * @return The classification of the failure.
     */
    public NumberErrorKind getKind() {
        return kind;
    }

    /**
     * @return The input that was rejected, never {@code null}.
     */
    public String getInput() {
        return input;
    }
}
