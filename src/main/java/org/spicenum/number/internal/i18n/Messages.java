package org.spicenum.number.internal.i18n;

import org.spicenum.number.api.NumberErrorKind;
import org.spicenum.number.api.NumberParseException;

import java.text.MessageFormat;
import java.util.MissingResourceException;
import java.util.ResourceBundle;

/**
 * Looks up the texts shown for rejected literals in the "number_messages" bundle.
 * Keys missing from the bundle render as {@code !key!}.
 */
public final class Messages {

    private static final ResourceBundle BUNDLE = ResourceBundle.getBundle("number_messages");

    private Messages() {}

    /**
     * @param kind The classification of a failed resolve.
     * @return The description of the kind, e.g. "invalid multiplier".
     */
    public static String describe(NumberErrorKind kind) {
        return get(switch (kind) {
            case EMPTY -> "number.error.empty";
            case INVALID_SYNTAX -> "number.error.invalid";
            case INVALID_MULTIPLIER -> "number.error.invalidMultiplier";
        });
    }

    /**
     * Describes a rejected literal together with its text, e.g. {@code invalid number: '1.2.3'}.
     *
     * @param rejection The failure of the resolver.
     * @return The line shown to users.
     */
    public static String describeRejection(NumberParseException rejection) {
        return get("scan.error.literal", describe(rejection.getKind()), rejection.getInput());
    }

    static String get(String key) {
        try {
            return BUNDLE.getString(key);
        } catch (MissingResourceException e) {
            return "!" + key + "!";
        }
    }

    static String get(String key, Object... args) {
        return MessageFormat.format(get(key), args);
    }
}
