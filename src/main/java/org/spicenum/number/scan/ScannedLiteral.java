package org.spicenum.number.scan;

import org.spicenum.number.api.SpiceNumber;

/**
 * A literal resolved by the {@link LiteralScanner}, together with its position.
 *
 * @param number The resolved number.
 * @param fileName The logical name of the source.
 * @param line The line number where the literal was found.
 * @param column The column number where the literal begins.
 */
public record ScannedLiteral(
        SpiceNumber number,
        String fileName,
        int line,
        int column
) {
}
