package org.spicenum.diagnostics;

/**
 * Represents a single diagnostic message (error, warning) that occurs while
 * resolving the literals of a source.
 *
 * @param type The type of the diagnostic (e.g., ERROR, WARNING).
 * @param message The diagnostic message.
 * @param fileName The name of the file where the issue occurred.
 * @param lineNumber The line number of the issue.
 * @param columnNumber The column where the offending literal begins.
 */
public record Diagnostic(
        Type type,
        String message,
        String fileName,
        int lineNumber,
        int columnNumber
) {
    /**
     * The type of a diagnostic message.
     */
    public enum Type {
        /** A literal that could not be resolved. */
        ERROR,
        /** A problem that does not invalidate the resolved literals. */
        WARNING
    }

    @Override
    public String toString() {
        return String.format("[%s] %s:%d:%d: %s", type, fileName, lineNumber, columnNumber, message);
    }
}
