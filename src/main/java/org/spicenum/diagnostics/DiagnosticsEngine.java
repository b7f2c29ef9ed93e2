package org.spicenum.diagnostics;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Collects the diagnostics produced while resolving literals, so that one bad literal
 * can be reported without aborting the rest of the source.
 */
public class DiagnosticsEngine {

    private final List<Diagnostic> diagnostics = new ArrayList<>();

    /**
     * Reports an error.
     *
     * @param message      The error message.
     * @param fileName     The file in which the error occurred.
     * @param lineNumber   The line number of the error.
     * @param columnNumber The column number of the error.
     */
    public void reportError(String message, String fileName, int lineNumber, int columnNumber) {
        diagnostics.add(new Diagnostic(Diagnostic.Type.ERROR, message, fileName, lineNumber, columnNumber));
    }

    /**
     * Reports a warning.
     *
     * @param message      The warning message.
     * @param fileName     The file in which the warning occurred.
     * @param lineNumber   The line number of the warning.
     * @param columnNumber The column number of the warning.
     */
    public void reportWarning(String message, String fileName, int lineNumber, int columnNumber) {
        diagnostics.add(new Diagnostic(Diagnostic.Type.WARNING, message, fileName, lineNumber, columnNumber));
    }

    /**
     * @return {@code true} if at least one error was reported.
     */
    public boolean hasErrors() {
        return diagnostics.stream().anyMatch(d -> d.type() == Diagnostic.Type.ERROR);
    }

    /**
     * @return An unmodifiable view of all collected diagnostics, in reporting order.
     */
    public List<Diagnostic> getDiagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    /**
     * Returns all collected diagnostics as a single, formatted string.
     *
     * @return One diagnostic per line.
     */
    public String summary() {
        return diagnostics.stream()
                .map(Diagnostic::toString)
                .collect(Collectors.joining("\n"));
    }
}
