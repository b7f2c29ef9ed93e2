package org.spicenum.number.scan;

import org.spicenum.diagnostics.DiagnosticsEngine;
import org.spicenum.number.api.NumberParseException;
import org.spicenum.number.internal.i18n.Messages;
import org.spicenum.number.lexer.LiteralResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Resolves every whitespace-separated token of a text as a numeric literal.
 * <p>
 * Tokens that cannot be resolved are reported to the {@link DiagnosticsEngine} with their
 * position. By default scanning continues with the next token. In fail-fast mode the first
 * failure stops this scanner for good: a warning is reported at that position and later
 * calls to {@link #scan} or {@link #scanArguments} resolve nothing.
 * <p>
 * Lines end with {@code \n}, {@code \r\n} or a lone {@code \r}. Columns count code points,
 * starting at 1.
 */
public class LiteralScanner {

    private static final Logger LOG = LoggerFactory.getLogger(LiteralScanner.class);

    private final DiagnosticsEngine diagnostics;
    private final boolean failFast;
    private boolean stopped;

    /**
     * Creates a new scanner.
     * @param diagnostics The engine for reporting literals that cannot be resolved.
     * @param failFast Whether to stop at the first literal that cannot be resolved.
     */
    public LiteralScanner(DiagnosticsEngine diagnostics, boolean failFast) {
        this.diagnostics = diagnostics;
        this.failFast = failFast;
    }

    /**
     * Scans a whole source text.
     *
     * @param source The text; tokens are separated by spaces, tabs and line breaks.
     * @param fileName The logical file name, for error reporting.
     * @return The literals that could be resolved, in source order.
     */
    public List<ScannedLiteral> scan(String source, String fileName) {
        List<ScannedLiteral> literals = new ArrayList<>();
        int current = 0;
        int line = 1;
        int column = 1;
        int failures = 0;

        while (current < source.length() && !stopped) {
            int c = source.codePointAt(current);
            if (c == '\n' || c == '\r') {
                current++;
                if (c == '\r' && current < source.length() && source.charAt(current) == '\n') current++;
                line++;
                column = 1;
                continue;
            }
            if (Character.isWhitespace(c)) {
                current += Character.charCount(c);
                column++;
                continue;
            }

            int start = current;
            int startColumn = column;
            while (current < source.length()) {
                int t = source.codePointAt(current);
                if (Character.isWhitespace(t)) break;
                current += Character.charCount(t);
                column++;
            }

            if (!accept(scanToken(source.substring(start, current), fileName, line, startColumn), literals)) {
                failures++;
            }
        }

        LOG.info("Resolved {} literal(s) from '{}', {} failed", literals.size(), fileName, failures);
        return literals;
    }

    /**
     * Scans literals given one per argument. Argument {@code i} (from 0) is reported at
     * line {@code i + 1}, column 1.
     *
     * @param arguments The literals.
     * @param sourceName The logical source name, for error reporting.
     * @return The literals that could be resolved, in argument order.
     */
    public List<ScannedLiteral> scanArguments(List<String> arguments, String sourceName) {
        List<ScannedLiteral> literals = new ArrayList<>();
        for (int i = 0; i < arguments.size() && !stopped; i++) {
            accept(scanToken(arguments.get(i), sourceName, i + 1, 1), literals);
        }
        return literals;
    }

    /**
     * Resolves a single token and reports it if it cannot be resolved.
     *
     * @param text The token text.
     * @param fileName The logical file name, for error reporting.
     * @param line The line of the token.
     * @param column The column of the token.
     * @return The resolved literal, or empty if an error was reported.
     */
    public Optional<ScannedLiteral> scanToken(String text, String fileName, int line, int column) {
        try {
            return Optional.of(new ScannedLiteral(LiteralResolver.resolve(text), fileName, line, column));
        } catch (NumberParseException e) {
            LOG.debug("{}:{}:{}: cannot resolve '{}' ({})", fileName, line, column, text, e.getKind());
            diagnostics.reportError(Messages.describeRejection(e), fileName, line, column);
            if (failFast) {
                diagnostics.reportWarning("Scanning stopped after the first invalid literal", fileName, line, column);
                stopped = true;
            }
            return Optional.empty();
        }
    }

    /**
     * @return Whether a failure in fail-fast mode has stopped this scanner.
     */
    public boolean isStopped() {
        return stopped;
    }

    private static boolean accept(Optional<ScannedLiteral> literal, List<ScannedLiteral> literals) {
        literal.ifPresent(literals::add);
        return literal.isPresent();
    }
}
