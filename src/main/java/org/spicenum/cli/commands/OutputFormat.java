package org.spicenum.cli.commands;

/**
 * Output formats of the {@code resolve} command.
 */
public enum OutputFormat {
    /** One {@code <raw><TAB><value>} line per literal. */
    TEXT,
    /** A JSON array of {@code {"value": ..., "raw": ...}} objects. */
    JSON
}
