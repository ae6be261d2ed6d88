package org.pragmatica.pyprinter.printer;

import org.pragmatica.pyprinter.tree.SourceLocation;

import java.util.Optional;

/**
 * Append-only text emitter that tracks line, column and indentation.
 *
 * <p>Lines are 1-based, columns 0-based. The column always equals the number of characters
 * written since the last {@link #newline()}, indentation included.
 */
public interface Printer {

    int line();

    int column();

    void pushIndent();

    /**
     * Decrease indentation; never goes below zero.
     */
    void popIndent();

    default void print(String text) {
        print(text, Optional.empty());
    }

    /**
     * Append text, indenting first when at the start of a line. A location is mapped to the
     * position of the first character of {@code text}.
     */
    void print(String text, Optional<SourceLocation> loc);

    void newline();

    /**
     * Record a mapping at the position the next character will be written to, without emitting text.
     */
    void addLocation(Optional<SourceLocation> loc);

    String makeImportPath(String path);
}
