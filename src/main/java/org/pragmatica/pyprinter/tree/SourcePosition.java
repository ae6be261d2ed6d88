package org.pragmatica.pyprinter.tree;

/**
 * A position in the original source (line 1-based, column 0-based).
 */
public record SourcePosition(int line, int column) {

    public static SourcePosition at(int line, int column) {
        return new SourcePosition(line, column);
    }

    @Override
    public String toString() {
        return line + ":" + column;
    }
}
