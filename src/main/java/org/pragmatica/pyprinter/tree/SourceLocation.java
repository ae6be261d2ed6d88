package org.pragmatica.pyprinter.tree;

import java.util.Optional;

/**
 * A range in the original source, optionally naming the identifier it covers.
 * Only used for source maps and diagnostics.
 */
public record SourceLocation(SourcePosition start, SourcePosition end, Optional<String> identifierName) {

    public static SourceLocation of(SourcePosition start, SourcePosition end) {
        return new SourceLocation(start, end, Optional.empty());
    }

    public static SourceLocation at(int line, int column) {
        var position = SourcePosition.at(line, column);
        return new SourceLocation(position, position, Optional.empty());
    }

    public static SourceLocation named(int line, int column, String identifierName) {
        var position = SourcePosition.at(line, column);
        return new SourceLocation(position, position, Optional.of(identifierName));
    }

    @Override
    public String toString() {
        return "(" + start + "-" + end + ")";
    }
}
