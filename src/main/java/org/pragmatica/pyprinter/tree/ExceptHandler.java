package org.pragmatica.pyprinter.tree;

import java.util.List;
import java.util.Optional;

/**
 * {@code except Type as name:} clause of a {@link Statement.Try}.
 */
public record ExceptHandler(
    Optional<Expression> type,
    Optional<String> name,
    List<Statement> body,
    Optional<SourceLocation> loc
) {
    public ExceptHandler {
        body = List.copyOf(body);
    }

    public static ExceptHandler of(Expression type, String name, List<Statement> body) {
        return new ExceptHandler(Optional.of(type), Optional.of(name), body, Optional.empty());
    }

    public static ExceptHandler catchAll(List<Statement> body) {
        return new ExceptHandler(Optional.empty(), Optional.empty(), body, Optional.empty());
    }
}
