package org.pragmatica.pyprinter.tree;

import java.util.List;

/**
 * Root of a compilation unit: the ordered top-level statements.
 */
public record PyModule(List<Statement> body) {

    public PyModule {
        body = List.copyOf(body);
    }

    public static PyModule of(Statement... body) {
        return new PyModule(List.of(body));
    }

    /**
     * Number of leading import statements.
     */
    public int importCount() {
        int count = 0;
        while (count < body.size() && Statement.isImport(body.get(count))) {
            count++;
        }
        return count;
    }

    public List<Statement> imports() {
        return body.subList(0, importCount());
    }

    public List<Statement> declarations() {
        return body.subList(importCount(), body.size());
    }
}
