package org.pragmatica.pyprinter;

import org.pragmatica.pyprinter.error.Diagnostic;
import org.pragmatica.pyprinter.sourcemap.Mapping;

import java.util.List;

/**
 * Output of an in-memory print: the generated source, its source map and the diagnostics.
 *
 * @param source      Generated Python source
 * @param mappings    Source-map entries in the order they were recorded
 * @param diagnostics Accumulated diagnostic messages (empty on full success)
 */
public record PrintResult(
    String source,
    List<Mapping> mappings,
    List<Diagnostic> diagnostics
) {
    public PrintResult {
        mappings = List.copyOf(mappings);
        diagnostics = List.copyOf(diagnostics);
    }

    public boolean isSuccess() {
        return diagnostics.isEmpty();
    }

    public boolean hasErrors() {
        return diagnostics.stream().anyMatch(Diagnostic::isError);
    }

    /**
     * Format all diagnostics in Rust style against the original source text.
     */
    public String formatDiagnostics(String originalSource, String filename) {
        var sb = new StringBuilder();
        for (var diag : diagnostics) {
            sb.append(diag.format(originalSource, filename));
            sb.append("\n");
        }
        return sb.toString();
    }
}
