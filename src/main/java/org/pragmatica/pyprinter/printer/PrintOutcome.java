package org.pragmatica.pyprinter.printer;

import org.pragmatica.pyprinter.error.Diagnostic;

import java.util.List;

/**
 * Result of printing one module: how far printing got and what was reported on the way.
 *
 * <p>Output text itself went to the sink. When {@code cancelled} is set, only the first
 * {@code declarationsPrinted} declarations reached it.
 *
 * @param diagnostics         Accumulated diagnostic messages (empty on full success)
 * @param declarationsPrinted Top-level declarations written to the sink
 * @param declarationsTotal   Top-level declarations in the module
 * @param cancelled           True if printing stopped early on request
 */
public record PrintOutcome(
    List<Diagnostic> diagnostics,
    int declarationsPrinted,
    int declarationsTotal,
    boolean cancelled
) {
    public PrintOutcome {
        diagnostics = List.copyOf(diagnostics);
    }

    /**
     * Check if the whole module was printed without any diagnostics.
     */
    public boolean isSuccess() {
        return !cancelled && diagnostics.isEmpty();
    }

    public boolean hasErrors() {
        return diagnostics.stream().anyMatch(Diagnostic::isError);
    }

    public int errorCount() {
        return (int) diagnostics.stream()
            .filter(d -> d.severity() == Diagnostic.Severity.ERROR)
            .count();
    }

    public int warningCount() {
        return (int) diagnostics.stream()
            .filter(d -> d.severity() == Diagnostic.Severity.WARNING)
            .count();
    }

    /**
     * Format all diagnostics in Rust style.
     *
     * @param source   Original source text the locations point into
     * @param filename Optional filename for display
     */
    public String formatDiagnostics(String source, String filename) {
        if (diagnostics.isEmpty()) {
            return "";
        }
        var sb = new StringBuilder();
        for (var diag : diagnostics) {
            sb.append(diag.format(source, filename));
            sb.append("\n");
        }
        return sb.toString();
    }
}
