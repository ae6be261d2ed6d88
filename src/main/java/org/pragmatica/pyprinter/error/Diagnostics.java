package org.pragmatica.pyprinter.error;

import org.pragmatica.pyprinter.tree.SourceLocation;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Collector for the diagnostics of one compilation unit.
 *
 * <p>Passed explicitly to every fallible operation and drained by the caller once the
 * printing pass is over. Not thread-safe: one instance per unit.
 */
public final class Diagnostics {

    private final List<Diagnostic> diagnostics = new ArrayList<>();
    private final FailurePolicy policy;

    private Diagnostics(FailurePolicy policy) {
        this.policy = policy;
    }

    public static Diagnostics create() {
        return new Diagnostics(FailurePolicy.REPORT);
    }

    public static Diagnostics create(FailurePolicy policy) {
        return new Diagnostics(policy);
    }

    public FailurePolicy policy() {
        return policy;
    }

    public void report(Diagnostic diagnostic) {
        diagnostics.add(diagnostic);
    }

    public void error(String code, String message, Optional<SourceLocation> location) {
        report(Diagnostic.error(code, message, location));
    }

    public void warning(String message, Optional<SourceLocation> location) {
        report(Diagnostic.warning(message, location));
    }

    /**
     * Report a failure that used to abort the whole process.
     * Under {@link FailurePolicy#ABORT} it is thrown instead of collected.
     *
     * @throws TranslationException when the policy is {@link FailurePolicy#ABORT}
     */
    public void fail(String code, String message, Optional<SourceLocation> location) {
        var diagnostic = Diagnostic.error(code, message, location);
        if (policy == FailurePolicy.ABORT) {
            throw new TranslationException(diagnostic);
        }
        report(diagnostic);
    }

    public List<Diagnostic> all() {
        return List.copyOf(diagnostics);
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
     * Return everything collected so far and start over.
     */
    public List<Diagnostic> drain() {
        var drained = List.copyOf(diagnostics);
        diagnostics.clear();
        return drained;
    }
}
