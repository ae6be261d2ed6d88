package org.pragmatica.pyprinter.error;

/**
 * Thrown under {@link FailurePolicy#ABORT} when a unit cannot be translated.
 */
public final class TranslationException extends RuntimeException {

    private final Diagnostic diagnostic;

    public TranslationException(Diagnostic diagnostic) {
        super(diagnostic.formatSimple());
        this.diagnostic = diagnostic;
    }

    public Diagnostic diagnostic() {
        return diagnostic;
    }
}
