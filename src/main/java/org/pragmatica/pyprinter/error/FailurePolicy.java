package org.pragmatica.pyprinter.error;

/**
 * What to do with an unrecognized literal pairing or an AST shape the printer does not render.
 */
public enum FailurePolicy {
    /**
     * Record an error diagnostic, substitute {@code None} and keep printing.
     */
    REPORT,
    /**
     * Throw {@link TranslationException}, ending the pass for the unit.
     */
    ABORT
}
