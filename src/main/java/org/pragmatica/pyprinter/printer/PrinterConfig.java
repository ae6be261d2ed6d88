package org.pragmatica.pyprinter.printer;

import org.pragmatica.pyprinter.error.FailurePolicy;

import java.util.Objects;

/**
 * Printer configuration options.
 */
public record PrinterConfig(
    String indentUnit,
    String lineSeparator,
    FailurePolicy failurePolicy
) {
    public static final PrinterConfig DEFAULT = new PrinterConfig(
        "    ",
        "\n",
        FailurePolicy.REPORT
    );

    public PrinterConfig {
        Objects.requireNonNull(indentUnit, "indentUnit");
        Objects.requireNonNull(lineSeparator, "lineSeparator");
        Objects.requireNonNull(failurePolicy, "failurePolicy");
        if (lineSeparator.isEmpty()) {
            throw new IllegalArgumentException("Line separator must not be empty");
        }
    }

    public PrinterConfig withFailurePolicy(FailurePolicy policy) {
        return new PrinterConfig(indentUnit, lineSeparator, policy);
    }
}
