package org.pragmatica.pyprinter.error;

import org.pragmatica.pyprinter.tree.SourceLocation;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Diagnostic reported while printing a compilation unit.
 *
 * <p>Example output of {@link #format(String, String)}:
 * <pre>
 * error[E001]: Cannot type test records, unions or classes
 *   --> Program.fs:3:8
 *    |
 *  3 |     if x :? Shape then
 *    |        ^^^^^^^^^^
 *    |
 *    = help: match on the union cases instead
 * </pre>
 *
 * @param severity Severity level
 * @param code     Optional error code (e.g. "E001")
 * @param message  Primary message
 * @param location Original source range, if known
 * @param notes    Additional notes or suggestions
 */
public record Diagnostic(
    Severity severity,
    String code,
    String message,
    Optional<SourceLocation> location,
    List<String> notes
) {
    public static final String UNSUPPORTED_TYPE_TEST = "E001";
    public static final String UNRECOGNIZED_LITERAL = "E002";
    public static final String UNSUPPORTED_NODE = "E003";

    public Diagnostic {
        notes = List.copyOf(notes);
    }

    public enum Severity {
        ERROR("error"),
        WARNING("warning"),
        INFO("info");

        private final String display;

        Severity(String display) {
            this.display = display;
        }

        public String display() {
            return display;
        }
    }

    public static Diagnostic error(String message, Optional<SourceLocation> location) {
        return new Diagnostic(Severity.ERROR, null, message, location, List.of());
    }

    public static Diagnostic error(String code, String message, Optional<SourceLocation> location) {
        return new Diagnostic(Severity.ERROR, code, message, location, List.of());
    }

    public static Diagnostic warning(String message, Optional<SourceLocation> location) {
        return new Diagnostic(Severity.WARNING, null, message, location, List.of());
    }

    public Diagnostic withNote(String note) {
        var newNotes = new ArrayList<>(notes);
        newNotes.add(note);
        return new Diagnostic(severity, code, message, location, newNotes);
    }

    public Diagnostic withHelp(String help) {
        return withNote("help: " + help);
    }

    public boolean isError() {
        return severity == Severity.ERROR;
    }

    /**
     * Format in Rust style, quoting the offending source lines.
     *
     * @param source   Original source text
     * @param filename Optional filename for display
     */
    public String format(String source, String filename) {
        var sb = new StringBuilder();

        sb.append(severity.display());
        if (code != null) {
            sb.append("[").append(code).append("]");
        }
        sb.append(": ").append(message).append("\n");

        if (location.isEmpty()) {
            if (filename != null) {
                sb.append("  --> ").append(filename).append("\n");
            }
            appendNotes(sb, 1);
            return sb.toString();
        }

        var loc = location.get();
        sb.append("  --> ");
        if (filename != null) {
            sb.append(filename).append(":");
        }
        sb.append(loc.start().line()).append(":").append(loc.start().column()).append("\n");

        var lines = source.split("\n", -1);
        int minLine = loc.start().line();
        int maxLine = loc.end().line();
        int gutterWidth = String.valueOf(maxLine).length();

        sb.append(" ".repeat(gutterWidth + 1)).append("|\n");

        for (int lineNum = minLine; lineNum <= maxLine; lineNum++) {
            if (lineNum < 1 || lineNum > lines.length) continue;

            var lineContent = lines[lineNum - 1];
            sb.append(String.format("%" + gutterWidth + "d", lineNum))
              .append(" | ")
              .append(lineContent)
              .append("\n");

            // Columns are 0-based
            int startCol = lineNum == loc.start().line() ? loc.start().column() : 0;
            int endCol = lineNum == loc.end().line() ? loc.end().column() : lineContent.length();
            sb.append(" ".repeat(gutterWidth))
              .append(" | ")
              .append(" ".repeat(Math.max(0, startCol)))
              .append("^".repeat(Math.max(1, endCol - startCol)))
              .append("\n");
        }

        sb.append(" ".repeat(gutterWidth + 1)).append("|\n");
        appendNotes(sb, gutterWidth + 1);

        return sb.toString();
    }

    private void appendNotes(StringBuilder sb, int indent) {
        for (var note : notes) {
            sb.append(" ".repeat(indent)).append("= ").append(note).append("\n");
        }
    }

    /**
     * Single-line format for logs.
     */
    public String formatSimple() {
        var where = location.map(loc -> loc.start().toString())
                            .orElse("?");
        return String.format("%s: %s%s: %s",
            where, severity.display(), code == null ? "" : "[" + code + "]", message);
    }
}
