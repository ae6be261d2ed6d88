package org.pragmatica.pyprinter.printer;

/**
 * Escaping for double-quoted Python string literals.
 *
 * <p>Output is pure printable ASCII: quotes, backslashes and control characters are escaped,
 * everything outside ASCII becomes {@code \\uXXXX} or, outside the BMP, {@code \\UXXXXXXXX}.
 */
public final class StringLiterals {

    public static final char QUOTE = '"';

    private StringLiterals() {}

    public static String quote(String value) {
        return QUOTE + escape(value) + QUOTE;
    }

    public static String escape(String value) {
        var sb = new StringBuilder(value.length() + 8);
        int i = 0;
        while (i < value.length()) {
            int cp = value.codePointAt(i);
            i += Character.charCount(cp);
            switch (cp) {
                case '\\' -> sb.append("\\\\");
                case '"' -> sb.append("\\\"");
                case '\'' -> sb.append("\\'");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '\t' -> sb.append("\\t");
                case '\b' -> sb.append("\\b");
                case '\f' -> sb.append("\\f");
                default -> appendCodePoint(sb, cp);
            }
        }
        return sb.toString();
    }

    private static void appendCodePoint(StringBuilder sb, int cp) {
        if (cp >= 0x20 && cp < 0x7f) {
            sb.append((char) cp);
        } else if (cp < 0x100) {
            sb.append(String.format("\\x%02x", cp));
        } else if (cp <= 0xffff) {
            sb.append(String.format("\\u%04x", cp));
        } else {
            sb.append(String.format("\\U%08x", cp));
        }
    }
}
