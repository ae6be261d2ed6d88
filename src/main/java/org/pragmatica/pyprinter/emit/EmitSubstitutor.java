package org.pragmatica.pyprinter.emit;

import org.pragmatica.pyprinter.printer.Printer;
import org.pragmatica.pyprinter.tree.Expression;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.function.Consumer;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Expands {@link Expression.Emit} templates and streams the result through a {@link Printer}.
 *
 * <p>Rewrites, applied in order over the whole template:
 * <ol>
 *     <li>{@code $i...} becomes {@code $i, $i+1, ..., $N-1} for {@code N} arguments</li>
 *     <li>{@code {{ $i ? A : B }}} becomes {@code A} if argument {@code i} is a constant, {@code B} otherwise</li>
 *     <li>{@code {{ ... $i ... }}} keeps its inner text if argument {@code i} exists, drops it otherwise</li>
 * </ol>
 * Remaining {@code $<digits>} tokens are replaced by the printed argument; indexes out of range print {@code None}.
 */
public final class EmitSubstitutor {

    private static final Logger LOGGER = LoggerFactory.getLogger(EmitSubstitutor.class);

    private static final Pattern SPREAD = Pattern.compile("\\$(\\d+)\\.\\.\\.");
    private static final Pattern TERNARY = Pattern.compile("\\{\\{\\s*\\$(\\d+)\\s*\\?(.*?):(.*?)\\}\\}");
    private static final Pattern PRESENCE = Pattern.compile("\\{\\{([^}]*\\$(\\d+).*?)\\}\\}");
    private static final Pattern PLACEHOLDER = Pattern.compile("\\$\\d+");
    private static final Pattern LINE_BREAK = Pattern.compile("\\r?\\n");

    private static final String NONE = "None";

    private EmitSubstitutor() {}

    /**
     * Apply the spread, ternary and presence rewrites. Bare placeholders are left in place.
     */
    public static String expand(String template, List<Expression> args) {
        var spread = SPREAD.matcher(template)
                           .replaceAll(m -> Matcher.quoteReplacement(spread(index(m.group(1)), args.size())));
        var ternary = TERNARY.matcher(spread)
                             .replaceAll(m -> Matcher.quoteReplacement(
                                 isConstant(args, index(m.group(1))) ? m.group(2) : m.group(3)));
        return PRESENCE.matcher(ternary)
                       .replaceAll(m -> Matcher.quoteReplacement(
                           index(m.group(2)) < args.size() ? m.group(1) : ""));
    }

    /**
     * Print the template, dispatching each {@code $i} to {@code printOperand}.
     *
     * @param printOperand prints an argument the way operator operands are printed
     */
    public static void print(Printer printer, Expression.Emit node, Consumer<Expression> printOperand) {
        var args = node.args();
        var value = expand(node.template(), args);
        LOGGER.trace("Emit template '{}' expanded to '{}'", node.template(), value);

        var matcher = PLACEHOLDER.matcher(value);
        int segmentStart = 0;
        while (matcher.find()) {
            printSegment(printer, value.substring(segmentStart, matcher.start()));

            int argIndex = index(matcher.group().substring(1));
            if (argIndex < args.size()) {
                printOperand.accept(args.get(argIndex));
            } else {
                printer.print(NONE);
            }
            segmentStart = matcher.end();
        }
        printSegment(printer, value.substring(segmentStart));
    }

    private static void printSegment(Printer printer, String segment) {
        if (segment.isEmpty()) {
            return;
        }
        var lines = LINE_BREAK.split(segment, -1);
        for (int i = 0; i < lines.length; i++) {
            // Indentation is applied by the printer, so drop the template's own
            var line = printer.column() == 0
                       ? lines[i].stripLeading()
                       : lines[i];
            if (!line.isEmpty()) {
                printer.print(line);
                if (i < lines.length - 1) {
                    printer.newline();
                }
            }
        }
    }

    private static String spread(int from, int argCount) {
        return IntStream.range(from, argCount)
                        .mapToObj(j -> "$" + j)
                        .collect(Collectors.joining(", "));
    }

    private static boolean isConstant(List<Expression> args, int index) {
        return index < args.size() && args.get(index) instanceof Expression.Constant;
    }

    private static int index(String digits) {
        try {
            return Integer.parseInt(digits);
        } catch (NumberFormatException e) {
            // Too many digits for an int: no argument list is that long
            return Integer.MAX_VALUE;
        }
    }
}
