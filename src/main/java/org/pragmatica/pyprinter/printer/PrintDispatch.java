package org.pragmatica.pyprinter.printer;

import org.pragmatica.pyprinter.builder.ExpressionBuilder;
import org.pragmatica.pyprinter.emit.EmitSubstitutor;
import org.pragmatica.pyprinter.error.Diagnostic;
import org.pragmatica.pyprinter.error.Diagnostics;
import org.pragmatica.pyprinter.tree.Alias;
import org.pragmatica.pyprinter.tree.Arg;
import org.pragmatica.pyprinter.tree.Arguments;
import org.pragmatica.pyprinter.tree.ConstantValue;
import org.pragmatica.pyprinter.tree.ExceptHandler;
import org.pragmatica.pyprinter.tree.Expression;
import org.pragmatica.pyprinter.tree.Keyword;
import org.pragmatica.pyprinter.tree.SourceLocation;
import org.pragmatica.pyprinter.tree.Statement;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.BiConsumer;

/**
 * Turns every statement and expression variant into printer calls.
 *
 * <p>Operands of operators are parenthesized unless they are a bare name or a non-negative
 * constant. This over-parenthesizes some expressions but never changes their grouping.
 */
public final class PrintDispatch implements Statement.Visitor<Void>, Expression.Visitor<Void> {

    private final Printer printer;
    private final Diagnostics diagnostics;
    private final ExpressionBuilder builder;

    private PrintDispatch(Printer printer, Diagnostics diagnostics) {
        this.printer = printer;
        this.diagnostics = diagnostics;
        this.builder = ExpressionBuilder.create(diagnostics);
    }

    public static PrintDispatch create(Printer printer, Diagnostics diagnostics) {
        return new PrintDispatch(printer, diagnostics);
    }

    // === Entry points ===

    public void printStatement(Statement stmt) {
        stmt.accept(this);
    }

    public void printExpression(Expression expr) {
        expr.accept(this);
    }

    /**
     * Print statements at the current indentation, each ending its line.
     */
    public void printStatements(List<Statement> statements) {
        for (var stmt : statements) {
            printStatement(stmt);
            printStatementSeparator();
        }
    }

    /**
     * Print an operand, in parentheses unless it cannot conflict with operator precedence.
     */
    public void printOperand(Expression expr) {
        if (isBareOperand(expr)) {
            printExpression(expr);
        } else {
            printWithParens(expr);
        }
    }

    // === Statements ===

    @Override
    public Void visitFunctionDef(Statement.FunctionDef stmt) {
        printFunction("def ", stmt.name(), stmt.args(), stmt.body(), stmt.returns(), stmt.decorators(), stmt.loc());
        printer.newline();
        return null;
    }

    @Override
    public Void visitAsyncFunctionDef(Statement.AsyncFunctionDef stmt) {
        printFunction("async def ", stmt.name(), stmt.args(), stmt.body(), stmt.returns(), stmt.decorators(), stmt.loc());
        printer.newline();
        return null;
    }

    @Override
    public Void visitClassDef(Statement.ClassDef stmt) {
        printDecorators(stmt.decorators());
        printer.print("class ", stmt.loc());
        printer.print(stmt.name());
        if (!stmt.bases().isEmpty()) {
            printer.print("(");
            printCommaSeparated(stmt.bases());
            printer.print(")");
        }
        printer.print(":");
        printBody(stmt.body());
        return null;
    }

    @Override
    public Void visitIf(Statement.If stmt) {
        printer.print("if ", stmt.loc());
        printExpression(stmt.test());
        printer.print(":");
        printBlock(stmt.body(), false);
        printElse(stmt.orElse());
        return null;
    }

    @Override
    public Void visitFor(Statement.For stmt) {
        printLoop("for ", stmt.target(), stmt.iterator(), stmt.body(), stmt.orElse(), stmt.loc());
        return null;
    }

    @Override
    public Void visitAsyncFor(Statement.AsyncFor stmt) {
        printLoop("async for ", stmt.target(), stmt.iterator(), stmt.body(), stmt.orElse(), stmt.loc());
        return null;
    }

    @Override
    public Void visitWhile(Statement.While stmt) {
        printer.print("while ", stmt.loc());
        printExpression(stmt.test());
        printer.print(":");
        printBody(stmt.body());
        printLoopElse(stmt.orElse());
        return null;
    }

    @Override
    public Void visitTry(Statement.Try stmt) {
        printer.print("try:", stmt.loc());
        printBlock(stmt.body(), false);

        for (var handler : stmt.handlers()) {
            printHandler(handler);
        }
        if (!stmt.orElse().isEmpty()) {
            printer.print("else:");
            printBlock(stmt.orElse(), false);
        }
        if (!stmt.finalBody().isEmpty()) {
            printer.print("finally:");
            printBlock(stmt.finalBody(), false);
        }
        return null;
    }

    @Override
    public Void visitImport(Statement.Import stmt) {
        if (stmt.names().isEmpty()) {
            return null;
        }
        printer.print("import ", stmt.loc());
        printAliases(stmt.names());
        return null;
    }

    @Override
    public Void visitImportFrom(Statement.ImportFrom stmt) {
        var path = ".".repeat(stmt.level()) + stmt.module().orElse("");

        printer.print("from ", stmt.loc());
        printer.print(printer.makeImportPath(path.isEmpty() ? "." : path));
        printer.print(" import ");
        if (!stmt.names().isEmpty()) {
            printAliases(stmt.names());
        }
        return null;
    }

    @Override
    public Void visitAssign(Statement.Assign stmt) {
        printer.addLocation(stmt.loc());
        for (var target : stmt.targets()) {
            printExpression(target);
            printer.print(" = ");
        }
        printExpression(stmt.value());
        return null;
    }

    @Override
    public Void visitReturn(Statement.Return stmt) {
        printer.print("return", stmt.loc());
        stmt.value().ifPresent(value -> {
            printer.print(" ");
            printExpression(value);
        });
        return null;
    }

    @Override
    public Void visitRaise(Statement.Raise stmt) {
        printer.print("raise", stmt.loc());
        stmt.exception().ifPresent(exception -> {
            printer.print(" ");
            printExpression(exception);
            stmt.cause().ifPresent(cause -> {
                printer.print(" from ");
                printExpression(cause);
            });
        });
        return null;
    }

    @Override
    public Void visitExpr(Statement.ExprStatement stmt) {
        printer.addLocation(stmt.loc());
        printExpression(stmt.value());
        return null;
    }

    @Override
    public Void visitPass(Statement.Pass stmt) {
        printer.print("pass", stmt.loc());
        return null;
    }

    @Override
    public Void visitBreak(Statement.Break stmt) {
        printer.print("break", stmt.loc());
        return null;
    }

    @Override
    public Void visitContinue(Statement.Continue stmt) {
        printer.print("continue", stmt.loc());
        return null;
    }

    @Override
    public Void visitGlobal(Statement.Global stmt) {
        if (stmt.names().isEmpty()) {
            return null;
        }
        printer.print("global ", stmt.loc());
        printer.print(String.join(", ", stmt.names()));
        return null;
    }

    @Override
    public Void visitNonLocal(Statement.NonLocal stmt) {
        if (stmt.names().isEmpty()) {
            return null;
        }
        printer.print("nonlocal ", stmt.loc());
        printer.print(String.join(", ", stmt.names()));
        return null;
    }

    // === Expressions ===

    @Override
    public Void visitName(Expression.Name expr) {
        printer.print(expr.id(), expr.loc());
        return null;
    }

    @Override
    public Void visitConstant(Expression.Constant expr) {
        printer.print(renderConstant(expr.value()), expr.loc());
        return null;
    }

    @Override
    public Void visitCall(Expression.Call expr) {
        printer.addLocation(expr.loc());
        printPrimary(expr.func());
        printer.print("(");
        printCommaSeparated(expr.args());
        if (!expr.args().isEmpty() && !expr.keywords().isEmpty()) {
            printer.print(", ");
        }
        printList(expr.keywords(), (p, kw) -> printKeyword(kw));
        printer.print(")");
        return null;
    }

    @Override
    public Void visitAttribute(Expression.Attribute expr) {
        printer.addLocation(expr.loc());
        printPrimary(expr.value());
        printer.print(".");
        printer.print(expr.attr());
        return null;
    }

    @Override
    public Void visitSubscript(Expression.Subscript expr) {
        printer.addLocation(expr.loc());
        printPrimary(expr.value());
        printer.print("[");
        printExpression(expr.slice());
        printer.print("]");
        return null;
    }

    @Override
    public Void visitBinOp(Expression.BinOp expr) {
        printer.addLocation(expr.loc());
        printOperand(expr.left());
        printer.print(expr.op().text());
        printOperand(expr.right());
        return null;
    }

    @Override
    public Void visitUnaryOp(Expression.UnaryOp expr) {
        printer.print(expr.op().text(), expr.loc());
        printOperand(expr.operand());
        return null;
    }

    @Override
    public Void visitBoolOp(Expression.BoolOp expr) {
        printer.addLocation(expr.loc());
        var values = expr.values();
        for (int i = 0; i < values.size(); i++) {
            printOperand(values.get(i));
            if (i < values.size() - 1) {
                printer.print(expr.op().text());
            }
        }
        return null;
    }

    @Override
    public Void visitCompare(Expression.Compare expr) {
        printer.addLocation(expr.loc());
        printOperand(expr.left());
        for (int i = 0; i < expr.ops().size(); i++) {
            printer.print(expr.ops().get(i).text());
            printOperand(expr.comparators().get(i));
        }
        return null;
    }

    @Override
    public Void visitIfExp(Expression.IfExp expr) {
        printer.addLocation(expr.loc());
        printOperand(expr.body());
        printer.print(" if ");
        printWithParens(expr.test());
        printer.print(" else ");
        printWithParens(expr.orElse());
        return null;
    }

    @Override
    public Void visitLambda(Expression.Lambda expr) {
        printer.print("lambda", expr.loc());
        if (!expr.args().isEmpty()) {
            printer.print(" ");
            printArguments(expr.args());
        }
        printer.print(": ");
        printExpression(expr.body());
        return null;
    }

    @Override
    public Void visitTuple(Expression.Tuple expr) {
        printer.print("(", expr.loc());
        printCommaSeparated(expr.elements());
        // (x,) is a tuple, (x) is just x
        if (expr.elements().size() == 1) {
            printer.print(",");
        }
        printer.print(")");
        return null;
    }

    @Override
    public Void visitList(Expression.ListExpr expr) {
        printer.print("[", expr.loc());
        printCommaSeparated(expr.elements());
        printer.print("]");
        return null;
    }

    @Override
    public Void visitDict(Expression.Dict expr) {
        if (expr.keys().isEmpty()) {
            printer.print("{}", expr.loc());
            return null;
        }
        printer.print("{", expr.loc());
        printer.newline();
        printer.pushIndent();

        int count = expr.keys().size();
        for (int i = 0; i < count; i++) {
            printExpression(expr.keys().get(i));
            printer.print(": ");
            printExpression(expr.values().get(i));
            if (i < count - 1) {
                printer.print(",");
                printer.newline();
            }
        }

        printer.newline();
        printer.popIndent();
        printer.print("}");
        return null;
    }

    @Override
    public Void visitSet(Expression.SetExpr expr) {
        // {} would be an empty dict
        if (expr.elements().isEmpty()) {
            printer.print("set()", expr.loc());
            return null;
        }
        printer.print("{", expr.loc());
        printCommaSeparated(expr.elements());
        printer.print("}");
        return null;
    }

    @Override
    public Void visitNamedExpr(Expression.NamedExpr expr) {
        // Bare := is a syntax error as a statement, an assigned value or a default
        printer.print("(", expr.loc());
        printExpression(expr.target());
        printer.print(" := ");
        printExpression(expr.value());
        printer.print(")");
        return null;
    }

    @Override
    public Void visitStarred(Expression.Starred expr) {
        printer.print("*", expr.loc());
        printOperand(expr.value());
        return null;
    }

    @Override
    public Void visitYield(Expression.Yield expr) {
        printer.print("yield", expr.loc());
        expr.value().ifPresent(value -> {
            printer.print(" ");
            printExpression(value);
        });
        return null;
    }

    @Override
    public Void visitYieldFrom(Expression.YieldFrom expr) {
        printer.print("yield from ", expr.loc());
        printExpression(expr.value());
        return null;
    }

    @Override
    public Void visitEmit(Expression.Emit expr) {
        printer.addLocation(expr.loc());
        EmitSubstitutor.print(printer, expr, this::printOperand);
        return null;
    }

    @Override
    public Void visitTypedLiteral(Expression.TypedLiteral expr) {
        printExpression(builder.makeTypeConst(expr.type(), expr.value(), expr.loc()));
        return null;
    }

    @Override
    public Void visitTypeTest(Expression.TypeTest expr) {
        printExpression(builder.makeTypeTest(expr.type(), expr.expr(), expr.loc()));
        return null;
    }

    @Override
    public Void visitUnsupported(Expression.Unsupported expr) {
        diagnostics.fail(Diagnostic.UNSUPPORTED_NODE,
                         "Cannot print " + expr.construct() + " expressions yet",
                         expr.loc());
        printer.print("None", expr.loc());
        return null;
    }

    // === Blocks ===

    /**
     * Print a header's body on new, indented lines. An empty body prints {@code pass}.
     *
     * @param skipNewLineAtEnd true when the caller ends the line itself
     */
    public void printBlock(List<Statement> body, boolean skipNewLineAtEnd) {
        printer.print("");
        printer.newline();
        printer.pushIndent();
        printStatements(orPass(body));
        printer.popIndent();
        if (!skipNewLineAtEnd) {
            printer.newline();
        }
    }

    private void printBody(List<Statement> body) {
        printer.newline();
        printer.pushIndent();
        printStatements(orPass(body));
        printer.popIndent();
    }

    private void printStatementSeparator() {
        if (printer.column() > 0) {
            printer.newline();
        }
    }

    private void printElse(List<Statement> orElse) {
        if (orElse.isEmpty() || isSinglePass(orElse)) {
            return;
        }
        if (orElse.size() == 1 && orElse.get(0) instanceof Statement.If elif) {
            printer.print("elif ", elif.loc());
            printExpression(elif.test());
            printer.print(":");
            printBlock(elif.body(), false);
            printElse(elif.orElse());
            return;
        }
        printer.print("else:");
        printBlock(orElse, false);
    }

    private void printLoop(String keyword,
                           Expression target,
                           Expression iterator,
                           List<Statement> body,
                           List<Statement> orElse,
                           Optional<SourceLocation> loc) {
        printer.print(keyword, loc);
        printExpression(target);
        printer.print(" in ");
        printExpression(iterator);
        printer.print(":");
        printBody(body);
        printLoopElse(orElse);
    }

    private void printLoopElse(List<Statement> orElse) {
        if (orElse.isEmpty()) {
            return;
        }
        printer.print("else:");
        printBody(orElse);
    }

    private void printHandler(ExceptHandler handler) {
        printer.print("except", handler.loc());
        handler.type().ifPresent(type -> {
            printer.print(" ");
            printExpression(type);
        });
        handler.name().ifPresent(name -> {
            printer.print(" as ");
            printer.print(name);
        });
        printer.print(":");
        printBlock(handler.body(), false);
    }

    private void printFunction(String keyword,
                               String name,
                               Arguments args,
                               List<Statement> body,
                               Optional<Expression> returns,
                               List<Expression> decorators,
                               Optional<SourceLocation> loc) {
        printDecorators(decorators);
        printer.print(keyword, loc);
        printer.print(name);
        printer.print("(");
        printArguments(args);
        printer.print(")");
        returns.ifPresent(annotation -> {
            printer.print(" -> ");
            printExpression(annotation);
        });
        printer.print(":");
        printBlock(body, true);
    }

    private void printDecorators(List<Expression> decorators) {
        for (var decorator : decorators) {
            printer.print("@");
            printExpression(decorator);
            printer.newline();
        }
    }

    // === Parameters and lists ===

    private void printArguments(Arguments arguments) {
        var parts = new ArrayList<Runnable>();

        for (var arg : arguments.posOnlyArgs()) {
            parts.add(() -> printArg(arg, Optional.empty()));
        }
        if (!arguments.posOnlyArgs().isEmpty()) {
            parts.add(() -> printer.print("/"));
        }

        var args = arguments.args();
        var defaults = arguments.defaults();
        int firstDefault = args.size() - defaults.size();
        for (int i = 0; i < args.size(); i++) {
            var arg = args.get(i);
            var defaultValue = i >= firstDefault
                               ? Optional.of(defaults.get(i - firstDefault))
                               : Optional.<Expression>empty();
            parts.add(() -> printArg(arg, defaultValue));
        }

        arguments.varArg().ifPresent(arg -> parts.add(() -> {
            printer.print("*");
            printArg(arg, Optional.empty());
        }));
        arguments.kwArg().ifPresent(arg -> parts.add(() -> {
            printer.print("**");
            printArg(arg, Optional.empty());
        }));

        printList(parts, (p, part) -> part.run());
    }

    private void printArg(Arg arg, Optional<Expression> defaultValue) {
        printer.print(arg.name());
        arg.annotation().ifPresent(annotation -> {
            printer.print(": ");
            printExpression(annotation);
        });
        defaultValue.ifPresent(value -> {
            printer.print(arg.annotation().isPresent() ? " = " : "=");
            printExpression(value);
        });
    }

    private void printKeyword(Keyword keyword) {
        printer.print(keyword.name());
        printer.print("=");
        printExpression(keyword.value());
    }

    /**
     * A single import prints bare; several are parenthesized.
     */
    private void printAliases(List<Alias> names) {
        boolean grouped = names.size() > 1;
        if (grouped) {
            printer.print("(");
        }
        printList(names, (p, alias) -> {
            printer.print(alias.name());
            alias.effectiveAlias().ifPresent(asName -> printer.print(" as " + asName));
        });
        if (grouped) {
            printer.print(")");
        }
    }

    private void printCommaSeparated(List<Expression> expressions) {
        printList(expressions, (p, expr) -> printExpression(expr));
    }

    private <T> void printList(List<T> items, BiConsumer<Printer, T> printItem) {
        for (int i = 0; i < items.size(); i++) {
            printItem.accept(printer, items.get(i));
            if (i < items.size() - 1) {
                printer.print(", ");
            }
        }
    }

    // === Parenthesization ===

    private void printWithParens(Expression expr) {
        printer.print("(");
        printExpression(expr);
        printer.print(")");
    }

    /**
     * Callee of a call, or receiver of an attribute or subscript.
     */
    private void printPrimary(Expression expr) {
        if (expr instanceof Expression.Name
            || expr instanceof Expression.Attribute
            || expr instanceof Expression.Call
            || expr instanceof Expression.Subscript) {
            printExpression(expr);
        } else {
            printWithParens(expr);
        }
    }

    private static boolean isBareOperand(Expression expr) {
        if (expr instanceof Expression.Name) {
            return true;
        }
        if (expr instanceof Expression.Constant constant) {
            return !isNegativeNumber(constant.value());
        }
        return false;
    }

    private static boolean isNegativeNumber(ConstantValue value) {
        if (value instanceof ConstantValue.NumberValue number) {
            var text = renderConstant(number);
            return text.startsWith("-");
        }
        return false;
    }

    private static boolean isSinglePass(List<Statement> statements) {
        return statements.size() == 1 && statements.get(0) instanceof Statement.Pass;
    }

    private static List<Statement> orPass(List<Statement> body) {
        return body.isEmpty() ? List.of(Statement.PASS) : body;
    }

    // === Literals ===

    static String renderConstant(ConstantValue value) {
        if (value instanceof ConstantValue.BoolValue bool) {
            return bool.value() ? "True" : "False";
        }
        if (value instanceof ConstantValue.StringValue string) {
            return StringLiterals.quote(string.value());
        }
        if (value instanceof ConstantValue.NumberValue number) {
            return renderNumber(number.value());
        }
        return "None";
    }

    private static String renderNumber(Number number) {
        if (number instanceof Double || number instanceof Float) {
            double d = number.doubleValue();
            if (Double.isNaN(d)) {
                return "float(\"nan\")";
            }
            if (Double.isInfinite(d)) {
                return d > 0 ? "float(\"inf\")" : "-float(\"inf\")";
            }
        }
        return number.toString();
    }
}
