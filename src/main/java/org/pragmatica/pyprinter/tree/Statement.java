package org.pragmatica.pyprinter.tree;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Statement nodes of the target AST. Closed variant set, consumed through {@link Visitor}.
 */
public sealed interface Statement {

    Optional<SourceLocation> loc();

    <R> R accept(Visitor<R> visitor);

    interface Visitor<R> {
        R visitFunctionDef(FunctionDef stmt);

        R visitAsyncFunctionDef(AsyncFunctionDef stmt);

        R visitClassDef(ClassDef stmt);

        R visitIf(If stmt);

        R visitFor(For stmt);

        R visitAsyncFor(AsyncFor stmt);

        R visitWhile(While stmt);

        R visitTry(Try stmt);

        R visitImport(Import stmt);

        R visitImportFrom(ImportFrom stmt);

        R visitAssign(Assign stmt);

        R visitReturn(Return stmt);

        R visitRaise(Raise stmt);

        R visitExpr(ExprStatement stmt);

        R visitPass(Pass stmt);

        R visitBreak(Break stmt);

        R visitContinue(Continue stmt);

        R visitGlobal(Global stmt);

        R visitNonLocal(NonLocal stmt);
    }

    // === Definitions ===

    record FunctionDef(
        String name,
        Arguments args,
        List<Statement> body,
        List<Expression> decorators,
        Optional<Expression> returns,
        Optional<SourceLocation> loc
    ) implements Statement {
        public FunctionDef {
            body = List.copyOf(body);
            decorators = List.copyOf(decorators);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitFunctionDef(this);
        }
    }

    record AsyncFunctionDef(
        String name,
        Arguments args,
        List<Statement> body,
        List<Expression> decorators,
        Optional<Expression> returns,
        Optional<SourceLocation> loc
    ) implements Statement {
        public AsyncFunctionDef {
            body = List.copyOf(body);
            decorators = List.copyOf(decorators);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitAsyncFunctionDef(this);
        }
    }

    record ClassDef(
        String name,
        List<Expression> bases,
        List<Statement> body,
        List<Expression> decorators,
        Optional<SourceLocation> loc
    ) implements Statement {
        public ClassDef {
            bases = List.copyOf(bases);
            body = List.copyOf(body);
            decorators = List.copyOf(decorators);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitClassDef(this);
        }
    }

    // === Control flow ===

    /**
     * {@code if}; an else branch holding exactly one {@code If} prints as {@code elif}.
     */
    record If(Expression test, List<Statement> body, List<Statement> orElse, Optional<SourceLocation> loc) implements Statement {
        public If {
            body = List.copyOf(body);
            orElse = List.copyOf(orElse);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitIf(this);
        }
    }

    record For(
        Expression target,
        Expression iterator,
        List<Statement> body,
        List<Statement> orElse,
        Optional<SourceLocation> loc
    ) implements Statement {
        public For {
            body = List.copyOf(body);
            orElse = List.copyOf(orElse);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitFor(this);
        }
    }

    record AsyncFor(
        Expression target,
        Expression iterator,
        List<Statement> body,
        List<Statement> orElse,
        Optional<SourceLocation> loc
    ) implements Statement {
        public AsyncFor {
            body = List.copyOf(body);
            orElse = List.copyOf(orElse);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitAsyncFor(this);
        }
    }

    record While(Expression test, List<Statement> body, List<Statement> orElse, Optional<SourceLocation> loc) implements Statement {
        public While {
            body = List.copyOf(body);
            orElse = List.copyOf(orElse);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitWhile(this);
        }
    }

    record Try(
        List<Statement> body,
        List<ExceptHandler> handlers,
        List<Statement> orElse,
        List<Statement> finalBody,
        Optional<SourceLocation> loc
    ) implements Statement {
        public Try {
            body = List.copyOf(body);
            handlers = List.copyOf(handlers);
            orElse = List.copyOf(orElse);
            finalBody = List.copyOf(finalBody);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitTry(this);
        }
    }

    // === Imports ===

    record Import(List<Alias> names, Optional<SourceLocation> loc) implements Statement {
        public Import {
            names = List.copyOf(names);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitImport(this);
        }
    }

    /**
     * {@code from module import names}; {@code level} counts leading dots of a relative import.
     */
    record ImportFrom(Optional<String> module, List<Alias> names, int level, Optional<SourceLocation> loc) implements Statement {
        public ImportFrom {
            names = List.copyOf(names);
            if (level < 0) {
                throw new IllegalArgumentException("Negative import level: " + level);
            }
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitImportFrom(this);
        }
    }

    // === Simple statements ===

    record Assign(List<Expression> targets, Expression value, Optional<SourceLocation> loc) implements Statement {
        public Assign {
            targets = List.copyOf(targets);
            if (targets.isEmpty()) {
                throw new IllegalArgumentException("Assignment needs at least one target");
            }
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitAssign(this);
        }
    }

    record Return(Optional<Expression> value, Optional<SourceLocation> loc) implements Statement {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitReturn(this);
        }
    }

    record Raise(Optional<Expression> exception, Optional<Expression> cause, Optional<SourceLocation> loc) implements Statement {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitRaise(this);
        }
    }

    /**
     * Expression evaluated for its side effects.
     */
    record ExprStatement(Expression value, Optional<SourceLocation> loc) implements Statement {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitExpr(this);
        }
    }

    record Pass(Optional<SourceLocation> loc) implements Statement {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitPass(this);
        }
    }

    record Break(Optional<SourceLocation> loc) implements Statement {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitBreak(this);
        }
    }

    record Continue(Optional<SourceLocation> loc) implements Statement {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitContinue(this);
        }
    }

    record Global(List<String> names, Optional<SourceLocation> loc) implements Statement {
        public Global {
            names = List.copyOf(names);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitGlobal(this);
        }
    }

    record NonLocal(List<String> names, Optional<SourceLocation> loc) implements Statement {
        public NonLocal {
            names = List.copyOf(names);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitNonLocal(this);
        }
    }

    // === Factories ===

    Pass PASS = new Pass(Optional.empty());

    static boolean isImport(Statement stmt) {
        return stmt instanceof Import || stmt instanceof ImportFrom;
    }

    static ExprStatement expr(Expression value) {
        return new ExprStatement(value, Optional.empty());
    }

    static Assign assign(Expression target, Expression value) {
        return new Assign(List.of(target), value, Optional.empty());
    }

    static Return returnValue(Expression value) {
        return new Return(Optional.of(value), Optional.empty());
    }

    static If ifElse(Expression test, List<Statement> body, List<Statement> orElse) {
        return new If(test, body, orElse, Optional.empty());
    }

    static FunctionDef function(String name, Arguments args, List<Statement> body) {
        return new FunctionDef(name, args, body, List.of(), Optional.empty(), Optional.empty());
    }

    static Import importNames(String... names) {
        return new Import(Arrays.stream(names).map(Alias::of).toList(), Optional.empty());
    }

    static ImportFrom importFrom(String module, String... names) {
        return new ImportFrom(Optional.of(module), Arrays.stream(names).map(Alias::of).toList(), 0, Optional.empty());
    }
}
