package org.pragmatica.pyprinter.tree;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Expression nodes of the target AST.
 *
 * <p>The variant set is closed. Consumers implement {@link Visitor}, so a new variant
 * fails compilation everywhere it is not handled.
 */
public sealed interface Expression {

    /**
     * Original source range, if the front end supplied one.
     */
    Optional<SourceLocation> loc();

    <R> R accept(Visitor<R> visitor);

    interface Visitor<R> {
        R visitName(Name expr);

        R visitConstant(Constant expr);

        R visitCall(Call expr);

        R visitAttribute(Attribute expr);

        R visitSubscript(Subscript expr);

        R visitBinOp(BinOp expr);

        R visitUnaryOp(UnaryOp expr);

        R visitBoolOp(BoolOp expr);

        R visitCompare(Compare expr);

        R visitIfExp(IfExp expr);

        R visitLambda(Lambda expr);

        R visitTuple(Tuple expr);

        R visitList(ListExpr expr);

        R visitDict(Dict expr);

        R visitSet(SetExpr expr);

        R visitNamedExpr(NamedExpr expr);

        R visitStarred(Starred expr);

        R visitYield(Yield expr);

        R visitYieldFrom(YieldFrom expr);

        R visitEmit(Emit expr);

        R visitTypedLiteral(TypedLiteral expr);

        R visitTypeTest(TypeTest expr);

        R visitUnsupported(Unsupported expr);
    }

    // === Atoms ===

    /**
     * Identifier reference. The identifier is already valid in the target language.
     */
    record Name(String id, Optional<SourceLocation> loc) implements Expression {
        public Name {
            if (id == null || id.isEmpty()) {
                throw new IllegalArgumentException("Identifier must not be empty");
            }
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitName(this);
        }
    }

    record Constant(ConstantValue value, Optional<SourceLocation> loc) implements Expression {
        public Constant {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitConstant(this);
        }
    }

    // === Access and application ===

    record Call(Expression func, List<Expression> args, List<Keyword> keywords, Optional<SourceLocation> loc) implements Expression {
        public Call {
            args = List.copyOf(args);
            keywords = List.copyOf(keywords);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitCall(this);
        }
    }

    record Attribute(Expression value, String attr, Optional<SourceLocation> loc) implements Expression {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitAttribute(this);
        }
    }

    record Subscript(Expression value, Expression slice, Optional<SourceLocation> loc) implements Expression {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitSubscript(this);
        }
    }

    // === Operations ===

    record BinOp(Expression left, BinaryOperator op, Expression right, Optional<SourceLocation> loc) implements Expression {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitBinOp(this);
        }
    }

    record UnaryOp(UnaryOperator op, Expression operand, Optional<SourceLocation> loc) implements Expression {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitUnaryOp(this);
        }
    }

    /**
     * {@code a and b and c}: one operator applied between every pair of values.
     */
    record BoolOp(BoolOperator op, List<Expression> values, Optional<SourceLocation> loc) implements Expression {
        public BoolOp {
            values = List.copyOf(values);
            if (values.size() < 2) {
                throw new IllegalArgumentException("Boolean operation needs at least two values");
            }
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitBoolOp(this);
        }
    }

    /**
     * Chained comparison {@code left op1 c1 op2 c2 ...}.
     */
    record Compare(Expression left,
                   List<ComparisonOperator> ops,
                   List<Expression> comparators,
                   Optional<SourceLocation> loc) implements Expression {
        public Compare {
            ops = List.copyOf(ops);
            comparators = List.copyOf(comparators);
            if (ops.isEmpty() || ops.size() != comparators.size()) {
                throw new IllegalArgumentException("Comparison needs one comparator per operator");
            }
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitCompare(this);
        }
    }

    /**
     * {@code body if test else orElse}
     */
    record IfExp(Expression test, Expression body, Expression orElse, Optional<SourceLocation> loc) implements Expression {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitIfExp(this);
        }
    }

    record Lambda(Arguments args, Expression body, Optional<SourceLocation> loc) implements Expression {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitLambda(this);
        }
    }

    /**
     * Assignment expression {@code target := value}.
     */
    record NamedExpr(Expression target, Expression value, Optional<SourceLocation> loc) implements Expression {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitNamedExpr(this);
        }
    }

    // === Collections ===

    record Tuple(List<Expression> elements, Optional<SourceLocation> loc) implements Expression {
        public Tuple {
            elements = List.copyOf(elements);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitTuple(this);
        }
    }

    record ListExpr(List<Expression> elements, Optional<SourceLocation> loc) implements Expression {
        public ListExpr {
            elements = List.copyOf(elements);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitList(this);
        }
    }

    /**
     * Dictionary display; {@code keys} and {@code values} pair up by index.
     */
    record Dict(List<Expression> keys, List<Expression> values, Optional<SourceLocation> loc) implements Expression {
        public Dict {
            keys = List.copyOf(keys);
            values = List.copyOf(values);
            if (keys.size() != values.size()) {
                throw new IllegalArgumentException("Dictionary has " + keys.size() + " keys but " + values.size() + " values");
            }
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitDict(this);
        }
    }

    record SetExpr(List<Expression> elements, Optional<SourceLocation> loc) implements Expression {
        public SetExpr {
            elements = List.copyOf(elements);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitSet(this);
        }
    }

    record Starred(Expression value, Optional<SourceLocation> loc) implements Expression {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitStarred(this);
        }
    }

    // === Generators ===

    record Yield(Optional<Expression> value, Optional<SourceLocation> loc) implements Expression {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitYield(this);
        }
    }

    record YieldFrom(Expression value, Optional<SourceLocation> loc) implements Expression {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitYieldFrom(this);
        }
    }

    // === Escape hatches ===

    /**
     * Raw target-language template with {@code $0}, {@code $1}... placeholders for {@code args}.
     */
    record Emit(String template, List<Expression> args, Optional<SourceLocation> loc) implements Expression {
        public Emit {
            Objects.requireNonNull(template, "template");
            args = List.copyOf(args);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitEmit(this);
        }
    }

    // === Type-directed nodes, expanded while printing ===

    /**
     * A literal value whose target rendering depends on its semantic type (64-bit integers,
     * decimals, single-precision floats, enums, raw numeric buffers).
     */
    record TypedLiteral(Type type, Object value, Optional<SourceLocation> loc) implements Expression {
        public TypedLiteral {
            Objects.requireNonNull(type, "type");
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitTypedLiteral(this);
        }
    }

    /**
     * Runtime check that {@code expr} holds a value of {@code type}.
     */
    record TypeTest(Expression expr, Type type, Optional<SourceLocation> loc) implements Expression {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitTypeTest(this);
        }
    }

    /**
     * A construct the front end produced but this back end does not render yet (e.g. formatted values).
     */
    record Unsupported(String construct, Optional<SourceLocation> loc) implements Expression {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitUnsupported(this);
        }
    }

    // === Factories ===

    static Name name(String id) {
        return new Name(id, Optional.empty());
    }

    static Name name(String id, SourceLocation loc) {
        return new Name(id, Optional.of(loc));
    }

    static Constant constant(boolean value) {
        return new Constant(new ConstantValue.BoolValue(value), Optional.empty());
    }

    static Constant constant(String value) {
        return new Constant(new ConstantValue.StringValue(value), Optional.empty());
    }

    static Constant constant(int value) {
        return new Constant(new ConstantValue.NumberValue(value, NumberKind.INT32), Optional.empty());
    }

    static Constant constant(double value) {
        return new Constant(new ConstantValue.NumberValue(value, NumberKind.FLOAT64), Optional.empty());
    }

    static Constant number(Number value, NumberKind kind) {
        return new Constant(new ConstantValue.NumberValue(value, kind), Optional.empty());
    }

    static Constant none() {
        return new Constant(ConstantValue.NONE, Optional.empty());
    }

    static Call call(Expression func, Expression... args) {
        return new Call(func, List.of(args), List.of(), Optional.empty());
    }

    static Attribute attribute(Expression value, String attr) {
        return new Attribute(value, attr, Optional.empty());
    }

    static BinOp binOp(Expression left, BinaryOperator op, Expression right) {
        return new BinOp(left, op, right, Optional.empty());
    }

    static Compare compare(Expression left, ComparisonOperator op, Expression right) {
        return new Compare(left, List.of(op), List.of(right), Optional.empty());
    }

    static Tuple tuple(Expression... elements) {
        return new Tuple(List.of(elements), Optional.empty());
    }

    static TypedLiteral typed(Type type, Object value) {
        return new TypedLiteral(type, value, Optional.empty());
    }

    static TypeTest typeTest(Expression expr, Type type) {
        return new TypeTest(expr, type, Optional.empty());
    }

    static Emit emit(String template, Expression... args) {
        return new Emit(template, List.of(args), Optional.empty());
    }
}
