package org.pragmatica.pyprinter.builder;

import org.pragmatica.pyprinter.error.Diagnostic;
import org.pragmatica.pyprinter.error.Diagnostics;
import org.pragmatica.pyprinter.tree.ComparisonOperator;
import org.pragmatica.pyprinter.tree.ConstantValue;
import org.pragmatica.pyprinter.tree.Expression;
import org.pragmatica.pyprinter.tree.ExtendedNumberKind;
import org.pragmatica.pyprinter.tree.NumberKind;
import org.pragmatica.pyprinter.tree.SourceLocation;
import org.pragmatica.pyprinter.tree.Type;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Builds target expressions from semantic types: typed literals and runtime type tests.
 *
 * <p>Covers what the target cannot say natively. 64-bit integers become two 32-bit limbs,
 * decimals lose precision to doubles, single-precision floats are rounded at runtime.
 * Every failure is reported to the {@link Diagnostics} collector and replaced by {@code None}.
 */
public final class ExpressionBuilder {

    private static final long LIMB_MASK = 0xFFFF_FFFFL;
    private static final BigInteger UINT64_MAX = BigInteger.ONE.shiftLeft(64).subtract(BigInteger.ONE);

    private final Diagnostics diagnostics;

    private ExpressionBuilder(Diagnostics diagnostics) {
        this.diagnostics = diagnostics;
    }

    public static ExpressionBuilder create(Diagnostics diagnostics) {
        return new ExpressionBuilder(diagnostics);
    }

    // === Literals ===

    /**
     * Build the expression for a literal {@code value} of semantic type {@code type}.
     *
     * @throws org.pragmatica.pyprinter.error.TranslationException if the pairing is unrecognized
     *         and the failure policy is {@code ABORT}
     */
    public Expression makeTypeConst(Type type, Object value, Optional<SourceLocation> loc) {
        return tryTypeConst(type, value, loc)
            .orElseGet(() -> {
                diagnostics.fail(Diagnostic.UNRECOGNIZED_LITERAL,
                                 "Unexpected type " + type + ", literal " + describe(value),
                                 loc);
                return none(loc);
            });
    }

    private Optional<Expression> tryTypeConst(Type type, Object value, Optional<SourceLocation> loc) {
        if (type instanceof Type.ExtendedNumber extended) {
            return extendedConst(extended.kind(), value, loc);
        }
        if (type instanceof Type.Number number) {
            return numberConst(number.kind(), value, loc);
        }
        if (type instanceof Type.BooleanType && value instanceof Boolean bool) {
            return Optional.of(constant(new ConstantValue.BoolValue(bool), loc));
        }
        if (type instanceof Type.StringType && value instanceof String string) {
            return Optional.of(constant(new ConstantValue.StringValue(string), loc));
        }
        if (type instanceof Type.CharType && value instanceof Character ch) {
            return Optional.of(constant(new ConstantValue.StringValue(String.valueOf(ch)), loc));
        }
        if (type instanceof Type.EnumType enumType) {
            return enumConst(enumType, value, loc);
        }
        if (type instanceof Type.Unit) {
            return Optional.of(none(loc));
        }
        if (type instanceof Type.ArrayType array && array.element() instanceof Type.Number element) {
            return bufferConst(element.kind(), value, loc);
        }
        return Optional.empty();
    }

    private Optional<Expression> extendedConst(ExtendedNumberKind kind, Object value, Optional<SourceLocation> loc) {
        switch (kind) {
            case INT64:
                if (value instanceof Long l) {
                    return Optional.of(makeLongInt(l, false, loc));
                }
                return Optional.empty();
            case UINT64:
                if (value instanceof Long l) {
                    return Optional.of(makeLongInt(l, true, loc));
                }
                if (value instanceof BigInteger big && big.signum() >= 0 && big.compareTo(UINT64_MAX) <= 0) {
                    return Optional.of(makeLongInt(big.longValue(), true, loc));
                }
                return Optional.empty();
            case DECIMAL:
                // Precision loss is accepted: the target has no decimal literal
                if (value instanceof BigDecimal decimal) {
                    return Optional.of(number(decimal.doubleValue(), NumberKind.FLOAT64, loc));
                }
                return Optional.empty();
            case BIG_INT:
            default:
                return Optional.empty();
        }
    }

    private Optional<Expression> numberConst(NumberKind kind, Object value, Optional<SourceLocation> loc) {
        switch (kind) {
            case INT8:
                return value instanceof Byte b
                       ? Optional.of(number(b.intValue(), kind, loc))
                       : Optional.empty();
            case UINT8:
                return unsigned(value, 0xFFL, kind, loc);
            case INT16:
                return value instanceof Short s
                       ? Optional.of(number(s.intValue(), kind, loc))
                       : Optional.empty();
            case UINT16:
                if (value instanceof Character ch) {
                    return Optional.of(number((int) ch, kind, loc));
                }
                return unsigned(value, 0xFFFFL, kind, loc);
            case INT32:
                return value instanceof Integer i
                       ? Optional.of(number(i, kind, loc))
                       : Optional.empty();
            case UINT32:
                return unsigned(value, LIMB_MASK, kind, loc);
            case FLOAT32:
                return value instanceof Float f
                       ? Optional.of(makeFloat32(f, loc))
                       : Optional.empty();
            case FLOAT64:
                return value instanceof Double d
                       ? Optional.of(number(d, kind, loc))
                       : Optional.empty();
            default:
                return Optional.empty();
        }
    }

    /**
     * Unsigned kinds take either the same-width signed box (reinterpreted) or a wider box within range.
     */
    private Optional<Expression> unsigned(Object value, long max, NumberKind kind, Optional<SourceLocation> loc) {
        if (!(value instanceof Byte || value instanceof Short || value instanceof Integer || value instanceof Long)) {
            return Optional.empty();
        }
        long raw = ((Number) value).longValue();
        long width = widthMask(value);
        if (width == max) {
            return Optional.of(number(toNumber(raw & max), kind, loc));
        }
        if (width > max && raw >= 0 && raw <= max) {
            return Optional.of(number(toNumber(raw), kind, loc));
        }
        return Optional.empty();
    }

    private Optional<Expression> enumConst(Type.EnumType enumType, Object value, Optional<SourceLocation> loc) {
        if (value instanceof Long) {
            diagnostics.fail(Diagnostic.UNRECOGNIZED_LITERAL, "int64 enums are not supported", loc);
            return Optional.of(none(loc));
        }
        if (value instanceof Byte || value instanceof Short || value instanceof Integer) {
            var tag = number(((Number) value).intValue(), NumberKind.INT32, Optional.empty());
            return Optional.of(new Expression.Call(Expression.name(enumType.name()), List.of(tag), List.of(), loc));
        }
        return Optional.empty();
    }

    /**
     * Small-element arrays arrive as raw buffers rather than array constructions.
     */
    private Optional<Expression> bufferConst(NumberKind kind, Object value, Optional<SourceLocation> loc) {
        var elements = new ArrayList<Expression>();
        if (value instanceof byte[] bytes) {
            for (byte b : bytes) {
                elements.add(number(kind.isUnsigned() ? b & 0xFF : b, kind, Optional.empty()));
            }
        } else if (value instanceof short[] shorts) {
            for (short s : shorts) {
                elements.add(number(kind.isUnsigned() ? s & 0xFFFF : s, kind, Optional.empty()));
            }
        } else if (value instanceof char[] chars) {
            for (char c : chars) {
                elements.add(number((int) c, kind, Optional.empty()));
            }
        } else {
            return Optional.empty();
        }
        return Optional.of(new Expression.ListExpr(elements, loc));
    }

    /**
     * {@code Long.fromBits(low, high, unsigned)} with both limbs as doubles.
     */
    public Expression makeLongInt(long bits, boolean unsigned, Optional<SourceLocation> loc) {
        double low = (double) (bits & LIMB_MASK);
        double high = (double) (bits >>> 32);
        var args = List.<Expression>of(number(low, NumberKind.FLOAT64, Optional.empty()),
                                       number(high, NumberKind.FLOAT64, Optional.empty()),
                                       Expression.constant(unsigned));
        return new Expression.Call(CoreLib.longFromBits(), args, List.of(), loc);
    }

    public Expression makeFloat32(float value, Optional<SourceLocation> loc) {
        var arg = number(value, NumberKind.FLOAT32, Optional.empty());
        return new Expression.Call(CoreLib.float32Round(), List.of(arg), List.of(), loc);
    }

    // === Type tests ===

    /**
     * Build a best-effort runtime check that {@code expr} is a {@code type}.
     * Records, unions, classes, options, generic parameters and erased unions cannot be tested;
     * they are reported as errors and yield {@code None}.
     */
    public Expression makeTypeTest(Type type, Expression expr, Optional<SourceLocation> loc) {
        if (type instanceof Type.Any) {
            return new Expression.Constant(new ConstantValue.BoolValue(true), loc);
        }
        if (type instanceof Type.Unit) {
            return new Expression.Compare(expr, List.of(ComparisonOperator.IS), List.of(Expression.none()), loc);
        }
        if (type instanceof Type.BooleanType) {
            return typeOf("boolean", expr, loc);
        }
        if (type instanceof Type.CharType || type instanceof Type.StringType) {
            return typeOf("string", expr, loc);
        }
        if (type instanceof Type.Regex) {
            return instanceOf(CoreLib.regexClass(), expr, loc);
        }
        if (type instanceof Type.Number || type instanceof Type.EnumType) {
            return typeOf("number", expr, loc);
        }
        if (type instanceof Type.ExtendedNumber extended) {
            switch (extended.kind()) {
                case INT64:
                case UINT64:
                    return instanceOf(CoreLib.classOf(CoreLib.LONG), expr, loc);
                case BIG_INT:
                    return instanceOf(CoreLib.classOf(CoreLib.BIG_INT), expr, loc);
                case DECIMAL:
                default:
                    return typeOf("number", expr, loc);
            }
        }
        if (type instanceof Type.FunctionType) {
            return typeOf("function", expr, loc);
        }
        if (type instanceof Type.ArrayType || type instanceof Type.TupleType || type instanceof Type.ListType) {
            return new Expression.Call(CoreLib.isArray(), List.of(expr), List.of(), loc);
        }
        if (type instanceof Type.DeclaredType declared) {
            return errorAndNone("Cannot type test records, unions or classes (" + declared.entity() + ")",
                                "match on a tag or field of " + declared.entity() + " instead",
                                loc);
        }
        return errorAndNone("Cannot type test options, generic parameters or erased unions",
                            "test the underlying value instead",
                            loc);
    }

    private Expression typeOf(String primitiveType, Expression expr, Optional<SourceLocation> loc) {
        var typeOfCall = Expression.call(CoreLib.typeOf(), expr);
        return new Expression.Compare(typeOfCall,
                                      List.of(ComparisonOperator.EQ),
                                      List.of(Expression.constant(primitiveType)),
                                      loc);
    }

    private Expression instanceOf(Expression cons, Expression expr, Optional<SourceLocation> loc) {
        return new Expression.Call(Expression.name("isinstance"), List.of(expr, cons), List.of(), loc);
    }

    private Expression errorAndNone(String message, String help, Optional<SourceLocation> loc) {
        diagnostics.report(Diagnostic.error(Diagnostic.UNSUPPORTED_TYPE_TEST, message, loc).withHelp(help));
        return none(loc);
    }

    // === Helpers ===

    private static Expression.Constant constant(ConstantValue value, Optional<SourceLocation> loc) {
        return new Expression.Constant(value, loc);
    }

    private static Expression.Constant number(Number value, NumberKind kind, Optional<SourceLocation> loc) {
        return new Expression.Constant(new ConstantValue.NumberValue(value, kind), loc);
    }

    private static Expression.Constant none(Optional<SourceLocation> loc) {
        return new Expression.Constant(ConstantValue.NONE, loc);
    }

    private static Number toNumber(long value) {
        return value <= Integer.MAX_VALUE ? Integer.valueOf((int) value) : Long.valueOf(value);
    }

    private static long widthMask(Object value) {
        if (value instanceof Byte) {
            return 0xFFL;
        }
        if (value instanceof Short) {
            return 0xFFFFL;
        }
        if (value instanceof Integer) {
            return LIMB_MASK;
        }
        return -1L >>> 1;
    }

    private static String describe(Object value) {
        if (value == null) {
            return "null";
        }
        return value + " (" + value.getClass().getSimpleName() + ")";
    }
}
