package org.pragmatica.pyprinter.builder;

import org.junit.jupiter.api.Test;
import org.pragmatica.pyprinter.error.Diagnostic;
import org.pragmatica.pyprinter.error.Diagnostics;
import org.pragmatica.pyprinter.error.FailurePolicy;
import org.pragmatica.pyprinter.error.TranslationException;
import org.pragmatica.pyprinter.tree.ComparisonOperator;
import org.pragmatica.pyprinter.tree.ConstantValue;
import org.pragmatica.pyprinter.tree.Expression;
import org.pragmatica.pyprinter.tree.ExtendedNumberKind;
import org.pragmatica.pyprinter.tree.NumberKind;
import org.pragmatica.pyprinter.tree.SourceLocation;
import org.pragmatica.pyprinter.tree.Type;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class ExpressionBuilderTest {

    private static final Optional<SourceLocation> NO_LOC = Optional.empty();

    private final Diagnostics diagnostics = Diagnostics.create();
    private final ExpressionBuilder builder = ExpressionBuilder.create(diagnostics);

    // === 64-bit integers ===

    @Test
    void int64_splitsIntoLowAndHighLimbs() {
        var result = builder.makeTypeConst(Type.extended(ExtendedNumberKind.INT64), 42L, NO_LOC);

        assertEquals(fromBits(42.0, 0.0, false), result);
        assertTrue(diagnostics.all().isEmpty());
    }

    @Test
    void int64_negativeValue_usesTwosComplementLimbs() {
        var result = builder.makeTypeConst(Type.extended(ExtendedNumberKind.INT64), -1L, NO_LOC);

        assertEquals(fromBits(4294967295.0, 4294967295.0, false), result);
    }

    @Test
    void int64_highBitsLandInSecondLimb() {
        var result = builder.makeLongInt((3L << 32) | 7L, false, NO_LOC);

        assertEquals(fromBits(7.0, 3.0, false), result);
    }

    @Test
    void uint64_acceptsBigIntegerUpToMax() {
        var max = BigInteger.ONE.shiftLeft(64).subtract(BigInteger.ONE);

        var result = builder.makeTypeConst(Type.extended(ExtendedNumberKind.UINT64), max, NO_LOC);

        assertEquals(fromBits(4294967295.0, 4294967295.0, true), result);
    }

    @Test
    void uint64_rejectsBigIntegerOutOfRange() {
        var tooBig = BigInteger.ONE.shiftLeft(64);

        var result = builder.makeTypeConst(Type.extended(ExtendedNumberKind.UINT64), tooBig, NO_LOC);

        assertEquals(Expression.none(), result);
        assertEquals(Diagnostic.UNRECOGNIZED_LITERAL, diagnostics.all().get(0).code());
    }

    // === Other numbers ===

    @Test
    void decimal_becomesDouble() {
        var result = builder.makeTypeConst(Type.extended(ExtendedNumberKind.DECIMAL), new BigDecimal("1.25"), NO_LOC);

        assertEquals(Expression.number(1.25, NumberKind.FLOAT64), result);
    }

    @Test
    void float32_isRoundedAtRuntime() {
        var result = builder.makeTypeConst(Type.number(NumberKind.FLOAT32), 1.5f, NO_LOC);

        var expected = Expression.call(CoreLib.float32Round(), Expression.number(1.5f, NumberKind.FLOAT32));
        assertEquals(expected, result);
    }

    @Test
    void signedKinds_takeMatchingBox() {
        assertEquals(Expression.number(-3, NumberKind.INT8),
                     builder.makeTypeConst(Type.number(NumberKind.INT8), (byte) -3, NO_LOC));
        assertEquals(Expression.number(1000, NumberKind.INT16),
                     builder.makeTypeConst(Type.number(NumberKind.INT16), (short) 1000, NO_LOC));
        assertEquals(Expression.number(7, NumberKind.INT32),
                     builder.makeTypeConst(Type.number(NumberKind.INT32), 7, NO_LOC));
        assertEquals(Expression.number(2.5, NumberKind.FLOAT64),
                     builder.makeTypeConst(Type.number(NumberKind.FLOAT64), 2.5, NO_LOC));
    }

    @Test
    void unsignedKinds_reinterpretSameWidthBox() {
        assertEquals(Expression.number(255, NumberKind.UINT8),
                     builder.makeTypeConst(Type.number(NumberKind.UINT8), (byte) -1, NO_LOC));
        assertEquals(Expression.number(65535, NumberKind.UINT16),
                     builder.makeTypeConst(Type.number(NumberKind.UINT16), (short) -1, NO_LOC));
        assertEquals(Expression.number(4294967295L, NumberKind.UINT32),
                     builder.makeTypeConst(Type.number(NumberKind.UINT32), -1, NO_LOC));
    }

    @Test
    void unsignedKinds_acceptWiderBoxInRange() {
        assertEquals(Expression.number(200, NumberKind.UINT8),
                     builder.makeTypeConst(Type.number(NumberKind.UINT8), 200, NO_LOC));
        assertEquals(Expression.number(4000000000L, NumberKind.UINT32),
                     builder.makeTypeConst(Type.number(NumberKind.UINT32), 4000000000L, NO_LOC));
        assertTrue(diagnostics.all().isEmpty());
    }

    @Test
    void unsignedKinds_rejectWiderBoxOutOfRange() {
        builder.makeTypeConst(Type.number(NumberKind.UINT8), 300, NO_LOC);

        assertEquals(1, diagnostics.errorCount());
    }

    @Test
    void mismatchedBox_isUnrecognized() {
        var result = builder.makeTypeConst(Type.number(NumberKind.INT32), 5L, NO_LOC);

        assertEquals(Expression.none(), result);
        assertThat(diagnostics.all().get(0).message()).contains("Unexpected type").contains("Long");
    }

    // === Scalars ===

    @Test
    void scalars_mapToConstants() {
        assertEquals(Expression.constant(true), builder.makeTypeConst(Type.BOOLEAN, true, NO_LOC));
        assertEquals(Expression.constant("hi"), builder.makeTypeConst(Type.STRING, "hi", NO_LOC));
        assertEquals(Expression.constant("c"), builder.makeTypeConst(Type.CHAR, 'c', NO_LOC));
        assertEquals(Expression.none(), builder.makeTypeConst(Type.UNIT, null, NO_LOC));
        assertTrue(diagnostics.all().isEmpty());
    }

    @Test
    void location_isKeptOnResult() {
        var loc = Optional.of(SourceLocation.at(3, 1));

        var result = builder.makeTypeConst(Type.STRING, "x", loc);

        assertEquals(loc, result.loc());
    }

    // === Enums and buffers ===

    @Test
    void enum_callsEnumTypeWithTag() {
        var result = builder.makeTypeConst(new Type.EnumType(NumberKind.INT32, "Color"), 2, NO_LOC);

        assertEquals(Expression.call(Expression.name("Color"), Expression.constant(2)), result);
    }

    @Test
    void enum_int64Tag_isRejected() {
        var result = builder.makeTypeConst(new Type.EnumType(NumberKind.INT32, "Color"), 2L, NO_LOC);

        assertEquals(Expression.none(), result);
        assertEquals(1, diagnostics.errorCount());
        assertThat(diagnostics.all().get(0).message()).contains("int64 enums");
    }

    @Test
    void byteBuffer_becomesListOfMaskedElements() {
        var result = builder.makeTypeConst(new Type.ArrayType(Type.number(NumberKind.UINT8)),
                                           new byte[]{-1, 2},
                                           NO_LOC);

        var expected = new Expression.ListExpr(List.of(Expression.number(255, NumberKind.UINT8),
                                                       Expression.number(2, NumberKind.UINT8)),
                                               NO_LOC);
        assertEquals(expected, result);
    }

    @Test
    void signedByteBuffer_keepsSign() {
        var result = builder.makeTypeConst(new Type.ArrayType(Type.number(NumberKind.INT8)), new byte[]{-1}, NO_LOC);

        assertEquals(new Expression.ListExpr(List.of(Expression.number(-1, NumberKind.INT8)), NO_LOC), result);
    }

    // === Failure policy ===

    @Test
    void unrecognizedPairing_underAbort_throws() {
        var aborting = ExpressionBuilder.create(Diagnostics.create(FailurePolicy.ABORT));

        var ex = assertThrows(TranslationException.class,
                              () -> aborting.makeTypeConst(Type.STRING, 42, NO_LOC));
        assertEquals(Diagnostic.UNRECOGNIZED_LITERAL, ex.diagnostic().code());
    }

    @Test
    void unsupportedTypeTest_underAbort_isStillRecoverable() {
        var aborting = Diagnostics.create(FailurePolicy.ABORT);

        var result = ExpressionBuilder.create(aborting)
                                      .makeTypeTest(new Type.OptionType(Type.STRING), Expression.name("x"), NO_LOC);

        assertEquals(Expression.none(), result);
        assertEquals(Diagnostic.UNSUPPORTED_TYPE_TEST, aborting.all().get(0).code());
    }

    // === Type tests ===

    @Test
    void typeTest_any_isAlwaysTrue() {
        assertEquals(Expression.constant(true), builder.makeTypeTest(Type.ANY, Expression.name("x"), NO_LOC));
    }

    @Test
    void typeTest_primitives_compareRuntimeTypeName() {
        var x = Expression.name("x");

        assertEquals(typeOf(x, "boolean"), builder.makeTypeTest(Type.BOOLEAN, x, NO_LOC));
        assertEquals(typeOf(x, "string"), builder.makeTypeTest(Type.CHAR, x, NO_LOC));
        assertEquals(typeOf(x, "number"), builder.makeTypeTest(Type.number(NumberKind.INT16), x, NO_LOC));
        assertEquals(typeOf(x, "number"), builder.makeTypeTest(new Type.EnumType(NumberKind.INT32, "E"), x, NO_LOC));
        assertEquals(typeOf(x, "number"), builder.makeTypeTest(Type.extended(ExtendedNumberKind.DECIMAL), x, NO_LOC));
        assertEquals(typeOf(x, "function"),
                     builder.makeTypeTest(new Type.FunctionType(List.of(Type.STRING), Type.UNIT), x, NO_LOC));
    }

    @Test
    void typeTest_classes_useIsinstance() {
        var x = Expression.name("x");

        assertEquals(isinstance(x, CoreLib.classOf(CoreLib.LONG)),
                     builder.makeTypeTest(Type.extended(ExtendedNumberKind.UINT64), x, NO_LOC));
        assertEquals(isinstance(x, CoreLib.classOf(CoreLib.BIG_INT)),
                     builder.makeTypeTest(Type.extended(ExtendedNumberKind.BIG_INT), x, NO_LOC));
        assertEquals(isinstance(x, CoreLib.regexClass()), builder.makeTypeTest(Type.REGEX, x, NO_LOC));
    }

    @Test
    void typeTest_sequences_useIsArray() {
        var x = Expression.name("x");
        var expected = Expression.call(CoreLib.isArray(), x);

        assertEquals(expected, builder.makeTypeTest(new Type.ArrayType(Type.STRING), x, NO_LOC));
        assertEquals(expected, builder.makeTypeTest(new Type.TupleType(List.of(Type.STRING)), x, NO_LOC));
        assertEquals(expected, builder.makeTypeTest(new Type.ListType(Type.STRING), x, NO_LOC));
    }

    @Test
    void typeTest_unit_isNoneCheck() {
        var x = Expression.name("x");

        assertEquals(Expression.compare(x, ComparisonOperator.IS, Expression.none()),
                     builder.makeTypeTest(Type.UNIT, x, NO_LOC));
    }

    @Test
    void typeTest_untestableTypes_reportEachFailure() {
        var x = Expression.name("x");

        builder.makeTypeTest(new Type.DeclaredType("Shape", List.of()), x, NO_LOC);
        builder.makeTypeTest(new Type.GenericParam("T"), x, NO_LOC);
        builder.makeTypeTest(new Type.ErasedUnion(List.of(Type.STRING, Type.BOOLEAN)), x, NO_LOC);

        assertEquals(3, diagnostics.errorCount());
        assertThat(diagnostics.all()).allMatch(d -> Diagnostic.UNSUPPORTED_TYPE_TEST.equals(d.code()));
    }

    @Test
    void typeTest_declaredType_suggestsAlternativeInHelpNote() {
        builder.makeTypeTest(new Type.DeclaredType("Shape", List.of()), Expression.name("x"), NO_LOC);
        builder.makeTypeTest(new Type.GenericParam("T"), Expression.name("x"), NO_LOC);

        assertThat(diagnostics.all().get(0).notes()).containsExactly("help: match on a tag or field of Shape instead");
        assertThat(diagnostics.all().get(1).notes()).containsExactly("help: test the underlying value instead");
    }

    // === Helpers ===

    private static Expression fromBits(double low, double high, boolean unsigned) {
        return Expression.call(CoreLib.longFromBits(),
                               Expression.number(low, NumberKind.FLOAT64),
                               Expression.number(high, NumberKind.FLOAT64),
                               new Expression.Constant(new ConstantValue.BoolValue(unsigned), NO_LOC));
    }

    private static Expression typeOf(Expression expr, String name) {
        return Expression.compare(Expression.call(CoreLib.typeOf(), expr), ComparisonOperator.EQ, Expression.constant(name));
    }

    private static Expression isinstance(Expression expr, Expression cls) {
        return Expression.call(Expression.name("isinstance"), expr, cls);
    }
}
