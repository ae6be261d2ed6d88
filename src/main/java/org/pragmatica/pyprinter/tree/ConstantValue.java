package org.pragmatica.pyprinter.tree;

import java.util.Objects;

/**
 * Scalar payload of a {@link Expression.Constant}.
 */
public sealed interface ConstantValue {

    record BoolValue(boolean value) implements ConstantValue {}

    record StringValue(String value) implements ConstantValue {
        public StringValue {
            Objects.requireNonNull(value, "value");
        }
    }

    /**
     * Numeric literal. The boxed value is kept as handed over, so it renders through its own {@code toString()}.
     */
    record NumberValue(Number value, NumberKind kind) implements ConstantValue {
        public NumberValue {
            Objects.requireNonNull(value, "value");
            Objects.requireNonNull(kind, "kind");
        }
    }

    /**
     * Unit / none.
     */
    record NoneValue() implements ConstantValue {}

    NoneValue NONE = new NoneValue();
}
