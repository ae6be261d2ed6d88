package org.pragmatica.pyprinter.builder;

import org.pragmatica.pyprinter.tree.Expression;

/**
 * References into the runtime library that emitted code calls.
 * The library itself is provided separately.
 */
public final class CoreLib {

    public static final String LONG = "Long";
    public static final String BIG_INT = "BigInt";
    public static final String UTIL = "Util";
    public static final String MATH = "Math";

    /**
     * Export holding a module's class, used for {@code isinstance} checks.
     */
    public static final String DEFAULT_EXPORT = "default";

    private CoreLib() {}

    public static Expression ref(String module, String member) {
        return Expression.attribute(Expression.name(module), member);
    }

    public static Expression longFromBits() {
        return ref(LONG, "fromBits");
    }

    public static Expression float32Round() {
        return ref(MATH, "fround");
    }

    public static Expression typeOf() {
        return ref(UTIL, "typeOf");
    }

    public static Expression isArray() {
        return ref(UTIL, "isArray");
    }

    public static Expression classOf(String module) {
        return ref(module, DEFAULT_EXPORT);
    }

    public static Expression regexClass() {
        return ref("re", "Pattern");
    }
}
