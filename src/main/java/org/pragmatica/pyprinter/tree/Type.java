package org.pragmatica.pyprinter.tree;

import java.util.List;

/**
 * Semantic type of a value, as decided by the front end.
 * Drives literal construction and runtime type tests.
 */
public sealed interface Type {

    Any ANY = new Any();
    Unit UNIT = new Unit();
    BooleanType BOOLEAN = new BooleanType();
    CharType CHAR = new CharType();
    StringType STRING = new StringType();
    Regex REGEX = new Regex();

    record Any() implements Type {}

    record Unit() implements Type {}

    record BooleanType() implements Type {}

    record CharType() implements Type {}

    record StringType() implements Type {}

    record Regex() implements Type {}

    record Number(NumberKind kind) implements Type {}

    record ExtendedNumber(ExtendedNumberKind kind) implements Type {}

    /**
     * Enumeration backed by numbers of {@code kind}, declared as {@code name}.
     */
    record EnumType(NumberKind kind, String name) implements Type {}

    record FunctionType(List<Type> args, Type returnType) implements Type {
        public FunctionType {
            args = List.copyOf(args);
        }
    }

    record ArrayType(Type element) implements Type {}

    record TupleType(List<Type> elements) implements Type {
        public TupleType {
            elements = List.copyOf(elements);
        }
    }

    record ListType(Type element) implements Type {}

    record OptionType(Type element) implements Type {}

    record GenericParam(String name) implements Type {}

    record ErasedUnion(List<Type> alternatives) implements Type {
        public ErasedUnion {
            alternatives = List.copyOf(alternatives);
        }
    }

    /**
     * User-declared record, union or class.
     */
    record DeclaredType(String entity, List<Type> genericArgs) implements Type {
        public DeclaredType {
            genericArgs = List.copyOf(genericArgs);
        }
    }

    static Number number(NumberKind kind) {
        return new Number(kind);
    }

    static ExtendedNumber extended(ExtendedNumberKind kind) {
        return new ExtendedNumber(kind);
    }
}
