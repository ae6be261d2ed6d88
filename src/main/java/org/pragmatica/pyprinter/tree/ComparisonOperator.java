package org.pragmatica.pyprinter.tree;

public enum ComparisonOperator {
    EQ(" == "),
    NOT_EQ(" != "),
    LT(" < "),
    LT_E(" <= "),
    GT(" > "),
    GT_E(" >= "),
    IS(" is "),
    IS_NOT(" is not "),
    IN(" in "),
    NOT_IN(" not in ");

    private final String text;

    ComparisonOperator(String text) {
        this.text = text;
    }

    public String text() {
        return text;
    }
}
