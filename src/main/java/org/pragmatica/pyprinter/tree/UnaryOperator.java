package org.pragmatica.pyprinter.tree;

public enum UnaryOperator {
    INVERT("~"),
    NOT("not "),
    UADD("+"),
    USUB("-");

    private final String text;

    UnaryOperator(String text) {
        this.text = text;
    }

    public String text() {
        return text;
    }
}
