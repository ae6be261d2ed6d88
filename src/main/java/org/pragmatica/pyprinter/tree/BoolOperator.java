package org.pragmatica.pyprinter.tree;

public enum BoolOperator {
    AND(" and "),
    OR(" or ");

    private final String text;

    BoolOperator(String text) {
        this.text = text;
    }

    public String text() {
        return text;
    }
}
