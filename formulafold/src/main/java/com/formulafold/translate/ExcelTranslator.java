// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package com.formulafold.translate;

/**
 * Renders formulas in Excel's own syntax with spaced operators and parentheses, either annotated
 * with comments or plain. Since nothing but spacing and comments is added, reversal is the identity.
 */
public class ExcelTranslator extends AbstractTranslator {

    private final boolean annotated;

    private ExcelTranslator(boolean annotated) {
        super(4);
        this.annotated = annotated;
    }

    /** Returns a translator which adds a header and function comments */
    public static ExcelTranslator annotated() { return new ExcelTranslator(true); }

    /** Returns a translator which adds indentation and spacing only */
    public static ExcelTranslator plain() { return new ExcelTranslator(false); }

    @Override
    public String languageName() { return annotated ? "Excel (annotated)" : "Excel (plain)"; }

    @Override
    public String fileExtension() { return ".txt"; }

    @Override
    public String headerComment() {
        return annotated ? "// Excel Formula (annotated Excel syntax)" : "";
    }

    @Override
    public boolean emitsComments() { return annotated; }

    @Override
    public String commentMarker() { return "//"; }

    @Override
    public String formatCellRef(String cellRef) { return cellRef; }

    @Override
    public String formatOperator(String operator) { return " " + operator + " "; }

    @Override
    public String formatPunctuation(String punctuation) {
        return switch (punctuation) {
            case "(" -> "( ";
            case ")" -> " )";
            default -> punctuation;
        };
    }

    @Override
    public String reverseCellRef(String text) { return text; }

    @Override
    public String reverseOperator(String text) { return text; }

}
