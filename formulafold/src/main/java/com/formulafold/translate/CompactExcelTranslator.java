// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package com.formulafold.translate;

/**
 * Renders formulas in Excel syntax with no spacing and no comments, for formulas close to
 * Excel's limit of 8192 characters. Only line breaks and a narrow indentation are added.
 */
public class CompactExcelTranslator extends AbstractTranslator {

    public CompactExcelTranslator() {
        super(2);
    }

    @Override
    public String languageName() { return "Excel (compact)"; }

    @Override
    public String fileExtension() { return ".txt"; }

    @Override
    public String headerComment() { return ""; }

    @Override
    public boolean emitsComments() { return false; }

    @Override
    public String commentMarker() { return "//"; }

    @Override
    public String separator() { return ","; }

    @Override
    public String formatCellRef(String cellRef) { return cellRef; }

    @Override
    public String formatOperator(String operator) { return operator; }

    @Override
    public String formatPunctuation(String punctuation) { return punctuation; }

    @Override
    public String reverseCellRef(String text) { return text; }

    @Override
    public String reverseOperator(String text) { return text; }

}
