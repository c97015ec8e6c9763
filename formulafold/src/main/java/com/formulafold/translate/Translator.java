// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package com.formulafold.translate;

/**
 * The rendering rules of one target notation for folded formulas, and the rules reversing them.
 * <p>
 * A translator is stateless. Every reverse operation undoes exactly the corresponding forward operation,
 * so that for every token kind X and legal value v, reverseX(formatX(v)) is v. The reverse operations
 * work on a whole flattened folded text rather than on single values, and never change the content
 * of Excel string literals except where this translator itself rendered a string differently.
 */
public interface Translator {

    /** The name of the notation, for display */
    String languageName();

    /** The file extension an editor should use to highlight this notation, including the dot */
    String fileExtension();

    /** The first line of a folded formula, or an empty string if this emits no header */
    String headerComment();

    /** Returns the given text as a comment line, or an empty string if this emits no comments */
    String sectionComment(String comment);

    /** Returns the descriptive comment text for a function, or an empty string if there is none */
    String functionComment(String functionName);

    /** Returns whether this emits any comments */
    boolean emitsComments();

    /** The marker starting a comment in this notation, which is stripped when unfolding */
    String commentMarker();

    /** Returns the indentation of a line at the given depth */
    String indent(int depth);

    /** Returns the text separating arguments rendered on the same line */
    String separator();

    String formatFunction(String functionName);

    String formatCellRef(String cellRef);

    /** Formats a string literal, given with its quotes */
    String formatString(String stringLiteral);

    String formatNumber(String number);

    String formatOperator(String operator);

    String formatPunctuation(String punctuation);

    String formatIdentifier(String identifier);

    /** Returns the given flattened text with the cell references rendered by this converted back to Excel */
    String reverseCellRef(String text);

    /** Returns the given flattened text with the operators rendered by this converted back to Excel */
    String reverseOperator(String text);

    /**
     * Applies any remaining reversal to a flattened text whose cell references and operators are already
     * reversed, such as converting function names back to Excel names.
     */
    String reverseLine(String text);

}
