// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package com.formulafold.translate;

import com.formulafold.lexer.CellReferences;
import com.formulafold.text.ExcelText;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Renders formulas in a JavaScript-like syntax, so that editors highlight cell references as strings:
 * cell references are double-quoted and {@code <>} becomes {@code !=}.
 * <p>
 * A string literal whose content looks like a cell reference, such as "A1" in INDIRECT("A1"),
 * is rendered with single quotes to keep it apart from a quoted cell reference.
 */
public class JavaScriptTranslator extends AbstractTranslator {

    private static final Pattern singleQuotedCellReference =
            Pattern.compile("'(" + CellReferences.pattern.pattern() + ")'(?!!)");

    public JavaScriptTranslator() {
        super(4);
    }

    @Override
    public String languageName() { return "JavaScript"; }

    @Override
    public String fileExtension() { return ".js"; }

    @Override
    public String headerComment() { return "// Excel Formula (JavaScript syntax for highlighting)"; }

    @Override
    public boolean emitsComments() { return true; }

    @Override
    public String commentMarker() { return "//"; }

    @Override
    public String formatCellRef(String cellRef) { return "\"" + cellRef + "\""; }

    @Override
    public String formatString(String stringLiteral) {
        if (isQuotedCellReference(stringLiteral))
            return "'" + unquote(stringLiteral) + "'";
        return stringLiteral;
    }

    @Override
    public String formatOperator(String operator) {
        if (operator.equals("<>")) return " != ";
        return " " + operator + " ";
    }

    @Override
    public String formatPunctuation(String punctuation) {
        return switch (punctuation) {
            case "(" -> "( ";
            case ")" -> " )";
            default -> punctuation;
        };
    }

    @Override
    public String reverseCellRef(String text) {
        String unquoted = ExcelText.mapStrings(text, s -> isQuotedCellReference(s) ? unquote(s) : s);
        return ExcelText.mapOutsideStrings(unquoted, this::requoteStrings);
    }

    @Override
    public String reverseOperator(String text) {
        return ExcelText.mapOutsideStrings(text, s -> s.replace("!=", "<>"));
    }

    private String requoteStrings(String text) {
        Matcher matcher = singleQuotedCellReference.matcher(text);
        return matcher.replaceAll(match -> Matcher.quoteReplacement("\"" + match.group(1) + "\""));
    }

    private static boolean isQuotedCellReference(String literal) {
        return literal.length() >= 2 && literal.startsWith("\"") && literal.endsWith("\"")
               && CellReferences.isCellReference(unquote(literal));
    }

    private static String unquote(String literal) {
        return literal.substring(1, literal.length() - 1);
    }

}
