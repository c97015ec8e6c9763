// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package com.formulafold.translate;

import com.formulafold.lexer.CellReferences;
import com.formulafold.text.ExcelText;
import com.google.common.collect.ImmutableMap;

import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Renders formulas in a Python-like syntax: cell references become sheet["A1"], comparison uses
 * == and !=, and functions written in upper case which have a Python counterpart are renamed.
 * Other names are kept as written. A kept name which equals a Python name, such as "sum" written
 * in lower case, is rendered with a space before any following parenthesis, since only a Python name
 * directly followed by '(' is renamed back.
 */
public class PythonTranslator extends AbstractTranslator {

    private static final String cellReferencePrefix = "sheet[\"";
    private static final String cellReferenceSuffix = "\"]";

    private static final Map<String, String> pythonNames = ImmutableMap.<String, String>builder()
            .put("SUM", "sum")
            .put("IF", "if_else")
            .put("AND", "all")
            .put("OR", "any")
            .put("NOT", "not")
            .put("CONCATENATE", "join")
            .put("LEN", "len")
            .put("COUNT", "count")
            .put("AVERAGE", "mean")
            .put("MAX", "max")
            .put("MIN", "min")
            .put("LET", "let")
            .build();

    private static final Map<String, String> excelNames = ImmutableMap.copyOf(
            pythonNames.entrySet().stream().collect(Collectors.toMap(Map.Entry::getValue, Map.Entry::getKey)));

    private static final Pattern pythonFunctionCall =
            Pattern.compile("(?<![A-Za-z0-9_.])(" + String.join("|", excelNames.keySet()) + ")(?=\\()");

    public PythonTranslator() {
        super(4);
    }

    @Override
    public String languageName() { return "Python"; }

    @Override
    public String fileExtension() { return ".py"; }

    @Override
    public String headerComment() { return "# Excel Formula (Python syntax for highlighting)"; }

    @Override
    public boolean emitsComments() { return true; }

    /** The marker includes the space so that error values such as #N/A are not taken as comments */
    @Override
    public String commentMarker() { return "# "; }

    @Override
    public String formatFunction(String functionName) {
        String pythonName = pythonNames.get(functionName);
        if (pythonName != null) return pythonName;
        return keptApartFromPythonNames(functionName);
    }

    @Override
    public String formatIdentifier(String identifier) {
        return keptApartFromPythonNames(identifier);
    }

    private static String keptApartFromPythonNames(String name) {
        return excelNames.containsKey(name) ? name + " " : name;
    }

    @Override
    public String formatCellRef(String cellRef) { return cellReferencePrefix + cellRef + cellReferenceSuffix; }

    @Override
    public String formatOperator(String operator) {
        return switch (operator) {
            case "=" -> " == ";
            case "<>" -> " != ";
            default -> " " + operator + " ";
        };
    }

    @Override
    public String formatPunctuation(String punctuation) { return punctuation; }

    @Override
    public String reverseCellRef(String text) {
        StringBuilder b = new StringBuilder(text.length());
        int i = 0;
        while (i < text.length()) {
            char c = text.charAt(i);
            if (text.startsWith(cellReferencePrefix, i) && ! precededByWordCharacter(text, i)) {
                int contentStart = i + cellReferencePrefix.length();
                int contentEnd = text.indexOf(cellReferenceSuffix, contentStart);
                if (contentEnd > 0 && CellReferences.isCellReference(text.substring(contentStart, contentEnd))) {
                    b.append(text, contentStart, contentEnd);
                    i = contentEnd + cellReferenceSuffix.length();
                    continue;
                }
            }
            if (c == '"') {
                int end = ExcelText.endOfString(text, i);
                b.append(text, i, end);
                i = end;
            }
            else {
                b.append(c);
                i++;
            }
        }
        return b.toString();
    }

    @Override
    public String reverseOperator(String text) {
        return ExcelText.mapOutsideStrings(text, s -> s.replace("!=", "<>").replace("==", "="));
    }

    @Override
    public String reverseLine(String text) {
        return ExcelText.mapOutsideStrings(text, s -> {
            Matcher matcher = pythonFunctionCall.matcher(s);
            return matcher.replaceAll(match -> excelNames.get(match.group(1)));
        });
    }

    private static boolean precededByWordCharacter(String text, int position) {
        if (position == 0) return false;
        char c = text.charAt(position - 1);
        return Character.isLetterOrDigit(c) || c == '_' || c == '.';
    }

}
