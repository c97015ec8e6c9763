// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package com.formulafold.reverse;

import com.formulafold.text.ExcelText;
import com.formulafold.translate.Translator;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Unfolds formulas: turns folded text back into a single line Excel formula.
 * <p>
 * The steps are, in order: remove the array formula lines, remove comments, join the lines,
 * undo the cell reference, operator and other renderings of the translator, normalize spacing
 * and add the formula prefix. Folded text not produced by this system is handled on a best effort basis.
 *
 * This is immutable and thread safe.
 */
public class ReverseEngine {

    private static final Logger log = Logger.getLogger(ReverseEngine.class.getName());

    private final Translator translator;
    private final CommentStripper commentStripper;

    public ReverseEngine(Translator translator) {
        this.translator = Objects.requireNonNull(translator, "translator");
        this.commentStripper = new CommentStripper(translator.commentMarker());
    }

    /** Returns the given folded text as an Excel formula, or an empty string if it has no content */
    public String unfold(String foldedText) {
        if (foldedText.isBlank()) return "";

        List<String> lines = new ArrayList<>(foldedText.lines().toList());
        boolean arrayFormula = removeArrayFormulaLines(lines);
        String formula = ExcelText.collapseWhitespace(String.join(" ", commentStripper.strip(lines)));
        formula = translator.reverseCellRef(formula);
        formula = translator.reverseOperator(formula);
        formula = translator.reverseLine(formula);
        formula = ExcelText.normalizeSpacing(formula);
        if (formula.isEmpty()) return "";
        return withPrefix(formula, arrayFormula);
    }

    /**
     * Removes the '{=' line starting and the '}' line ending an array formula, if present.
     *
     * @return whether the lines were present
     */
    private boolean removeArrayFormulaLines(List<String> lines) {
        int first = 0;
        while (first < lines.size() && (lines.get(first).isBlank() || commentStripper.isComment(lines.get(first))))
            first++;
        int last = lines.size() - 1;
        while (last > first && lines.get(last).isBlank())
            last--;
        if (last <= first) return false;
        if ( ! lines.get(first).strip().equals("{=") || ! lines.get(last).strip().equals("}")) return false;

        lines.remove(last);
        lines.remove(first);
        return true;
    }

    private String withPrefix(String formula, boolean arrayFormula) {
        if (formula.startsWith("{=") && formula.endsWith("}")) return formula;
        if (formula.startsWith("=")) {
            if ( ! arrayFormula) return formula;
            formula = formula.substring(1);
        }
        if (arrayFormula) {
            log.log(Level.FINE, () -> "Restoring array formula wrapper");
            return "{=" + formula + "}";
        }
        return "=" + formula;
    }

}
