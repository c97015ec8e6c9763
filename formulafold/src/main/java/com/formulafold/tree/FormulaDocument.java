// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package com.formulafold.tree;

import com.formulafold.lexer.Lexer;
import com.formulafold.lexer.Token;
import com.google.common.collect.ImmutableList;

import java.util.List;

/**
 * A formula split into its array-formula flag and the tokens of its body.
 * The body is what remains after removing a leading '=' or the '{=' ... '}' array wrapper.
 *
 * @param arrayFormula whether the formula was wrapped as {=...}
 * @param tokens the tokens of the body
 */
public record FormulaDocument(boolean arrayFormula, List<Token> tokens) {

    private static final Lexer lexer = new Lexer();

    public FormulaDocument {
        tokens = ImmutableList.copyOf(tokens);
    }

    /** Returns the nodes of the body of this */
    public List<FormulaNode> nodes() {
        return FormulaParser.parse(tokens);
    }

    public boolean isEmpty() { return tokens.isEmpty(); }

    /** Creates a document from a formula, which may start with '=', be wrapped in '{=' and '}', or have no prefix */
    public static FormulaDocument of(String formula) {
        String clean = formula.strip();
        boolean arrayFormula = false;
        if (clean.startsWith("{=") && clean.endsWith("}")) {
            arrayFormula = true;
            clean = clean.substring(2, clean.length() - 1);
        }
        else if (clean.startsWith("=")) {
            clean = clean.substring(1);
        }
        return new FormulaDocument(arrayFormula, lexer.tokenize(clean));
    }

}
