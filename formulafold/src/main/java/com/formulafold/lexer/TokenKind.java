// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package com.formulafold.lexer;

/**
 * The kinds of lexical units in an Excel formula.
 */
public enum TokenKind {

    STRING(false),
    CELL_REF(true),
    OPERATOR(false),
    PUNCTUATION(false),
    FUNCTION(true),
    NUMBER(true),
    IDENTIFIER(true);

    private final boolean wordLike;

    TokenKind(boolean wordLike) { this.wordLike = wordLike; }

    /**
     * Returns whether tokens of this kind are made of word characters, such that two adjacent
     * tokens of word-like kinds must have been separated by whitespace in the formula.
     */
    public boolean isWordLike() { return wordLike; }

}
