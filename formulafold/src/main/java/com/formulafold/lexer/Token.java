// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package com.formulafold.lexer;

import java.util.Objects;

/**
 * An immutable lexical unit of a formula. The text is exactly as it appeared in the formula,
 * including the quotes of string literals.
 */
public record Token(TokenKind kind, String text) {

    public Token {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(text, "text");
        if (text.isEmpty())
            throw new IllegalArgumentException("A token cannot be empty");
    }

    public boolean is(TokenKind kind, String text) {
        return this.kind == kind && this.text.equals(text);
    }

    public boolean isPunctuation(String text) { return is(TokenKind.PUNCTUATION, text); }

    public static Token string(String text) { return new Token(TokenKind.STRING, text); }
    public static Token cellRef(String text) { return new Token(TokenKind.CELL_REF, text); }
    public static Token operator(String text) { return new Token(TokenKind.OPERATOR, text); }
    public static Token punctuation(String text) { return new Token(TokenKind.PUNCTUATION, text); }
    public static Token function(String text) { return new Token(TokenKind.FUNCTION, text); }
    public static Token number(String text) { return new Token(TokenKind.NUMBER, text); }
    public static Token identifier(String text) { return new Token(TokenKind.IDENTIFIER, text); }

    @Override
    public String toString() { return kind + "(" + text + ")"; }

}
