// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package com.formulafold.lexer;

import com.google.common.collect.ImmutableList;

import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.regex.Pattern;

/**
 * A single-pass scanner turning the body of a formula (without the leading '=' or array wrapper)
 * into tokens. Scanning never fails: every character of the input ends up in some token,
 * except whitespace between tokens. Two adjacent word-like tokens were always separated by whitespace.
 * <p>
 * Instances are immutable and may be shared between threads.
 */
public final class Lexer {

    private static final Logger log = Logger.getLogger(Lexer.class.getName());

    private static final String operatorCharacters = "+-*/=<>&^";
    private static final String punctuationCharacters = "(),[]:;!%{}";

    private static final Pattern numberPattern = Pattern.compile("[0-9]*\\.?[0-9]+(?:[eE][+-]?[0-9]+)?");
    private static final Pattern partialExponentPattern = Pattern.compile("[0-9]*\\.?[0-9]+[eE]");

    /** Returns the tokens of the given formula body */
    public List<Token> tokenize(String body) {
        return new Scanner(body).scan();
    }

    /** Returns the kind a complete word is classified as */
    static TokenKind classify(String word) {
        if (FunctionNames.isFunction(word)) return TokenKind.FUNCTION;
        if (CellReferences.isCellReference(word)) return TokenKind.CELL_REF;
        if (numberPattern.matcher(word).matches()) return TokenKind.NUMBER;
        return TokenKind.IDENTIFIER;
    }

    private static boolean isDelimiter(char c) {
        return Character.isWhitespace(c) || c == '"'
               || operatorCharacters.indexOf(c) >= 0 || punctuationCharacters.indexOf(c) >= 0;
    }

    /** A single-use scanner over one formula body */
    private static class Scanner {

        private final String body;
        private final ImmutableList.Builder<Token> tokens = ImmutableList.builder();
        private int position = 0;

        Scanner(String body) {
            this.body = body;
        }

        List<Token> scan() {
            while (position < body.length()) {
                char c = body.charAt(position);
                if (Character.isWhitespace(c))
                    position++;
                else if (c == '"')
                    consumeString();
                else if ( ! consumeCellReference() && ! consumeOperator() && ! consumePunctuation())
                    consumeWord();
            }
            return tokens.build();
        }

        private void consumeString() {
            int endQuote = body.indexOf('"', position + 1);
            if (endQuote < 0) {
                log.log(Level.FINE, () -> "Unterminated string literal at position " + position + " in '" + body + "'");
                endQuote = body.length() - 1;
            }
            tokens.add(Token.string(body.substring(position, endQuote + 1)));
            position = endQuote + 1;
        }

        private boolean consumeCellReference() {
            int end = CellReferences.matchAt(body, position);
            if (end < 0) return false;
            if (end < body.length() && ! isDelimiter(body.charAt(end))) return false; // part of a longer word
            tokens.add(Token.cellRef(body.substring(position, end)));
            position = end;
            return true;
        }

        private boolean consumeOperator() {
            if (position + 1 < body.length()) {
                String twoCharacters = body.substring(position, position + 2);
                if (twoCharacters.equals("<>") || twoCharacters.equals(">=") || twoCharacters.equals("<=")) {
                    tokens.add(Token.operator(twoCharacters));
                    position += 2;
                    return true;
                }
            }
            if (operatorCharacters.indexOf(body.charAt(position)) < 0) return false;
            tokens.add(Token.operator(String.valueOf(body.charAt(position++))));
            return true;
        }

        private boolean consumePunctuation() {
            if (punctuationCharacters.indexOf(body.charAt(position)) < 0) return false;
            tokens.add(Token.punctuation(String.valueOf(body.charAt(position++))));
            return true;
        }

        private void consumeWord() {
            int start = position;
            while (position < body.length() && ! isDelimiter(body.charAt(position)))
                position++;
            consumeSignedExponent(start);
            String word = body.substring(start, position);
            tokens.add(new Token(classify(word), word));
        }

        /** Extends a word such as '1.5E' over a following signed exponent, as in '1.5E+10' */
        private void consumeSignedExponent(int start) {
            if (position + 1 >= body.length()) return;
            char sign = body.charAt(position);
            if (sign != '+' && sign != '-') return;
            if ( ! Character.isDigit(body.charAt(position + 1))) return;
            if ( ! partialExponentPattern.matcher(body.substring(start, position)).matches()) return;
            position++;
            while (position < body.length() && Character.isDigit(body.charAt(position)))
                position++;
        }

    }

}
