// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package com.formulafold.text;

import java.util.function.UnaryOperator;

/**
 * Text utility functions for Excel formula text which respect string literals:
 * text between double quotes is never changed by anything in this class
 * unless the method says so. An unterminated string literal extends to the end of the text.
 */
public final class ExcelText {

    private static final String operatorAndPunctuationCharacters = "+-*/=<>&^(),[]:;!%{}";

    /** No instantiation */
    private ExcelText() {}

    /** Returns the index after the string literal starting at the given quote */
    public static int endOfString(String text, int quotePosition) {
        int endQuote = text.indexOf('"', quotePosition + 1);
        return endQuote < 0 ? text.length() : endQuote + 1;
    }

    /** Applies the given function to each stretch of text outside string literals */
    public static String mapOutsideStrings(String text, UnaryOperator<String> function) {
        return map(text, function, UnaryOperator.identity());
    }

    /** Applies the given function to each string literal, including its quotes */
    public static String mapStrings(String text, UnaryOperator<String> function) {
        return map(text, UnaryOperator.identity(), function);
    }

    private static String map(String text, UnaryOperator<String> outside, UnaryOperator<String> inside) {
        StringBuilder b = new StringBuilder(text.length());
        int start = 0;
        while (start < text.length()) {
            int quote = text.indexOf('"', start);
            if (quote < 0) {
                b.append(outside.apply(text.substring(start)));
                break;
            }
            b.append(outside.apply(text.substring(start, quote)));
            int end = endOfString(text, quote);
            b.append(inside.apply(text.substring(quote, end)));
            start = end;
        }
        return b.toString();
    }

    /** Returns the first index of the given marker outside string literals, or -1 if none */
    public static int indexOutsideStrings(String text, String marker) {
        int i = 0;
        while (i < text.length()) {
            if (text.charAt(i) == '"')
                i = endOfString(text, i);
            else if (text.startsWith(marker, i))
                return i;
            else
                i++;
        }
        return -1;
    }

    /** Replaces each run of whitespace outside string literals by a single space, and strips the ends */
    public static String collapseWhitespace(String text) {
        return mapOutsideStrings(text, s -> s.replaceAll("\\s+", " ")).strip();
    }

    /**
     * Returns the canonical spacing of the given formula text: outside string literals, whitespace is removed
     * except a single space between two word characters, and each comma is followed by one space unless
     * it is followed by another comma or a closing parenthesis.
     */
    public static String normalizeSpacing(String text) {
        StringBuilder b = new StringBuilder(text.length());
        int i = 0;
        while (i < text.length()) {
            char c = text.charAt(i);
            if (c == '"') {
                int end = endOfString(text, i);
                b.append(text, i, end);
                i = end;
            }
            else if (Character.isWhitespace(c)) {
                int next = skipWhitespace(text, i);
                if (b.length() > 0 && next < text.length()
                    && isWordCharacter(b.charAt(b.length() - 1)) && isWordCharacter(text.charAt(next)))
                    b.append(' ');
                i = next;
            }
            else if (c == ',') {
                b.append(',');
                int next = skipWhitespace(text, i + 1);
                if (next < text.length() && text.charAt(next) != ',' && text.charAt(next) != ')')
                    b.append(' ');
                i = next;
            }
            else {
                b.append(c);
                i++;
            }
        }
        return b.toString();
    }

    /** Returns whether the given character may be part of a name, reference or number */
    public static boolean isWordCharacter(char c) {
        return ! Character.isWhitespace(c) && c != '"' && operatorAndPunctuationCharacters.indexOf(c) < 0;
    }

    private static int skipWhitespace(String text, int i) {
        while (i < text.length() && Character.isWhitespace(text.charAt(i)))
            i++;
        return i;
    }

}
