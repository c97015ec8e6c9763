// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package com.formulafold.lexer;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Recognizes A1-style cell references: an optional sheet qualifier, an optionally absolute column of one to
 * three upper-case letters, an optionally absolute row, an optional range end of the same form,
 * and an optional '#' spill suffix as in A1#.
 */
public final class CellReferences {

    private static final String sheet = "(?:'(?:[^']|'')+'|[A-Za-z0-9_.]+)!";
    private static final String cell = "\\$?[A-Z]{1,3}\\$?[0-9]+";

    /** A complete cell reference, unanchored */
    public static final Pattern pattern = Pattern.compile("(?:" + sheet + ")?" + cell + "(?::" + cell + ")?#?");

    private CellReferences() {}

    /** Returns whether the given text is exactly one cell reference */
    public static boolean isCellReference(String text) {
        return pattern.matcher(text).matches();
    }

    /**
     * Returns the end index of the cell reference starting exactly at the given position,
     * or -1 if there is none. A candidate followed by a word character or an opening parenthesis
     * is rejected, since it is then part of a longer name or a function call such as LOG10(.
     */
    public static int matchAt(String text, int position) {
        Matcher matcher = pattern.matcher(text);
        matcher.region(position, text.length());
        if ( ! matcher.lookingAt()) return -1;
        int end = matcher.end();
        if (end < text.length()) {
            char next = text.charAt(end);
            if (isWordCharacter(next) || next == '(') return -1;
        }
        return end;
    }

    private static boolean isWordCharacter(char c) {
        return Character.isLetterOrDigit(c) || c == '_' || c == '.' || c == '$';
    }

}
