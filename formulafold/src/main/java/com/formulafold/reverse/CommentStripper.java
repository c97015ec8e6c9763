// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package com.formulafold.reverse;

import com.formulafold.text.ExcelText;
import com.google.common.base.Preconditions;

import java.util.ArrayList;
import java.util.List;

/**
 * Removes comments from folded lines. A comment starts at the first comment marker outside a string literal.
 * <p>
 * A line which is only a comment is removed. A trailing comment is removed together with the whitespace
 * before it, which leaves any comma ending the line in place: in "A1, // note" only the comment goes.
 */
public final class CommentStripper {

    private final String marker;

    public CommentStripper(String marker) {
        Preconditions.checkArgument( ! marker.isBlank(), "A comment marker cannot be blank");
        this.marker = marker;
    }

    /** Returns whether the given line holds nothing but a comment */
    public boolean isComment(String line) {
        String content = line.strip();
        return content.equals(marker.strip()) || content.startsWith(marker);
    }

    /** Returns the given line without its comment, or null if nothing but whitespace remains */
    public String strip(String line) {
        int start = ExcelText.indexOutsideStrings(line, marker);
        if (start < 0) return isComment(line) ? null : line;
        String content = line.substring(0, start).stripTrailing();
        return content.isBlank() ? null : content;
    }

    /** Returns the given lines with comments and comment lines removed */
    public List<String> strip(List<String> lines) {
        List<String> stripped = new ArrayList<>(lines.size());
        for (String line : lines) {
            String content = strip(line);
            if (content != null)
                stripped.add(content);
        }
        return stripped;
    }

    @Override
    public String toString() { return "comment stripper for '" + marker + "'"; }

}
