// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package com.formulafold.reverse;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CommentStripperTest {

    private final CommentStripper slashes = new CommentStripper("//");
    private final CommentStripper hash = new CommentStripper("# ");

    @Test
    void removes_comment_lines() {
        assertNull(slashes.strip("    // Sum values"));
        assertTrue(slashes.isComment("  // x"));
        assertFalse(slashes.isComment("A1 // x"));
        assertEquals(List.of("SUM(", ")"), slashes.strip(List.of("// Excel Formula", "SUM(", "    // note", ")")));
    }

    @Test
    void keeps_comma_before_trailing_comment() {
        assertEquals("    A1,", slashes.strip("    A1, // note"));
        assertEquals("    A1,", slashes.strip("    A1,// note"));
        assertEquals("    A1 + B1", slashes.strip("    A1 + B1   // note"));
    }

    @Test
    void ignores_markers_in_strings() {
        assertEquals("    \"http://example.com\",", slashes.strip("    \"http://example.com\","));
        assertEquals("    \"a // b\",", slashes.strip("    \"a // b\", // note"));
    }

    @Test
    void hash_comments_do_not_match_error_values() {
        assertEquals("IFERROR(A1, #N/A)", hash.strip("IFERROR(A1, #N/A) # note"));
        assertNull(hash.strip("    # Conditional logic"));
    }

    @Test
    void requires_a_marker() {
        assertThrows(IllegalArgumentException.class, () -> new CommentStripper(" "));
    }

}
