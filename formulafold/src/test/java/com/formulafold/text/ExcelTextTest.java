// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package com.formulafold.text;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ExcelTextTest {

    @Test
    void normalizes_spacing_outside_strings() {
        assertEquals("SUM(A1, B1)", ExcelText.normalizeSpacing("SUM( A1 , B1 )"));
        assertEquals("IF(A1<>B1, \"a  , b\", 0)", ExcelText.normalizeSpacing("IF( A1 <> B1 ,\"a  , b\",0 )"));
        assertEquals("IF(A1,, 0)", ExcelText.normalizeSpacing("IF( A1 , , 0 )"));
        assertEquals("F(A1,)", ExcelText.normalizeSpacing("F( A1 , )"));
    }

    @Test
    void keeps_one_space_between_words() {
        assertEquals("SUM(A1:A3 A2:B2)", ExcelText.normalizeSpacing("SUM( A1:A3    A2:B2 )"));
    }

    @Test
    void collapses_whitespace_outside_strings() {
        assertEquals("A1 + \"x  y\"", ExcelText.collapseWhitespace("  A1 \n\t +  \"x  y\" "));
    }

    @Test
    void finds_markers_outside_strings() {
        assertEquals(10, ExcelText.indexOutsideStrings("\"//\" & A1 // c", "//"));
        assertEquals(-1, ExcelText.indexOutsideStrings("\"// c\"", "//"));
    }

    @Test
    void maps_strings_and_the_rest_separately() {
        assertEquals("a\"b\"a", ExcelText.mapOutsideStrings("b\"b\"b", s -> s.replace('b', 'a')));
        assertEquals("b\"a\"b", ExcelText.mapStrings("b\"b\"b", s -> s.replace('b', 'a')));
        assertEquals("x\"open", ExcelText.mapOutsideStrings("y\"open", s -> "x"));
    }

    @Test
    void word_characters() {
        assertTrue(ExcelText.isWordCharacter('A'));
        assertTrue(ExcelText.isWordCharacter('$'));
        assertTrue(ExcelText.isWordCharacter('.'));
        assertFalse(ExcelText.isWordCharacter(','));
        assertFalse(ExcelText.isWordCharacter('"'));
        assertFalse(ExcelText.isWordCharacter(' '));
    }

}
