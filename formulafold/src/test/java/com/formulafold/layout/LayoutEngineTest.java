// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package com.formulafold.layout;

import com.formulafold.translate.CompactExcelTranslator;
import com.formulafold.translate.ExcelTranslator;
import com.formulafold.translate.JavaScriptTranslator;
import com.formulafold.translate.PythonTranslator;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class LayoutEngineTest {

    private final LayoutEngine javaScript = new LayoutEngine(new JavaScriptTranslator());
    private final LayoutEngine annotated = new LayoutEngine(ExcelTranslator.annotated());
    private final LayoutEngine plain = new LayoutEngine(ExcelTranslator.plain());
    private final LayoutEngine compact = new LayoutEngine(new CompactExcelTranslator());
    private final LayoutEngine python = new LayoutEngine(new PythonTranslator());

    @Test
    void short_call_stays_on_one_line() {
        assertEquals("""
                     // Excel Formula (JavaScript syntax for highlighting)
                     SUM( "A1:A10" )""",
                     javaScript.fold("=SUM(A1:A10)"));
        assertEquals("TODAY() - A1", plain.fold("=TODAY()-A1"));
    }

    @Test
    void generic_call_has_one_argument_per_line() {
        assertEquals("""
                     IF(
                         A1 > 0,
                         SUM( B1:B10 ),
                         0
                     )""",
                     plain.fold("=IF(A1>0,SUM(B1:B10),0)"));
        assertEquals("""
                     IF(
                       A1>0,
                       SUM(B1:B10),
                       0
                     )""",
                     compact.fold("=IF(A1>0,SUM(B1:B10),0)"));
    }

    @Test
    void function_comment_precedes_multi_line_call() {
        assertEquals("""
                     # Excel Formula (Python syntax for highlighting)
                     # Conditional logic
                     if_else(
                         sheet["A1"] == 1,
                         "yes",
                         "no"
                     )""",
                     python.fold("=IF(A1=1,\"yes\",\"no\")"));
    }

    @Test
    void let_pairs_names_with_values() {
        assertEquals("""
                     // Excel Formula (JavaScript syntax for highlighting)
                     // Variable assignments
                     LET(
                         x, "A1",
                         y, "B1",
                         x + y
                     )""",
                     javaScript.fold("=LET(x,A1,y,B1,x+y)"));
    }

    @Test
    void let_value_block_starts_on_the_name_line() {
        assertEquals("""
                     // Excel Formula (JavaScript syntax for highlighting)
                     // Variable assignments
                     LET(
                         x, IF(
                             "A1",
                             "B1",
                             "C1"
                         ),
                         x
                     )""",
                     javaScript.fold("=LET(x,IF(A1,B1,C1),x)"));
    }

    @Test
    void ifs_separates_case_result_pairs() {
        assertEquals("""
                     // Excel Formula (annotated Excel syntax)
                     // Multiple conditions
                     IFS(
                         // --- case / result pair ---
                         A1 > 0,
                         "Positive",

                         // --- case / result pair ---
                         A1 < 0,
                         "Negative",

                         // --- case / result pair ---
                         TRUE,
                         "Zero"
                     )""",
                     annotated.fold("=IFS(A1>0,\"Positive\",A1<0,\"Negative\",TRUE,\"Zero\")"));
    }

    @Test
    void switch_without_comments_keeps_blank_lines() {
        assertEquals("""
                     SWITCH(
                         A1,
                         1,

                         "One",
                         2,

                         "Other"
                     )""",
                     plain.fold("=SWITCH(A1,1,\"One\",2,\"Other\")"));
    }

    @Test
    void and_packs_short_arguments() {
        assertEquals("""
                     // Excel Formula (JavaScript syntax for highlighting)
                     // Logical AND
                     AND(
                         NOT( a ), NOT( b ), NOT( c ),
                         d, e
                     )""",
                     javaScript.fold("=AND(NOT(a),NOT(b),NOT(c),d,e)"));
    }

    @Test
    void or_with_let_argument_has_one_argument_per_line() {
        assertEquals("""
                     OR(
                         A1,
                         LET(
                             x, 1,
                             x
                         )
                     )""",
                     plain.fold("=OR(A1,LET(x,1,x))"));
    }

    @Test
    void empty_arguments_keep_their_commas() {
        assertEquals("""
                     IF(
                         A1,
                         ,
                         0
                     )""",
                     plain.fold("=IF(A1,,0)"));
    }

    @Test
    void group_with_call_is_laid_out_deeper() {
        assertEquals("""
                     (
                         IF(
                             A1,
                             B1,
                             C1
                         )
                         + 1
                     ) * 2""",
                     plain.fold("=(IF(A1,B1,C1)+1)*2"));
        assertEquals("( A1 + B1 ) * 2", plain.fold("=(A1+B1)*2"));
    }

    @Test
    void array_formula_is_wrapped() {
        assertEquals("""
                     {=
                     SUM( A1:A10 * B1:B10 )
                     }""",
                     plain.fold("{=SUM(A1:A10*B1:B10)}"));
    }

    @Test
    void unclosed_call_has_no_closing_line() {
        assertEquals("""
                     SUM(
                         A1,
                         B1""",
                     plain.fold("=SUM(A1,B1"));
    }

    @Test
    void empty_formula_folds_to_nothing() {
        assertEquals("", javaScript.fold("="));
        assertEquals("", javaScript.fold("  "));
    }

    @Test
    void settings_control_line_breaking() {
        LayoutEngine narrow = new LayoutEngine(ExcelTranslator.plain(),
                                               LayoutSettings.builder().inlineWidth(5).maxArgumentsPerLine(2).build());
        assertEquals("""
                     SUM(
                         A1:A10
                     )""",
                     narrow.fold("=SUM(A1:A10)"));
        assertEquals("""
                     AND(
                         A1, B1,
                         C1
                     )""",
                     narrow.fold("=AND(A1,B1,C1)"));
        assertThrows(IllegalArgumentException.class, () -> LayoutSettings.builder().wrapWidth(0));
    }

}
