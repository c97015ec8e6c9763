// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package com.formulafold.translate;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class JavaScriptTranslatorTest {

    private final JavaScriptTranslator translator = new JavaScriptTranslator();

    @Test
    void quotes_cell_references() {
        assertEquals("\"A1:A10\"", translator.formatCellRef("A1:A10"));
        assertEquals("SUM( A1:A10 )", translator.reverseCellRef("SUM( \"A1:A10\" )"));
    }

    @Test
    void single_quotes_strings_shaped_like_cell_references() {
        assertEquals("'A1'", translator.formatString("\"A1\""));
        assertEquals("\"text\"", translator.formatString("\"text\""));
        assertEquals("INDIRECT( \"A1\" ) & A1", translator.reverseCellRef("INDIRECT( 'A1' ) & \"A1\""));
    }

    @Test
    void keeps_quoted_sheet_names() {
        assertEquals("'My Sheet'!B2", translator.reverseCellRef(translator.formatCellRef("'My Sheet'!B2")));
    }

    @Test
    void renders_not_equal_as_javascript() {
        assertEquals(" != ", translator.formatOperator("<>"));
        assertEquals("A1 <> \"a != b\"", translator.reverseOperator("A1 != \"a != b\""));
    }

}
