// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package com.formulafold;

import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;

class ModeDetectorTest {

    private static final String formula = "=IF(A1>0,SUM(B1:B10),0)";

    private final FormulaFolder folder = new FormulaFolder();
    private final ModeDetector detector = new ModeDetector();

    @Test
    void detects_the_mode_of_folded_text() {
        for (Mode mode : Mode.values())
            assertEquals(Optional.of(mode), detector.detect(folder.fold(mode, formula)), "Detects " + mode);
    }

    @Test
    void detects_folds_without_header() {
        assertEquals(Optional.of(Mode.JAVASCRIPT), detector.detect(withoutFirstLine(folder.fold(Mode.JAVASCRIPT, formula))));
        assertEquals(Optional.of(Mode.PYTHON), detector.detect(withoutFirstLine(folder.fold(Mode.PYTHON, formula))));
        assertEquals(Optional.of(Mode.JAVASCRIPT), detector.detect("AND(\n    x != 1,\n    y\n)"));
        assertEquals(Optional.of(Mode.PYTHON), detector.detect("all(\n    x == 1,\n    y\n)"));
        assertEquals(Optional.of(Mode.PLAIN), detector.detect("AND(\n    x <> \"!=\",\n    y\n)"));
    }

    @Test
    void single_line_is_unfolded() {
        assertEquals(Optional.of(Mode.PLAIN), detector.detect("=SUM(A1:A10)"));
    }

    private static String withoutFirstLine(String text) {
        return text.substring(text.indexOf('\n') + 1);
    }

    @Test
    void unknown_text_has_no_mode() {
        assertEquals(Optional.empty(), detector.detect(""));
        assertEquals(Optional.empty(), detector.detect(" \n\t"));
        assertEquals(Optional.empty(), detector.detect("hello\nworld"));
    }

    @Test
    void detects_by_cell_references_and_indentation() {
        assertEquals(Optional.of(Mode.PYTHON), detector.detect("sum(\n    sheet[\"A1\"]\n)"));
        assertEquals(Optional.of(Mode.PLAIN), detector.detect("SUM(\n\tA1\n)"));
        assertEquals(Optional.of(Mode.COMPACT), detector.detect("SUM(\n  A1,\n  B1\n)"));
    }

}
