// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package com.formulafold.translate;

import com.formulafold.text.ExcelText;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests the reversal of each rendering, for all translators.
 */
class TranslatorTest {

    private static final List<Translator> translators = List.of(new JavaScriptTranslator(),
                                                                ExcelTranslator.annotated(),
                                                                ExcelTranslator.plain(),
                                                                new CompactExcelTranslator(),
                                                                new PythonTranslator());

    private static final List<String> cellReferences = List.of("A1", "$B$2", "A1:C10", "Sheet2!$A$1:$C$100", "'My Sheet'!B7");
    private static final List<String> operators = List.of("+", "-", "*", "/", "=", "<", ">", "&", "^", "<>", ">=", "<=");

    @Test
    void reverses_cell_references() {
        for (Translator translator : translators)
            for (String cellReference : cellReferences)
                assertEquals(cellReference, translator.reverseCellRef(translator.formatCellRef(cellReference)),
                             translator + " reverses " + cellReference);
    }

    @Test
    void reverses_operators() {
        for (Translator translator : translators)
            for (String operator : operators)
                assertEquals(operator, translator.reverseOperator(translator.formatOperator(operator)).strip(),
                             translator + " reverses " + operator);
    }

    @Test
    void reverses_function_names() {
        for (Translator translator : translators)
            for (String function : List.of("SUM", "IF", "AND", "NOT", "LET", "VLOOKUP", "IFS", "Sum", "max", "If", "not"))
                assertEquals(function + "(A1)",
                             ExcelText.normalizeSpacing(translator.reverseLine(translator.formatFunction(function) + "(A1)")),
                             translator + " reverses " + function);
    }

    @Test
    void leaves_string_literals_alone() {
        for (Translator translator : translators) {
            String literal = "\"a != b == c\"";
            assertEquals(literal, translator.reverseOperator(translator.formatString(literal)));
            assertEquals(literal, translator.reverseCellRef(translator.formatString(literal)));
        }
    }

    @Test
    void comments_only_where_emitted() {
        for (Translator translator : translators) {
            if (translator.emitsComments()) {
                assertFalse(translator.headerComment().isEmpty());
                assertTrue(translator.sectionComment("note").startsWith(translator.commentMarker().strip() + " "));
            }
            else {
                assertEquals("", translator.headerComment());
                assertEquals("", translator.sectionComment("note"));
                assertEquals("", translator.functionComment("SUM"));
            }
        }
    }

    @Test
    void describes_common_functions() {
        assertEquals("Sum values", new JavaScriptTranslator().functionComment("sum"));
        assertEquals("Variable assignments", ExcelTranslator.annotated().functionComment("LET"));
        assertEquals("", ExcelTranslator.annotated().functionComment("CHAR"));
        assertEquals("", ExcelTranslator.plain().functionComment("LET"));
    }

    @Test
    void names_and_file_extensions() {
        assertEquals(".js", new JavaScriptTranslator().fileExtension());
        assertEquals(".py", new PythonTranslator().fileExtension());
        assertEquals(".txt", ExcelTranslator.plain().fileExtension());
        assertEquals("Excel (compact) translator", new CompactExcelTranslator().toString());
    }

    @Test
    void indentation() {
        assertEquals("", ExcelTranslator.plain().indent(0));
        assertEquals("        ", ExcelTranslator.plain().indent(2));
        assertEquals("    ", new CompactExcelTranslator().indent(2));
    }

}
