// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package com.formulafold;

import com.formulafold.lexer.CellReferences;
import com.formulafold.text.ExcelText;

import java.util.List;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.regex.Pattern;

/**
 * Guesses which mode a text is folded in, from its header comment, then its cell reference and comparison
 * rendering, then its spacing and indentation.
 * A single line is taken to be an unfolded formula, which is what unfolding in plain mode returns unchanged.
 */
class ModeDetector {

    private static final Logger log = Logger.getLogger(ModeDetector.class.getName());

    private static final Pattern spacedOperator = Pattern.compile("(?<=\\S) (?:[-+*/&^=<>]|<>|<=|>=) (?=\\S)|\\( (?=\\S)|(?<=\\S) \\)");

    /** Returns the mode of the given text, or empty if it cannot be determined */
    Optional<Mode> detect(String text) {
        if (text.isBlank()) return Optional.empty();

        List<String> lines = text.strip().lines().toList();
        if (lines.size() == 1) return Optional.of(Mode.PLAIN);

        String header = lines.get(0);
        if (header.contains("JavaScript syntax")) return Optional.of(Mode.JAVASCRIPT);
        if (header.contains("annotated Excel syntax")) return Optional.of(Mode.ANNOTATED);
        if (header.contains("Python syntax")) return Optional.of(Mode.PYTHON);

        if (text.contains("sheet[\"")) return Optional.of(Mode.PYTHON);
        String withoutStringContent = ExcelText.mapStrings(text, s -> "\"\"");
        if (withoutStringContent.contains("==")) return Optional.of(Mode.PYTHON);
        if (withoutStringContent.contains("!=") || containsQuotedCellReference(text)) return Optional.of(Mode.JAVASCRIPT);
        if (spacedOperator.matcher(withoutStringContent).find()) return Optional.of(Mode.PLAIN);
        if (lines.stream().anyMatch(line -> indentation(line) % 4 == 2)) return Optional.of(Mode.COMPACT);
        if (lines.stream().anyMatch(line -> indentation(line) >= 4 || line.startsWith("\t"))) return Optional.of(Mode.PLAIN);

        log.log(Level.FINE, () -> "Could not determine the mode of a text of " + lines.size() + " lines");
        return Optional.empty();
    }

    /** Returns whether the given text has a string literal holding exactly a cell reference, as "A1" */
    private static boolean containsQuotedCellReference(String text) {
        int quote = text.indexOf('"');
        while (quote >= 0) {
            int end = ExcelText.endOfString(text, quote);
            if (end - quote > 2 && text.charAt(end - 1) == '"'
                && CellReferences.isCellReference(text.substring(quote + 1, end - 1)))
                return true;
            quote = text.indexOf('"', end);
        }
        return false;
    }

    private static int indentation(String line) {
        if (line.isBlank()) return 0;
        int spaces = 0;
        while (line.charAt(spaces) == ' ')
            spaces++;
        return spaces;
    }

}
