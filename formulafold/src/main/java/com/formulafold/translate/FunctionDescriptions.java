// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package com.formulafold.translate;

import com.google.common.collect.ImmutableMap;

import java.util.Locale;

/**
 * Short descriptions of common Excel functions, used as comments above multi-line function calls.
 */
public final class FunctionDescriptions {

    private static final ImmutableMap<String, String> descriptions = ImmutableMap.<String, String>builder()
            .put("SUM", "Sum values")
            .put("IF", "Conditional logic")
            .put("VLOOKUP", "Vertical lookup")
            .put("HLOOKUP", "Horizontal lookup")
            .put("INDEX", "Index lookup")
            .put("MATCH", "Find position")
            .put("SUMIF", "Conditional sum")
            .put("SUMIFS", "Multiple criteria sum")
            .put("COUNTIF", "Conditional count")
            .put("COUNTIFS", "Multiple criteria count")
            .put("CONCATENATE", "Text concatenation")
            .put("TEXTJOIN", "Join text with delimiter")
            .put("LET", "Variable assignments")
            .put("LAMBDA", "Function definition")
            .put("AND", "Logical AND")
            .put("OR", "Logical OR")
            .put("NOT", "Logical NOT")
            .put("FILTER", "Filter array")
            .put("SORT", "Sort array")
            .put("UNIQUE", "Unique values")
            .put("XLOOKUP", "Extended lookup")
            .put("XMATCH", "Extended match")
            .put("IFS", "Multiple conditions")
            .put("SWITCH", "Match a value against cases")
            .put("IFERROR", "Fallback on error")
            .build();

    private FunctionDescriptions() {}

    /** Returns the description of the given function, or an empty string if none */
    public static String of(String functionName) {
        return descriptions.getOrDefault(functionName.toUpperCase(Locale.ROOT), "");
    }

}
