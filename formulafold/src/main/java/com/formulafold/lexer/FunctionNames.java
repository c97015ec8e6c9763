// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package com.formulafold.lexer;

import com.google.common.collect.ImmutableSet;

import java.util.Locale;

/**
 * The Excel function names recognized as functions by the lexer. Lookup is case-insensitive.
 */
public final class FunctionNames {

    private static final ImmutableSet<String> names = ImmutableSet.of(
            // math and aggregation
            "SUM", "SUMIF", "SUMIFS", "SUMPRODUCT", "COUNT", "COUNTA", "COUNTBLANK", "COUNTIF", "COUNTIFS",
            "AVERAGE", "AVERAGEIF", "AVERAGEIFS", "MAX", "MIN", "MEDIAN", "MODE", "STDEV", "VAR",
            "ROUND", "ROUNDUP", "ROUNDDOWN", "INT", "ABS", "SQRT", "POWER", "EXP", "LN", "LOG", "LOG10",
            "SIN", "COS", "TAN", "ASIN", "ACOS", "ATAN", "PI", "RAND", "RANDBETWEEN", "MOD",
            // lookup and reference
            "VLOOKUP", "HLOOKUP", "XLOOKUP", "INDEX", "MATCH", "XMATCH", "CHOOSE", "INDIRECT", "OFFSET",
            "ROW", "COLUMN", "ROWS", "COLUMNS", "TRANSPOSE",
            // text
            "LEN", "MID", "LEFT", "RIGHT", "FIND", "SEARCH", "SUBSTITUTE", "CONCATENATE", "CONCAT", "TEXTJOIN",
            "TEXT", "VALUE", "TRIM", "UPPER", "LOWER", "PROPER", "REPT", "TEXTBEFORE", "TEXTAFTER", "TEXTSPLIT",
            // date and finance
            "DATE", "TODAY", "NOW", "YEAR", "MONTH", "DAY", "WEEKDAY", "WORKDAY", "NETWORKDAYS", "EDATE", "EOMONTH",
            "PMT", "PV", "FV", "RATE", "NPER", "NPV", "IRR",
            // logical and information
            "IF", "IFS", "SWITCH", "IFERROR", "IFNA", "AND", "OR", "NOT", "XOR",
            "ISERROR", "ISBLANK", "ISNUMBER", "ISTEXT",
            // dynamic arrays and lambdas
            "LET", "LAMBDA", "MAP", "REDUCE", "SCAN", "BYROW", "BYCOL", "MAKEARRAY", "FILTER", "SORT", "SORTBY",
            "UNIQUE", "SEQUENCE", "HSTACK", "VSTACK", "TAKE", "DROP", "CHOOSEROWS", "CHOOSECOLS");

    private FunctionNames() {}

    public static boolean isFunction(String word) {
        return names.contains(word.toUpperCase(Locale.ROOT));
    }

}
