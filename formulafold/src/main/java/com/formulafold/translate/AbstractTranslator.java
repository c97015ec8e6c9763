// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package com.formulafold.translate;

import com.google.common.base.Preconditions;

/**
 * Superclass of translators, providing the rules which are common to most notations:
 * space indentation, shared function descriptions, and literal rendering of strings, numbers and identifiers.
 */
public abstract class AbstractTranslator implements Translator {

    private final int indentSize;

    protected AbstractTranslator(int indentSize) {
        Preconditions.checkArgument(indentSize > 0, "indentSize must be positive, but was %s", indentSize);
        this.indentSize = indentSize;
    }

    @Override
    public String indent(int depth) {
        return " ".repeat(Math.max(0, depth) * indentSize);
    }

    @Override
    public String functionComment(String functionName) {
        return emitsComments() ? FunctionDescriptions.of(functionName) : "";
    }

    @Override
    public String sectionComment(String comment) {
        return emitsComments() ? commentMarker().strip() + " " + comment : "";
    }

    @Override
    public String separator() { return ", "; }

    @Override
    public String formatFunction(String functionName) { return functionName; }

    @Override
    public String formatString(String stringLiteral) { return stringLiteral; }

    @Override
    public String formatNumber(String number) { return number; }

    @Override
    public String formatIdentifier(String identifier) { return identifier; }

    @Override
    public String reverseLine(String text) { return text; }

    @Override
    public String toString() { return languageName() + " translator"; }

}
