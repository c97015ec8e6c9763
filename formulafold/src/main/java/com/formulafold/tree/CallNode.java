// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package com.formulafold.tree;

import com.formulafold.lexer.Token;
import com.google.common.collect.ImmutableList;

import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * A function call: a function name token followed by a parenthesized argument list.
 *
 * @param function the function name token, as written
 * @param arguments the arguments, split at the commas on the top level of this call
 * @param closed false if the formula ended before the closing parenthesis of this call
 */
public record CallNode(Token function, List<ArgumentGroup> arguments, boolean closed) implements FormulaNode {

    public CallNode {
        Objects.requireNonNull(function, "function");
        arguments = ImmutableList.copyOf(arguments);
    }

    /** Returns the function name in upper case, which is how layout policies are selected */
    public String name() { return function.text().toUpperCase(Locale.ROOT); }

    @Override
    public boolean containsCall() { return true; }

    @Override
    public boolean containsCallTo(String... functionNames) {
        for (String functionName : functionNames)
            if (functionName.equals(name())) return true;
        return arguments.stream().anyMatch(argument -> argument.containsCallTo(functionNames));
    }

}
