// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package com.formulafold.tree;

import com.formulafold.lexer.Token;

import java.util.Objects;

/**
 * A leaf of the parse tree.
 */
public record TokenNode(Token token) implements FormulaNode {

    public TokenNode {
        Objects.requireNonNull(token, "token");
    }

    @Override
    public boolean containsCall() { return false; }

    @Override
    public boolean containsCallTo(String... functionNames) { return false; }

}
