// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package com.formulafold.tree;

/**
 * A node in the parse tree of a formula: a function call, a parenthesized group or a single token.
 */
public interface FormulaNode {

    /** Returns whether this node is, or contains, a function call */
    boolean containsCall();

    /** Returns whether this node is, or contains, a call to one of the given (upper-case) function names */
    boolean containsCallTo(String... functionNames);

}
