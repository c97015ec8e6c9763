// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package com.formulafold.tree;

import com.google.common.collect.ImmutableList;

import java.util.List;

/**
 * A parenthesized subexpression which is not the argument list of a function, as in (A1+B1)*2.
 *
 * @param children the nodes between the parentheses
 * @param closed false if the formula ended before the closing parenthesis
 */
public record GroupNode(List<FormulaNode> children, boolean closed) implements FormulaNode {

    public GroupNode {
        children = ImmutableList.copyOf(children);
    }

    @Override
    public boolean containsCall() {
        return children.stream().anyMatch(FormulaNode::containsCall);
    }

    @Override
    public boolean containsCallTo(String... functionNames) {
        return children.stream().anyMatch(child -> child.containsCallTo(functionNames));
    }

}
