// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package com.formulafold.tree;

import com.google.common.collect.ImmutableList;

import java.util.List;

/**
 * The nodes of one argument of a function call, that is, everything between two commas
 * at the top level of the call's parameter list. An argument group may be empty, as the
 * middle argument of IF(A1,,0).
 */
public record ArgumentGroup(List<FormulaNode> nodes) {

    public ArgumentGroup {
        nodes = ImmutableList.copyOf(nodes);
    }

    public boolean isEmpty() { return nodes.isEmpty(); }

    public boolean containsCall() {
        return nodes.stream().anyMatch(FormulaNode::containsCall);
    }

    public boolean containsCallTo(String... functionNames) {
        return nodes.stream().anyMatch(node -> node.containsCallTo(functionNames));
    }

}
