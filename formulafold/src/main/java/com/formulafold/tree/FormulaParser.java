// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package com.formulafold.tree;

import com.formulafold.lexer.Token;
import com.formulafold.lexer.TokenKind;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * A recursive-descent parser building the tree of calls, groups and tokens of a formula.
 * This only resolves parenthesis structure; it does not validate the formula.
 * Unbalanced parentheses are tolerated: an unclosed call or group is marked as such,
 * and a stray closing parenthesis becomes a plain token.
 */
public final class FormulaParser {

    private static final Logger log = Logger.getLogger(FormulaParser.class.getName());

    private final List<Token> tokens;
    private int position = 0;

    private FormulaParser(List<Token> tokens) {
        this.tokens = tokens;
    }

    /** Returns the top-level nodes of the given token sequence */
    public static List<FormulaNode> parse(List<Token> tokens) {
        return new FormulaParser(tokens).parseSequence(false).nodes;
    }

    /**
     * Parses nodes until the end of input or, if insideGroup, a closing parenthesis,
     * which is consumed.
     */
    private Sequence parseSequence(boolean insideGroup) {
        List<FormulaNode> nodes = new ArrayList<>();
        while (position < tokens.size()) {
            if (insideGroup && peekPunctuation(")")) {
                position++;
                return new Sequence(nodes, true);
            }
            nodes.add(parseNode());
        }
        return new Sequence(nodes, false);
    }

    private FormulaNode parseNode() {
        Token token = tokens.get(position++);
        if (token.kind() == TokenKind.FUNCTION && peekPunctuation("(")) {
            position++;
            return parseCall(token);
        }
        if (token.isPunctuation("(")) {
            Sequence children = parseSequence(true);
            if ( ! children.closed)
                log.log(Level.FINE, () -> "Unclosed parenthesis in formula");
            return new GroupNode(children.nodes, children.closed);
        }
        return new TokenNode(token);
    }

    /** Parses the arguments of a call whose opening parenthesis has been consumed */
    private CallNode parseCall(Token function) {
        List<ArgumentGroup> arguments = new ArrayList<>();
        List<FormulaNode> current = new ArrayList<>();
        while (position < tokens.size()) {
            if (peekPunctuation(")")) {
                position++;
                if ( ! current.isEmpty() || ! arguments.isEmpty())
                    arguments.add(new ArgumentGroup(current));
                return new CallNode(function, arguments, true);
            }
            if (peekPunctuation(",")) {
                position++;
                arguments.add(new ArgumentGroup(current));
                current = new ArrayList<>();
                continue;
            }
            current.add(parseNode());
        }
        log.log(Level.FINE, () -> "Unclosed call to " + function.text() + " in formula");
        if ( ! current.isEmpty() || ! arguments.isEmpty())
            arguments.add(new ArgumentGroup(current));
        return new CallNode(function, arguments, false);
    }

    private boolean peekPunctuation(String text) {
        return position < tokens.size() && tokens.get(position).isPunctuation(text);
    }

    private record Sequence(List<FormulaNode> nodes, boolean closed) {}

}
