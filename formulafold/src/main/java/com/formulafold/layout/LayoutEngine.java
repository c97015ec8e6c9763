// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package com.formulafold.layout;

import com.formulafold.lexer.Token;
import com.formulafold.translate.Translator;
import com.formulafold.tree.ArgumentGroup;
import com.formulafold.tree.CallNode;
import com.formulafold.tree.FormulaDocument;
import com.formulafold.tree.FormulaNode;
import com.formulafold.tree.GroupNode;
import com.formulafold.tree.TokenNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Folds formulas: lays the parse tree of a formula out as indented lines rendered by a translator.
 * <p>
 * Calls are laid out by a policy selected by their name:
 * <ul>
 *     <li>LET: each name and value pair on one line, then the body</li>
 *     <li>IFS and SWITCH: each argument on its own line, with a separator before each condition</li>
 *     <li>AND and OR: arguments packed a few to a line, when they are short</li>
 *     <li>any other: one argument per line</li>
 * </ul>
 * Any call with at most one short argument and no nested call is kept inline.
 * Every line ends where an argument ends, so commas always end a line or separate
 * arguments within one.
 *
 * This is immutable and thread safe.
 */
public class LayoutEngine {

    private static final Logger log = Logger.getLogger(LayoutEngine.class.getName());

    private static final String casePairComment = "--- case / result pair ---";

    private final Translator translator;
    private final LayoutSettings settings;

    public LayoutEngine(Translator translator) {
        this(translator, LayoutSettings.defaults());
    }

    public LayoutEngine(Translator translator, LayoutSettings settings) {
        this.translator = Objects.requireNonNull(translator, "translator");
        this.settings = Objects.requireNonNull(settings, "settings");
    }

    /** Returns the given formula folded, or an empty string if the formula has no content */
    public String fold(String formula) {
        return fold(FormulaDocument.of(formula));
    }

    /** Returns the given document folded, or an empty string if it has no content */
    public String fold(FormulaDocument document) {
        if (document.isEmpty()) return "";

        List<String> lines = new ArrayList<>();
        if ( ! translator.headerComment().isEmpty())
            lines.add(translator.headerComment());
        if (document.arrayFormula())
            lines.add("{=");
        lines.addAll(layout(document.nodes(), 0, false));
        if (document.arrayFormula())
            lines.add("}");
        log.log(Level.FINE, () -> "Folded " + document.tokens().size() + " tokens into " + lines.size() +
                                  " lines using the " + translator);
        return String.join("\n", lines);
    }

    /**
     * Lays out a node sequence at the given depth.
     *
     * @param suppressComments whether to omit the comment before calls directly in this sequence
     */
    private List<String> layout(List<FormulaNode> nodes, int depth, boolean suppressComments) {
        List<String> lines = new ArrayList<>();
        Line line = new Line();
        for (FormulaNode node : nodes) {
            if (isInline(node)) {
                line.append(node);
            }
            else if (node instanceof CallNode call) {
                line.flushTo(lines, depth);
                line = new Line();
                lines.addAll(layoutCall(call, depth, suppressComments));
            }
            else if (node instanceof GroupNode group) {
                line.appendText(translator.formatPunctuation("("), false, false);
                line.flushTo(lines, depth);
                lines.addAll(layout(group.children(), depth + 1, suppressComments));
                line = new Line();
                if (group.closed())
                    line.appendText(translator.formatPunctuation(")"), false, false);
            }
        }
        line.flushTo(lines, depth);
        return lines;
    }

    private List<String> layoutCall(CallNode call, int depth, boolean suppressComments) {
        List<String> lines = new ArrayList<>();
        if ( ! suppressComments) {
            String description = translator.functionComment(call.name());
            if ( ! description.isEmpty())
                lines.add(translator.indent(depth) + translator.sectionComment(description));
        }
        lines.add(translator.indent(depth) + openCall(call).strip());
        switch (call.name()) {
            case "LET" -> layoutLet(call, depth + 1, lines);
            case "IFS", "SWITCH" -> layoutCases(call, depth + 1, lines);
            case "AND", "OR" -> {
                if ( ! layoutPacked(call, depth + 1, lines))
                    layoutArguments(call, depth + 1, lines);
            }
            default -> layoutArguments(call, depth + 1, lines);
        }
        if (call.closed())
            lines.add(translator.indent(depth) + translator.formatPunctuation(")").strip());
        return lines;
    }

    /** One argument per line, or per block of lines */
    private void layoutArguments(CallNode call, int depth, List<String> lines) {
        List<ArgumentGroup> arguments = call.arguments();
        for (int i = 0; i < arguments.size(); i++) {
            List<String> argumentLines = layoutArgument(arguments.get(i), depth, false);
            if (i < arguments.size() - 1)
                appendComma(argumentLines);
            lines.addAll(argumentLines);
        }
    }

    /** Name and value pairs on one line each, then the body */
    private void layoutLet(CallNode call, int depth, List<String> lines) {
        List<ArgumentGroup> arguments = call.arguments();
        int i = 0;
        while (arguments.size() - i >= 2) {
            String prefix = translator.indent(depth) + inline(arguments.get(i).nodes()) + translator.separator();
            List<String> valueLines = layoutArgument(arguments.get(i + 1), depth, true);
            String firstValueLine = valueLines.get(0).strip();

            List<String> pairLines = new ArrayList<>();
            pairLines.add(firstValueLine.isEmpty() ? prefix.stripTrailing() : prefix + firstValueLine);
            pairLines.addAll(valueLines.subList(1, valueLines.size()));
            i += 2;
            if (i < arguments.size())
                appendComma(pairLines);
            lines.addAll(pairLines);
        }
        if (i < arguments.size())
            lines.addAll(layoutArgument(arguments.get(i), depth, false));
    }

    /** Each argument on its own line, with a separator before each condition */
    private void layoutCases(CallNode call, int depth, List<String> lines) {
        List<ArgumentGroup> arguments = call.arguments();
        for (int i = 0; i < arguments.size(); i++) {
            if (i % 2 == 0) {
                if (i > 0)
                    lines.add("");
                String separator = translator.sectionComment(casePairComment);
                if ( ! separator.isEmpty())
                    lines.add(translator.indent(depth) + separator);
            }
            List<String> argumentLines = layoutArgument(arguments.get(i), depth, true);
            if (i < arguments.size() - 1)
                appendComma(argumentLines);
            lines.addAll(argumentLines);
        }
    }

    /**
     * Packs the arguments of a call several to a line, if all are short and none contains
     * a call with its own layout policy.
     *
     * @return whether the arguments were laid out
     */
    private boolean layoutPacked(CallNode call, int depth, List<String> lines) {
        List<ArgumentGroup> arguments = call.arguments();
        if (arguments.size() < 2) return false;

        String indent = translator.indent(depth);
        int available = settings.wrapWidth() - indent.length();
        List<String> rendered = new ArrayList<>();
        for (ArgumentGroup argument : arguments) {
            if (argument.containsCallTo("LET", "IFS", "SWITCH")) return false;
            String text = inline(argument.nodes());
            if (text.length() > available) return false;
            rendered.add(text);
        }

        List<String> packed = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        int count = 0;
        for (String text : rendered) {
            if (count > 0 && (count == settings.maxArgumentsPerLine() ||
                              current.length() + translator.separator().length() + text.length() > available)) {
                packed.add(current.toString());
                current.setLength(0);
                count = 0;
            }
            if (count > 0)
                current.append(translator.separator());
            current.append(text);
            count++;
        }
        packed.add(current.toString());

        String comma = translator.separator().strip();
        for (int i = 0; i < packed.size(); i++)
            lines.add((indent + packed.get(i)).stripTrailing() + (i < packed.size() - 1 ? comma : ""));
        return true;
    }

    /** Lays out one argument, as a single line holding only indentation if it is empty */
    private List<String> layoutArgument(ArgumentGroup argument, int depth, boolean suppressComments) {
        List<String> lines = layout(argument.nodes(), depth, suppressComments);
        if (lines.isEmpty())
            lines.add(translator.indent(depth));
        return lines;
    }

    private void appendComma(List<String> lines) {
        int last = lines.size() - 1;
        lines.set(last, lines.get(last) + translator.separator().strip());
    }

    /** Returns whether this node is rendered on the current line */
    private boolean isInline(FormulaNode node) {
        if (node instanceof CallNode call) return fitsInline(call);
        if (node instanceof GroupNode group) return group.children().stream().allMatch(this::isInline);
        return true;
    }

    private boolean fitsInline(CallNode call) {
        if (call.arguments().size() > 1) return false;
        if (call.arguments().stream().anyMatch(ArgumentGroup::containsCall)) return false;
        return inline(call).length() <= settings.inlineWidth();
    }

    /** Returns the given nodes rendered on a single line */
    private String inline(List<FormulaNode> nodes) {
        Line line = new Line();
        nodes.forEach(line::append);
        return line.text();
    }

    private String inline(CallNode call) {
        if (call.arguments().isEmpty())
            return openCall(call).strip() + (call.closed() ? translator.formatPunctuation(")").strip() : "");

        StringBuilder b = new StringBuilder(openCall(call));
        for (int i = 0; i < call.arguments().size(); i++) {
            if (i > 0)
                b.append(translator.separator());
            b.append(inline(call.arguments().get(i).nodes()));
        }
        if (call.closed())
            b.append(translator.formatPunctuation(")"));
        return b.toString();
    }

    private String openCall(CallNode call) {
        return translator.formatFunction(call.function().text()) + translator.formatPunctuation("(");
    }

    private String format(Token token) {
        return switch (token.kind()) {
            case STRING -> translator.formatString(token.text());
            case CELL_REF -> translator.formatCellRef(token.text());
            case OPERATOR -> translator.formatOperator(token.text());
            case FUNCTION -> translator.formatFunction(token.text());
            case NUMBER -> translator.formatNumber(token.text());
            case IDENTIFIER -> translator.formatIdentifier(token.text());
            case PUNCTUATION -> token.text().equals(",") ? translator.separator()
                                                         : translator.formatPunctuation(token.text());
        };
    }

    /** The content of one output line as it is being built */
    private final class Line {

        private final StringBuilder text = new StringBuilder();

        /** Whether the last thing appended was a word which must be kept apart from a following word */
        private boolean endsWithWord = false;

        void append(FormulaNode node) {
            if (node instanceof TokenNode tokenNode) {
                Token token = tokenNode.token();
                boolean word = token.kind().isWordLike();
                appendText(format(token), word, word);
            }
            else if (node instanceof CallNode call) {
                appendText(inline(call), true, false);
            }
            else if (node instanceof GroupNode group) {
                appendText(translator.formatPunctuation("("), false, false);
                group.children().forEach(this::append);
                if (group.closed())
                    appendText(translator.formatPunctuation(")"), false, false);
            }
        }

        void appendText(String piece, boolean startsWithWord, boolean endsWithWord) {
            if (piece.isEmpty()) return;
            if (startsWithWord && this.endsWithWord)
                text.append(' ');
            if (piece.charAt(0) == ' ' && ! text.isEmpty() && text.charAt(text.length() - 1) == ' ')
                text.append(piece, 1, piece.length());
            else
                text.append(piece);
            this.endsWithWord = endsWithWord;
        }

        String text() { return text.toString().strip(); }

        void flushTo(List<String> lines, int depth) {
            if ( ! text().isEmpty())
                lines.add(translator.indent(depth) + text());
        }

    }

}
