// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package com.formulafold;

import com.formulafold.layout.LayoutEngine;
import com.formulafold.layout.LayoutSettings;
import com.formulafold.reverse.ReverseEngine;
import com.google.common.collect.ImmutableMap;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Folds Excel formulas into multi-line text in some mode, and unfolds such text back into formulas.
 * <p>
 * Unfolding the folding of a formula in any mode returns the same formula, up to whitespace.
 * Methods taking a mode id throw {@link InvalidModeException} if the id is not registered,
 * and never throw for any irregularity in the text given.
 * This is immutable and thread safe.
 */
public class FormulaFolder {

    private static final Logger log = Logger.getLogger(FormulaFolder.class.getName());

    private final ModeRegistry registry;
    private final Map<Mode, LayoutEngine> layoutEngines;
    private final Map<Mode, ReverseEngine> reverseEngines;
    private final ModeDetector detector = new ModeDetector();

    /** Creates a folder of all modes with default settings */
    public FormulaFolder() {
        this(ModeRegistry.defaultRegistry(), LayoutSettings.defaults());
    }

    public FormulaFolder(ModeRegistry registry, LayoutSettings settings) {
        this.registry = Objects.requireNonNull(registry, "registry");
        Objects.requireNonNull(settings, "settings");
        ImmutableMap.Builder<Mode, LayoutEngine> layoutEngines = ImmutableMap.builder();
        ImmutableMap.Builder<Mode, ReverseEngine> reverseEngines = ImmutableMap.builder();
        for (Mode mode : registry.modes()) {
            layoutEngines.put(mode, new LayoutEngine(registry.translator(mode), settings));
            reverseEngines.put(mode, new ReverseEngine(registry.translator(mode)));
        }
        this.layoutEngines = layoutEngines.build();
        this.reverseEngines = reverseEngines.build();
    }

    /**
     * Returns the given formula folded in the mode with the given id.
     *
     * @param modeId the id or alias of a registered mode
     * @param formula the formula, starting by '=', wrapped in '{=' and '}', or without prefix
     * @return the folded formula, or an empty string if the formula is blank
     * @throws InvalidModeException if the mode is not registered
     */
    public String fold(String modeId, String formula) {
        return fold(registry.mode(modeId), formula);
    }

    public String fold(Mode mode, String formula) {
        LayoutEngine engine = layoutEngine(mode);
        if (formula.isBlank()) return "";
        return engine.fold(formula);
    }

    /**
     * Returns the given folded text as a single line formula.
     *
     * @param modeId the id or alias of the registered mode the text is folded in
     * @param foldedText the folded text, which may have been edited
     * @return the formula, starting by '=' or wrapped in '{=' and '}', or an empty string if the text is blank
     * @throws InvalidModeException if the mode is not registered
     */
    public String unfold(String modeId, String foldedText) {
        return unfold(registry.mode(modeId), foldedText);
    }

    public String unfold(Mode mode, String foldedText) {
        ReverseEngine engine = reverseEngine(mode);
        if (foldedText.isBlank()) return "";
        return engine.unfold(foldedText);
    }

    /** Returns the mode the given text is folded in, or empty if it cannot be determined */
    public Optional<Mode> detectMode(String text) {
        return detector.detect(text).filter(registry::isRegistered);
    }

    /**
     * Returns text folded in one mode folded in another instead. This unfolds and folds again,
     * so nothing specific to the source mode, such as comments, is carried over.
     *
     * @return the text unchanged if the modes are the same, the text in the target mode otherwise
     * @throws InvalidModeException if either mode is not registered
     */
    public String switchMode(String text, String fromModeId, String toModeId) {
        Mode from = registry.mode(fromModeId);
        Mode to = registry.mode(toModeId);
        if (from == to) return text;
        log.log(Level.FINE, () -> "Switching from " + from + " to " + to);
        return fold(to, unfold(from, text));
    }

    /**
     * Folds or unfolds text depending on what it is: a single line formula starting by '=' or '{=' is folded
     * in the given mode, multi-line text detected as folded is unfolded from the mode detected,
     * and anything else is returned unchanged.
     *
     * @throws InvalidModeException if the mode is not registered
     */
    public String autoFormat(String modeId, String text) {
        Mode mode = registry.mode(modeId);
        String content = text.strip();
        if (content.lines().count() <= 1) {
            if (content.startsWith("=") || content.startsWith("{=")) return fold(mode, content);
            return text;
        }
        Optional<Mode> detected = detectMode(text);
        if (detected.isPresent())
            return unfold(detected.get(), text);
        return text;
    }

    /** Returns the available modes, in registration order */
    public List<Mode> modes() { return registry.modes(); }

    private LayoutEngine layoutEngine(Mode mode) {
        LayoutEngine engine = layoutEngines.get(mode);
        if (engine == null) throw new InvalidModeException(mode.id(), registry.ids());
        return engine;
    }

    private ReverseEngine reverseEngine(Mode mode) {
        ReverseEngine engine = reverseEngines.get(mode);
        if (engine == null) throw new InvalidModeException(mode.id(), registry.ids());
        return engine;
    }

}
