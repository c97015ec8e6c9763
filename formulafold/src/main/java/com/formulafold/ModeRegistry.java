// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package com.formulafold;

import com.formulafold.translate.CompactExcelTranslator;
import com.formulafold.translate.ExcelTranslator;
import com.formulafold.translate.JavaScriptTranslator;
import com.formulafold.translate.PythonTranslator;
import com.formulafold.translate.Translator;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * The translators of the available modes. This is immutable once built, and may be shared between threads.
 */
public final class ModeRegistry {

    private static final ModeRegistry defaultRegistry = new Builder()
            .register(Mode.JAVASCRIPT, new JavaScriptTranslator())
            .register(Mode.ANNOTATED, ExcelTranslator.annotated())
            .register(Mode.PLAIN, ExcelTranslator.plain())
            .register(Mode.COMPACT, new CompactExcelTranslator())
            .register(Mode.PYTHON, new PythonTranslator())
            .build();

    private final ImmutableMap<Mode, Translator> translators;

    private ModeRegistry(Map<Mode, Translator> translators) {
        this.translators = ImmutableMap.copyOf(translators);
    }

    /** Returns the registry of all modes with their standard translators */
    public static ModeRegistry defaultRegistry() { return defaultRegistry; }

    public static Builder builder() { return new Builder(); }

    /** Returns the registered modes, in registration order */
    public List<Mode> modes() { return translators.keySet().asList(); }

    public boolean isRegistered(Mode mode) { return translators.containsKey(mode); }

    /**
     * Returns the registered mode having the given id or alias.
     *
     * @throws InvalidModeException if no registered mode has this id
     */
    public Mode mode(String id) {
        Objects.requireNonNull(id, "id");
        for (Mode mode : translators.keySet())
            if (mode.isNamed(id)) return mode;
        throw new InvalidModeException(id, ids());
    }

    /**
     * Returns the translator of the given mode.
     *
     * @throws InvalidModeException if the mode is not registered
     */
    public Translator translator(Mode mode) {
        Translator translator = translators.get(Objects.requireNonNull(mode, "mode"));
        if (translator == null)
            throw new InvalidModeException(mode.id(), ids());
        return translator;
    }

    /** Returns the translator of the mode with the given id or alias */
    public Translator translator(String id) {
        return translator(mode(id));
    }

    /** Returns the ids of the registered modes, in registration order */
    public List<String> ids() {
        return translators.keySet().stream().map(Mode::id).collect(ImmutableList.toImmutableList());
    }

    @Override
    public String toString() { return "mode registry of " + ids(); }

    public static class Builder {

        private final Map<Mode, Translator> translators = new LinkedHashMap<>();

        /** Registers a translator for a mode, replacing any previous translator of that mode */
        public Builder register(Mode mode, Translator translator) {
            translators.put(Objects.requireNonNull(mode, "mode"), Objects.requireNonNull(translator, "translator"));
            return this;
        }

        public ModeRegistry build() { return new ModeRegistry(translators); }

    }

}
