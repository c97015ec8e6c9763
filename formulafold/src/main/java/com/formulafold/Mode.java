// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package com.formulafold;

import java.util.Locale;

/**
 * The notations a formula can be folded into. Each is identified by a short id and a longer alias.
 */
public enum Mode {

    /** JavaScript-like syntax, for syntax highlighting in editors */
    JAVASCRIPT("j", "javascript"),

    /** Excel syntax with a header and comments on functions */
    ANNOTATED("a", "annotated"),

    /** Excel syntax with indentation only */
    PLAIN("p", "plain"),

    /** Excel syntax with minimal spacing */
    COMPACT("c", "compact"),

    /** Python-like syntax, for syntax highlighting in editors */
    PYTHON("py", "python");

    private final String id;
    private final String alias;

    Mode(String id, String alias) {
        this.id = id;
        this.alias = alias;
    }

    public String id() { return id; }

    /** Returns whether the given id, in any case, is the id or alias of this */
    public boolean isNamed(String name) {
        String lowerCase = name.strip().toLowerCase(Locale.ROOT);
        return id.equals(lowerCase) || alias.equals(lowerCase);
    }

}
