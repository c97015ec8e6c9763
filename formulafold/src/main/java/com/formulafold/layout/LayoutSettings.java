// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package com.formulafold.layout;

import com.google.common.base.Preconditions;

/**
 * Immutable tuning of the line breaking done by a {@link LayoutEngine}.
 * Widths are counted in characters, including indentation where that is stated.
 */
public final class LayoutSettings {

    private static final LayoutSettings defaults = new Builder().build();

    private final int inlineWidth;
    private final int wrapWidth;
    private final int maxArgumentsPerLine;

    private LayoutSettings(Builder builder) {
        this.inlineWidth = builder.inlineWidth;
        this.wrapWidth = builder.wrapWidth;
        this.maxArgumentsPerLine = builder.maxArgumentsPerLine;
    }

    /** The max width of a call with a single argument which is kept on one line, not including indentation */
    public int inlineWidth() { return inlineWidth; }

    /** The max width, including indentation, of a line of packed AND/OR arguments */
    public int wrapWidth() { return wrapWidth; }

    /** The max number of AND/OR arguments packed on one line */
    public int maxArgumentsPerLine() { return maxArgumentsPerLine; }

    public static LayoutSettings defaults() { return defaults; }

    public static Builder builder() { return new Builder(); }

    @Override
    public String toString() {
        return "layout settings: inline width " + inlineWidth + ", wrap width " + wrapWidth +
               ", max arguments per line " + maxArgumentsPerLine;
    }

    public static class Builder {

        private int inlineWidth = 40;
        private int wrapWidth = 76;
        private int maxArgumentsPerLine = 3;

        public Builder inlineWidth(int inlineWidth) {
            Preconditions.checkArgument(inlineWidth > 0, "inlineWidth must be positive, but was %s", inlineWidth);
            this.inlineWidth = inlineWidth;
            return this;
        }

        public Builder wrapWidth(int wrapWidth) {
            Preconditions.checkArgument(wrapWidth > 0, "wrapWidth must be positive, but was %s", wrapWidth);
            this.wrapWidth = wrapWidth;
            return this;
        }

        public Builder maxArgumentsPerLine(int maxArgumentsPerLine) {
            Preconditions.checkArgument(maxArgumentsPerLine > 0,
                                        "maxArgumentsPerLine must be positive, but was %s", maxArgumentsPerLine);
            this.maxArgumentsPerLine = maxArgumentsPerLine;
            return this;
        }

        public LayoutSettings build() { return new LayoutSettings(this); }

    }

}
