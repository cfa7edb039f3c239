package com.darkyen.textlayout.font;

/** Provides metrics and glyph coverage for the {@link Shaper} it is used with.
 *
 * This font is immutable and may never change properties after construction (or loading). */
public interface Font <SelfFont extends Font<SelfFont>> {

    int MISSING_GLYPH_ID = 0;

    /** @return metrics in font units, never null
     * @see FontMetrics#scale(float) */
    FontMetrics getMetrics();

    /** @return true if this font (not its fallback) can display given code point */
    boolean hasGlyph(int codePoint);

    /** Get font that should be used when some character is not found in this font.
     * This may form an arbitrarily long chain, but must never cycle.
     * @return fallback font, or null if no such font exists */
    SelfFont getFallback();
}
