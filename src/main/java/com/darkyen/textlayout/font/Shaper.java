package com.darkyen.textlayout.font;

/** Converts text into positioned glyphs of a font.
 *
 * Implementations must be stateless or thread safe, and shaping of a loaded font can't fail. */
public interface Shaper <F extends Font<F>> {

    /** Shape text in [start, end) with a single font.
     * The range never contains hard line breaks in the middle.
     *
     * @param sizePx size of the font, in pixels per em
     * @param level bidi embedding level of the whole range
     * @return shaped run with glyphs in logical order, never null */
    ShapedRun<F> shape(CharSequence text, int start, int end, F font, float sizePx, byte level);
}
