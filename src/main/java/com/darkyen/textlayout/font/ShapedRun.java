package com.darkyen.textlayout.font;

import com.badlogic.gdx.utils.FloatArray;
import com.badlogic.gdx.utils.IntArray;
import com.darkyen.textlayout.bidi.BidiResolver;
import com.ibm.icu.lang.UScript;

/** Glyphs of a single font and direction, produced by a {@link Shaper}.
 *
 * Glyphs are stored in logical order. Pen positions in {@link #glyphX} are measured along the writing direction
 * from the logical start of the run, which is its left edge for LTR runs and its right edge for RTL runs.
 * Use {@link #visualGlyphX(int)} to get the offset from the left edge.
 *
 * <strong>DO NOT MODIFY THE CONTENTS</strong> of the arrays, runs are shared between line boxes and layout caches.
 *
 * @param <F> Font that is used in the run */
public final class ShapedRun<F extends Font<F>> {

    /** Glyph ID of entries which only advance the pen, for example spaces missing from the font. */
    public static final int NO_GLYPH = -1;

    /** Range of the text, which is drawn in this run. [start, end) */
    public final int start, end;
    /** Font used by the run. */
    public final F font;
    /** Size of the font, in pixels per em. */
    public final float fontSize;
    /** Bidi embedding level of the run. */
    public final byte level;
    /** {@link UScript} code of the run. */
    public final int script;

    /** Glyph IDs, or {@link #NO_GLYPH}. */
    public final IntArray glyphs;
    /** Pen position of each glyph, relative to the logical start of the run. */
    public final FloatArray glyphX;
    /** Vertical offset of each glyph from the baseline, positive goes up. */
    public final FloatArray glyphY;
    /** Distance from the pen position of each glyph to the pen position of the next glyph (or run end). */
    public final FloatArray advances;
    /** Index of the first char of each glyph's cluster, relative to {@link #start}. Never decreasing. */
    public final IntArray clusters;
    /** Sum of all advances. */
    public final float width;

    /** X coordinate of the left edge of the run, relative to the start of the line. Set during line layout. */
    public float x;

    public ShapedRun(int start, int end, F font, float fontSize, byte level, int script,
                     IntArray glyphs, FloatArray glyphX, FloatArray glyphY, FloatArray advances, IntArray clusters, float width) {
        assert start <= end;
        assert glyphs.size == glyphX.size && glyphs.size == glyphY.size && glyphs.size == advances.size && glyphs.size == clusters.size;
        this.start = start;
        this.end = end;
        this.font = font;
        this.fontSize = fontSize;
        this.level = level;
        this.script = script;
        this.glyphs = glyphs;
        this.glyphX = glyphX;
        this.glyphY = glyphY;
        this.advances = advances;
        this.clusters = clusters;
        this.width = width;
    }

    public boolean isLtr() {
        return BidiResolver.isLevelLtr(level);
    }

    /** @return amount of glyphs */
    public int size() {
        return glyphs.size;
    }

    /** @return total advance of glyphs whose clusters start in [from, to), indices into the text */
    public float advanceOf(int from, int to) {
        final int[] clusters = this.clusters.items;
        final float[] advances = this.advances.items;
        final int relativeFrom = from - start, relativeTo = to - start;
        float result = 0f;
        for (int i = 0, n = this.clusters.size; i < n; i++) {
            final int cluster = clusters[i];
            if (cluster >= relativeTo) break;
            if (cluster >= relativeFrom) {
                result += advances[i];
            }
        }
        return result;
    }

    /** @return X of the left edge of glyph's advance box, relative to {@link #x} */
    public float visualGlyphX(int glyph) {
        if (isLtr()) {
            return glyphX.get(glyph);
        }
        return width - glyphX.get(glyph) - advances.get(glyph);
    }

    /** @return copy of this run, moved by delta chars in the text, sharing glyph data */
    public ShapedRun<F> shifted(int delta) {
        if (delta == 0) return this;
        final ShapedRun<F> result = new ShapedRun<>(start + delta, end + delta, font, fontSize, level, script,
                glyphs, glyphX, glyphY, advances, clusters, width);
        result.x = x;
        return result;
    }

    /** @return {@link UScript} code of the first character in [start, end) which has a real script,
     * {@link UScript#COMMON} if there is none */
    public static int detectScript(CharSequence text, int start, int end) {
        for (int i = start; i < end; ) {
            final int codePoint = Character.codePointAt(text, i);
            final int script = UScript.getScript(codePoint);
            if (script != UScript.COMMON && script != UScript.INHERITED && script != UScript.UNKNOWN) {
                return script;
            }
            i += Character.charCount(codePoint);
        }
        return UScript.COMMON;
    }

    @Override
    public String toString() {
        return "ShapedRun["+start+", "+end+")@"+level+" x="+x+" w="+width+" glyphs="+glyphs.size;
    }
}
