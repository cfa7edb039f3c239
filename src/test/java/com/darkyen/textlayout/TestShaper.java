package com.darkyen.textlayout;

import com.badlogic.gdx.utils.FloatArray;
import com.badlogic.gdx.utils.IntArray;
import com.darkyen.textlayout.font.ShapedRun;
import com.darkyen.textlayout.font.Shaper;
import com.darkyen.textlayout.unicode.LineBreaking;

/**
 * Each code point is one em wide (10 px at 10 px size), except combining marks, format characters
 * and line breaks, which have no width.
 */
public final class TestShaper implements Shaper<TestFont> {

    public static final TestShaper INSTANCE = new TestShaper();

    public int shapedRuns = 0;

    @Override
    public ShapedRun<TestFont> shape(CharSequence text, int start, int end, TestFont font, float sizePx, byte level) {
        shapedRuns++;
        final IntArray glyphs = new IntArray();
        final FloatArray glyphX = new FloatArray();
        final FloatArray glyphY = new FloatArray();
        final FloatArray advances = new FloatArray();
        final IntArray clusters = new IntArray();

        float penX = 0f;
        for (int i = start; i < end; ) {
            final int codePoint = Character.codePointAt(text, i);
            final float advance = isZeroWidth(codePoint) ? 0f : sizePx;
            glyphs.add(codePoint);
            glyphX.add(penX);
            glyphY.add(0f);
            advances.add(advance);
            clusters.add(i - start);
            penX += advance;
            i += Character.charCount(codePoint);
        }
        return new ShapedRun<>(start, end, font, sizePx, level, ShapedRun.detectScript(text, start, end),
                glyphs, glyphX, glyphY, advances, clusters, penX);
    }

    public static boolean isZeroWidth(int codePoint) {
        if (codePoint <= Character.MAX_VALUE && LineBreaking.isHardBreak((char) codePoint)) {
            return true;
        }
        final int type = Character.getType(codePoint);
        return type == Character.NON_SPACING_MARK || type == Character.ENCLOSING_MARK || type == Character.FORMAT;
    }
}
