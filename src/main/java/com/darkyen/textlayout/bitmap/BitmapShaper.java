package com.darkyen.textlayout.bitmap;

import com.badlogic.gdx.utils.FloatArray;
import com.badlogic.gdx.utils.IntArray;
import com.darkyen.textlayout.font.Font;
import com.darkyen.textlayout.font.ShapedRun;
import com.darkyen.textlayout.font.Shaper;
import com.darkyen.textlayout.unicode.LineBreaking;

/** Shaper for {@link BitmapFont}s: each code point maps to the glyph of the same ID, with kerning between neighbours.
 *
 * Tab advances to the next multiple of 8 space widths, measured from the start of the run. */
public final class BitmapShaper implements Shaper<BitmapFont> {

    /** This shaper has no state, so it is exposed as stateless singleton. */
    private BitmapShaper() {
    }

    /** The only instance of this shaper. */
    public static final BitmapShaper INSTANCE = new BitmapShaper();

    @Override
    public ShapedRun<BitmapFont> shape(CharSequence text, int start, int end, BitmapFont font, float sizePx, byte level) {
        final float scale = sizePx / font.getMetrics().unitsPerEm;
        final int length = end - start;

        final IntArray glyphs = new IntArray(true, length);
        final FloatArray glyphX = new FloatArray(true, length);
        final FloatArray glyphY = new FloatArray(true, length);
        final IntArray clusters = new IntArray(true, length);

        BitmapFont.BitmapGlyph lastGlyph = null;
        float penX = 0;
        for (int i = start; i < end; ) {
            final int cluster = i - start;
            final int codepoint;
            {
                final char c = text.charAt(i);
                if (Character.isHighSurrogate(c) && i + 1 < end && Character.isLowSurrogate(text.charAt(i + 1))) {
                    codepoint = Character.toCodePoint(c, text.charAt(i + 1));
                    i += 2;
                } else if (Character.isSurrogate(c)) {
                    // Either unexpected low surrogate or incomplete high surrogate, so this is a broken character
                    codepoint = '\uFFFD'; // https://en.wikipedia.org/wiki/Specials_(Unicode_block)#Replacement_character
                    i++;
                } else {
                    codepoint = c;
                    i++;
                }
            }

            if (codepoint <= Character.MAX_VALUE && LineBreaking.isHardBreak((char) codepoint)) {
                // Line breaks are never visible
                lastGlyph = null;
                continue;
            }

            if (codepoint == '\t') {
                final float tabAdvance = font.spaceXAdvance * 8f * scale;
                if (tabAdvance > 0f) {
                    final float nextStop = ((int) (penX / tabAdvance) + 1) * tabAdvance;
                    glyphs.add(ShapedRun.NO_GLYPH);
                    glyphX.add(penX);
                    glyphY.add(0f);
                    clusters.add(cluster);
                    penX = nextStop;
                }
                lastGlyph = null;
                continue;
            }

            BitmapFont.BitmapGlyph glyph = font.getGlyph(codepoint);
            if (glyph == null) {
                byte handling = missingGlyphHandling(codepoint);
                if (handling < 0) {
                    glyph = font.getGlyph(Font.MISSING_GLYPH_ID);
                    if (glyph == null) {
                        // Missing glyph and no replacement, ignore it
                        continue;
                    }
                } else if (handling == 0) {
                    // Fully ignored
                    continue;
                } else {
                    // Just advance and continue
                    glyphs.add(ShapedRun.NO_GLYPH);
                    glyphX.add(penX);
                    glyphY.add(0f);
                    clusters.add(cluster);
                    penX += font.spaceXAdvance * (handling / 8f) * scale;
                    lastGlyph = null;
                    continue;
                }
            }

            if (lastGlyph != null) {
                penX += font.getKerning(lastGlyph, glyph) * scale;
            }
            glyphs.add(glyph.glyphId);
            glyphX.add(penX);
            glyphY.add(glyph.yOffset * scale);
            clusters.add(cluster);
            penX += glyph.xAdvance * scale;
            lastGlyph = glyph;
        }

        // Kerning belongs to the advance of the glyph before it
        final FloatArray advances = new FloatArray(true, glyphs.size);
        for (int g = 0; g < glyphs.size; g++) {
            final float next = g + 1 < glyphs.size ? glyphX.get(g + 1) : penX;
            advances.add(next - glyphX.get(g));
        }

        return new ShapedRun<>(start, end, font, sizePx, level, ShapedRun.detectScript(text, start, end),
                glyphs, glyphX, glyphY, advances, clusters, penX);
    }

    static boolean isIgnorableCodepoint(int codepoint) {
        /*
        https://www.unicode.org/reports/tr44/#Default_Ignorable_Code_Point
        Generated from: Other_Default_Ignorable_Code_Point
        + Cf (format characters)
        + Variation_Selector
        - White_Space (NOTE: Here omitted as handled elsewhere)
        - FFF9..FFFB (annotation characters)
        - 0600..0605, 06DD, 070F, 08E2, 110BD (exceptional Cf characters that should be visible)
         */
        return (codepoint == 0x034F
                || (codepoint >= 0x115F && codepoint <= 0x1160)
                || (codepoint >= 0x17B4 && codepoint <= 0x17B5)
                || codepoint == 0x3164
                || codepoint == 0xFFA0
                || (codepoint >= 0x180B && codepoint <= 0x180D)
                || (codepoint >= 0xFE00 && codepoint <= 0xFE0F)
                || (codepoint >= 0xE0100 && codepoint <= 0xE01EF))
                || (Character.getType(codepoint) == Character.FORMAT)
                && !(
                    (codepoint >= 0xFFF9 && codepoint <= 0xFFFB)
                 || (codepoint >= 0x0600 && codepoint <= 0x0605)
                 || codepoint == 0x06DD
                 || codepoint == 0x070F
                 || codepoint == 0x08E2
                 || codepoint == 0x110BD
                );
    }

    /** Call when glyph for particular unicode codepoint is missing, to determine how it should be handled.
     *
     * If returned value is -1, show .nodef (glyph 0).
     * If returned value is 0, ignore codepoint completely (as a zero-width character)
     * If returned value is positive, divide by eight and multiply by default space advance and use that as X advance */
    static byte missingGlyphHandling(int codepoint) {
        // https://www.unicode.org/faq/unsup_char.html
        if (Character.isWhitespace(codepoint) || Character.isSpaceChar(codepoint)) {
            // Try to guess some character widths
            // Values from http://jkorpela.fi/chars/spaces.html
            switch (codepoint) {
                // Unit here is 1em = 32, 1en = 16
                case 0x0020: return 8;//SPACE
                case 0x00A0: return 8;//NO-BREAK SPACE
                case 0x2000: return 16;//EN QUAD
                case 0x2001: return 32;//EM QUAD
                case 0x2002: return 16;//EN SPACE
                case 0x2003: return 32;//EM SPACE
                case 0x2004: return 11;//THREE-PER-EM SPACE
                case 0x2005: return 8;//FOUR-PER-EM SPACE
                case 0x2006: return 5;//SIX-PER-EM SPACE
                case 0x2007: return 8;//FIGURE SPACE (arbitrary)
                case 0x2008: return 4;//PUNCTUATION SPACE (arbitrary)
                case 0x2009: return 6;//THIN SPACE
                case 0x200A: return 3;//HAIR SPACE
                case 0x202F: return 6;//NARROW NO-BREAK SPACE
                case 0x205F: return 7;//MEDIUM MATHEMATICAL SPACE
                case 0x3000: return 10;//IDEOGRAPHIC SPACE (arbitrary)
                default: return 8;
            }
        } else if (isIgnorableCodepoint(codepoint)) {
            return 0;
        } else {
            return -1;
        }
    }
}
