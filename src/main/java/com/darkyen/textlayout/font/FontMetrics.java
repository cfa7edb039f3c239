package com.darkyen.textlayout.font;

/** Vertical metrics of a font.
 * Values are either in font units (as returned by {@link Font#getMetrics()}) or in pixels (after {@link #scale(float)}).
 * Ascent and descent are both positive, ascent goes up from the baseline, descent goes down. */
public final class FontMetrics {

    public final float ascent;
    public final float descent;
    /** Recommended extra space between lines. */
    public final float lineGap;
    /** Size of the em square, in the same units as other values. */
    public final float unitsPerEm;
    public final float capHeight;
    public final float xHeight;

    public FontMetrics(float ascent, float descent, float lineGap, float unitsPerEm, float capHeight, float xHeight) {
        if (!(unitsPerEm > 0f)) {
            throw new IllegalArgumentException("unitsPerEm must be positive: "+unitsPerEm);
        }
        this.ascent = ascent;
        this.descent = descent;
        this.lineGap = lineGap;
        this.unitsPerEm = unitsPerEm;
        this.capHeight = capHeight;
        this.xHeight = xHeight;
    }

    /** @return ascent + descent + lineGap */
    public float lineHeight() {
        return ascent + descent + lineGap;
    }

    /** @param sizePx pixel size of the em square
     * @return metrics in pixels */
    public FontMetrics scale(float sizePx) {
        final float factor = sizePx / unitsPerEm;
        return new FontMetrics(ascent * factor, descent * factor, lineGap * factor, sizePx, capHeight * factor, xHeight * factor);
    }

    /** @return pixel size of a font of given point size on a screen with given DPI */
    public static float pointsToPixels(float points, float dpi) {
        return points * dpi / 72f;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        final FontMetrics that = (FontMetrics) o;
        return Float.compare(that.ascent, ascent) == 0
                && Float.compare(that.descent, descent) == 0
                && Float.compare(that.lineGap, lineGap) == 0
                && Float.compare(that.unitsPerEm, unitsPerEm) == 0
                && Float.compare(that.capHeight, capHeight) == 0
                && Float.compare(that.xHeight, xHeight) == 0;
    }

    @Override
    public int hashCode() {
        int result = Float.floatToIntBits(ascent);
        result = 31 * result + Float.floatToIntBits(descent);
        result = 31 * result + Float.floatToIntBits(lineGap);
        result = 31 * result + Float.floatToIntBits(unitsPerEm);
        return result;
    }

    @Override
    public String toString() {
        return "FontMetrics{ascent=" + ascent + ", descent=" + descent + ", lineGap=" + lineGap + ", unitsPerEm=" + unitsPerEm + '}';
    }
}
