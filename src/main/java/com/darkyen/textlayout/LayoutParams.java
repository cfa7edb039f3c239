package com.darkyen.textlayout;

import com.darkyen.textlayout.bidi.BaseDirection;
import com.darkyen.textlayout.font.Font;

/**
 * Immutable settings of a {@link TextLayout}.
 * Two params are equal when all of their settings are, so they can be used as cache keys.
 */
public final class LayoutParams <F extends Font<F>> {

    /** Primary font, its fallback chain is used for characters it does not have. */
    public final F font;
    /** Font size in pixels per em. */
    public final float fontSize;
    /** Width at which the lines are wrapped. Zero, negative or infinite value means no limit. */
    public final float maxWidth;
    public final WrapMode wrapMode;
    public final BaseDirection baseDirection;

    public LayoutParams(F font, float fontSize) {
        this(font, fontSize, Float.POSITIVE_INFINITY, WrapMode.NO_WRAP, BaseDirection.AUTO);
    }

    public LayoutParams(F font, float fontSize, float maxWidth, WrapMode wrapMode, BaseDirection baseDirection) {
        if (font == null) throw new NullPointerException("font");
        if (wrapMode == null) throw new NullPointerException("wrapMode");
        if (baseDirection == null) throw new NullPointerException("baseDirection");
        if (!(fontSize > 0f) || Float.isInfinite(fontSize)) {
            throw new IllegalArgumentException("fontSize must be positive: "+fontSize);
        }
        this.font = font;
        this.fontSize = fontSize;
        this.maxWidth = maxWidth;
        this.wrapMode = wrapMode;
        this.baseDirection = baseDirection;
    }

    /** @return true if lines longer than {@link #maxWidth} are wrapped */
    public boolean wraps() {
        return wrapMode != WrapMode.NO_WRAP && maxWidth > 0f && maxWidth != Float.POSITIVE_INFINITY;
    }

    public LayoutParams<F> withFont(F font, float fontSize) {
        return new LayoutParams<>(font, fontSize, maxWidth, wrapMode, baseDirection);
    }

    public LayoutParams<F> withWrap(float maxWidth, WrapMode wrapMode) {
        return new LayoutParams<>(font, fontSize, maxWidth, wrapMode, baseDirection);
    }

    public LayoutParams<F> withBaseDirection(BaseDirection baseDirection) {
        return new LayoutParams<>(font, fontSize, maxWidth, wrapMode, baseDirection);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        final LayoutParams<?> that = (LayoutParams<?>) o;
        return Float.compare(that.fontSize, fontSize) == 0
                && Float.compare(that.maxWidth, maxWidth) == 0
                && font.equals(that.font)
                && wrapMode == that.wrapMode
                && baseDirection == that.baseDirection;
    }

    @Override
    public int hashCode() {
        int result = font.hashCode();
        result = 31 * result + Float.floatToIntBits(fontSize);
        result = 31 * result + Float.floatToIntBits(maxWidth);
        result = 31 * result + wrapMode.hashCode();
        result = 31 * result + baseDirection.hashCode();
        return result;
    }

    @Override
    public String toString() {
        return "LayoutParams{" + font + " " + fontSize + "px, maxWidth=" + maxWidth + ", " + wrapMode + ", " + baseDirection + '}';
    }
}
