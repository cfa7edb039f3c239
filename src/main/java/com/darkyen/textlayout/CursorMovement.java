package com.darkyen.textlayout;

import com.darkyen.textlayout.unicode.Graphemes;
import com.darkyen.textlayout.unicode.LineBreaking;
import com.darkyen.textlayout.unicode.WordSegmentation;

/**
 * Logical cursor movement, which depends only on the text.
 *
 * All methods accept any offset, which is clamped into the text and snapped to a grapheme boundary first.
 * Movement past either end of the text does nothing.
 * Visual line movement needs the layout, see {@link TextLayout#moveLeft(int, MovementUnit)}.
 */
public final class CursorMovement {

    private CursorMovement() {
    }

    /** @return start of the grapheme before offset, 0 at the start */
    public static int previousGrapheme(CharSequence text, int offset) {
        offset = Graphemes.snap(text, offset);
        if (offset == 0) return 0;
        return Graphemes.previousBoundary(text, offset);
    }

    /** @return end of the grapheme after offset, length of the text at the end */
    public static int nextGrapheme(CharSequence text, int offset) {
        offset = Graphemes.snap(text, offset);
        if (offset == text.length()) return offset;
        return Graphemes.nextBoundary(text, offset);
    }

    /** @return start of the last word which starts before offset, or 0 */
    public static int wordLeft(CharSequence text, int offset) {
        return WordSegmentation.previousWordStart(text, Graphemes.snap(text, offset));
    }

    /** @return end of the first word which ends after offset, or length of the text */
    public static int wordRight(CharSequence text, int offset) {
        return WordSegmentation.nextWordEnd(text, Graphemes.snap(text, offset));
    }

    /** @return start of the hard line which contains offset */
    public static int paragraphStart(CharSequence text, int offset) {
        return LineBreaking.paragraphStart(text, Graphemes.snap(text, offset));
    }

    /** @return end of the hard line which contains offset, before its line break */
    public static int paragraphEnd(CharSequence text, int offset) {
        offset = Graphemes.snap(text, offset);
        final int start = LineBreaking.paragraphStart(text, offset);
        final int end = LineBreaking.paragraphEnd(text, offset);
        if (end == start) return end;
        return end - LineBreaking.hardBreakLengthBefore(text, end);
    }

    /**
     * Move towards the start of the text.
     * {@link MovementUnit#LINE} moves to the start of the hard line.
     */
    public static int moveLeft(CharSequence text, int offset, MovementUnit unit) {
        switch (unit) {
            case CHARACTER:
                return previousGrapheme(text, offset);
            case WORD:
                return wordLeft(text, offset);
            case LINE:
                return paragraphStart(text, offset);
            case DOCUMENT:
                return 0;
            default:
                throw new IllegalArgumentException("Unknown unit: " + unit);
        }
    }

    /**
     * Move towards the end of the text.
     * {@link MovementUnit#LINE} moves to the end of the hard line.
     */
    public static int moveRight(CharSequence text, int offset, MovementUnit unit) {
        switch (unit) {
            case CHARACTER:
                return nextGrapheme(text, offset);
            case WORD:
                return wordRight(text, offset);
            case LINE:
                return paragraphEnd(text, offset);
            case DOCUMENT:
                return text.length();
            default:
                throw new IllegalArgumentException("Unknown unit: " + unit);
        }
    }
}
