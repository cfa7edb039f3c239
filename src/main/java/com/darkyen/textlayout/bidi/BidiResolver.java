package com.darkyen.textlayout.bidi;

import com.badlogic.gdx.utils.Array;
import com.ibm.icu.lang.UCharacter;

import java.text.Bidi;

/**
 * Resolution of bidirectional text according to <a href="https://www.unicode.org/reports/tr9/">UAX #9</a>,
 * backed by {@link Bidi}.
 *
 * Text is split into paragraphs on paragraph separators (LF, CR, CRLF, NEL, PS and information separators
 * U+001C..U+001E), each paragraph is resolved on its own.
 * Offsets are char indices.
 */
public final class BidiResolver {

    private BidiResolver() {
    }

    public static boolean isLevelLtr(byte level) {
        return (level & 1) == 0;
    }

    /**
     * @return true if c is of bidi class B
     */
    public static boolean isParagraphSeparator(char c) {
        return c == '\n' || c == '\r' || c == '\u0085' || c == '\u2029' || (c >= '\u001C' && c <= '\u001E');
    }

    /**
     * @return index right after the paragraph separator that ends the paragraph containing from, or length of the text
     */
    public static int paragraphEnd(CharSequence text, int from) {
        final int length = text.length();
        for (int i = from; i < length; i++) {
            final char c = text.charAt(i);
            if (isParagraphSeparator(c)) {
                if (c == '\r' && i + 1 < length && text.charAt(i + 1) == '\n') {
                    return i + 2;
                }
                return i + 1;
            }
        }
        return length;
    }

    /**
     * @return start of the paragraph containing index
     */
    public static int paragraphStart(CharSequence text, int index) {
        int i = Math.min(index, text.length());
        while (i > 0 && !isParagraphSeparator(text.charAt(i - 1))) {
            i--;
        }
        return i;
    }

    private static int flagsFor(BaseDirection base) {
        switch (base) {
            case LTR:
                return Bidi.DIRECTION_LEFT_TO_RIGHT;
            case RTL:
                return Bidi.DIRECTION_RIGHT_TO_LEFT;
            case AUTO:
            default:
                return Bidi.DIRECTION_DEFAULT_LEFT_TO_RIGHT;
        }
    }

    /**
     * Resolve text in [start, end) as a single paragraph.
     * The range may contain a paragraph separator only at its end.
     */
    public static ParagraphBidi resolveParagraph(CharSequence text, int start, int end, BaseDirection base) {
        if (text == null) throw new NullPointerException("text");
        if (base == null) throw new NullPointerException("base");
        if (start < 0 || start > end || end > text.length()) {
            throw new IndexOutOfBoundsException("["+start+", "+end+") not in [0, "+text.length()+")");
        }

        final int length = end - start;
        if (length == 0) {
            return new ParagraphBidi(start, end, (byte) (base == BaseDirection.RTL ? 1 : 0), false, null);
        }

        final char[] chars = new char[length];
        if (text instanceof String) {
            ((String) text).getChars(start, end, chars, 0);
        } else {
            for (int i = 0; i < length; i++) {
                chars[i] = text.charAt(start + i);
            }
        }

        if (base != BaseDirection.RTL && !Bidi.requiresBidi(chars, 0, length)) {
            // Fast path, everything is left-to-right
            return new ParagraphBidi(start, end, (byte) 0, false, null);
        }

        final Bidi bidi = new Bidi(chars, 0, null, 0, length, flagsFor(base));
        final byte level = (byte) bidi.getBaseLevel();
        if (bidi.isMixed()) {
            return new ParagraphBidi(start, end, level, true, bidi);
        }
        // Uniform levels may still differ from the base level, for example LTR text in RTL paragraph
        final byte uniformLevel = (byte) bidi.getLevelAt(0);
        if (uniformLevel == level) {
            return new ParagraphBidi(start, end, level, false, null);
        }
        return new ParagraphBidi(start, end, level, true, bidi);
    }

    /**
     * Partition text into paragraphs and resolve each of them.
     * Empty text has a single empty paragraph.
     */
    public static Array<ParagraphBidi> paragraphs(CharSequence text, BaseDirection base) {
        if (text == null) throw new NullPointerException("text");
        final Array<ParagraphBidi> result = new Array<>(true, 4, ParagraphBidi.class);
        final int length = text.length();
        if (length == 0) {
            result.add(resolveParagraph(text, 0, 0, base));
            return result;
        }
        int start = 0;
        while (start < length) {
            final int end = paragraphEnd(text, start);
            result.add(resolveParagraph(text, start, end, base));
            start = end;
        }
        return result;
    }

    /**
     * @return embedding level of each char of the text, chars of a surrogate pair share the level
     */
    public static byte[] levelsPerChar(CharSequence text, BaseDirection base) {
        if (text == null) throw new NullPointerException("text");
        final byte[] levels = new byte[text.length()];
        for (ParagraphBidi paragraph : paragraphs(text, base)) {
            for (int i = paragraph.start; i < paragraph.end; i++) {
                levels[i] = paragraph.levelAt(i);
            }
        }
        return levels;
    }

    private static ParagraphBidi paragraphOfLine(CharSequence text, BaseDirection base, int lineStart, int lineEnd) {
        if (text == null) throw new NullPointerException("text");
        if (lineStart < 0 || lineStart > lineEnd || lineEnd > text.length()) {
            throw new IndexOutOfBoundsException("["+lineStart+", "+lineEnd+") not in [0, "+text.length()+")");
        }
        final int paragraphStart = paragraphStart(text, lineStart);
        final int paragraphEnd = paragraphEnd(text, paragraphStart);
        if (lineEnd > paragraphEnd) {
            throw new IllegalArgumentException("Line ["+lineStart+", "+lineEnd+") crosses paragraph boundary at "+paragraphEnd);
        }
        return resolveParagraph(text, paragraphStart, paragraphEnd, base);
    }

    /**
     * Resolve a single line.
     * @throws IllegalArgumentException if the line does not lie within a single paragraph
     */
    public static VisualRuns visualRuns(CharSequence text, BaseDirection base, int lineStart, int lineEnd) {
        return paragraphOfLine(text, base, lineStart, lineEnd).visualRuns(lineStart, lineEnd);
    }

    /**
     * Map visual position of each code point of the line to its logical position.
     * Indices count code points from lineStart, not chars.
     * @return permutation, where result[visualIndex] = logicalIndex
     * @throws IllegalArgumentException if the line does not lie within a single paragraph
     */
    public static int[] visualIndexMap(CharSequence text, BaseDirection base, int lineStart, int lineEnd) {
        final VisualRuns runs = visualRuns(text, base, lineStart, lineEnd);
        final int count = Character.codePointCount(text, lineStart, lineEnd);
        final byte[] levels = new byte[count];
        final Integer[] indices = new Integer[count];
        for (int i = lineStart, c = 0; i < lineEnd; c++) {
            levels[c] = runs.levels[i - lineStart];
            indices[c] = c;
            i += Character.charCount(Character.codePointAt(text, i));
        }
        Bidi.reorderVisually(levels, 0, indices, 0, count);

        final int[] result = new int[count];
        for (int i = 0; i < count; i++) {
            result[i] = indices[i];
        }
        return result;
    }

    /**
     * @return code point which should be displayed instead of codePoint in right-to-left runs, codePoint itself if none
     */
    public static int mirroredBracket(int codePoint) {
        return UCharacter.getMirror(codePoint);
    }

    /**
     * @return characters of the line in visual order, with mirrored characters in right-to-left runs
     */
    public static String reorderLine(CharSequence text, BaseDirection base, int lineStart, int lineEnd) {
        final VisualRuns visualRuns = visualRuns(text, base, lineStart, lineEnd);
        final StringBuilder sb = new StringBuilder(lineEnd - lineStart);
        for (BidiRun run : visualRuns.runs) {
            if (run.isLtr()) {
                sb.append(text, run.start, run.end);
            } else {
                for (int i = run.end; i > run.start; ) {
                    final int codePoint = Character.codePointBefore(text, i);
                    sb.appendCodePoint(mirroredBracket(codePoint));
                    i -= Character.charCount(codePoint);
                }
            }
        }
        return sb.toString();
    }
}
