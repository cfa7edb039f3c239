package com.darkyen.textlayout.unicode;

import com.badlogic.gdx.utils.Array;
import com.badlogic.gdx.utils.IntArray;
import com.darkyen.textlayout.util.CharSequenceIterator;
import com.ibm.icu.text.BreakIterator;
import com.ibm.icu.util.ULocale;

/**
 * Extended grapheme cluster segmentation, as specified by
 * <a href="https://www.unicode.org/reports/tr29/">UAX #29</a>.
 *
 * All methods are thread safe. Offsets are char indices.
 */
public final class Graphemes {

    private static final BreakIterator PROTOTYPE = BreakIterator.getCharacterInstance(ULocale.ROOT);

    private Graphemes() {
    }

    /**
     * @return new iterator over the grapheme boundaries of text in [start, end), which reports indices into the whole text
     */
    public static BreakIterator iterator(CharSequence text, int start, int end) {
        final BreakIterator iterator = (BreakIterator) PROTOTYPE.clone();
        iterator.setText(new CharSequenceIterator(text, start, end));
        return iterator;
    }

    /**
     * @return ordered, non-overlapping clusters covering the whole text
     */
    public static Array<GraphemeCluster> clusters(CharSequence text) {
        if (text == null) throw new NullPointerException("text");
        final Array<GraphemeCluster> result = new Array<>(true, text.length(), GraphemeCluster.class);
        if (text.length() == 0) {
            return result;
        }

        final BreakIterator iterator = iterator(text, 0, text.length());
        int start = iterator.first();
        for (int end = iterator.next(); end != BreakIterator.DONE; end = iterator.next()) {
            result.add(new GraphemeCluster(start, end));
            start = end;
        }
        return result;
    }

    /**
     * Add all grapheme boundaries in [start, end] (both ends included) to out, in ascending order.
     */
    public static void boundaries(CharSequence text, int start, int end, IntArray out) {
        if (text == null) throw new NullPointerException("text");
        if (start < 0 || start > end || end > text.length()) {
            throw new IndexOutOfBoundsException("["+start+", "+end+") not in [0, "+text.length()+")");
        }
        out.add(start);
        if (start == end) {
            return;
        }
        final BreakIterator iterator = iterator(text, start, end);
        iterator.first();
        for (int b = iterator.next(); b != BreakIterator.DONE; b = iterator.next()) {
            out.add(b);
        }
    }

    /**
     * @return true if offset lies on a boundary between two clusters, or on either end of the text
     */
    public static boolean isBoundary(CharSequence text, int offset) {
        if (text == null) throw new NullPointerException("text");
        final int length = text.length();
        if (offset < 0 || offset > length) {
            return false;
        }
        if (offset == 0 || offset == length) {
            return true;
        }
        // Cheap checks first
        final char before = text.charAt(offset - 1);
        final char after = text.charAt(offset);
        if (Character.isHighSurrogate(before) && Character.isLowSurrogate(after)) {
            return false;
        }
        return iterator(text, 0, length).isBoundary(offset);
    }

    /**
     * @return greatest boundary strictly less than offset, or -1 if there is no such boundary
     */
    public static int previousBoundary(CharSequence text, int offset) {
        if (text == null) throw new NullPointerException("text");
        if (offset <= 0) {
            return -1;
        }
        final int length = text.length();
        if (offset > length) {
            offset = length;
        }
        final int result = iterator(text, 0, length).preceding(offset);
        return result == BreakIterator.DONE ? -1 : result;
    }

    /**
     * @return least boundary strictly greater than offset, or -1 if there is no such boundary
     */
    public static int nextBoundary(CharSequence text, int offset) {
        if (text == null) throw new NullPointerException("text");
        final int length = text.length();
        if (offset >= length) {
            return -1;
        }
        if (offset < 0) {
            return 0;
        }
        final int result = iterator(text, 0, length).following(offset);
        return result == BreakIterator.DONE ? -1 : result;
    }

    /**
     * Clamp offset into the text and move it to the nearest boundary at or before it.
     * @return always a valid boundary
     */
    public static int snap(CharSequence text, int offset) {
        if (text == null) throw new NullPointerException("text");
        final int length = text.length();
        if (offset <= 0) return 0;
        if (offset >= length) return length;
        if (isBoundary(text, offset)) {
            return offset;
        }
        return previousBoundary(text, offset);
    }

    /**
     * @return amount of grapheme clusters in the text
     */
    public static int count(CharSequence text) {
        if (text == null) throw new NullPointerException("text");
        if (text.length() == 0) return 0;
        final BreakIterator iterator = iterator(text, 0, text.length());
        int count = 0;
        iterator.first();
        while (iterator.next() != BreakIterator.DONE) {
            count++;
        }
        return count;
    }
}
