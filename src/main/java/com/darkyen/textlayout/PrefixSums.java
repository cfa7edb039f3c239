package com.darkyen.textlayout;

import com.badlogic.gdx.utils.Array;

/**
 * Index of line ranges, for fast offset to line lookups.
 * Line starts and ends are stored in plain arrays, lookups by offset are binary searches over them.
 */
public final class PrefixSums {

    private final int[] lineStarts;
    private final int[] lineEnds;
    /* Amount of code points before each line, with one extra entry for the total. */
    private final int[] codePointOffsets;

    public PrefixSums(CharSequence text, Array<? extends LineBox<?>> lines) {
        final int count = lines.size;
        lineStarts = new int[count];
        lineEnds = new int[count];
        codePointOffsets = new int[count + 1];
        int codePoints = 0;
        for (int i = 0; i < count; i++) {
            final LineBox<?> line = lines.get(i);
            lineStarts[i] = line.start;
            lineEnds[i] = line.end;
            codePointOffsets[i] = codePoints;
            codePoints += Character.codePointCount(text, line.start, line.end);
        }
        codePointOffsets[count] = codePoints;
    }

    public int lineCount() {
        return lineStarts.length;
    }

    public int lineStart(int line) {
        return lineStarts[line];
    }

    /** @return end of the line, including its hard line break */
    public int lineEnd(int line) {
        return lineEnds[line];
    }

    /** @return amount of code points before the line */
    public int codePointOffset(int line) {
        return codePointOffsets[line];
    }

    /** @return amount of code points of the whole text */
    public int codePointCount() {
        return codePointOffsets[codePointOffsets.length - 1];
    }

    /**
     * @return index of the last line which starts at or before offset, 0 for negative offsets
     */
    public int lineAt(int offset) {
        return lastAtOrBefore(lineStarts, offset);
    }

    /**
     * @param codePoint index of a code point in the text
     * @return index of the last line which starts at or before the code point
     */
    public int lineAtCodePoint(int codePoint) {
        return lastAtOrBefore(codePointOffsets, lineStarts.length, codePoint);
    }

    private static int lastAtOrBefore(int[] sorted, int value) {
        return lastAtOrBefore(sorted, sorted.length, value);
    }

    private static int lastAtOrBefore(int[] sorted, int size, int value) {
        int low = 0, high = size - 1;
        int result = 0;
        while (low <= high) {
            final int mid = (low + high) >>> 1;
            if (sorted[mid] <= value) {
                result = mid;
                low = mid + 1;
            } else {
                high = mid - 1;
            }
        }
        return result;
    }
}
