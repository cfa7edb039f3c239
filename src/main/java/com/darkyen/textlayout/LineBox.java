package com.darkyen.textlayout;

import com.badlogic.gdx.utils.Array;
import com.darkyen.textlayout.font.Font;
import com.darkyen.textlayout.font.ShapedRun;

import java.util.Arrays;

/**
 * A single visual line of a {@link TextLayout}.
 *
 * Coordinates are relative to the top left corner of the layout, Y goes down.
 * X coordinates are relative to the left edge of the line.
 *
 * Besides the shaped runs, each line holds its caret stops. For a line of N graphemes, there are N+1 caret slots,
 * ordered from left to right, and each slot holds exactly one offset of the line.
 * For left-to-right text the slots are the grapheme boundaries in order.
 *
 * Immutable once created, line boxes are shared between layouts through {@link LayoutCache}.
 */
public final class LineBox <F extends Font<F>> {

    /** Range of the line, including the trailing hard line break, if any. [start, end) */
    public final int start, end;
    /** Amount of chars at the end of the line which form its hard line break. 0, 1 or 2. */
    public final int breakLength;

    /** Full advance of the line content, trailing whitespace included. */
    public final float width;
    /** {@link #width} without the trailing whitespace. */
    public final float visibleWidth;

    public final float height;
    /** Distance from the line top to the baseline. */
    public final float baselineOffset;
    public final float ascent, descent, leading;
    /** Distance from the layout top to the line top. */
    public final float yOffset;

    /** Embedding level of the paragraph of this line. */
    public final byte paragraphLevel;
    /**
     * Shaped runs in visual order, from left to right. Trailing line break is not in any run.
     * <strong>DO NOT MODIFY.</strong>
     */
    public final Array<ShapedRun<F>> runs;

    /* Caret slots, left to right. */
    private final int[] stopOffsets;
    private final float[] stopX;
    /* Logical start of each grapheme, in visual order. Grapheme i lies between slots i and i + 1. */
    private final int[] graphemeStarts;

    /* Caret stops sorted by offset. */
    private final int[] sortedStopOffsets;
    private final float[] sortedStopX;

    LineBox(int start, int end, int breakLength,
            float width, float visibleWidth,
            float ascent, float descent, float leading, float yOffset,
            byte paragraphLevel, Array<ShapedRun<F>> runs,
            int[] stopOffsets, float[] stopX, int[] graphemeStarts) {
        assert start <= end;
        assert stopOffsets.length == stopX.length && stopOffsets.length == graphemeStarts.length + 1;
        this.start = start;
        this.end = end;
        this.breakLength = breakLength;
        this.width = width;
        this.visibleWidth = visibleWidth;
        this.ascent = ascent;
        this.descent = descent;
        this.leading = leading;
        this.height = ascent + descent + leading;
        this.baselineOffset = ascent;
        this.yOffset = yOffset;
        this.paragraphLevel = paragraphLevel;
        this.runs = runs;
        this.stopOffsets = stopOffsets;
        this.stopX = stopX;
        this.graphemeStarts = graphemeStarts;

        final int stops = stopOffsets.length;
        final long[] packed = new long[stops];
        for (int i = 0; i < stops; i++) {
            packed[i] = ((long) stopOffsets[i] << 32) | i;
        }
        Arrays.sort(packed);
        sortedStopOffsets = new int[stops];
        sortedStopX = new float[stops];
        for (int i = 0; i < stops; i++) {
            final int slot = (int) (packed[i] & 0xFFFF_FFFFL);
            sortedStopOffsets[i] = stopOffsets[slot];
            sortedStopX[i] = stopX[slot];
        }
    }

    /** @return end of the line without its hard line break */
    public int contentEnd() {
        return end - breakLength;
    }

    public boolean endsWithHardBreak() {
        return breakLength > 0;
    }

    /** @return distance from the layout top to the baseline */
    public float baselineY() {
        return yOffset + baselineOffset;
    }

    /** @return distance from the layout top to the line bottom */
    public float bottomY() {
        return yOffset + height;
    }

    /** @return true if the point lies within the line box */
    public boolean contains(float x, float y) {
        return y >= yOffset && y < bottomY() && x >= 0f && x <= width;
    }

    /** @return amount of caret slots, always at least one */
    public int getStopCount() {
        return stopOffsets.length;
    }

    /** @return offset of the caret slot, slots are ordered from left to right */
    public int getStopOffset(int slot) {
        return stopOffsets[slot];
    }

    /** @return X of the caret slot */
    public float getStopX(int slot) {
        return stopX[slot];
    }

    /** @return amount of graphemes on this line, without the hard line break */
    public int getGraphemeCount() {
        return graphemeStarts.length;
    }

    /** @return logical start offset of the visualIndex-th grapheme from the left */
    public int getGraphemeStart(int visualIndex) {
        return graphemeStarts[visualIndex];
    }

    /** @return offset of the leftmost caret slot */
    public int visualStartOffset() {
        return stopOffsets[0];
    }

    /** @return offset of the rightmost caret slot */
    public int visualEndOffset() {
        return stopOffsets[stopOffsets.length - 1];
    }

    /**
     * @return caret X of the offset, offsets which are not caret stops of this line use the nearest lower stop
     */
    public float xOfOffset(int offset) {
        int index = Arrays.binarySearch(sortedStopOffsets, offset);
        if (index < 0) {
            index = Math.max(-index - 2, 0);
        }
        return sortedStopX[index];
    }

    /**
     * @return true if the offset is one of the caret stops of this line
     */
    public boolean hasStop(int offset) {
        return Arrays.binarySearch(sortedStopOffsets, offset) >= 0;
    }

    /**
     * @return slot whose X is the nearest to x, the left one on a tie
     */
    public int nearestStop(float x) {
        final float[] stopX = this.stopX;
        int best = 0;
        float bestDistance = Math.abs(x - stopX[0]);
        for (int i = 1; i < stopX.length; i++) {
            final float distance = Math.abs(x - stopX[i]);
            if (distance < bestDistance) {
                best = i;
                bestDistance = distance;
            } else if (stopX[i] > x) {
                break;
            }
        }
        return best;
    }

    /** @return offset of the caret slot nearest to x */
    public int offsetAtX(float x) {
        return stopOffsets[nearestStop(x)];
    }

    /**
     * @return copy of this line, whose text range is moved by delta and its top by dy
     */
    LineBox<F> shifted(int delta, float dy) {
        if (delta == 0 && dy == 0f) return this;
        final Array<ShapedRun<F>> shiftedRuns = new Array<>(true, runs.size);
        for (ShapedRun<F> run : runs) {
            shiftedRuns.add(run.shifted(delta));
        }
        final int[] shiftedStops = new int[stopOffsets.length];
        for (int i = 0; i < shiftedStops.length; i++) {
            shiftedStops[i] = stopOffsets[i] + delta;
        }
        final int[] shiftedGraphemes = new int[graphemeStarts.length];
        for (int i = 0; i < shiftedGraphemes.length; i++) {
            shiftedGraphemes[i] = graphemeStarts[i] + delta;
        }
        return new LineBox<>(start + delta, end + delta, breakLength, width, visibleWidth,
                ascent, descent, leading, yOffset + dy, paragraphLevel, shiftedRuns,
                shiftedStops, stopX, shiftedGraphemes);
    }

    /**
     * Compare everything but the shaped runs.
     * @return true if both lines have the same range, metrics, position and caret stops
     */
    public boolean sameGeometry(LineBox<?> other) {
        return start == other.start && end == other.end && breakLength == other.breakLength
                && Float.compare(width, other.width) == 0 && Float.compare(visibleWidth, other.visibleWidth) == 0
                && Float.compare(height, other.height) == 0 && Float.compare(yOffset, other.yOffset) == 0
                && Float.compare(baselineOffset, other.baselineOffset) == 0
                && paragraphLevel == other.paragraphLevel
                && runs.size == other.runs.size
                && Arrays.equals(stopOffsets, other.stopOffsets) && Arrays.equals(stopX, other.stopX)
                && Arrays.equals(graphemeStarts, other.graphemeStarts);
    }

    @Override
    public String toString() {
        return "LineBox[" + start + ", " + end + ") y=" + yOffset + " w=" + width + " h=" + height + " runs=" + runs.size;
    }
}
