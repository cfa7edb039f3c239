package com.darkyen.textlayout.bidi;

import com.badlogic.gdx.utils.Array;

import java.text.Bidi;
import java.util.Arrays;

/**
 * Bidirectional resolution of a single paragraph.
 *
 * Lines of the paragraph are resolved through {@link #visualRuns(int, int)}, which applies the line rules
 * (trailing whitespace takes the paragraph level) and visual reordering.
 */
public final class ParagraphBidi {

    /** Range of the paragraph, including its paragraph separator, [start, end) */
    public final int start, end;
    /** Paragraph embedding level, 0 for left-to-right, 1 for right-to-left. */
    public final byte level;
    /** Direction according to the paragraph level. */
    public final ParagraphDirection direction;
    /** Whether the paragraph contains characters on more than one embedding level. */
    public final boolean mixed;

    /** Null when the whole paragraph is on {@link #level}. */
    private final Bidi bidi;

    ParagraphBidi(int start, int end, byte level, boolean mixed, Bidi bidi) {
        this.start = start;
        this.end = end;
        this.level = level;
        this.direction = BidiResolver.isLevelLtr(level) ? ParagraphDirection.LTR : ParagraphDirection.RTL;
        this.mixed = mixed;
        this.bidi = bidi;
    }

    /**
     * @return {@link ParagraphDirection#MIXED} if the paragraph is {@link #mixed}, {@link #direction} otherwise
     */
    public ParagraphDirection resolvedDirection() {
        return mixed ? ParagraphDirection.MIXED : direction;
    }

    /**
     * @param index of a char in the paragraph
     * @return its embedding level, without line rules
     */
    public byte levelAt(int index) {
        if (index < start || index >= end) {
            throw new IndexOutOfBoundsException(index+" not in ["+start+", "+end+")");
        }
        if (bidi == null) {
            return level;
        }
        return (byte) bidi.getLevelAt(index - start);
    }

    /**
     * Resolve a line of this paragraph.
     * @param lineStart inclusive, in [{@link #start}, {@link #end}]
     * @param lineEnd exclusive, in [lineStart, {@link #end}]
     */
    public VisualRuns visualRuns(int lineStart, int lineEnd) {
        if (lineStart < start || lineEnd > end || lineStart > lineEnd) {
            throw new IllegalArgumentException("Line ["+lineStart+", "+lineEnd+") is not within paragraph ["+start+", "+end+")");
        }
        final int length = lineEnd - lineStart;
        final Array<BidiRun> runs = new Array<>(true, 4, BidiRun.class);
        final byte[] levels = new byte[length];
        if (length == 0) {
            return new VisualRuns(lineStart, levels, runs);
        }

        if (bidi == null) {
            Arrays.fill(levels, level);
            runs.add(new BidiRun(lineStart, lineEnd, level));
            return new VisualRuns(lineStart, levels, runs);
        }

        final Bidi lineBidi = bidi.createLineBidi(lineStart - start, lineEnd - start);
        for (int i = 0; i < length; i++) {
            levels[i] = (byte) lineBidi.getLevelAt(i);
        }

        final int runCount = lineBidi.getRunCount();
        final BidiRun[] logicalRuns = new BidiRun[runCount];
        final byte[] runLevels = new byte[runCount];
        for (int r = 0; r < runCount; r++) {
            final byte runLevel = (byte) lineBidi.getRunLevel(r);
            logicalRuns[r] = new BidiRun(lineStart + lineBidi.getRunStart(r), lineStart + lineBidi.getRunLimit(r), runLevel);
            runLevels[r] = runLevel;
        }
        Bidi.reorderVisually(runLevels, 0, logicalRuns, 0, runCount);
        runs.addAll(logicalRuns, 0, runCount);
        return new VisualRuns(lineStart, levels, runs);
    }

    @Override
    public String toString() {
        return "["+start+", "+end+")@"+level+" "+resolvedDirection();
    }
}
