package com.darkyen.textlayout.bidi;

import com.badlogic.gdx.utils.Array;

/**
 * Embedding levels of a single line, together with its runs in visual order.
 */
public final class VisualRuns {

    /** Index of the first character of the line. */
    public final int lineStart;
    /** Embedding level of each char of the line, indexed from {@link #lineStart}. */
    public final byte[] levels;
    /** Runs, in left-to-right rendering order. */
    public final Array<BidiRun> runs;

    public VisualRuns(int lineStart, byte[] levels, Array<BidiRun> runs) {
        this.lineStart = lineStart;
        this.levels = levels;
        this.runs = runs;
    }
}
