package com.darkyen.textlayout.bidi;

/**
 * Range of text with uniform embedding level.
 */
public final class BidiRun {

    /** Range of the run, [start, end) */
    public final int start, end;
    /** Embedding level, even levels are left-to-right. */
    public final byte level;

    public BidiRun(int start, int end, byte level) {
        assert start <= end;
        this.start = start;
        this.end = end;
        this.level = level;
    }

    public boolean isLtr() {
        return BidiResolver.isLevelLtr(level);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        final BidiRun that = (BidiRun) o;
        return start == that.start && end == that.end && level == that.level;
    }

    @Override
    public int hashCode() {
        return (31 * start + end) * 31 + level;
    }

    @Override
    public String toString() {
        return "["+start+", "+end+")@"+level;
    }
}
