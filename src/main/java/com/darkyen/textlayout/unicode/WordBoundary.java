package com.darkyen.textlayout.unicode;

/**
 * One segment of word segmentation.
 * @see WordSegmentation#compute(CharSequence)
 */
public final class WordBoundary {

    public enum Kind {
        /** Segment contains at least one letter or digit. */
        WORD,
        /** Whitespace, punctuation and other runs without letters or digits. */
        NON_WORD
    }

    /** Range of the segment, [start, end) */
    public final int start, end;
    public final Kind kind;

    public WordBoundary(int start, int end, Kind kind) {
        assert start <= end;
        this.start = start;
        this.end = end;
        this.kind = kind;
    }

    public boolean isWord() {
        return kind == Kind.WORD;
    }

    /** @return true if offset is in [start, end) */
    public boolean contains(int offset) {
        return offset >= start && offset < end;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        final WordBoundary that = (WordBoundary) o;
        return start == that.start && end == that.end && kind == that.kind;
    }

    @Override
    public int hashCode() {
        return (31 * start + end) * 31 + kind.hashCode();
    }

    @Override
    public String toString() {
        return kind+"["+start+", "+end+")";
    }
}
