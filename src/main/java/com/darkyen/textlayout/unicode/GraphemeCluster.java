package com.darkyen.textlayout.unicode;

/**
 * Range of text, which forms a single user-perceived character.
 * Cursor may never stop inside of it.
 */
public final class GraphemeCluster {

    /** Range of the cluster, [start, end) */
    public final int start, end;

    public GraphemeCluster(int start, int end) {
        assert start <= end;
        this.start = start;
        this.end = end;
    }

    public int length() {
        return end - start;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        final GraphemeCluster that = (GraphemeCluster) o;
        return start == that.start && end == that.end;
    }

    @Override
    public int hashCode() {
        return 31 * start + end;
    }

    @Override
    public String toString() {
        return "["+start+", "+end+")";
    }
}
