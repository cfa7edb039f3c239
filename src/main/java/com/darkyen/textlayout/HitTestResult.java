package com.darkyen.textlayout;

/**
 * Result of {@link TextLayout#hitTest(float, float, HitTestPolicy)}.
 */
public final class HitTestResult {

    public final int offset;
    public final Affinity affinity;
    public final int lineIndex;

    public HitTestResult(int offset, Affinity affinity, int lineIndex) {
        this.offset = offset;
        this.affinity = affinity;
        this.lineIndex = lineIndex;
    }

    public CursorPosition toCursorPosition() {
        return new CursorPosition(offset, affinity);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        final HitTestResult that = (HitTestResult) o;
        return offset == that.offset && lineIndex == that.lineIndex && affinity == that.affinity;
    }

    @Override
    public int hashCode() {
        return (31 * offset + affinity.hashCode()) * 31 + lineIndex;
    }

    @Override
    public String toString() {
        return "HitTestResult{" + offset + " " + affinity + " line " + lineIndex + '}';
    }
}
