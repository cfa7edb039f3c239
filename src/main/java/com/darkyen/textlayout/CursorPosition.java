package com.darkyen.textlayout;

/**
 * Offset of a cursor, together with its {@link Affinity}.
 */
public final class CursorPosition {

    public final int offset;
    public final Affinity affinity;

    public CursorPosition(int offset) {
        this(offset, Affinity.DOWNSTREAM);
    }

    public CursorPosition(int offset, Affinity affinity) {
        if (affinity == null) throw new NullPointerException("affinity");
        this.offset = offset;
        this.affinity = affinity;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        final CursorPosition that = (CursorPosition) o;
        return offset == that.offset && affinity == that.affinity;
    }

    @Override
    public int hashCode() {
        return 31 * offset + affinity.hashCode();
    }

    @Override
    public String toString() {
        return offset + (affinity == Affinity.UPSTREAM ? "^" : "");
    }
}
