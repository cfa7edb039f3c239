package com.darkyen.textlayout;

/** Point in the coordinate space of a {@link TextLayout}, whose origin is its top left corner, Y goes down. */
public final class Position {

    public final float x, y;
    public final int lineIndex;

    public Position(float x, float y, int lineIndex) {
        this.x = x;
        this.y = y;
        this.lineIndex = lineIndex;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        final Position that = (Position) o;
        return Float.compare(that.x, x) == 0 && Float.compare(that.y, y) == 0 && lineIndex == that.lineIndex;
    }

    @Override
    public int hashCode() {
        return (31 * Float.floatToIntBits(x) + Float.floatToIntBits(y)) * 31 + lineIndex;
    }

    @Override
    public String toString() {
        return "(" + x + ", " + y + ") line " + lineIndex;
    }
}
