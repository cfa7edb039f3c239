package com.darkyen.textlayout.unicode;

/**
 * Place after which a line may (or must) be broken.
 * @see LineBreaking#compute(CharSequence)
 */
public final class LineBreak {

    public enum Kind {
        /** Line must end here, after a hard line break character or at the end of the text. */
        MANDATORY,
        /** Line may end here. */
        OPPORTUNITY
    }

    /** Offset of the break, the line ends before this index. */
    public final int offset;
    public final Kind kind;

    public LineBreak(int offset, Kind kind) {
        this.offset = offset;
        this.kind = kind;
    }

    public boolean isMandatory() {
        return kind == Kind.MANDATORY;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        final LineBreak that = (LineBreak) o;
        return offset == that.offset && kind == that.kind;
    }

    @Override
    public int hashCode() {
        return 31 * offset + kind.hashCode();
    }

    @Override
    public String toString() {
        return (kind == Kind.MANDATORY ? "!" : "") + offset;
    }
}
