package com.darkyen.textlayout;

/** Result of moving the cursor up or down.
 * @see TextLayout#moveCursorUp(int, float) */
public final class VerticalMove {

    /** New cursor offset. */
    public final int offset;
    /** X which should be used for the next vertical movement. */
    public final float preferredX;

    public VerticalMove(int offset, float preferredX) {
        this.offset = offset;
        this.preferredX = preferredX;
    }

    @Override
    public String toString() {
        return offset + " @" + preferredX;
    }
}
