package com.darkyen.textlayout;

/**
 * Immutable range of selected text.
 * Anchor is the fixed end, where the selection started, focus is the end that moves with the cursor.
 * Focus may be before the anchor.
 */
public final class Selection {

    public final int anchor, focus;

    public Selection(int anchor, int focus) {
        this.anchor = anchor;
        this.focus = focus;
    }

    /** @return collapsed selection at offset */
    public static Selection collapsed(int offset) {
        return new Selection(offset, offset);
    }

    public int start() {
        return Math.min(anchor, focus);
    }

    public int end() {
        return Math.max(anchor, focus);
    }

    public int length() {
        return end() - start();
    }

    public boolean isCollapsed() {
        return anchor == focus;
    }

    /** @return true if the focus is not before the anchor */
    public boolean isForward() {
        return anchor <= focus;
    }

    /** @return true if offset is in [start, end) */
    public boolean contains(int offset) {
        return offset >= start() && offset < end();
    }

    public Selection extendTo(int focus) {
        return new Selection(anchor, focus);
    }

    public Selection moveTo(int offset) {
        return collapsed(offset);
    }

    public Selection collapseToStart() {
        return collapsed(start());
    }

    public Selection collapseToEnd() {
        return collapsed(end());
    }

    /** @return selection with swapped anchor and focus */
    public Selection flip() {
        return new Selection(focus, anchor);
    }

    /** @return selected part of the text, the selection must be within it */
    public String text(CharSequence text) {
        return text.subSequence(start(), end()).toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        final Selection that = (Selection) o;
        return anchor == that.anchor && focus == that.focus;
    }

    @Override
    public int hashCode() {
        return 31 * anchor + focus;
    }

    @Override
    public String toString() {
        return "Selection[" + anchor + " -> " + focus + "]";
    }
}
