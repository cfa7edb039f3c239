package com.darkyen.textlayout;

/** Single recorded edit, which can be undone and redone.
 * Replaces {@link #oldText} at {@link #offset} with {@link #text}. */
public final class TextOperation {

    public enum Kind {
        INSERT,
        DELETE,
        REPLACE
    }

    public final Kind kind;
    public final int offset;
    /** Inserted text, empty for {@link Kind#DELETE}. */
    public final String text;
    /** Removed text, empty for {@link Kind#INSERT}. */
    public final String oldText;
    public final Selection selectionBefore;
    public final Selection selectionAfter;

    public TextOperation(int offset, String oldText, String text, Selection selectionBefore, Selection selectionAfter) {
        if (oldText == null) throw new NullPointerException("oldText");
        if (text == null) throw new NullPointerException("text");
        this.offset = offset;
        this.oldText = oldText;
        this.text = text;
        this.selectionBefore = selectionBefore;
        this.selectionAfter = selectionAfter;
        if (oldText.isEmpty()) {
            kind = Kind.INSERT;
        } else if (text.isEmpty()) {
            kind = Kind.DELETE;
        } else {
            kind = Kind.REPLACE;
        }
    }

    /** @return end of {@link #text} after the operation is applied */
    public int insertedEnd() {
        return offset + text.length();
    }

    /** @return end of {@link #oldText} before the operation is applied */
    public int removedEnd() {
        return offset + oldText.length();
    }

    @Override
    public String toString() {
        return kind + "@" + offset + " '" + oldText + "' -> '" + text + "'";
    }
}
