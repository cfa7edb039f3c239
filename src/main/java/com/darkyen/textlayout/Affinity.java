package com.darkyen.textlayout;

/** Which side of an ambiguous boundary (line wrap point) the cursor is associated with. */
public enum Affinity {
    /** Cursor belongs to the text before the offset, for example at the end of a wrapped line. */
    UPSTREAM,
    /** Cursor belongs to the text after the offset. Default. */
    DOWNSTREAM
}
