package com.darkyen.textlayout;

/** Granularity of horizontal cursor movement. */
public enum MovementUnit {
    /** One grapheme cluster. */
    CHARACTER,
    /** To the previous word start or next word end. */
    WORD,
    /** To the visual start or end of the line. */
    LINE,
    /** To the start or end of the text. */
    DOCUMENT
}
