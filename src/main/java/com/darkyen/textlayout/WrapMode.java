package com.darkyen.textlayout;

/** How are lines wrapped when they don't fit into the maximum width. */
public enum WrapMode {
    /** Lines end only on hard line breaks. */
    NO_WRAP,
    /** Lines end on line break opportunities, words which are too long are broken between graphemes. */
    BREAK_WORD,
    /** Lines may end between any two graphemes. */
    BREAK_ALL
}
