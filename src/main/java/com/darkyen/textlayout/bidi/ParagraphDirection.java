package com.darkyen.textlayout.bidi;

/**
 * Resolved direction of a paragraph.
 */
public enum ParagraphDirection {
    LTR,
    RTL,
    /** Paragraph contains runs of both directions. */
    MIXED
}
