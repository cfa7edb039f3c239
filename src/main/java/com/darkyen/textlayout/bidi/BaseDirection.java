package com.darkyen.textlayout.bidi;

/**
 * Hint for the base direction of paragraphs.
 */
public enum BaseDirection {
    /** Detect from the first strong character of each paragraph, left-to-right if there is none. */
    AUTO,
    LTR,
    RTL
}
