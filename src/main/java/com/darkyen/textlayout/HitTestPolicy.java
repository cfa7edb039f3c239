package com.darkyen.textlayout;

/** What happens when a hit test point lies outside of the text. */
public enum HitTestPolicy {
    /** Snap to the nearest valid offset, always returns a result. */
    CLAMP,
    /** Return no result for points outside of the laid out lines. */
    STRICT
}
