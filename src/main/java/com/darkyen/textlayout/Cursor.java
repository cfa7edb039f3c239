package com.darkyen.textlayout;

/**
 * Position of the text cursor, together with its blinking state.
 * Call {@link #update(float)} every frame to animate the blinking.
 */
public final class Cursor {

    public static final float DEFAULT_BLINK_INTERVAL = 0.5f;
    public static final float MIN_BLINK_INTERVAL = 0.1f;

    private int offset;
    private Affinity affinity = Affinity.DOWNSTREAM;

    private float blinkInterval = DEFAULT_BLINK_INTERVAL;
    private float blinkTime;
    private boolean visible = true;

    public int getOffset() {
        return offset;
    }

    public Affinity getAffinity() {
        return affinity;
    }

    public CursorPosition getPosition() {
        return new CursorPosition(offset, affinity);
    }

    public void setPosition(int offset, Affinity affinity) {
        if (affinity == null) throw new NullPointerException("affinity");
        this.offset = offset;
        this.affinity = affinity;
    }

    /**
     * @param delta time since the last update, in seconds
     */
    public void update(float delta) {
        blinkTime += delta;
        if (blinkTime >= blinkInterval) {
            final int flips = (int) (blinkTime / blinkInterval);
            blinkTime -= flips * blinkInterval;
            if ((flips & 1) == 1) {
                visible = !visible;
            }
        }
    }

    /** Make the cursor visible and start the blinking over, for example after typing. */
    public void resetBlink() {
        visible = true;
        blinkTime = 0f;
    }

    public boolean isVisible() {
        return visible;
    }

    public float getBlinkInterval() {
        return blinkInterval;
    }

    /** @param blinkInterval seconds between visibility changes, values below {@link #MIN_BLINK_INTERVAL} are clamped */
    public void setBlinkInterval(float blinkInterval) {
        this.blinkInterval = Math.max(blinkInterval, MIN_BLINK_INTERVAL);
    }
}
