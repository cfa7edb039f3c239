package com.darkyen.textlayout;

import com.darkyen.textlayout.font.Font;
import com.darkyen.textlayout.font.FontMetrics;

import java.util.function.IntPredicate;

/**
 * Font for tests, with fixed metrics: 8 units above the baseline, 2 below, 10 units per em.
 */
public final class TestFont implements Font<TestFont> {

    public static final TestFont REGULAR = new TestFont("regular");

    public final String name;
    private final FontMetrics metrics;
    private final IntPredicate coverage;
    private final TestFont fallback;

    public TestFont(String name) {
        this(name, new FontMetrics(8f, 2f, 0f, 10f, 7f, 5f), codePoint -> true, null);
    }

    public TestFont(String name, FontMetrics metrics, IntPredicate coverage, TestFont fallback) {
        this.name = name;
        this.metrics = metrics;
        this.coverage = coverage;
        this.fallback = fallback;
    }

    @Override
    public FontMetrics getMetrics() {
        return metrics;
    }

    @Override
    public boolean hasGlyph(int codePoint) {
        return coverage.test(codePoint);
    }

    @Override
    public TestFont getFallback() {
        return fallback;
    }

    @Override
    public String toString() {
        return name;
    }
}
