package com.github.wikiexport.parsing;

import java.util.Map;
import java.util.Objects;
import java.util.function.BiPredicate;

/**
 * Span of the token stream between a triggering start tag and its matching
 * end tag. Lives only for the duration of a single parse.
 */
public final class CaptureRegion {
    private final String name;
    private final BiPredicate<String, Map<String, String>> trigger;
    private int openDepth;

    CaptureRegion(String name, BiPredicate<String, Map<String, String>> trigger) {
        this.name = Objects.requireNonNull(name);
        this.trigger = trigger;
    }

    public String getName() {
        return name;
    }

    public boolean isActive() {
        return openDepth > 0;
    }

    /** Stack depth right after the opening tag was pushed, zero when inactive. */
    public int getOpenDepth() {
        return openDepth;
    }

    boolean fires(String tag, Map<String, String> attributes) {
        return trigger != null && !isActive() && trigger.test(tag, attributes);
    }

    void open(int depth) {
        if (depth <= 0) {
            throw new IllegalArgumentException("depth must be positive: " + depth);
        }

        openDepth = depth;
    }

    void close() {
        openDepth = 0;
    }

    @Override
    public String toString() {
        return String.format("%s@%d", name, openDepth);
    }
}
