package com.github.wikiexport.crawl;

import java.util.ArrayList;
import java.util.List;

/**
 * Accumulates titles until the configured bound is reached.
 */
public final class ExportBatch {
    private final int maxSize;
    private final List<String> titles;

    public ExportBatch(int maxSize) {
        if (maxSize < 1) {
            throw new IllegalArgumentException("Batch size must be positive: " + maxSize);
        }

        this.maxSize = maxSize;
        this.titles = new ArrayList<>(Math.min(maxSize, 1000));
    }

    /**
     * @return true when the batch has reached its bound and should be flushed
     */
    public boolean add(String title) {
        if (isFull()) {
            throw new IllegalStateException("Batch is full, drain it first");
        }

        titles.add(title);
        return isFull();
    }

    public boolean isFull() {
        return titles.size() >= maxSize;
    }

    public boolean isEmpty() {
        return titles.isEmpty();
    }

    public int size() {
        return titles.size();
    }

    public int getMaxSize() {
        return maxSize;
    }

    /** Returns the accumulated titles and starts over with an empty batch. */
    public List<String> drain() {
        var copy = List.copyOf(titles);
        titles.clear();
        return copy;
    }
}
