package com.github.wikiexport.utils;

import java.util.Objects;

/**
 * Sub-interval of an index listing, as linked from a chunk index page.
 */
public record PageRangeChunk(String from, String to) {
    public PageRangeChunk {
        Objects.requireNonNull(from);
        Objects.requireNonNull(to);
    }
}
