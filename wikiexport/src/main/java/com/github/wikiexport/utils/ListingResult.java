package com.github.wikiexport.utils;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Facts extracted from one Special:AllPages response: either a chunk index
 * (sub-ranges to visit) or a leaf list of page titles with an optional
 * continuation cursor. Chunks take precedence should a malformed page carry
 * both.
 */
public record ListingResult(List<PageRangeChunk> chunks, List<String> pages, String nextCursor) {
    public ListingResult {
        chunks = List.copyOf(chunks);
        pages = List.copyOf(Objects.requireNonNull(pages));
    }

    public boolean isChunkIndex() {
        return !chunks.isEmpty();
    }

    public Optional<String> optNextCursor() {
        return Optional.ofNullable(nextCursor);
    }
}
