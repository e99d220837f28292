package com.github.wikiexport.parsing;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import com.github.wikiexport.utils.ListingResult;
import com.github.wikiexport.utils.PageRangeChunk;

/**
 * Extracts page titles, sub-range chunks and the continuation cursor from a
 * Special:AllPages response.
 * <p>
 * Old MediaWiki versions answer with a chunk index
 * (<code>table.allpageslist</code>) for large namespaces; newer ones list
 * titles in <code>ul.mw-allpages-chunk</code> or
 * <code>table.mw-allpages-table-chunk</code> and link the following page from
 * <code>div.mw-allpages-nav</code>.
 */
public final class ListingExtractor extends ScopeTracker {
    private final CaptureRegion chunkIndex = register("allpageslist",
        (tag, attrs) -> tag.equals("table") && Utils.hasClass(attrs, "allpageslist"));

    private final CaptureRegion pageTable = register("mw-allpages-table-chunk",
        (tag, attrs) -> tag.equals("table") && Utils.hasClass(attrs, "mw-allpages-table-chunk"));

    private final CaptureRegion pageList = register("mw-allpages-chunk",
        (tag, attrs) -> tag.equals("ul") && Utils.hasClass(attrs, "mw-allpages-chunk"));

    private final CaptureRegion navigation = register("mw-allpages-nav",
        (tag, attrs) -> tag.equals("div") && Utils.hasClass(attrs, "mw-allpages-nav"));

    private final List<PageRangeChunk> chunks = new ArrayList<>();
    private final List<String> pages = new ArrayList<>();
    private String nextCursor;

    @Override
    protected void handleStartTag(String tag, Map<String, String> attributes) {
        if (!tag.equals("a")) {
            return;
        }

        if (chunkIndex.isActive()) {
            addChunk(attributes.get("href"));
        } else if (pageTable.isActive() || pageList.isActive()) {
            var title = attributes.get("title");

            if (title != null) {
                pages.add(title);
            } else {
                diagnose("page link without title attribute");
            }
        } else if (navigation.isActive()) {
            // "previous page" precedes "next page", the last link wins
            Utils.queryParameter(attributes.get("href"), "from").ifPresent(from -> nextCursor = from);
        }
    }

    private void addChunk(String href) {
        var query = Utils.parseQuery(href);
        var from = query.get("from");
        var to = query.get("to");

        if (from == null || to == null) {
            diagnose("chunk link without range: " + href);
            return;
        }

        var chunk = new PageRangeChunk(from, to);

        if (chunks.isEmpty() || !chunks.get(chunks.size() - 1).equals(chunk)) {
            chunks.add(chunk);
        }
    }

    public ListingResult getResult() {
        return new ListingResult(chunks, pages, nextCursor);
    }

    public static ListingResult extract(String html) {
        var extractor = new ListingExtractor();
        extractor.feed(html);
        return extractor.getResult();
    }
}
