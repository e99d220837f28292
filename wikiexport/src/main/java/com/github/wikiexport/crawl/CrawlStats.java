package com.github.wikiexport.crawl;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Counters updated by the lister thread and the job workers.
 */
public final class CrawlStats {
    final AtomicInteger namespaces = new AtomicInteger();
    final AtomicInteger titles = new AtomicInteger();
    final AtomicInteger exports = new AtomicInteger();
    final AtomicInteger failedExports = new AtomicInteger();
    final AtomicInteger downloads = new AtomicInteger();
    final AtomicInteger skippedDownloads = new AtomicInteger();
    final AtomicInteger failedDownloads = new AtomicInteger();

    public int getNamespaces() {
        return namespaces.get();
    }

    public int getTitles() {
        return titles.get();
    }

    public int getExports() {
        return exports.get();
    }

    public int getFailedExports() {
        return failedExports.get();
    }

    public int getDownloads() {
        return downloads.get();
    }

    public int getSkippedDownloads() {
        return skippedDownloads.get();
    }

    public int getFailedDownloads() {
        return failedDownloads.get();
    }

    @Override
    public String toString() {
        return String.format("namespaces: %d, titles: %d, exports: %d (%d failed), downloads: %d (%d skipped, %d failed)",
            namespaces.get(), titles.get(), exports.get(), failedExports.get(),
            downloads.get(), skippedDownloads.get(), failedDownloads.get());
    }
}
