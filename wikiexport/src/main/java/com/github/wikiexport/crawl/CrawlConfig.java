package com.github.wikiexport.crawl;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;

public final class CrawlConfig {
    public static final int DEFAULT_BATCH_SIZE = 300;
    public static final int DEFAULT_WORKERS = 8;

    private static final Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(60);
    private static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(30);

    private boolean history;
    private Path saveDir;
    private int limit;
    private int batchSize = DEFAULT_BATCH_SIZE;
    private boolean strict;
    private Duration requestTimeout = DEFAULT_REQUEST_TIMEOUT;
    private Duration connectTimeout = DEFAULT_CONNECT_TIMEOUT;

    public CrawlConfig history(boolean history) {
        this.history = history;
        return this;
    }

    public CrawlConfig history() {
        return history(true);
    }

    public CrawlConfig saveDir(Path saveDir) {
        this.saveDir = Objects.requireNonNull(saveDir);
        return this;
    }

    public CrawlConfig limit(int limit) {
        if (limit < 1) {
            throw new IllegalArgumentException("Connection limit must be positive: " + limit);
        }

        this.limit = limit;
        return this;
    }

    public CrawlConfig batchSize(int batchSize) {
        if (batchSize < 1) {
            throw new IllegalArgumentException("Batch size must be positive: " + batchSize);
        }

        this.batchSize = batchSize;
        return this;
    }

    public CrawlConfig strict(boolean strict) {
        this.strict = strict;
        return this;
    }

    public CrawlConfig requestTimeout(Duration timeout) {
        if (timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("Timeout must be positive: " + timeout);
        }

        this.requestTimeout = timeout;
        return this;
    }

    public CrawlConfig connectTimeout(Duration timeout) {
        if (timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("Timeout must be positive: " + timeout);
        }

        this.connectTimeout = timeout;
        return this;
    }

    public boolean includesHistory() {
        return history;
    }

    public Optional<Path> optSaveDir() {
        return Optional.ofNullable(saveDir);
    }

    public OptionalInt optLimit() {
        return limit > 0 ? OptionalInt.of(limit) : OptionalInt.empty();
    }

    /** Number of export and download jobs allowed to run at once. */
    public int getWorkerCount() {
        return optLimit().orElse(DEFAULT_WORKERS);
    }

    public int getBatchSize() {
        return batchSize;
    }

    public boolean isStrict() {
        return strict;
    }

    public Duration getRequestTimeout() {
        return requestTimeout;
    }

    public Duration getConnectTimeout() {
        return connectTimeout;
    }

    @Override
    public String toString() {
        return String.format("[history=%s, savedir=%s, limit=%s, batchsize=%d, strict=%s, timeout=%s]",
            history, saveDir, limit > 0 ? limit : "none", batchSize, strict, requestTimeout);
    }
}
