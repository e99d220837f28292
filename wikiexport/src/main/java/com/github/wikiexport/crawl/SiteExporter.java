package com.github.wikiexport.crawl;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.ByteBuffer;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.logging.Level;
import java.util.logging.Logger;

import com.github.wikiexport.main.WikiSession;
import com.github.wikiexport.parsing.DiscoveryException;

/**
 * Lists every page of every namespace, groups the titles into export batches
 * and downloads media files, running up to {@link CrawlConfig#getWorkerCount()}
 * jobs at a time. Export documents are written to the sink one after another,
 * in the order the batches were formed, while listing is still in progress:
 * finished jobs at the head of the queue are written after every title.
 */
public class SiteExporter {
    private static final Logger LOGGER = Logger.getLogger("wiki-export.export");

    private final WikiSession session;
    private final CrawlConfig config;
    private final CancellationToken token;
    private final PageLister lister;
    private final Writer out;
    private final CrawlStats stats = new CrawlStats();

    private final CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
        .onMalformedInput(CodingErrorAction.IGNORE)
        .onUnmappableCharacter(CodingErrorAction.IGNORE);

    private ExecutorService executor;
    private Semaphore slots;

    public SiteExporter(WikiSession session, CrawlConfig config, CancellationToken token, Writer out) {
        this(session, config, token, out, new PageLister(session, config.isStrict(), token));
    }

    SiteExporter(WikiSession session, CrawlConfig config, CancellationToken token, Writer out, PageLister lister) {
        this.session = Objects.requireNonNull(session);
        this.config = Objects.requireNonNull(config);
        this.token = Objects.requireNonNull(token);
        this.out = Objects.requireNonNull(out);
        this.lister = Objects.requireNonNull(lister);
    }

    /**
     * Discovers the wiki behind the seed page and exports all of it.
     */
    public static CrawlStats exportSite(String seedUrl, CrawlConfig config, CancellationToken token, Writer out)
    throws IOException, InterruptedException, DiscoveryException {
        var basePath = WikiSession.discoverBasePath(seedUrl, config);
        LOGGER.logp(Level.INFO, "SiteExporter", "exportSite", "Using base path = " + basePath);

        try (var session = WikiSession.newSession(basePath, config)) {
            return new SiteExporter(session, config, token, out).run();
        }
    }

    public CrawlStats run() throws IOException, InterruptedException {
        var namespaces = session.fetchNamespaces();
        var batch = new ExportBatch(config.getBatchSize());
        var jobs = new ArrayDeque<Future<byte[]>>();

        executor = Executors.newFixedThreadPool(config.getWorkerCount());
        slots = new Semaphore(config.getWorkerCount());

        try {
            for (var ns : namespaces) {
                token.throwIfCancelled();
                LOGGER.logp(Level.FINE, "SiteExporter", "run", "namespace " + ns);
                stats.namespaces.incrementAndGet();

                var titles = lister.iterator(ns.id());

                while (nextTitle(titles)) {
                    var title = titles.next();
                    stats.titles.incrementAndGet();
                    scheduleDownload(title, jobs);

                    if (batch.add(title)) {
                        jobs.add(flush(batch.drain(), false));
                    }

                    writeResults(jobs, false);
                }
            }

            if (!batch.isEmpty()) {
                // the remainder always goes through the bulk endpoint
                jobs.add(flush(batch.drain(), true));
            }

            writeResults(jobs, true);
        } finally {
            executor.shutdownNow();
        }

        return stats;
    }

    private boolean nextTitle(Iterator<String> titles) throws IOException {
        try {
            return titles.hasNext();
        } catch (UncheckedIOException e) {
            // strict mode
            throw e.getCause();
        }
    }

    private void scheduleDownload(String title, Deque<Future<byte[]>> jobs) throws InterruptedException {
        var optSaveDir = config.optSaveDir();

        if (optSaveDir.isEmpty() || !DownloadJob.isFilePage(title)) {
            return;
        }

        var optJob = DownloadJob.forTitle(title, optSaveDir.get());

        if (optJob.isEmpty()) {
            LOGGER.logp(Level.WARNING, "SiteExporter", "scheduleDownload", "will not download filenames with path separators: " + title);
            stats.skippedDownloads.incrementAndGet();
            return;
        }

        var job = optJob.get();
        jobs.add(submit(() -> download(job)));
    }

    private Future<byte[]> flush(List<String> titles, boolean remainder) throws InterruptedException {
        if (titles.size() == 1 && config.getBatchSize() == 1 && !remainder) {
            var title = titles.get(0);
            return submit(() -> export(() -> session.exportPage(title), titles));
        } else {
            var curonly = !config.includesHistory();
            return submit(() -> export(() -> session.exportPages(titles, curonly), titles));
        }
    }

    private byte[] export(Callable<byte[]> request, List<String> titles) throws Exception {
        try {
            var xml = request.call();
            stats.exports.incrementAndGet();
            return xml;
        } catch (IOException e) {
            stats.failedExports.incrementAndGet();

            if (config.isStrict()) {
                throw e;
            }

            LOGGER.logp(Level.WARNING, "SiteExporter", "export", String.format("export of %d pages starting at '%s' failed", titles.size(), titles.get(0)), e);
            return null;
        }
    }

    private byte[] download(DownloadJob job) throws IOException, InterruptedException {
        LOGGER.logp(Level.INFO, "SiteExporter", "download", "downloading " + job.title() + " to " + job.destination());

        try {
            session.downloadBinary(job.localName(), Files.newOutputStream(job.destination()));
            stats.downloads.incrementAndGet();
        } catch (IOException e) {
            stats.failedDownloads.incrementAndGet();

            if (config.isStrict()) {
                throw e;
            }

            LOGGER.logp(Level.WARNING, "SiteExporter", "download", "download of " + job.title() + " failed", e);
        }

        return null;
    }

    /**
     * Hands the job to the pool once a slot is free; blocks the caller otherwise.
     */
    private Future<byte[]> submit(Callable<byte[]> job) throws InterruptedException {
        token.throwIfCancelled();
        slots.acquire();

        try {
            return executor.submit(() -> {
                try {
                    return job.call();
                } finally {
                    slots.release();
                }
            });
        } catch (RejectedExecutionException e) {
            slots.release();
            throw e;
        }
    }

    /**
     * Writes finished jobs from the head of the queue, keeping submission order.
     *
     * @param waitForAll whether to block until every queued job is done
     */
    private void writeResults(Deque<Future<byte[]>> jobs, boolean waitForAll) throws IOException, InterruptedException {
        while (!jobs.isEmpty() && (waitForAll || jobs.peek().isDone())) {
            var future = jobs.poll();
            final byte[] xml;

            try {
                xml = future.get();
            } catch (ExecutionException e) {
                var cause = e.getCause();

                if (cause instanceof IOException ioe) {
                    throw ioe;
                } else if (cause instanceof RuntimeException re) {
                    throw re;
                } else if (cause instanceof InterruptedException ie) {
                    throw ie;
                } else {
                    throw new IOException(cause);
                }
            }

            if (xml != null && xml.length != 0) {
                out.write(decoder.decode(ByteBuffer.wrap(xml)).toString());
                out.write(System.lineSeparator());
                out.flush();
            }
        }
    }

    public CrawlStats getStats() {
        return stats;
    }
}
