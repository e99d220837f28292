package com.github.wikiexport.crawl;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.concurrent.CancellationException;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

import com.github.wikiexport.main.WikiSession;
import com.github.wikiexport.parsing.ListingExtractor;
import com.github.wikiexport.utils.ListingResult;

/**
 * Walks Special:AllPages for a namespace and yields every title once, in the
 * server's listing order.
 * <p>
 * Chunk index pages are expanded depth-first through an explicit stack of
 * pending ranges. Leaf pages are followed through their continuation cursor
 * for as long as it moves forward; a cursor that does not sort after the
 * current lower bound ends the walk of that range.
 * <p>
 * A failed request ends the affected range only, unless strict mode is set,
 * in which case it is rethrown as {@link UncheckedIOException}.
 */
public class PageLister {
    private static final Logger LOGGER = Logger.getLogger("wiki-export.pages");

    private final WikiSession session;
    private final boolean strict;
    private final CancellationToken token;

    public PageLister(WikiSession session, boolean strict, CancellationToken token) {
        this.session = Objects.requireNonNull(session);
        this.strict = strict;
        this.token = Objects.requireNonNull(token);
    }

    public Iterator<String> iterator(int namespace, String from, String to) {
        return new Walk(namespace, new Range(from, to));
    }

    public Iterator<String> iterator(int namespace) {
        return iterator(namespace, null, null);
    }

    public Stream<String> listPages(int namespace, String from, String to) {
        var sp = Spliterators.spliteratorUnknownSize(iterator(namespace, from, to), Spliterator.ORDERED | Spliterator.NONNULL);
        return StreamSupport.stream(sp, false);
    }

    public Stream<String> listPages(int namespace) {
        return listPages(namespace, null, null);
    }

    ListingResult fetchListing(int namespace, String from, String to) throws IOException, InterruptedException {
        var params = new LinkedHashMap<String, String>();
        params.put("title", "Special:AllPages");
        params.put("namespace", Integer.toString(namespace));

        if (from != null && !from.isEmpty()) {
            params.put("from", from);
        }

        if (to != null && !to.isEmpty()) {
            params.put("to", to);
        }

        return ListingExtractor.extract(session.fetchText(params));
    }

    private record Range(String from, String to) {}

    private class Walk implements Iterator<String> {
        private final int namespace;
        private final Deque<Range> pending = new ArrayDeque<>();
        private final Deque<String> buffer = new ArrayDeque<>();

        Walk(int namespace, Range initial) {
            this.namespace = namespace;
            pending.push(initial);
        }

        @Override
        public boolean hasNext() {
            while (buffer.isEmpty() && !pending.isEmpty()) {
                step(pending.pop());
            }

            return !buffer.isEmpty();
        }

        @Override
        public String next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }

            return buffer.poll();
        }

        private void step(Range range) {
            token.throwIfCancelled();
            LOGGER.logp(Level.FINE, "PageLister", "step", String.format("allpages, ns: %d, from: '%s', to: '%s'", namespace, range.from(), range.to()));

            final ListingResult listing;

            try {
                listing = fetchListing(namespace, range.from(), range.to());
            } catch (IOException e) {
                if (strict) {
                    throw new UncheckedIOException(e);
                }

                LOGGER.logp(Level.WARNING, "PageLister", "step", String.format("listing of ns %d from '%s' failed", namespace, range.from()), e);
                return;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                var ce = new CancellationException("Interrupted while listing namespace " + namespace);
                ce.initCause(e);
                throw ce;
            }

            if (listing.isChunkIndex()) {
                var chunks = listing.chunks();

                // pushed in reverse so that the first chunk is visited first
                for (int i = chunks.size() - 1; i >= 0; i--) {
                    pending.push(new Range(chunks.get(i).from(), chunks.get(i).to()));
                }

                return;
            }

            buffer.addAll(listing.pages());

            var optCursor = listing.optNextCursor();

            if (optCursor.isEmpty()) {
                return;
            }

            var cursor = optCursor.get();

            if (range.from() != null && cursor.compareTo(range.from()) <= 0) {
                LOGGER.logp(Level.FINE, "PageLister", "step", String.format("going back from '%s' to '%s', stopping", range.from(), cursor));
                return;
            }

            // the continuation replaces the current range, ahead of any sibling chunk
            pending.push(new Range(cursor, null));
        }
    }
}
