package com.github.wikiexport.parsing;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.function.BiPredicate;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Streaming scanner that tracks the stack of open elements and lets subclasses
 * react to tokens found inside named capture regions.
 * <p>
 * A region opens when its trigger fires on a start tag and remembers the stack
 * depth right after that tag was pushed. It closes as soon as an end tag brings
 * the stack below that depth, which is the matching end tag for well-nested
 * input. Mismatched end tags are repaired by unwinding to the nearest matching
 * open element, or ignored when there is none; neither case raises.
 * <p>
 * Instances are single-use: create one per document.
 */
public abstract class ScopeTracker {
    private static final Logger LOGGER = Logger.getLogger("wiki-export.parsing");

    private final List<String> stack = new ArrayList<>();
    private final List<CaptureRegion> regions = new ArrayList<>();
    private final List<String> diagnostics = new ArrayList<>();
    private boolean finished;

    protected final CaptureRegion register(String name, BiPredicate<String, Map<String, String>> trigger) {
        var region = new CaptureRegion(name, trigger);
        regions.add(region);
        return region;
    }

    /** Registers a region that is only opened and closed by the subclass itself. */
    protected final CaptureRegion register(String name) {
        return register(name, null);
    }

    public final void feed(String html) {
        if (finished) {
            throw new IllegalStateException("Parser already finished, create a new instance");
        }

        for (var token : HtmlTokenizer.tokens(html)) {
            process(token);
        }

        finish();
    }

    final void process(HtmlToken token) {
        if (token instanceof HtmlToken.StartTag start) {
            processStartTag(start);
        } else if (token instanceof HtmlToken.EndTag end) {
            processEndTag(end.name());
        } else if (token instanceof HtmlToken.Element element) {
            handleElement(element.name(), element.attributes());
        } else if (token instanceof HtmlToken.Text text) {
            handleText(text.content());
        }
    }

    private void processStartTag(HtmlToken.StartTag start) {
        stack.add(start.name());

        for (var region : regions) {
            if (region.fires(start.name(), start.attributes())) {
                region.open(depth());
            }
        }

        handleStartTag(start.name(), start.attributes());
    }

    private void processEndTag(String tag) {
        int top = stack.size() - 1;

        if (top >= 0 && stack.get(top).equals(tag)) {
            stack.remove(top);
        } else {
            int index = stack.lastIndexOf(tag);

            if (index == -1) {
                diagnose(String.format("could not find start tag for: '%s' in %s", tag, stack));
                return;
            }

            diagnose(String.format("missing end tag for: %s, closing %s", stack.subList(index + 1, stack.size()), tag));
            stack.subList(index, stack.size()).clear();
        }

        closeRegionsAbove(depth());
    }

    private void closeRegionsAbove(int depth) {
        var closing = new ArrayList<CaptureRegion>();

        for (var region : regions) {
            if (region.isActive() && region.getOpenDepth() > depth) {
                closing.add(region);
            }
        }

        // innermost first
        closing.sort(Comparator.comparingInt(CaptureRegion::getOpenDepth).reversed());

        for (var region : closing) {
            closeRegion(region);
        }
    }

    /** Opens a region at the current depth, i.e. anchored on the element just pushed. */
    protected final void openRegion(CaptureRegion region) {
        if (depth() == 0) {
            throw new IllegalStateException("No open element to anchor " + region.getName());
        }

        region.open(depth());
    }

    protected final void closeRegion(CaptureRegion region) {
        if (region.isActive()) {
            region.close();
            regionClosed(region);
        }
    }

    private void finish() {
        finished = true;

        if (!stack.isEmpty()) {
            LOGGER.logp(Level.FINEST, getClass().getSimpleName(), "finish", "Unclosed at end of document: " + stack);
        }

        closeRegionsAbove(0);
    }

    protected final void diagnose(String message) {
        diagnostics.add(message);
        LOGGER.logp(Level.FINE, getClass().getSimpleName(), "diagnose", message);
    }

    protected final int depth() {
        return stack.size();
    }

    public final List<String> getOpenElements() {
        return Collections.unmodifiableList(stack);
    }

    public final List<String> getDiagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    protected void handleStartTag(String tag, Map<String, String> attributes) {}

    protected void handleElement(String tag, Map<String, String> attributes) {}

    protected void handleText(String text) {}

    protected void regionClosed(CaptureRegion region) {}
}
