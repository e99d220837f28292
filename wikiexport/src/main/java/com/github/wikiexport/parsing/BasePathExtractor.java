package com.github.wikiexport.parsing;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Finds the wiki's script path (e.g. <code>/w/index.php</code>) by looking at
 * the links of well-known skin elements: login, view source, printable
 * version, history and permanent link. The most frequent link target wins.
 */
public final class BasePathExtractor extends ScopeTracker {
    private static final Logger LOGGER = Logger.getLogger("wiki-export.parsing");
    private static final Set<String> CHROME_IDS = Set.of("pt-login", "ca-viewsource", "t-print", "ca-history", "t-permalink");

    private final CaptureRegion chromeItem = register("chrome-item",
        (tag, attrs) -> tag.equals("li") && CHROME_IDS.contains(attrs.get("id")));

    private final Map<String, Integer> candidates = new LinkedHashMap<>();

    @Override
    protected void handleStartTag(String tag, Map<String, String> attributes) {
        if (!tag.equals("a")) {
            return;
        }

        if (chromeItem.isActive() || CHROME_IDS.contains(attributes.get("id"))) {
            var href = attributes.get("href");

            if (href == null || href.isBlank()) {
                diagnose("chrome link without target in " + chromeItem);
                return;
            }

            candidates.merge(Utils.stripQuery(href), 1, Integer::sum);
        }
    }

    /** Candidate paths with their occurrence counts, in document order. */
    public Map<String, Integer> getCandidates() {
        return Collections.unmodifiableMap(candidates);
    }

    public String getBasePath() throws DiscoveryException {
        if (candidates.isEmpty()) {
            throw new DiscoveryException("no base path found");
        }

        if (candidates.size() > 1) {
            LOGGER.logp(Level.WARNING, "BasePathExtractor", "getBasePath", "found multiple base paths: " + candidates);
        }

        String best = null;
        int bestCount = 0;

        // ties go to the first candidate in document order
        for (var entry : candidates.entrySet()) {
            if (entry.getValue() > bestCount) {
                best = entry.getKey();
                bestCount = entry.getValue();
            }
        }

        return best;
    }

    public static String extract(String html) throws DiscoveryException {
        var extractor = new BasePathExtractor();
        extractor.feed(html);
        return extractor.getBasePath();
    }
}
