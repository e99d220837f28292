package com.github.wikiexport.parsing;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.github.wikiexport.utils.Namespace;

/**
 * Reads the namespace table off the <code>select#namespace</code> drop-down
 * found on Special:PrefixIndex and similar special pages.
 */
public final class NamespaceExtractor extends ScopeTracker {
    private final CaptureRegion selector = register("namespace-select",
        (tag, attrs) -> tag.equals("select") && "namespace".equals(attrs.get("id")));

    private final CaptureRegion option = register("namespace-option");

    private final List<Namespace> namespaces = new ArrayList<>();
    private final Set<Integer> seenIds = new HashSet<>();

    private StringBuilder optionText;
    private Integer optionValue;

    @Override
    protected void handleStartTag(String tag, Map<String, String> attributes) {
        if (!selector.isActive() || !tag.equals("option")) {
            return;
        }

        // <option> without its end tag
        closeRegion(option);

        var value = attributes.getOrDefault("value", "");

        try {
            optionValue = Integer.valueOf(value.strip());
        } catch (NumberFormatException e) {
            // e.g. the "all" entry
            diagnose(String.format("ignoring namespace option with value '%s'", value));
            optionValue = null;
        }

        optionText = new StringBuilder();
        openRegion(option);
    }

    @Override
    protected void handleText(String text) {
        if (option.isActive()) {
            optionText.append(text);
        }
    }

    @Override
    protected void regionClosed(CaptureRegion region) {
        if (region == option && optionValue != null) {
            if (seenIds.add(optionValue)) {
                namespaces.add(new Namespace(optionValue, optionText.toString()));
            } else {
                diagnose("duplicate namespace id " + optionValue);
            }

            optionValue = null;
        }
    }

    public List<Namespace> getNamespaces() {
        return Collections.unmodifiableList(namespaces);
    }

    public static List<Namespace> extract(String html) {
        var extractor = new NamespaceExtractor();
        extractor.feed(html);
        return extractor.getNamespaces();
    }
}
