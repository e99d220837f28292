package com.github.wikiexport.parsing;

import java.util.Map;
import java.util.Objects;

/**
 * A single lexical unit of an HTML document, as produced by {@link HtmlTokenizer}.
 * Tag and attribute names are lower-cased, attribute values and text have their
 * character references resolved.
 */
public sealed interface HtmlToken {
    record StartTag(String name, Map<String, String> attributes) implements HtmlToken {
        public StartTag {
            Objects.requireNonNull(name);
            attributes = Map.copyOf(attributes);
        }
    }

    record EndTag(String name) implements HtmlToken {
        public EndTag {
            Objects.requireNonNull(name);
        }
    }

    /**
     * Void element (<code>&lt;br&gt;</code>) or an explicitly self-closed tag
     * (<code>&lt;x/&gt;</code>). Never opens a scope.
     */
    record Element(String name, Map<String, String> attributes) implements HtmlToken {
        public Element {
            Objects.requireNonNull(name);
            attributes = Map.copyOf(attributes);
        }
    }

    /** Comments, doctype declarations and processing instructions. */
    record Comment(String content) implements HtmlToken {}

    record Text(String content) implements HtmlToken {}
}
