package com.github.wikiexport.parsing;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import org.apache.commons.lang3.ArrayUtils;
import org.apache.commons.lang3.StringUtils;

public final class Utils {
    private Utils() {}

    /**
     * Strips the query string off a link target.
     */
    public static String stripQuery(String href) {
        return StringUtils.substringBefore(href, "?");
    }

    /**
     * Decodes the query string of a link target. Only the first value of each
     * parameter is kept, parameters with a blank value are dropped.
     */
    public static Map<String, String> parseQuery(String href) {
        var map = new LinkedHashMap<String, String>();

        if (href == null || !href.contains("?")) {
            return map;
        }

        var query = StringUtils.substringBefore(StringUtils.substringAfter(href, "?"), "#");

        for (var pair : StringUtils.split(query, '&')) {
            var key = decode(StringUtils.substringBefore(pair, "="));
            var value = pair.contains("=") ? decode(StringUtils.substringAfter(pair, "=")) : "";

            if (!key.isEmpty() && !value.isEmpty()) {
                map.putIfAbsent(key, value);
            }
        }

        return map;
    }

    public static Optional<String> queryParameter(String href, String name) {
        return Optional.ofNullable(parseQuery(href).get(name));
    }

    /**
     * Tests the whitespace-separated <code>class</code> attribute for the given token.
     */
    public static boolean hasClass(Map<String, String> attributes, String cls) {
        var value = attributes.get("class");
        return value != null && ArrayUtils.contains(StringUtils.split(value), cls);
    }

    private static String decode(String s) {
        try {
            return URLDecoder.decode(s, StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            // malformed percent escape, keep as is
            return s;
        }
    }
}
