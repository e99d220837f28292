package com.github.wikiexport.parsing;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Set;

import org.jsoup.parser.Parser;

/**
 * Lenient, single-pass HTML lexer. It never builds a tree and never fails on
 * broken markup: anything that cannot be read as a tag is passed on as text.
 */
public class HtmlTokenizer implements Iterator<HtmlToken> {
    static final Set<String> VOID_ELEMENTS = Set.of(
        "meta", "input", "br", "link", "img", "hr",
        "area", "base", "col", "embed", "param", "source", "track", "wbr"
    );

    private static final Set<String> RAW_TEXT_ELEMENTS = Set.of("script", "style");

    private final String html;
    private final int length;

    private int pos;
    private String rawTextEnd;
    private HtmlToken next;

    public HtmlTokenizer(String html) {
        if (html == null) {
            throw new ParsingException("HTML input must not be null");
        }

        this.html = html;
        this.length = html.length();
    }

    @Override
    public boolean hasNext() {
        if (next == null) {
            next = readToken();
        }

        return next != null;
    }

    @Override
    public HtmlToken next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }

        var token = next;
        next = null;
        return token;
    }

    private HtmlToken readToken() {
        while (pos < length) {
            HtmlToken token;

            if (rawTextEnd != null) {
                token = readRawText();
            } else if (html.charAt(pos) != '<') {
                token = readText();
            } else {
                token = readMarkup();
            }

            if (token != null) {
                return token;
            }
        }

        return null;
    }

    private HtmlToken readText() {
        int end = html.indexOf('<', pos + 1);

        if (end == -1) {
            end = length;
        }

        var text = html.substring(pos, end);
        pos = end;
        return new HtmlToken.Text(Parser.unescapeEntities(text, false));
    }

    private HtmlToken readRawText() {
        int end = pos;

        while (end < length && !html.regionMatches(true, end, rawTextEnd, 0, rawTextEnd.length())) {
            end++;
        }

        rawTextEnd = null;

        if (end == pos) {
            return null;
        }

        var text = html.substring(pos, end);
        pos = end;
        return new HtmlToken.Text(text);
    }

    // returns null when nothing was emitted but the cursor moved on
    private HtmlToken readMarkup() {
        if (html.startsWith("<!--", pos)) {
            int end = html.indexOf("-->", pos + 4);
            var content = html.substring(pos + 4, end == -1 ? length : end);
            pos = end == -1 ? length : end + 3;
            return new HtmlToken.Comment(content);
        }

        if (pos + 1 >= length) {
            pos = length;
            return new HtmlToken.Text("<");
        }

        char c = html.charAt(pos + 1);

        if (c == '!' || c == '?') {
            int end = html.indexOf('>', pos + 2);
            var content = html.substring(pos + 2, end == -1 ? length : end);
            pos = end == -1 ? length : end + 1;
            return new HtmlToken.Comment(content);
        }

        if (c == '/') {
            if (pos + 2 < length && Character.isLetter(html.charAt(pos + 2))) {
                return readEndTag();
            }

            // "</>" and "</ ..." are dropped like browsers do
            int end = html.indexOf('>', pos + 2);
            pos = end == -1 ? length : end + 1;
            return null;
        }

        if (Character.isLetter(c)) {
            return readStartTag();
        }

        pos++;
        return new HtmlToken.Text("<");
    }

    private HtmlToken readEndTag() {
        int start = pos + 2;
        int i = start;

        while (i < length && isNameChar(html.charAt(i))) {
            i++;
        }

        var name = html.substring(start, i).toLowerCase(Locale.ROOT);
        int end = html.indexOf('>', i);
        pos = end == -1 ? length : end + 1;
        return new HtmlToken.EndTag(name);
    }

    private HtmlToken readStartTag() {
        int start = pos + 1;
        int i = start;

        while (i < length && isNameChar(html.charAt(i))) {
            i++;
        }

        var name = html.substring(start, i).toLowerCase(Locale.ROOT);
        var attributes = new LinkedHashMap<String, String>();
        boolean selfClosing = false;

        while (true) {
            i = skipWhitespace(i);

            if (i >= length) {
                break;
            }

            char c = html.charAt(i);

            if (c == '>') {
                i++;
                break;
            }

            if (c == '/') {
                i++;

                if (i < length && html.charAt(i) == '>') {
                    selfClosing = true;
                    i++;
                    break;
                }

                continue;
            }

            i = readAttribute(i, attributes);
        }

        pos = i;

        if (selfClosing || VOID_ELEMENTS.contains(name)) {
            return new HtmlToken.Element(name, attributes);
        }

        if (RAW_TEXT_ELEMENTS.contains(name)) {
            rawTextEnd = "</" + name;
        }

        return new HtmlToken.StartTag(name, attributes);
    }

    private int readAttribute(int i, Map<String, String> attributes) {
        int start = i;

        while (i < length) {
            char c = html.charAt(i);

            if (Character.isWhitespace(c) || c == '=' || c == '>' || (c == '/' && i > start)) {
                break;
            }

            i++;
        }

        if (i == start) {
            // stray '=' or similar
            return i + 1;
        }

        var key = html.substring(start, i).toLowerCase(Locale.ROOT);
        var value = "";
        int j = skipWhitespace(i);

        if (j < length && html.charAt(j) == '=') {
            j = skipWhitespace(j + 1);

            if (j < length && (html.charAt(j) == '"' || html.charAt(j) == '\'')) {
                char quote = html.charAt(j);
                int end = html.indexOf(quote, j + 1);

                if (end == -1) {
                    end = length;
                }

                value = html.substring(j + 1, end);
                i = Math.min(end + 1, length);
            } else {
                int end = j;

                while (end < length && !Character.isWhitespace(html.charAt(end)) && html.charAt(end) != '>') {
                    end++;
                }

                value = html.substring(j, end);
                i = end;
            }
        }

        // first occurrence wins
        attributes.putIfAbsent(key, Parser.unescapeEntities(value, true));
        return i;
    }

    private int skipWhitespace(int i) {
        while (i < length && Character.isWhitespace(html.charAt(i))) {
            i++;
        }

        return i;
    }

    private static boolean isNameChar(char c) {
        return Character.isLetterOrDigit(c) || c == '-' || c == '_' || c == ':' || c == '.';
    }

    public static Iterable<HtmlToken> tokens(String html) {
        Objects.requireNonNull(html);
        return () -> new HtmlTokenizer(html);
    }
}
