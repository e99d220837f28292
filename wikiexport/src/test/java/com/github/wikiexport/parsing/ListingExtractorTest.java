package com.github.wikiexport.parsing;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

import com.github.wikiexport.utils.PageRangeChunk;

public class ListingExtractorTest {
    @Test
    public void shouldExtractChunkIndexWithoutConsecutiveDuplicates() {
        var html = """
            <table class="allpageslist">
            <tr><td class="mw-allpages-alphaindexline">
              <a href="/w/index.php?title=Special:AllPages&amp;from=A&amp;to=M&amp;namespace=0">A</a> to
              <a href="/w/index.php?title=Special:AllPages&amp;from=A&amp;to=M&amp;namespace=0">M</a>
            </td></tr>
            <tr><td class="mw-allpages-alphaindexline">
              <a href="/w/index.php?title=Special:AllPages&amp;from=M&amp;to=Z&amp;namespace=0">M</a> to
              <a href="/w/index.php?title=Special:AllPages&amp;from=M&amp;to=Z&amp;namespace=0">Z</a>
            </td></tr>
            </table>
            """;

        var result = ListingExtractor.extract(html);

        assertThat(result.isChunkIndex()).isTrue();
        assertThat(result.chunks()).containsExactly(new PageRangeChunk("A", "M"), new PageRangeChunk("M", "Z"));
        assertThat(result.pages()).isEmpty();
        assertThat(result.optNextCursor()).isEmpty();
    }

    @Test
    public void shouldExtractLeafListAndCursor() {
        var html = """
            <div class="mw-allpages-nav">
              <a href="/w/index.php?title=Special:AllPages&amp;from=Gamma+ray" title="Special:AllPages">Next page (Gamma ray)</a>
            </div>
            <div class="mw-allpages-body">
            <ul class="mw-allpages-chunk">
              <li><a href="/wiki/Alpha" title="Alpha">Alpha</a></li>
              <li class="allpagesredirect"><a href="/wiki/Beta" title="Beta (letter)">Beta</a></li>
            </ul>
            </div>
            <a href="/wiki/Elsewhere" title="Elsewhere">outside</a>
            """;

        var result = ListingExtractor.extract(html);

        assertThat(result.isChunkIndex()).isFalse();
        assertThat(result.pages()).containsExactly("Alpha", "Beta (letter)");
        assertThat(result.optNextCursor()).contains("Gamma ray");
    }

    @Test
    public void shouldExtractTableChunk() {
        var html = """
            <table class="mw-allpages-table-chunk">
            <tr><td style="width:33%"><a href="/wiki/Foo" title="Foo">Foo</a></td>
            <td style="width:33%"><a href="/wiki/Foo_bar" title="Foo bar">Foo bar</a></td></tr>
            </table>
            """;

        assertThat(ListingExtractor.extract(html).pages()).containsExactly("Foo", "Foo bar");
    }

    @Test
    public void shouldPreferNextPageOverPreviousPage() {
        var html = """
            <div class="mw-allpages-nav">
              <a href="/w/index.php?title=Special:AllPages&amp;from=Apple">Previous page (Apple)</a> |
              <a href="/w/index.php?title=Special:AllPages&amp;from=Kiwi">Next page (Kiwi)</a>
            </div>
            <ul class="mw-allpages-chunk"><li><a title="Fig">Fig</a></li></ul>
            """;

        assertThat(ListingExtractor.extract(html).optNextCursor()).contains("Kiwi");
    }

    @Test
    public void shouldHaveNoCursorWithoutNavigation() {
        var html = "<ul class=\"mw-allpages-chunk\"><li><a href=\"/wiki/Last\" title=\"Last\">Last</a></li></ul>";

        var result = ListingExtractor.extract(html);

        assertThat(result.pages()).containsExactly("Last");
        assertThat(result.optNextCursor()).isEmpty();
    }

    @Test
    public void shouldSkipLinksWithoutRangeOrTitle() {
        var html = """
            <table class="allpageslist"><tr><td><a href="/w/index.php?title=Special:AllPages&amp;from=A">A</a></td></tr></table>
            <ul class="mw-allpages-chunk"><li><a href="/wiki/NoTitle">NoTitle</a></li></ul>
            """;

        var extractor = new ListingExtractor();
        extractor.feed(html);

        assertThat(extractor.getResult().chunks()).isEmpty();
        assertThat(extractor.getResult().pages()).isEmpty();
        assertThat(extractor.getDiagnostics()).hasSize(2);
    }
}
