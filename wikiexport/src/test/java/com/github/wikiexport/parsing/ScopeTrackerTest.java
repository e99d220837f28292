package com.github.wikiexport.parsing;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Test;

public class ScopeTrackerTest {
    private static class BoxRecorder extends ScopeTracker {
        final CaptureRegion box = register("box", (tag, attrs) -> tag.equals("div") && Utils.hasClass(attrs, "box"));
        final List<String> captured = new ArrayList<>();
        final List<Integer> closedAtDepth = new ArrayList<>();

        @Override
        protected void handleText(String text) {
            if (box.isActive()) {
                captured.add(text);
            }
        }

        @Override
        protected void regionClosed(CaptureRegion region) {
            closedAtDepth.add(depth());
        }
    }

    private static BoxRecorder feed(String html) {
        var recorder = new BoxRecorder();
        recorder.feed(html);
        return recorder;
    }

    @Test
    public void shouldCloseRegionOnMatchingEndTag() {
        var recorder = feed("<div><div class=\"box\"><div>in</div><span>also</span></div><div>out</div></div>");

        assertThat(recorder.captured).containsExactly("in", "also");
        assertThat(recorder.closedAtDepth).containsExactly(1);
        assertThat(recorder.getDiagnostics()).isEmpty();
        assertThat(recorder.getOpenElements()).isEmpty();
    }

    @Test
    public void shouldIgnoreSameNamedTagsOutsideRegion() {
        var recorder = feed("<div><div>before</div><div class=\"wide box\">x<div>y</div>z</div>after</div>");

        assertThat(recorder.captured).containsExactly("x", "y", "z");
    }

    @Test
    public void shouldReopenForEachTrigger() {
        var recorder = feed("<div class=\"box\">one</div>between<div class=\"box\">two</div>");

        assertThat(recorder.captured).containsExactly("one", "two");
        assertThat(recorder.closedAtDepth).containsExactly(0, 0);
    }

    @Test
    public void shouldLeaveStackUnchangedOnOrphanEndTag() {
        var recorder = feed("<div><p>text</span>");

        assertThat(recorder.getOpenElements()).containsExactly("div", "p");
        assertThat(recorder.getDiagnostics()).containsExactly("could not find start tag for: 'span' in [div, p]");
    }

    @Test
    public void shouldUnwindOnMissingEndTags() {
        var recorder = feed("<div class=\"box\"><p>one<b>two</div>after");

        assertThat(recorder.captured).containsExactly("one", "two");
        assertThat(recorder.getOpenElements()).isEmpty();
        assertThat(recorder.getDiagnostics()).containsExactly("missing end tag for: [p, b], closing div");
    }

    @Test
    public void shouldNotPushVoidElements() {
        var recorder = feed("<div class=\"box\"><br><img src=x><input type=text><hr>t</div>after");

        assertThat(recorder.captured).containsExactly("t");
        assertThat(recorder.getDiagnostics()).isEmpty();
    }

    @Test
    public void shouldCloseDanglingRegionAtEndOfDocument() {
        var recorder = feed("<div class=\"box\">never closed");

        assertThat(recorder.captured).containsExactly("never closed");
        assertThat(recorder.closedAtDepth).hasSize(1);
        assertThat(recorder.box.isActive()).isFalse();
    }

    @Test
    public void shouldNeverRaiseOnGarbage() {
        assertThatCode(() -> feed("</></<<>>&&&<a href=</div></div><div class=box></p></td>")).doesNotThrowAnyException();
        assertThatCode(() -> feed("")).doesNotThrowAnyException();
    }

    @Test
    public void shouldBeSingleUse() {
        var recorder = feed("<div></div>");

        assertThatThrownBy(() -> recorder.feed("<div></div>")).isInstanceOf(IllegalStateException.class);
    }
}
