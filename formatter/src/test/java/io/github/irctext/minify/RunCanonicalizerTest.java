package io.github.irctext.minify;

import static org.junit.jupiter.api.Assertions.*;

import io.github.irctext.marker.Marker;
import io.github.irctext.marker.RenderState;
import io.github.irctext.marker.ToggleKind;
import java.util.List;
import org.junit.jupiter.api.Test;

class RunCanonicalizerTest {

    private static final Marker BOLD = Marker.toggle(ToggleKind.BOLD);
    private static final Marker ITALICS = Marker.toggle(ToggleKind.ITALICS);
    private static final Marker UNDERLINE = Marker.toggle(ToggleKind.UNDERLINE);
    private static final Marker REVERSE = Marker.toggle(ToggleKind.REVERSE);

    private static List<Marker> canonical(List<Marker> run, RenderState before) {
        return RunCanonicalizer.canonicalize(run, before).markers();
    }

    @Test
    void testToggleTwiceCancels() {
        assertEquals(List.of(), canonical(List.of(BOLD, BOLD), RenderState.initial()));
        assertEquals(List.of(ITALICS), canonical(List.of(BOLD, ITALICS, BOLD), RenderState.initial()));
    }

    @Test
    void testToggleThreeTimesKeepsOne() {
        assertEquals(List.of(UNDERLINE), canonical(List.of(UNDERLINE, UNDERLINE, UNDERLINE), RenderState.initial()));
    }

    @Test
    void testTogglesUseCanonicalOrder() {
        assertEquals(
                List.of(ITALICS, BOLD, UNDERLINE, REVERSE),
                canonical(List.of(REVERSE, UNDERLINE, BOLD, ITALICS), RenderState.initial()));
    }

    @Test
    void testMarkersBeforeLastResetAreDiscarded() {
        var before = RenderState.initial().apply(BOLD);
        var result = RunCanonicalizer.canonicalize(
                List.of(ITALICS, Marker.color(4, null), Marker.reset(), UNDERLINE, Marker.reset(), BOLD), before);
        assertEquals(List.of(Marker.reset(), BOLD), result.markers());
        assertEquals(RenderState.initial().apply(BOLD), result.after());
        // bold was already on, so the whole run changes nothing
        assertEquals(List.of(), result.alternative());
        assertTrue(result.isNoOp());
    }

    @Test
    void testAlternativeAddsOrRemovesTheReset() {
        var before = RenderState.initial().apply(BOLD).apply(ITALICS).apply(UNDERLINE);
        var withoutReset = RunCanonicalizer.canonicalize(List.of(BOLD, ITALICS, UNDERLINE), before);
        assertEquals(List.of(ITALICS, BOLD, UNDERLINE), withoutReset.markers());
        assertEquals(List.of(Marker.reset()), withoutReset.alternative());
        assertFalse(withoutReset.isNoOp());

        var withReset = RunCanonicalizer.canonicalize(List.of(Marker.reset(), Marker.color(4, null)), before);
        assertEquals(List.of(Marker.reset(), Marker.color(4, null)), withReset.markers());
        assertEquals(List.of(Marker.color(4, null), ITALICS, BOLD, UNDERLINE), withReset.alternative());
        assertEquals(before.applyAll(withReset.alternative()), withReset.after());
    }

    @Test
    void testResetFromInitialStateIsDropped() {
        assertEquals(List.of(), canonical(List.of(Marker.reset()), RenderState.initial()));
        assertEquals(List.of(BOLD), canonical(List.of(Marker.reset(), BOLD), RenderState.initial()));
    }

    @Test
    void testColorsFoldLeftToRight() {
        var run = List.<Marker>of(Marker.color(3, null), Marker.color(null, 7), Marker.color(5, null));
        assertEquals(List.of(Marker.color(5, 7)), canonical(run, RenderState.initial()));
    }

    @Test
    void testColorComesBeforeToggles() {
        var run = List.<Marker>of(BOLD, Marker.color(3, null));
        assertEquals(List.of(Marker.color(3, null), BOLD), canonical(run, RenderState.initial()));
    }

    @Test
    void testUnchangedColorIsDropped() {
        var before = RenderState.initial().apply(Marker.color(4, 1));
        assertEquals(List.of(), canonical(List.of(Marker.color(4, 1)), before));
        assertEquals(List.of(), canonical(List.of(Marker.color(4, null)), before));
    }

    @Test
    void testOnlyChangedComponentsAreEmitted() {
        var before = RenderState.initial().apply(Marker.color(4, 1));
        assertEquals(List.of(Marker.color(null, 2)), canonical(List.of(Marker.color(4, 2)), before));
        assertEquals(List.of(Marker.color(9, null)), canonical(List.of(Marker.color(9, 1)), before));
    }

    @Test
    void testClearBothEmitsBareMarker() {
        var before = RenderState.initial().apply(Marker.color(4, 1));
        assertEquals(
                List.of(Marker.clearColors()),
                canonical(List.of(Marker.color(8, null), Marker.clearColors()), before));
        assertEquals(List.of(), canonical(List.of(Marker.clearColors()), RenderState.initial()));
    }

    @Test
    void testClearingOneSlotNeedsTwoMarkers() {
        var before = RenderState.initial().apply(Marker.color(4, 1));
        var result = RunCanonicalizer.canonicalize(List.of(Marker.clearColors(), Marker.color(null, 6)), before);
        assertEquals(List.of(Marker.clearColors(), Marker.color(null, 6)), result.markers());
        assertNull(result.after().fg());
        assertEquals(6, result.after().bg());
    }

    @Test
    void testAfterMatchesReplayOfOriginalRun() {
        var before = RenderState.initial().apply(Marker.color(2, 3)).apply(REVERSE);
        var run = List.<Marker>of(
                REVERSE, Marker.color(null, 9), BOLD, Marker.clearColors(), Marker.color(11, null), BOLD, ITALICS);
        var result = RunCanonicalizer.canonicalize(run, before);
        assertEquals(before.applyAll(run), result.after());
        assertEquals(before.applyAll(run), before.applyAll(result.markers()));
    }

    @Test
    void testColorTransition() {
        assertEquals(List.of(), RunCanonicalizer.colorTransition(1, 2, 1, 2));
        assertEquals(List.of(Marker.clearColors()), RunCanonicalizer.colorTransition(1, 2, null, null));
        assertEquals(
                List.of(Marker.clearColors(), Marker.color(1, null)),
                RunCanonicalizer.colorTransition(1, 2, 1, null));
        assertEquals(List.of(Marker.color(1, 2)), RunCanonicalizer.colorTransition(null, null, 1, 2));
    }
}
