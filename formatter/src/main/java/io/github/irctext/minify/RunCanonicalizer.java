package io.github.irctext.minify;

import io.github.irctext.marker.Marker;
import io.github.irctext.marker.RenderState;
import io.github.irctext.marker.ToggleKind;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.jetbrains.annotations.Nullable;

/**
 * Reduces one maximal run of markers (no literal text between them) to the shortest marker list that leaves the
 * {@link RenderState} in the same place.
 *
 * <p>Only the net effect of a run matters: markers before its last reset are overwritten, toggles cancel in pairs and
 * colors fold left to right. The output always has the shape {@code [Reset] [Color [Color]] [Toggle...]}, with toggles
 * in {@link ToggleKind} declaration order, so equivalent runs canonicalize identically.
 */
public final class RunCanonicalizer {

    private RunCanonicalizer() {}

    /**
     * Result of canonicalizing a run. Both marker lists move {@code before} to {@link #after()}; which one writes
     * shorter depends on the text that follows the run, so the choice is left to {@link MarkerWriter}.
     *
     * @param markers the canonical replacement run, starting with a reset only if the source run had one that
     *     matters
     * @param alternative the same transition with the leading reset added or removed
     * @param after the state once the run has been applied
     */
    public record CanonicalRun(List<Marker> markers, List<Marker> alternative, RenderState after) {
        public CanonicalRun {
            markers = List.copyOf(markers);
            alternative = List.copyOf(alternative);
        }

        /** True when the run leaves the state where it found it and can be dropped. */
        public boolean isNoOp() {
            return markers.isEmpty() || alternative.isEmpty();
        }
    }

    public static CanonicalRun canonicalize(List<Marker> run, RenderState before) {
        Objects.requireNonNull(run, "run");
        Objects.requireNonNull(before, "before");

        RenderState after = before.applyAll(run);
        List<Marker> direct = transition(before, after);
        var viaReset = new ArrayList<Marker>();
        viaReset.add(Marker.reset());
        viaReset.addAll(transition(RenderState.initial(), after));

        // a reset from the initial state changes nothing
        boolean hasReset = run.stream().anyMatch(marker -> marker instanceof Marker.Reset);
        if (hasReset && !before.isInitial()) {
            return new CanonicalRun(viaReset, direct, after);
        }
        return new CanonicalRun(direct, viaReset, after);
    }

    /** Colors first, then the toggles whose flag differs, in {@link ToggleKind} order. */
    private static List<Marker> transition(RenderState from, RenderState to) {
        var out = new ArrayList<Marker>(colorTransition(from.fg(), from.bg(), to.fg(), to.bg()));
        for (ToggleKind kind : ToggleKind.values()) {
            if (from.isSet(kind) != to.isSet(kind)) {
                out.add(Marker.toggle(kind));
            }
        }
        return out;
    }

    /**
     * Minimal color markers moving from {@code (fromFg, fromBg)} to {@code (toFg, toBg)}. A single marker cannot clear
     * just one slot, so that case needs a bare marker followed by one restoring the other slot.
     */
    static List<Marker> colorTransition(
            @Nullable Integer fromFg, @Nullable Integer fromBg, @Nullable Integer toFg, @Nullable Integer toBg) {
        if (Objects.equals(fromFg, toFg) && Objects.equals(fromBg, toBg)) {
            return List.of();
        }
        if (toFg == null && toBg == null) {
            return List.of(Marker.clearColors());
        }
        boolean fgCleared = toFg == null && fromFg != null;
        boolean bgCleared = toBg == null && fromBg != null;
        if (fgCleared || bgCleared) {
            return List.of(Marker.clearColors(), Marker.color(toFg, toBg));
        }
        return List.of(Marker.color(
                Objects.equals(fromFg, toFg) ? null : toFg, Objects.equals(fromBg, toBg) ? null : toBg));
    }
}
