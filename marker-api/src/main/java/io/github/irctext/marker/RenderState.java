package io.github.irctext.marker;

import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import org.jetbrains.annotations.Nullable;

/**
 * Style and color state produced by replaying markers left to right. Two states are equivalent iff all six fields
 * match, which is exactly record equality.
 */
public record RenderState(
        boolean bold,
        boolean italics,
        boolean underline,
        boolean reverse,
        @Nullable Integer fg,
        @Nullable Integer bg) {

    private static final RenderState INITIAL = new RenderState(false, false, false, false, null, null);

    public static RenderState initial() {
        return INITIAL;
    }

    public boolean isInitial() {
        return equals(INITIAL);
    }

    public boolean isSet(ToggleKind kind) {
        return switch (kind) {
            case ITALICS -> italics;
            case BOLD -> bold;
            case UNDERLINE -> underline;
            case REVERSE -> reverse;
        };
    }

    /** The toggles currently switched on. */
    public Set<ToggleKind> activeToggles() {
        var active = EnumSet.noneOf(ToggleKind.class);
        for (ToggleKind kind : ToggleKind.values()) {
            if (isSet(kind)) {
                active.add(kind);
            }
        }
        return active;
    }

    public RenderState withColors(@Nullable Integer newFg, @Nullable Integer newBg) {
        return new RenderState(bold, italics, underline, reverse, newFg, newBg);
    }

    public RenderState flip(ToggleKind kind) {
        return new RenderState(
                kind == ToggleKind.BOLD ? !bold : bold,
                kind == ToggleKind.ITALICS ? !italics : italics,
                kind == ToggleKind.UNDERLINE ? !underline : underline,
                kind == ToggleKind.REVERSE ? !reverse : reverse,
                fg,
                bg);
    }

    /** Returns the state after {@code marker} has been applied to this one. */
    public RenderState apply(Marker marker) {
        Objects.requireNonNull(marker, "marker");
        if (marker instanceof Marker.Toggle toggle) {
            return flip(toggle.kind());
        }
        if (marker instanceof Marker.Reset) {
            return INITIAL;
        }
        var color = (Marker.Color) marker;
        if (color.isClear()) {
            return withColors(null, null);
        }
        return withColors(color.fg() != null ? color.fg() : fg, color.bg() != null ? color.bg() : bg);
    }

    public RenderState applyAll(List<Marker> markers) {
        RenderState state = this;
        for (Marker marker : markers) {
            state = state.apply(marker);
        }
        return state;
    }
}
