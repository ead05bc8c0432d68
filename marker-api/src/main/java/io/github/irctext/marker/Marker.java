package io.github.irctext.marker;

import java.util.Objects;
import org.jetbrains.annotations.Nullable;

/**
 * A single display instruction embedded in text.
 *
 * <p>Markers never nest and have no open/close pairing: each one mutates the current {@link RenderState} when it is
 * encountered left to right.
 */
public sealed interface Marker {

    static Marker toggle(ToggleKind kind) {
        return new Toggle(kind);
    }

    static Marker reset() {
        return Reset.INSTANCE;
    }

    /** The bare color marker, which clears both color slots. */
    static Color clearColors() {
        return Color.CLEAR;
    }

    static Color color(@Nullable Integer fg, @Nullable Integer bg) {
        return new Color(fg, bg);
    }

    /** Flips one boolean style flag. */
    record Toggle(ToggleKind kind) implements Marker {
        public Toggle {
            Objects.requireNonNull(kind, "kind");
        }
    }

    /** Clears every toggle and both color slots. */
    final class Reset implements Marker {
        static final Reset INSTANCE = new Reset();

        private Reset() {
            // use Marker.reset()
        }

        @Override
        public String toString() {
            return "Marker.Reset";
        }
    }

    /**
     * Sets foreground and/or background. A component that is null is left untouched, except that a marker with neither
     * component clears both.
     */
    record Color(@Nullable Integer fg, @Nullable Integer bg) implements Marker {
        static final Color CLEAR = new Color(null, null);

        public Color {
            checkRange(fg, "fg");
            checkRange(bg, "bg");
        }

        public boolean isClear() {
            return fg == null && bg == null;
        }

        private static void checkRange(@Nullable Integer value, String name) {
            if (value != null && (value < 0 || value > ControlCode.MAX_COLOR)) {
                throw new IllegalArgumentException(name + " must be within 0.." + ControlCode.MAX_COLOR + ": " + value);
            }
        }
    }
}
