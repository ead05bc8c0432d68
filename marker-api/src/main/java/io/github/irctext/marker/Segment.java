package io.github.irctext.marker;

import java.util.Objects;

/** One element of a tokenized message: either literal text or a single marker. */
public sealed interface Segment {

    /** The exact source characters this segment was read from. */
    String raw();

    /** A non-empty run of ordinary characters. */
    record Text(String raw) implements Segment {
        public Text {
            Objects.requireNonNull(raw, "raw");
            if (raw.isEmpty()) {
                throw new IllegalArgumentException("Text segment must not be empty");
            }
        }
    }

    /** A marker together with the characters it consumed, e.g. {@code "\u000304,1"}. */
    record MarkerSegment(Marker marker, String raw) implements Segment {
        public MarkerSegment {
            Objects.requireNonNull(marker, "marker");
            Objects.requireNonNull(raw, "raw");
        }
    }
}
