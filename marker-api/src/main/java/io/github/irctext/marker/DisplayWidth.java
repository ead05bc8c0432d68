package io.github.irctext.marker;

/**
 * Visible width of annotated text. Markers occupy characters but no display space, so every layout budget is measured
 * with {@link #displayWidth(String)} rather than {@link String#length()}.
 */
public final class DisplayWidth {

    private DisplayWidth() {}

    /** Returns {@code text} with every marker removed. */
    public static String stripMarkers(String text) {
        var sb = new StringBuilder(text.length());
        for (Segment segment : MarkerTokenizer.tokenize(text)) {
            if (segment instanceof Segment.Text literal) {
                sb.append(literal.raw());
            }
        }
        return sb.toString();
    }

    /** Codepoint count of {@code text} once markers are removed. */
    public static int displayWidth(String text) {
        int width = 0;
        for (Segment segment : MarkerTokenizer.tokenize(text)) {
            if (segment instanceof Segment.Text literal) {
                String raw = literal.raw();
                width += raw.codePointCount(0, raw.length());
            }
        }
        return width;
    }
}
