package io.github.irctext.marker;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.jetbrains.annotations.Nullable;

/**
 * Single-pass scanner splitting annotated text into {@link Segment}s.
 *
 * <p>The scan never fails. A color character is followed by up to two foreground digits and, only when at least one
 * digit follows it, a comma with up to two background digits. Anything the color tail grammar does not accept stays
 * literal text, so {@code "\u0003,x"} is a bare color marker followed by {@code ",x"}.
 */
public final class MarkerTokenizer {

    private MarkerTokenizer() {}

    public static List<Segment> tokenize(String text) {
        Objects.requireNonNull(text, "text");
        var segments = new ArrayList<Segment>();
        int literalStart = 0;
        int i = 0;
        while (i < text.length()) {
            if (!ControlCode.isControl(text.charAt(i))) {
                i++;
                continue;
            }
            if (literalStart < i) {
                segments.add(new Segment.Text(text.substring(literalStart, i)));
            }
            var marker = readMarker(text, i);
            segments.add(marker);
            i += marker.raw().length();
            literalStart = i;
        }
        if (literalStart < text.length()) {
            segments.add(new Segment.Text(text.substring(literalStart)));
        }
        return segments;
    }

    /**
     * Groups {@link #tokenize(String)} into alternating literal text and maximal marker runs. Each group is either a
     * single {@link Segment.Text} or one or more consecutive {@link Segment.MarkerSegment}s.
     */
    public static List<List<Segment>> runs(String text) {
        var groups = new ArrayList<List<Segment>>();
        var run = new ArrayList<Segment>();
        for (Segment segment : tokenize(text)) {
            if (segment instanceof Segment.MarkerSegment) {
                run.add(segment);
                continue;
            }
            if (!run.isEmpty()) {
                groups.add(List.copyOf(run));
                run.clear();
            }
            groups.add(List.of(segment));
        }
        if (!run.isEmpty()) {
            groups.add(List.copyOf(run));
        }
        return groups;
    }

    /**
     * Reads the marker starting at {@code start}, which must hold a reserved character.
     *
     * @throws IllegalArgumentException if the character at {@code start} is not a control code
     */
    public static Segment.MarkerSegment readMarker(String text, int start) {
        char c = text.charAt(start);
        ToggleKind kind = ToggleKind.fromCode(c);
        if (kind != null) {
            return new Segment.MarkerSegment(Marker.toggle(kind), String.valueOf(c));
        }
        if (c == ControlCode.RESET) {
            return new Segment.MarkerSegment(Marker.reset(), String.valueOf(c));
        }
        if (c != ControlCode.COLOR) {
            throw new IllegalArgumentException("Not a control code at " + start + ": " + (int) c);
        }

        int pos = start + 1;
        int fgEnd = digitsEnd(text, pos);
        Integer fg = parse(text, pos, fgEnd);
        pos = fgEnd;

        Integer bg = null;
        if (pos + 1 < text.length() && text.charAt(pos) == ',' && ControlCode.isAsciiDigit(text.charAt(pos + 1))) {
            int bgEnd = digitsEnd(text, pos + 1);
            bg = parse(text, pos + 1, bgEnd);
            pos = bgEnd;
        }
        return new Segment.MarkerSegment(Marker.color(fg, bg), text.substring(start, pos));
    }

    /** Index just past at most two ASCII digits beginning at {@code from}. */
    private static int digitsEnd(String text, int from) {
        int end = from;
        while (end < text.length() && end - from < 2 && ControlCode.isAsciiDigit(text.charAt(end))) {
            end++;
        }
        return end;
    }

    private static @Nullable Integer parse(String text, int from, int to) {
        return from == to ? null : Integer.parseInt(text.substring(from, to));
    }
}
