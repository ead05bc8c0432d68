package io.github.irctext.minify;

import io.github.irctext.marker.ControlCode;
import io.github.irctext.marker.Marker;
import io.github.irctext.minify.RunCanonicalizer.CanonicalRun;
import java.util.List;
import org.jetbrains.annotations.Nullable;

/**
 * Serializes markers back to their control-character form using the fewest digits that still read back
 * unambiguously.
 *
 * <p>A color component is written without its leading zero unless the next written character is a digit. A color
 * marker that would swallow the literal text after it ({@code "\u0003" + "5"} or {@code "\u00034" + ",5"}) is closed
 * with a no-op bold pair.
 */
public final class MarkerWriter {

    static final String TERMINATOR = "" + ControlCode.BOLD + ControlCode.BOLD;

    private MarkerWriter() {}

    /**
     * Appends whichever of the run's two equivalent forms writes shorter; a tie keeps {@link CanonicalRun#markers()}.
     *
     * @param following the literal text written right after the run, used to decide padding and termination
     */
    public static void write(StringBuilder out, CanonicalRun run, String following) {
        String preferred = render(run.markers(), following);
        String alternative = render(run.alternative(), following);
        out.append(alternative.length() < preferred.length() ? alternative : preferred);
    }

    /** Control-character form of {@code run} when {@code following} is written right after it. */
    static String render(List<Marker> run, String following) {
        var out = new StringBuilder();
        for (int i = 0; i < run.size(); i++) {
            Marker marker = run.get(i);
            if (marker instanceof Marker.Toggle toggle) {
                out.append(toggle.kind().code());
            } else if (marker instanceof Marker.Reset) {
                out.append(ControlCode.RESET);
            } else {
                // anything after a marker inside the run starts with a control character
                String next = i + 1 < run.size() ? "" : following;
                writeColor(out, (Marker.Color) marker, next);
            }
        }
        return out.toString();
    }

    private static void writeColor(StringBuilder out, Marker.Color color, String next) {
        boolean digitNext = !next.isEmpty() && isDigit(next.charAt(0));
        boolean bgNext = next.length() > 1 && next.charAt(0) == ',' && isDigit(next.charAt(1));

        out.append(ControlCode.COLOR);
        @Nullable Integer fg = color.fg();
        @Nullable Integer bg = color.bg();
        if (bg != null) {
            if (fg != null) {
                out.append(fg).append(',');
            } else {
                out.append(',');
            }
            appendComponent(out, bg, digitNext);
            return;
        }
        if (fg != null) {
            appendComponent(out, fg, digitNext);
            if (bgNext) {
                out.append(TERMINATOR);
            }
            return;
        }
        if (digitNext || bgNext) {
            out.append(TERMINATOR);
        }
    }

    private static void appendComponent(StringBuilder out, int value, boolean pad) {
        if (pad && value < 10) {
            out.append('0');
        }
        out.append(value);
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }
}
