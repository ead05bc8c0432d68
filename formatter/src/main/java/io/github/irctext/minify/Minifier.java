package io.github.irctext.minify;

import com.google.common.base.Splitter;
import io.github.irctext.marker.Marker;
import io.github.irctext.marker.MarkerTokenizer;
import io.github.irctext.marker.RenderState;
import io.github.irctext.marker.Segment;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Rewrites annotated text into the shortest marker sequence with the same visual result.
 *
 * <p>Lines are independent protocol frames, so every line starts from {@link RenderState#initial()}. Within a line the
 * state is folded across marker runs: each run is canonicalized against the state accumulated so far, runs that
 * change nothing are dropped, and markers after the last visible character are never observable and are dropped too.
 * A kept run is written in whichever equivalent form is shorter, so the output is never longer than the input.
 *
 * <p>{@code minify(minify(s)).equals(minify(s))} holds for every input.
 */
public final class Minifier {
    private static final Logger logger = LogManager.getLogger(Minifier.class);

    private Minifier() {}

    public static String minify(String text) {
        Objects.requireNonNull(text, "text");
        var lines = new ArrayList<String>();
        for (String line : Splitter.on('\n').split(text)) {
            lines.add(minifyLine(line));
        }
        String result = String.join("\n", lines);
        logger.trace("Minified {} chars to {}", text.length(), result.length());
        return result;
    }

    /** Minifies a single line; {@code line} is treated as one frame even if it contains a newline. */
    public static String minifyLine(String line) {
        List<Item> items = fold(MarkerTokenizer.runs(line));

        // runs after the last literal text are never observable
        int lastText = -1;
        for (int i = 0; i < items.size(); i++) {
            if (items.get(i) instanceof Literal) {
                lastText = i;
            }
        }

        var out = new StringBuilder(line.length());
        for (int i = 0; i <= lastText; i++) {
            Item item = items.get(i);
            if (item instanceof Literal literal) {
                out.append(literal.text());
            } else {
                MarkerWriter.write(out, ((Run) item).canonical(), followingText(items, i));
            }
        }
        return out.toString();
    }

    private sealed interface Item permits Literal, Run {}

    private record Literal(String text) implements Item {}

    private record Run(RunCanonicalizer.CanonicalRun canonical) implements Item {}

    /**
     * Folds the run/text alternation into literal text and canonical runs that change something. Adjacent literals
     * (left behind when a run turns out to be a no-op) are merged so that the writer sees the real following text.
     */
    private static List<Item> fold(List<List<Segment>> groups) {
        var items = new ArrayList<Item>();
        RenderState state = RenderState.initial();
        for (List<Segment> group : groups) {
            if (group.get(0) instanceof Segment.Text text) {
                appendLiteral(items, text.raw());
                continue;
            }
            var markers = new ArrayList<Marker>(group.size());
            for (Segment segment : group) {
                markers.add(((Segment.MarkerSegment) segment).marker());
            }
            var canonical = RunCanonicalizer.canonicalize(markers, state);
            if (!canonical.isNoOp()) {
                items.add(new Run(canonical));
            }
            state = canonical.after();
        }
        return items;
    }

    private static void appendLiteral(List<Item> items, String text) {
        int last = items.size() - 1;
        if (last >= 0 && items.get(last) instanceof Literal previous) {
            items.set(last, new Literal(previous.text() + text));
        } else {
            items.add(new Literal(text));
        }
    }

    private static String followingText(List<Item> items, int runIndex) {
        if (runIndex + 1 < items.size() && items.get(runIndex + 1) instanceof Literal literal) {
            return literal.text();
        }
        return "";
    }
}
