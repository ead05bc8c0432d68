package io.github.irctext;

import io.github.irctext.config.FormatterConfig;
import io.github.irctext.layout.AlignedTable;
import io.github.irctext.layout.GridTable;
import io.github.irctext.layout.JoinUntil;
import io.github.irctext.layout.JustifiedTable;
import io.github.irctext.marker.DisplayWidth;
import io.github.irctext.marker.MarkerTokenizer;
import io.github.irctext.marker.Segment;
import io.github.irctext.minify.Minifier;
import io.github.irctext.util.TextUtil;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.jetbrains.annotations.Nullable;

/**
 * Entry point for callers that format outgoing chat text. Binds a {@link FormatterConfig} so that transport limits and
 * table styling do not have to be repeated at every call site.
 *
 * <p>Instances are immutable and safe to share between threads.
 */
public final class IrcText {

    private final FormatterConfig config;

    public IrcText() {
        this(FormatterConfig.load());
    }

    public IrcText(FormatterConfig config) {
        this.config = Objects.requireNonNull(config, "config");
    }

    public FormatterConfig config() {
        return config;
    }

    public String minify(String text) {
        return Minifier.minify(text);
    }

    public int displayWidth(String text) {
        return DisplayWidth.displayWidth(text);
    }

    public String stripMarkers(String text) {
        return DisplayWidth.stripMarkers(text);
    }

    /** Joins as many parts as fit in {@code ceiling} display columns. */
    public Optional<String> joinUntil(String separator, Iterable<String> parts, int ceiling) {
        return JoinUntil.joinUntil(separator, parts, ceiling);
    }

    /** Joins as many parts as fit in {@code maxBytes} once encoded with the configured charset. */
    public Optional<String> joinUntilBytes(String separator, Iterable<String> parts, int maxBytes) {
        var charset = config.charset();
        return JoinUntil.joinUntil(separator, parts, maxBytes, s -> TextUtil.encodedSize(charset, s));
    }

    /**
     * Prepares {@code text} for sending: one minified entry per line, each cut to the configured maximum length.
     * Lines are minified before cutting so markers do not eat into the budget.
     */
    public List<String> lines(String text) {
        var lines = new ArrayList<String>();
        for (String line : TextUtil.lineify(text, Integer.MAX_VALUE)) {
            lines.add(truncate(Minifier.minifyLine(line), config.maxLineLength()));
        }
        return lines;
    }

    /**
     * Cuts a minified line to {@code maxCodepoints} without splitting a marker, then drops the markers the cut left
     * dangling at the end.
     */
    private static String truncate(String line, int maxCodepoints) {
        if (line.codePointCount(0, line.length()) <= maxCodepoints) {
            return line;
        }
        var sb = new StringBuilder();
        int remaining = maxCodepoints;
        for (Segment segment : MarkerTokenizer.tokenize(line)) {
            String raw = segment.raw();
            int size = raw.codePointCount(0, raw.length());
            if (size <= remaining) {
                sb.append(raw);
                remaining -= size;
                continue;
            }
            if (segment instanceof Segment.Text) {
                sb.append(TextUtil.truncateCodepoints(raw, remaining));
            }
            break;
        }
        return Minifier.minifyLine(sb.toString());
    }

    public List<String> gridTable(List<String> labels, int width) {
        return GridTable.render(labels, width, null, "", "", config.tableColor());
    }

    public List<String> gridTable(
            List<String> labels, int width, @Nullable Integer rowMax, String header, String rightHeader) {
        return GridTable.render(labels, width, rowMax, header, rightHeader, config.tableColor());
    }

    public List<String> justify(List<String> items, int width) {
        return JustifiedTable.render(items, width, config.justifyMinSeparator());
    }

    public List<String> align(List<? extends List<String>> rows) {
        return AlignedTable.render(rows, config.alignSeparator());
    }
}
