package io.github.irctext.util;

import com.google.common.base.CharMatcher;
import com.google.common.base.Splitter;
import io.github.irctext.marker.DisplayWidth;
import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CodingErrorAction;
import java.util.ArrayList;
import java.util.List;

/** Small text helpers shared by the layout engines and callers preparing outgoing lines. */
public final class TextUtil {

    private TextUtil() {}

    /**
     * Number of bytes {@code text} occupies in {@code charset}. Characters the charset cannot represent count as the
     * charset's replacement bytes.
     */
    public static int encodedSize(Charset charset, String text) {
        try {
            ByteBuffer encoded = charset.newEncoder()
                    .onMalformedInput(CodingErrorAction.REPLACE)
                    .onUnmappableCharacter(CodingErrorAction.REPLACE)
                    .encode(CharBuffer.wrap(text));
            return encoded.remaining();
        } catch (CharacterCodingException e) {
            // unreachable with REPLACE, fall back to the lenient String encoder
            return text.getBytes(charset).length;
        }
    }

    /**
     * Splits {@code data} into protocol-safe lines: one entry per {@code '\n'}, trailing whitespace removed, and each
     * line cut to at most {@code maxSize} codepoints.
     */
    public static List<String> lineify(String data, int maxSize) {
        if (maxSize < 0) {
            throw new IllegalArgumentException("maxSize must not be negative: " + maxSize);
        }
        var lines = new ArrayList<String>();
        for (String line : Splitter.on('\n').split(data)) {
            lines.add(truncateCodepoints(CharMatcher.whitespace().trimTrailingFrom(line), maxSize));
        }
        return lines;
    }

    /** Cuts {@code text} to at most {@code maxCodepoints} codepoints without splitting a surrogate pair. */
    public static String truncateCodepoints(String text, int maxCodepoints) {
        if (text.codePointCount(0, text.length()) <= maxCodepoints) {
            return text;
        }
        return text.substring(0, text.offsetByCodePoints(0, maxCodepoints));
    }

    /** Glues {@code left} and {@code right} with enough spaces to reach {@code length} display columns. */
    public static String spacepad(String left, String right, int length) {
        int used = DisplayWidth.displayWidth(left) + DisplayWidth.displayWidth(right);
        return left + spaces(length - used) + right;
    }

    /** {@code count} spaces; none when {@code count} is not positive. */
    public static String spaces(int count) {
        return count > 0 ? " ".repeat(count) : "";
    }

    /** Ordinal form of an integer, e.g. 1st, 12th, 23rd. */
    public static String ordinal(int value) {
        int lastTwo = Math.abs(value % 100);
        String suffix = "th";
        if (lastTwo / 10 != 1) {
            suffix = switch (lastTwo % 10) {
                case 1 -> "st";
                case 2 -> "nd";
                case 3 -> "rd";
                default -> "th";
            };
        }
        return value + suffix;
    }

    /** Human-friendly description of how long ago something happened, e.g. "3 hours ago". */
    public static String prettyDate(long secondsAgo) {
        if (secondsAgo < 0) {
            return "just now";
        }
        long days = secondsAgo / 86400;
        long seconds = secondsAgo % 86400;

        if (days == 0) {
            if (seconds < 10) {
                return "just now";
            }
            if (seconds < 60) {
                return seconds + " seconds ago";
            }
            if (seconds < 120) {
                return "a minute ago";
            }
            if (seconds < 3600) {
                return seconds / 60 + " minutes ago";
            }
            if (seconds < 7200) {
                return "an hour ago";
            }
            return seconds / 3600 + " hours ago";
        }
        if (days == 1) {
            return "Yesterday";
        }
        if (days < 7) {
            return days + " days ago";
        }
        if (days < 31) {
            return days / 7 + " weeks ago";
        }
        if (days < 365) {
            return days / 30 + " months ago";
        }
        return days / 365 + " years ago";
    }
}
