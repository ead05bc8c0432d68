package io.github.irctext.util;

import io.github.irctext.marker.MarkerTokenizer;
import io.github.irctext.marker.Segment;
import java.util.Map;

/**
 * Unicode look-alike transforms for clients without native styling: small capitals, fullwidth forms and combining
 * overline/underline/strikethrough.
 */
public final class GlyphUtil {

    private static final char COMBINING_OVERLINE = '\u0305';
    private static final char COMBINING_LOW_LINE = '\u0332';
    private static final char COMBINING_LONG_STROKE = '\u0336';

    // Fullwidth forms mirror printable ASCII at a fixed offset
    private static final int FULLWIDTH_OFFSET = 0xFF01 - '!';

    private static final Map<Character, Character> SMALL_CAPS = Map.ofEntries(
            Map.entry('a', 'ᴀ'),
            Map.entry('b', 'ʙ'),
            Map.entry('c', 'ᴄ'),
            Map.entry('d', 'ᴅ'),
            Map.entry('e', 'ᴇ'),
            Map.entry('f', 'ꜰ'),
            Map.entry('g', 'ɢ'),
            Map.entry('h', 'ʜ'),
            Map.entry('i', 'ɪ'),
            Map.entry('j', 'ᴊ'),
            Map.entry('k', 'ᴋ'),
            Map.entry('l', 'ʟ'),
            Map.entry('m', 'ᴍ'),
            Map.entry('n', 'ɴ'),
            Map.entry('o', 'ᴏ'),
            Map.entry('p', 'ᴘ'),
            Map.entry('q', 'ǫ'),
            Map.entry('r', 'ʀ'),
            Map.entry('s', 'ꜱ'),
            Map.entry('t', 'ᴛ'),
            Map.entry('u', 'ᴜ'),
            Map.entry('v', 'ᴠ'),
            Map.entry('w', 'ᴡ'),
            Map.entry('y', 'ʏ'),
            Map.entry('z', 'ᴢ'));

    private GlyphUtil() {}

    /** Lowercase ASCII letters to small capitals; everything else unchanged. */
    public static String smallcaps(String text) {
        var sb = new StringBuilder(text.length());
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            char mapped = SMALL_CAPS.getOrDefault(c, c);
            sb.append(mapped);
        }
        return sb.toString();
    }

    /** Printable ASCII (except space) to its fullwidth form. */
    public static String fullwidth(String text) {
        var sb = new StringBuilder(text.length());
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            sb.append(c >= '!' && c <= '~' ? (char) (c + FULLWIDTH_OFFSET) : c);
        }
        return sb.toString();
    }

    public static String overline(String text) {
        return interleave(text, COMBINING_OVERLINE);
    }

    public static String underline(String text) {
        return interleave(text, COMBINING_LOW_LINE);
    }

    /** Strikes through literal text only; markers pass through untouched so colors keep working. */
    public static String strikethrough(String text) {
        var sb = new StringBuilder(text.length() * 2);
        for (Segment segment : MarkerTokenizer.tokenize(text)) {
            if (segment instanceof Segment.Text literal) {
                sb.append(interleave(literal.raw(), COMBINING_LONG_STROKE));
            } else {
                sb.append(segment.raw());
            }
        }
        return sb.toString();
    }

    /** Puts {@code mark} before every codepoint of {@code text}. */
    private static String interleave(String text, char mark) {
        var sb = new StringBuilder(text.length() * 2);
        text.codePoints().forEach(cp -> sb.append(mark).appendCodePoint(cp));
        return sb.toString();
    }
}
