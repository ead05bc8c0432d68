package io.github.irctext.marker;

/**
 * Reserved control characters of the chat protocol's inline formatting. Each constant is a single character; color is
 * additionally followed by an optional digit tail (see {@link MarkerTokenizer}).
 */
public final class ControlCode {

    public static final char BOLD = '\u0002';
    public static final char COLOR = '\u0003';
    public static final char RESET = '\u000F';
    public static final char REVERSE = '\u0016';
    public static final char ITALICS = '\u001D';
    public static final char UNDERLINE = '\u001F';

    // Largest color index a two-digit component can carry
    public static final int MAX_COLOR = 99;

    private ControlCode() {}

    /** True for any of the six reserved characters. */
    public static boolean isControl(char c) {
        return switch (c) {
            case BOLD, COLOR, RESET, REVERSE, ITALICS, UNDERLINE -> true;
            default -> false;
        };
    }

    static boolean isAsciiDigit(char c) {
        return c >= '0' && c <= '9';
    }
}
