package io.github.irctext.marker;

import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.api.Test;

class DisplayWidthTest {

    @Test
    void testMarkersOccupyNoWidth() {
        assertEquals(0, DisplayWidth.displayWidth(""));
        assertEquals(0, DisplayWidth.displayWidth("\u0002\u00034,5\u000F"));
        assertEquals(5, DisplayWidth.displayWidth("\u0002hello\u0002"));
        assertEquals(3, DisplayWidth.displayWidth("\u000312,34abc"));
    }

    @Test
    void testLiteralRemaindersAreCounted() {
        // third digit and dangling comma are literal text
        assertEquals(1, DisplayWidth.displayWidth("\u0003123"));
        assertEquals(2, DisplayWidth.displayWidth("\u0003,x"));
    }

    @Test
    void testCountsCodepointsNotChars() {
        String emoji = "😀";
        assertEquals(2, emoji.length());
        assertEquals(1, DisplayWidth.displayWidth(emoji));
        assertEquals(3, DisplayWidth.displayWidth("\u0002" + emoji + "ab"));
    }

    @Test
    void testStripMarkers() {
        assertEquals("hello world", DisplayWidth.stripMarkers("\u00034hello\u000F \u001Fworld\u001F"));
        assertEquals(",x", DisplayWidth.stripMarkers("\u0003,x"));
        assertEquals("⎢a⎥", DisplayWidth.stripMarkers("\u000312⎢\u0003a\u000312⎥\u0003"));
    }

    @Test
    void testWidthAgreesWithStrippedText() {
        String[] samples = {"plain", "\u00031,2\u0002x\u0016y", "\u0003,,5", "\u000399,999", "\u001D\u001D"};
        for (String s : samples) {
            assertEquals(DisplayWidth.displayWidth(s), DisplayWidth.displayWidth(DisplayWidth.stripMarkers(s)), s);
            assertEquals(DisplayWidth.stripMarkers(s).length(), DisplayWidth.displayWidth(s), s);
        }
    }
}
