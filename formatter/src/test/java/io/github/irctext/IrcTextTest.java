package io.github.irctext;

import static org.junit.jupiter.api.Assertions.*;

import io.github.irctext.config.FormatterConfig;
import io.github.irctext.layout.AlignedTable;
import io.github.irctext.layout.GridTable;
import io.github.irctext.layout.JustifiedTable;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class IrcTextTest {

    private static final char B = '\u0002';

    private final IrcText ircText = new IrcText(FormatterConfig.defaults());

    @Test
    void testLinesAreTrimmedAndMinified() {
        String text = "a" + B + B + "b  \n" + B + "c" + B;
        assertEquals(List.of("ab", B + "c"), ircText.lines(text));
    }

    @Test
    void testLinesRespectMaxLineLength() {
        var narrow = new IrcText(new FormatterConfig(5, "UTF-8", 12, 3, " | "));
        assertEquals(List.of("abcde", "xy"), narrow.lines("abcdefgh\nxy"));
    }

    @Test
    void testCutNeverSplitsAMarker() {
        var narrow = new IrcText(new FormatterConfig(4, "UTF-8", 12, 3, " | "));
        // the color marker is four characters long and does not fit after "a"
        assertEquals(List.of("a"), narrow.lines("a\u00034,5b"));
        assertEquals(List.of("ab"), narrow.lines("ab\u00034"));
    }

    @Test
    void testCutDropsDanglingMarkers() {
        var narrow = new IrcText(new FormatterConfig(3, "UTF-8", 12, 3, " | "));
        assertEquals(List.of("ab"), narrow.lines("ab\u0002cd"));
        assertEquals(List.of("\u0002ab"), narrow.lines("\u0002abcd"));
    }

    @Test
    void testWidthAndStrip() {
        String text = B + "bold" + B + " \u000304,01red";
        assertEquals(8, ircText.displayWidth(text));
        assertEquals("bold red", ircText.stripMarkers(text));
    }

    @Test
    void testJoinUntilByWidthIgnoresMarkers() {
        var parts = List.of(B + "one" + B, "two", "three");
        assertEquals(Optional.of(B + "one" + B + " two"), ircText.joinUntil(" ", parts, 7));
    }

    @Test
    void testJoinUntilBytesUsesConfiguredCharset() {
        var parts = List.of("é", "é", "é");
        assertEquals(Optional.of("éé"), ircText.joinUntilBytes("", parts, 5));

        var latin1 = new IrcText(new FormatterConfig(512, "ISO-8859-1", 12, 3, " | "));
        assertEquals(Optional.of("ééé"), latin1.joinUntilBytes("", parts, 5));
    }

    @Test
    void testLayoutUsesConfiguredDefaults() {
        var labels = List.of("alpha", "beta", "gamma", "delta");
        assertEquals(GridTable.render(labels, 40, null, "", "", 12), ircText.gridTable(labels, 40));
        assertEquals(JustifiedTable.render(labels, 20, 3), ircText.justify(labels, 20));

        var rows = List.of(List.of("a", "bb"), List.of("ccc", "d"));
        assertEquals(AlignedTable.render(rows, AlignedTable.DEFAULT_SEPARATOR), ircText.align(rows));
    }

    @Test
    void testConfiguredTableColor() {
        var green = new IrcText(new FormatterConfig(512, "UTF-8", 3, 3, " | "));
        var labels = List.of("one", "two");
        assertEquals(GridTable.render(labels, 30, 1, "h", "r", 3), green.gridTable(labels, 30, 1, "h", "r"));
    }
}
