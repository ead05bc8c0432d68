package io.github.irctext.layout;

import static org.junit.jupiter.api.Assertions.*;

import io.github.irctext.marker.DisplayWidth;
import java.util.List;
import org.junit.jupiter.api.Test;

class AlignedTableTest {

    @Test
    void testColumnsPaddedToWidestCell() {
        var table = AlignedTable.render(List.of(List.of("a", "bb"), List.of("ccc")), " | ");
        assertEquals(List.of("a   | bb", "ccc"), table);
    }

    @Test
    void testColumnWidthsIgnoreMissingCells() {
        assertEquals(List.of(3, 2), AlignedTable.columnWidths(List.of(List.of("a", "bb"), List.of("ccc"))));
        assertEquals(List.of(), AlignedTable.columnWidths(List.of()));
    }

    @Test
    void testMarkersDoNotCountTowardsWidth() {
        var rows = List.of(List.of("\u00034red\u0003", "x"), List.of("blue", "y"));
        var table = AlignedTable.render(rows, "|");
        assertEquals(List.of("\u00034red\u0003 |x", "blue|y"), table);
        assertEquals(DisplayWidth.displayWidth(table.get(0)), DisplayWidth.displayWidth(table.get(1)));
    }

    @Test
    void testDefaultSeparator() {
        var table = AlignedTable.render(List.of(List.of("k", "v"), List.of("key", "value")));
        assertEquals("k   ⎪ v    ", DisplayWidth.stripMarkers(table.get(0)));
        assertEquals("key ⎪ value", DisplayWidth.stripMarkers(table.get(1)));
    }

    @Test
    void testEmptyInputs() {
        assertEquals(List.of(), AlignedTable.render(List.of()));
        assertEquals(List.of("", "a"), AlignedTable.render(List.of(List.of(), List.of("a"))));
    }
}
