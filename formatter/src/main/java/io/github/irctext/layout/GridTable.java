package io.github.irctext.layout;

import static io.github.irctext.marker.DisplayWidth.displayWidth;

import io.github.irctext.marker.ControlCode;
import io.github.irctext.util.TextUtil;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Bordered grid of labels, filled row by row with as many equal-width columns as the width budget allows.
 *
 * <pre>
 * Results                 more
 * ⎢alpha ⎪ beta  ⎪  gamma⎥
 * ⎢delta ⎪ eps   ⎥
 * </pre>
 *
 * Every cell costs its width plus three columns of border/divider, and the row as a whole one less. The last column is
 * right-aligned, the others left-aligned. When a row cap is given and the labels need more rows, the widest labels are
 * dropped one at a time until they fit and the header says so.
 */
public final class GridTable {
    private static final Logger logger = LogManager.getLogger(GridTable.class);

    /** Border and divider columns charged to each cell. */
    static final int CELL_OVERHEAD = 3;

    private GridTable() {}

    public static List<String> render(List<String> labels, int width) {
        return render(labels, width, null, "", "", 12);
    }

    /**
     * Lays out {@code labels} within {@code width} display columns.
     *
     * @param rowMax maximum number of data rows, or null for no cap
     * @param header left-hand header text
     * @param rightHeader right-hand header text, right-aligned on the header row
     * @param color color index (0-99) for the borders and the truncation note
     * @return the header row followed by the data rows; empty if there are no labels
     */
    public static List<String> render(
            List<String> labels, int width, @Nullable Integer rowMax, String header, String rightHeader, int color) {
        Objects.requireNonNull(labels, "labels");
        Objects.requireNonNull(header, "header");
        Objects.requireNonNull(rightHeader, "rightHeader");
        if (rowMax != null && rowMax < 1) {
            throw new IllegalArgumentException("rowMax must be at least 1: " + rowMax);
        }
        if (color < 0 || color > ControlCode.MAX_COLOR) {
            throw new IllegalArgumentException("color must be within 0.." + ControlCode.MAX_COLOR + ": " + color);
        }
        if (labels.isEmpty()) {
            return List.of();
        }

        String code = ControlCode.COLOR + String.format(Locale.ROOT, "%02d", color);
        String borderLeft = code + "⎢" + ControlCode.COLOR;
        String divider = " " + code + "⎪" + ControlCode.COLOR + " ";
        String borderRight = code + "⎥" + ControlCode.COLOR;

        var cells = new ArrayList<>(labels);
        Shape shape = Shape.of(cells, width);
        String note = "";
        if (rowMax != null && shape.rows() > rowMax) {
            while (shape.rows() > rowMax) {
                cells.remove(widestIndex(cells));
                shape = Shape.of(cells, width);
            }
            note = "(first " + shape.rows() + " rows) ";
            logger.debug(
                    "Dropped {} of {} labels to fit {} rows", labels.size() - cells.size(), labels.size(), rowMax);
        }

        int naturalWidth = shape.columns() * (shape.biggest() + CELL_OVERHEAD) - 1;
        String headerRow = TextUtil.spacepad(header + code + note, rightHeader, naturalWidth);
        int headerWidth = displayWidth(headerRow);
        int cellWidth = shape.biggest();
        if (naturalWidth < headerWidth) {
            cellWidth = (headerWidth - 1) / shape.columns() - 1;
            logger.debug("Header is {} wide, widening cells from {} to {}", headerWidth, shape.biggest(), cellWidth);
        }

        var table = new ArrayList<String>(shape.rows() + 1);
        table.add(headerRow);
        for (int row = 0; row < shape.rows(); row++) {
            int from = row * shape.columns();
            int to = Math.min(from + shape.columns(), cells.size());
            var padded = new ArrayList<String>(to - from);
            for (int i = from; i < to; i++) {
                String cell = cells.get(i);
                String padding = TextUtil.spaces(cellWidth - displayWidth(cell));
                boolean lastColumn = i - from + 1 == shape.columns();
                padded.add(lastColumn ? padding + cell : cell + padding);
            }
            table.add(borderLeft + String.join(divider, padded) + borderRight);
        }
        return table;
    }

    /** Column and row counts for a label set; always at least one column. */
    record Shape(int biggest, int columns, int rows) {
        static Shape of(List<String> cells, int width) {
            int biggest = 0;
            for (String cell : cells) {
                biggest = Math.max(biggest, displayWidth(cell));
            }
            int columns = Math.max(1, Math.min(cells.size(), (width - 2) / (biggest + CELL_OVERHEAD)));
            int rows = (cells.size() + columns - 1) / columns;
            return new Shape(biggest, columns, rows);
        }
    }

    private static int widestIndex(List<String> cells) {
        int index = 0;
        int widest = -1;
        for (int i = 0; i < cells.size(); i++) {
            int w = displayWidth(cells.get(i));
            if (w > widest) {
                widest = w;
                index = i;
            }
        }
        return index;
    }
}
