package io.github.irctext.layout;

import static io.github.irctext.marker.DisplayWidth.displayWidth;

import io.github.irctext.marker.ControlCode;
import io.github.irctext.util.TextUtil;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/** Column-aligns rows of cells. Rows may have different cell counts; short rows simply end early. */
public final class AlignedTable {

    /** Grey divider between columns. */
    public static final String DEFAULT_SEPARATOR = " " + ControlCode.COLOR + "08⎪" + ControlCode.COLOR + " ";

    private AlignedTable() {}

    public static List<String> render(List<? extends List<String>> rows) {
        return render(rows, DEFAULT_SEPARATOR);
    }

    public static List<String> render(List<? extends List<String>> rows, String separator) {
        Objects.requireNonNull(rows, "rows");
        Objects.requireNonNull(separator, "separator");

        List<Integer> widths = columnWidths(rows);
        var table = new ArrayList<String>(rows.size());
        for (List<String> row : rows) {
            var padded = new ArrayList<String>(row.size());
            for (int i = 0; i < row.size(); i++) {
                String cell = row.get(i);
                padded.add(cell + TextUtil.spaces(widths.get(i) - displayWidth(cell)));
            }
            table.add(String.join(separator, padded));
        }
        return table;
    }

    /** Widest display width per column, over the rows that have that column. */
    static List<Integer> columnWidths(List<? extends List<String>> rows) {
        var widths = new ArrayList<Integer>();
        for (List<String> row : rows) {
            for (int i = 0; i < row.size(); i++) {
                int w = displayWidth(row.get(i));
                if (i == widths.size()) {
                    widths.add(w);
                } else if (w > widths.get(i)) {
                    widths.set(i, w);
                }
            }
        }
        return widths;
    }
}
