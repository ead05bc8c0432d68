package io.github.irctext.layout;

import static io.github.irctext.marker.DisplayWidth.displayWidth;

import io.github.irctext.util.TextUtil;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Wraps items into rows of at most {@code width} display columns and stretches the gaps of each multi-item row so the
 * row fills the width exactly. Leftover spaces from the integer division go to the leftmost gaps.
 */
public final class JustifiedTable {

    private JustifiedTable() {}

    public static List<String> render(List<String> items, int width, int minSeparator) {
        Objects.requireNonNull(items, "items");
        if (minSeparator < 0) {
            throw new IllegalArgumentException("minSeparator must not be negative: " + minSeparator);
        }

        var rows = new ArrayList<List<String>>();
        var current = new ArrayList<String>();
        int used = 0;
        for (String item : items) {
            int itemWidth = displayWidth(item);
            if (used + itemWidth <= width) {
                current.add(item);
                used += itemWidth + minSeparator;
            } else {
                if (!current.isEmpty()) {
                    rows.add(current);
                }
                current = new ArrayList<>();
                current.add(item);
                used = itemWidth + minSeparator;
            }
        }
        if (!current.isEmpty()) {
            rows.add(current);
        }

        var table = new ArrayList<String>(rows.size());
        for (List<String> row : rows) {
            table.add(justify(row, width));
        }
        return table;
    }

    private static String justify(List<String> row, int width) {
        if (row.size() == 1) {
            return row.get(0);
        }
        int rowWidth = 0;
        for (String item : row) {
            rowWidth += displayWidth(item);
        }
        int gaps = row.size() - 1;
        int gapWidth = Math.floorDiv(width - rowWidth, gaps);
        int spares = Math.floorMod(width - rowWidth, gaps);

        var sb = new StringBuilder(row.get(0));
        for (int i = 1; i < row.size(); i++) {
            sb.append(TextUtil.spaces(gapWidth + (i - 1 < spares ? 1 : 0)));
            sb.append(row.get(i));
        }
        return sb.toString();
    }
}
