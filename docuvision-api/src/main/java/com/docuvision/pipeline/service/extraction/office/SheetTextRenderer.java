package com.docuvision.pipeline.service.extraction.office;

import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Collects the cell values of one sheet and renders them as text: cells tab-joined over the
 * sheet's used column range, every row terminated by a newline, missing cells as empty strings.
 */
final class SheetTextRenderer {

    private final SortedMap<Integer, SortedMap<Integer, String>> rows = new TreeMap<>();
    private int firstColumn = Integer.MAX_VALUE;
    private int lastColumn = -1;

    void put(int row, int column, String value) {
        rows.computeIfAbsent(row, key -> new TreeMap<>()).put(column, value == null ? "" : value);
        firstColumn = Math.min(firstColumn, column);
        lastColumn = Math.max(lastColumn, column);
    }

    void appendTo(StringBuilder out) {
        if (rows.isEmpty()) {
            return;
        }
        for (int row = rows.firstKey(); row <= rows.lastKey(); row++) {
            Map<Integer, String> cells = rows.getOrDefault(row, new TreeMap<>());
            for (int column = firstColumn; column <= lastColumn; column++) {
                if (column > firstColumn) {
                    out.append('\t');
                }
                out.append(cells.getOrDefault(column, ""));
            }
            out.append('\n');
        }
    }
}
