package com.powerwatch.backup.etl.source;

import com.google.common.collect.ImmutableList;
import com.powerwatch.backup.exception.SchemaMismatchException;

import java.util.ArrayList;
import java.util.List;

/**
 * A named, untyped table as read from a workbook sheet or a delimited file: a header row and the
 * data rows below it.
 */
public record TabularTable(String name, List<String> header, List<TabularRow> rows) {

    public TabularTable {
        header = ImmutableList.copyOf(header);
        rows = ImmutableList.copyOf(rows);
    }

    /**
     * @return index of the column whose trimmed header equals {@code column}, or -1
     */
    public int columnIndex(String column) {
        for (int i = 0; i < header.size(); i++) {
            if (header.get(i) != null && header.get(i).trim().equals(column)) {
                return i;
            }
        }
        return -1;
    }

    public boolean hasColumn(String column) {
        return columnIndex(column) >= 0;
    }

    /**
     * Returns a copy with the header {@code from} renamed to {@code to}. Unchanged if {@code from} is absent.
     */
    public TabularTable renameColumn(String from, String to) {
        int idx = columnIndex(from);
        if (idx < 0) {
            return this;
        }
        List<String> renamed = new ArrayList<>(header);
        renamed.set(idx, to);
        return new TabularTable(name, renamed, rows);
    }

    /**
     * @throws SchemaMismatchException listing every column of {@code required} the header lacks
     */
    public void requireColumns(List<String> required) throws SchemaMismatchException {
        List<String> missing = required.stream().filter(c -> !hasColumn(c)).toList();
        if (!missing.isEmpty()) {
            throw new SchemaMismatchException(name, missing);
        }
    }
}
