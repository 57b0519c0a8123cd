package com.powerwatch.backup.etl.source;

import javax.annotation.Nullable;
import java.util.List;

/**
 * Raw cell values of one data row. Values are {@code String}, {@code Double}, {@code Boolean},
 * {@code LocalDateTime} (date-formatted workbook cells) or null.
 *
 * @param rowNumber 1-based position in the source, counting the header as row 1
 */
public record TabularRow(int rowNumber, List<Object> values) {

    public @Nullable Object get(int columnIndex) {
        return columnIndex < values.size() ? values.get(columnIndex) : null;
    }
}
