package io.cgmes.eqflat.mapping;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Rows of one CIM class over a fixed column list. A row that lacks a column reads as empty.
 *
 * @param columns column names in output order
 * @param rows one column-to-value map per object, in discovery order
 */
public record ClassTable(String className, List<String> columns, List<Map<String, String>> rows) {

    public ClassTable {
        columns = List.copyOf(columns);
        rows = Collections.unmodifiableList(rows);
    }

    public int rowCount() {
        return rows.size();
    }

    /** Cell value, or the empty string when the row has no value for the column. */
    public String cell(int row, String column) {
        String value = rows.get(row).get(column);
        return value == null ? "" : value;
    }
}
