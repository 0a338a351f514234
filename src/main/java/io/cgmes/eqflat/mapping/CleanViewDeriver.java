package io.cgmes.eqflat.mapping;

import io.cgmes.eqflat.model.FieldValue;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Projects a class table onto the columns worth showing to people: the identifier column,
 * pointer columns and mRID columns are dropped, every other value is kept as is.
 */
public class CleanViewDeriver {

    private static final String MRID_MARKER = "mrid";

    public ClassTable derive(ClassTable table) {
        List<String> kept =
                table.columns().stream()
                        .filter(column -> !isDropped(column))
                        .collect(Collectors.toList());
        List<Map<String, String>> rows = new ArrayList<>(table.rowCount());
        for (Map<String, String> row : table.rows()) {
            Map<String, String> projected = new LinkedHashMap<>();
            for (String column : kept) {
                String value = row.get(column);
                if (value != null) {
                    projected.put(column, value);
                }
            }
            rows.add(projected);
        }
        return new ClassTable(table.className(), kept, rows);
    }

    static boolean isDropped(String column) {
        return column.equals(FlattenedRecord.ID_COLUMN)
                || column.contains(FieldValue.RESOURCE_MARKER)
                || column.toLowerCase(Locale.ROOT).endsWith(MRID_MARKER);
    }
}
