package io.cgmes.eqflat.mapping;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Groups flattened records into one table per class. Classes and columns appear in first-seen
 * order, rows in discovery order; the column set of a class is the union over all its records.
 */
public class ClassTableAssembler {

    public Map<String, ClassTable> assemble(List<FlattenedRecord> records) {
        Map<String, Set<String>> columns = new LinkedHashMap<>();
        Map<String, List<Map<String, String>>> rows = new LinkedHashMap<>();
        for (FlattenedRecord record : records) {
            columns.computeIfAbsent(record.className(), k -> new LinkedHashSet<>())
                    .addAll(record.columns().keySet());
            rows.computeIfAbsent(record.className(), k -> new ArrayList<>()).add(record.columns());
        }

        Map<String, ClassTable> tables = new LinkedHashMap<>();
        columns.forEach(
                (className, columnSet) ->
                        tables.put(
                                className,
                                new ClassTable(
                                        className,
                                        new ArrayList<>(columnSet),
                                        rows.get(className))));
        return tables;
    }
}
