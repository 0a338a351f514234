package io.cgmes.eqflat.mapping;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * An object's own fields plus the enrichment columns spliced in from the objects it references,
 * in column order.
 */
public record FlattenedRecord(String id, String className, Map<String, String> columns) {

    /** Name of the identifier column, always the first column. */
    public static final String ID_COLUMN = "rdf_ID";

    public FlattenedRecord {
        columns = Collections.unmodifiableMap(new LinkedHashMap<>(columns));
    }

    public String get(String column) {
        return columns.get(column);
    }
}
