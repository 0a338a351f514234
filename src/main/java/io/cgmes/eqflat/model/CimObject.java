package io.cgmes.eqflat.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One RDF resource of the EQ document.
 *
 * <p>{@code fields} keeps document order across scalars and references, so the column order of
 * the flattened record follows the order the properties were written in.
 *
 * @param id identifier as written ({@code rdf:ID}, or {@code rdf:about} without leading '#')
 * @param className local name of the resource's CIM class
 * @param fields ordered field name to tagged value
 */
public record CimObject(String id, String className, Map<String, FieldValue> fields) {

    public CimObject {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(className, "className");
        fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    public Map<String, String> attributes() {
        Map<String, String> out = new LinkedHashMap<>();
        fields.forEach(
                (name, value) -> {
                    if (value instanceof FieldValue.Scalar scalar) {
                        out.put(name, scalar.raw());
                    }
                });
        return out;
    }

    public Map<String, String> references() {
        Map<String, String> out = new LinkedHashMap<>();
        fields.forEach(
                (name, value) -> {
                    if (value instanceof FieldValue.Reference reference) {
                        out.put(name, reference.targetId());
                    }
                });
        return out;
    }
}
