package io.cgmes.eqflat.mapping;

import io.cgmes.eqflat.diagnostics.DiagnosticKind;
import io.cgmes.eqflat.diagnostics.Diagnostics;
import io.cgmes.eqflat.model.CimObject;
import io.cgmes.eqflat.model.FieldValue;
import io.cgmes.eqflat.model.IdentifierIndex;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Flattens objects by splicing the columns of every referenced object into the referencing
 * record, following reference chains.
 *
 * <p>A reference field {@code ConductingEquipment.BaseVoltage__resource} pointing at a {@code
 * BaseVoltage} contributes columns named {@code
 * ConductingEquipment.BaseVoltage__BaseVoltage.<column>} for every column of the flattened
 * target. Each resolution path carries its own visited set, so a chain that comes back to one of
 * its ancestors stops there; chains longer than {@code maxDepth} hops are cut off.
 *
 * <p>Resolution only reads the index, so records can be resolved in any order or in parallel.
 */
public class ReferenceResolver {
    private static final Logger LOG = LoggerFactory.getLogger(ReferenceResolver.class);

    public static final int DEFAULT_MAX_DEPTH = 5;

    private final IdentifierIndex index;
    private final int maxDepth;
    private final Diagnostics diagnostics;

    public ReferenceResolver(IdentifierIndex index, Diagnostics diagnostics) {
        this(index, DEFAULT_MAX_DEPTH, diagnostics);
    }

    public ReferenceResolver(IdentifierIndex index, int maxDepth, Diagnostics diagnostics) {
        if (maxDepth < 0) {
            throw new IllegalArgumentException("maxDepth must be >= 0, was " + maxDepth);
        }
        this.index = index;
        this.maxDepth = maxDepth;
        this.diagnostics = diagnostics;
    }

    /** Resolves every object, keeping the input order. */
    public List<FlattenedRecord> resolveAll(List<CimObject> objects, boolean parallel) {
        long start = System.nanoTime();
        List<FlattenedRecord> records =
                (parallel ? objects.parallelStream() : objects.stream())
                        .map(this::resolve)
                        .collect(Collectors.toList());
        LOG.info(
                "Resolved {} objects in {} ms (maxDepth={}, parallel={})",
                records.size(),
                (System.nanoTime() - start) / 1_000_000,
                maxDepth,
                parallel);
        return records;
    }

    public FlattenedRecord resolve(CimObject object) {
        Set<String> visited = new HashSet<>();
        visited.add(key(object.id()));
        Map<String, String> columns = new LinkedHashMap<>();
        columns.put(FlattenedRecord.ID_COLUMN, object.id());
        flatten(object, visited, 0, new Branch(object, ""), columns);
        return new FlattenedRecord(object.id(), object.className(), columns);
    }

    /**
     * Writes the columns of {@code object} into {@code out}: own fields in order, each reference
     * field followed by the columns of its resolved target.
     */
    private void flatten(
            CimObject object,
            Set<String> visited,
            int depth,
            Branch path,
            Map<String, String> out) {
        Set<String> own = object.fields().keySet();
        for (Map.Entry<String, FieldValue> field : object.fields().entrySet()) {
            String name = field.getKey();
            FieldValue value = field.getValue();
            out.put(name, value.raw());
            if (value instanceof FieldValue.Reference reference) {
                enrich(name, reference, visited, depth, path, own, out);
            }
        }
    }

    private void enrich(
            String field,
            FieldValue.Reference reference,
            Set<String> visited,
            int depth,
            Branch path,
            Set<String> own,
            Map<String, String> out) {
        Optional<CimObject> found = index.find(reference.targetId());
        if (found.isEmpty()) {
            path.report(
                    diagnostics,
                    DiagnosticKind.UNRESOLVED_REFERENCE,
                    field,
                    "no object with id " + reference.targetId());
            return;
        }
        CimObject target = found.get();
        String targetKey = key(target.id());
        if (visited.contains(targetKey)) {
            path.report(
                    diagnostics,
                    DiagnosticKind.CYCLE_DETECTED,
                    field,
                    target.className() + " " + target.id() + " is already on the resolution path");
            return;
        }
        if (depth + 1 > maxDepth) {
            path.report(
                    diagnostics,
                    DiagnosticKind.DEPTH_EXCEEDED,
                    field,
                    "chain longer than " + maxDepth + " references");
            return;
        }

        Set<String> branch = new HashSet<>(visited);
        branch.add(targetKey);
        String prefix = FieldValue.stripMarker(field) + "__";
        Map<String, String> targetColumns = new LinkedHashMap<>();
        flatten(target, branch, depth + 1, path.into(prefix, target), targetColumns);

        for (Map.Entry<String, String> column : targetColumns.entrySet()) {
            String name = prefix + qualify(target.className(), column.getKey());
            if (!own.contains(name)) {
                out.putIfAbsent(name, column.getValue());
            }
        }
    }

    /** Prefixes a target column with its class unless it already starts with it. */
    static String qualify(String className, String column) {
        String qualifier = className + ".";
        return column.startsWith(qualifier) ? column : qualifier + column;
    }

    private static String key(String id) {
        String canonical = IdentifierIndex.canonical(id);
        return canonical == null ? id : canonical;
    }

    /** Root object and column prefix of the current branch, for diagnostics. */
    private record Branch(CimObject root, String columnPrefix) {
        Branch into(String prefix, CimObject target) {
            return new Branch(root, columnPrefix + prefix + target.className() + ".");
        }

        void report(Diagnostics diagnostics, DiagnosticKind kind, String field, String detail) {
            String column = columnPrefix + field;
            LOG.debug("{} on {} {} at {}: {}", kind, root.className(), root.id(), column, detail);
            diagnostics.record(kind, root.className(), root.id(), column, detail);
        }
    }
}
