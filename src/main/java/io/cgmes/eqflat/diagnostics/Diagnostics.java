package io.cgmes.eqflat.diagnostics;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.stream.Collectors;

/**
 * Collects the non-fatal conditions of one run. Safe for concurrent {@link #record} calls from
 * parallel resolution.
 */
public final class Diagnostics {
    private final ConcurrentLinkedQueue<Diagnostic> entries = new ConcurrentLinkedQueue<>();

    public void record(
            DiagnosticKind kind, String className, String objectId, String field, String detail) {
        entries.add(new Diagnostic(kind, className, objectId, field, detail));
    }

    public List<Diagnostic> entries() {
        return Collections.unmodifiableList(new ArrayList<>(entries));
    }

    public List<Diagnostic> entries(DiagnosticKind kind) {
        return entries.stream().filter(d -> d.kind() == kind).collect(Collectors.toList());
    }

    public long count(DiagnosticKind kind) {
        return entries.stream().filter(d -> d.kind() == kind).count();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    /** Occurrence count per kind, every kind present (zero when never recorded). */
    public Map<DiagnosticKind, Long> summary() {
        Map<DiagnosticKind, Long> counts = new EnumMap<>(DiagnosticKind.class);
        for (DiagnosticKind kind : DiagnosticKind.values()) {
            counts.put(kind, 0L);
        }
        for (Diagnostic diagnostic : entries) {
            counts.merge(diagnostic.kind(), 1L, Long::sum);
        }
        return counts;
    }
}
