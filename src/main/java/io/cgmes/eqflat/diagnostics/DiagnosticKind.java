package io.cgmes.eqflat.diagnostics;

/** Non-fatal data-quality conditions found while flattening a document. */
public enum DiagnosticKind {
    /** Object element with neither {@code rdf:ID} nor {@code rdf:about}. */
    MALFORMED_RECORD,
    UNRESOLVED_REFERENCE,
    CYCLE_DETECTED,
    DEPTH_EXCEEDED,
    DUPLICATE_IDENTIFIER,
    /** The same property appeared more than once on one object; the last value was kept. */
    REPEATED_FIELD,
    /** XML parser warning, or nested property content that was reduced or skipped. */
    PARSER_WARNING
}
