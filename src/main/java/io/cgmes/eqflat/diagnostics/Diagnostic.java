package io.cgmes.eqflat.diagnostics;

/**
 * @param className class of the object the condition was found on, may be null
 * @param objectId identifier of that object, may be null
 * @param field field path the condition applies to, may be null
 */
public record Diagnostic(
        DiagnosticKind kind, String className, String objectId, String field, String detail) {}
