package io.cgmes.eqflat.config.model;

import java.nio.file.Path;

/**
 * @param input EQ archive (.zip) or bare RDF/XML file
 * @param entryPattern regex selecting the EQ entry inside the archive
 * @param diagnosticsFile JSON report target, null to only log the report
 * @param maxDepth maximum number of reference hops followed from a record
 */
public record FlattenConfig(
        Path input,
        String entryPattern,
        Path enrichedDir,
        Path cleanDir,
        OutputFormat enrichedFormat,
        OutputFormat cleanFormat,
        Path diagnosticsFile,
        int maxDepth,
        boolean parallel) {}
