package io.cgmes.eqflat.diagnostics;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Logs the aggregated diagnostics and optionally writes them as a JSON report. */
public class DiagnosticsReportWriter {
    private static final Logger LOG = LoggerFactory.getLogger(DiagnosticsReportWriter.class);

    private final ObjectMapper mapper;

    public DiagnosticsReportWriter() {
        this(new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT));
    }

    DiagnosticsReportWriter(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public void log(Diagnostics diagnostics) {
        Map<DiagnosticKind, Long> summary = diagnostics.summary();
        if (diagnostics.isEmpty()) {
            LOG.info("No data-quality issues found");
            return;
        }
        summary.forEach(
                (kind, count) -> {
                    if (count > 0) {
                        LOG.warn("{}: {}", kind, count);
                    }
                });
    }

    public ObjectNode toJson(Diagnostics diagnostics) {
        ObjectNode root = mapper.createObjectNode();
        ObjectNode summary = root.putObject("summary");
        diagnostics.summary().forEach((kind, count) -> summary.put(kind.name(), count));
        ArrayNode entries = root.putArray("entries");
        for (Diagnostic diagnostic : diagnostics.entries()) {
            entries.add(mapper.valueToTree(diagnostic));
        }
        return root;
    }

    public void write(Diagnostics diagnostics, Path target) throws IOException {
        Path parent = target.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        mapper.writeValue(target.toFile(), toJson(diagnostics));
        LOG.info("Wrote diagnostics report -> {}", target);
    }
}
