package io.cgmes.eqflat;

import io.cgmes.eqflat.config.model.FlattenConfig;
import io.cgmes.eqflat.diagnostics.Diagnostics;
import io.cgmes.eqflat.diagnostics.DiagnosticsReportWriter;
import io.cgmes.eqflat.mapping.ClassTable;
import io.cgmes.eqflat.mapping.ClassTableAssembler;
import io.cgmes.eqflat.mapping.CleanViewDeriver;
import io.cgmes.eqflat.mapping.FlattenedRecord;
import io.cgmes.eqflat.mapping.ReferenceResolver;
import io.cgmes.eqflat.model.CimObject;
import io.cgmes.eqflat.model.IdentifierIndex;
import io.cgmes.eqflat.output.TableWriter;
import io.cgmes.eqflat.output.TableWriters;
import io.cgmes.eqflat.parse.ArchiveReader;
import io.cgmes.eqflat.parse.ObjectModelBuilder;
import io.cgmes.eqflat.parse.UnparseableDocumentException;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs the whole conversion: read the EQ document, build objects, index them, resolve references,
 * assemble class tables, derive clean views, write both table sets and report diagnostics.
 */
public class EqFlattener {
    private static final Logger LOG = LoggerFactory.getLogger(EqFlattener.class);

    public static final String ENRICHED_SUFFIX = "_enriched";
    public static final String CLEAN_SUFFIX = "_clean";

    private final FlattenConfig config;
    private final ArchiveReader archiveReader;
    private final TableWriter enrichedWriter;
    private final TableWriter cleanWriter;
    private final DiagnosticsReportWriter reportWriter;
    private final ClassTableAssembler assembler = new ClassTableAssembler();
    private final CleanViewDeriver cleanViewDeriver = new CleanViewDeriver();

    public EqFlattener(FlattenConfig config) {
        this(
                config,
                new ArchiveReader(config.entryPattern()),
                TableWriters.forFormat(config.enrichedFormat()),
                TableWriters.forFormat(config.cleanFormat()),
                new DiagnosticsReportWriter());
    }

    EqFlattener(
            FlattenConfig config,
            ArchiveReader archiveReader,
            TableWriter enrichedWriter,
            TableWriter cleanWriter,
            DiagnosticsReportWriter reportWriter) {
        this.config = config;
        this.archiveReader = archiveReader;
        this.enrichedWriter = enrichedWriter;
        this.cleanWriter = cleanWriter;
        this.reportWriter = reportWriter;
    }

    /** Reads the configured input, flattens it and writes every table and the report. */
    public FlattenResult run() throws IOException {
        byte[] document = archiveReader.read(config.input());
        FlattenResult result = flatten(new ByteArrayInputStream(document));
        if (result.objectCount() == 0) {
            LOG.warn("No objects extracted from {}", config.input());
        }
        write(result);
        reportWriter.log(result.diagnostics());
        if (config.diagnosticsFile() != null) {
            reportWriter.write(result.diagnostics(), config.diagnosticsFile());
        }
        return result;
    }

    /** Flattens one RDF/XML document in memory. */
    public FlattenResult flatten(InputStream document) throws UnparseableDocumentException {
        Diagnostics diagnostics = new Diagnostics();
        List<CimObject> objects =
                new ObjectModelBuilder(diagnostics).build(document);
        IdentifierIndex index = IdentifierIndex.build(objects, diagnostics);
        List<FlattenedRecord> records =
                new ReferenceResolver(index, config.maxDepth(), diagnostics)
                        .resolveAll(objects, config.parallel());

        Map<String, ClassTable> enriched = assembler.assemble(records);
        Map<String, ClassTable> clean = new LinkedHashMap<>();
        enriched.forEach(
                (className, table) -> clean.put(className, cleanViewDeriver.derive(table)));
        LOG.info("Assembled {} class tables from {} objects", enriched.size(), objects.size());
        return new FlattenResult(enriched, clean, diagnostics, objects.size());
    }

    public void write(FlattenResult result) throws IOException {
        for (Map.Entry<String, ClassTable> entry : result.enriched().entrySet()) {
            String className = entry.getKey();
            enrichedWriter.write(
                    entry.getValue(), config.enrichedDir(), className + ENRICHED_SUFFIX);
            cleanWriter.write(
                    result.clean().get(className), config.cleanDir(), className + CLEAN_SUFFIX);
        }
    }
}
