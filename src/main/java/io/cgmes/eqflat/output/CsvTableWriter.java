package io.cgmes.eqflat.output;

import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import io.cgmes.eqflat.config.model.OutputFormat;
import io.cgmes.eqflat.mapping.ClassTable;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** UTF-8 CSV with a header row; absent cells are written empty. */
public class CsvTableWriter implements TableWriter {
    private static final Logger LOG = LoggerFactory.getLogger(CsvTableWriter.class);

    private final CsvMapper mapper = new CsvMapper();

    @Override
    public String extension() {
        return OutputFormat.CSV.extension();
    }

    @Override
    public Path write(ClassTable table, Path directory, String baseName) throws IOException {
        Files.createDirectories(directory);
        Path target = directory.resolve(TableWriter.fileSafe(baseName) + "." + extension());
        List<String> columns = table.columns();
        try (Writer out = Files.newBufferedWriter(target, StandardCharsets.UTF_8);
                SequenceWriter rows =
                        mapper.writerFor(String[].class)
                                .with(CsvSchema.emptySchema())
                                .writeValues(out)) {
            rows.write(columns.toArray(new String[0]));
            for (int row = 0; row < table.rowCount(); row++) {
                String[] values = new String[columns.size()];
                for (int col = 0; col < values.length; col++) {
                    values[col] = table.cell(row, columns.get(col));
                }
                rows.write(values);
            }
        }
        LOG.info("Wrote {} rows -> {}", table.rowCount(), target);
        return target;
    }
}
