package io.cgmes.eqflat.output;

import io.cgmes.eqflat.config.model.OutputFormat;

public final class TableWriters {

    private TableWriters() {}

    public static TableWriter forFormat(OutputFormat format) {
        return switch (format) {
            case CSV -> new CsvTableWriter();
            case XLSX -> new ExcelTableWriter();
        };
    }
}
