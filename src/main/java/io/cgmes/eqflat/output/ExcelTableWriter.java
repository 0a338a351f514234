package io.cgmes.eqflat.output;

import io.cgmes.eqflat.config.model.OutputFormat;
import io.cgmes.eqflat.mapping.ClassTable;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.regex.Pattern;
import org.apache.poi.ss.SpreadsheetVersion;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellStyle;
import org.apache.poi.ss.usermodel.Font;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.util.WorkbookUtil;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Single-sheet workbook per table: bold frozen header row, numbers and booleans written as typed
 * cells, everything else as text. Columns and text beyond the XLSX limits are cut off.
 */
public class ExcelTableWriter implements TableWriter {
    private static final Logger LOG = LoggerFactory.getLogger(ExcelTableWriter.class);

    // no leading zeros, so codes such as "0012" stay text
    private static final Pattern NUMBER =
            Pattern.compile("-?(0|[1-9]\\d{0,14})(\\.\\d+)?([eE][+-]?\\d{1,3})?");

    private static final int MAX_COLUMNS = SpreadsheetVersion.EXCEL2007.getMaxColumns();
    private static final int MAX_TEXT = SpreadsheetVersion.EXCEL2007.getMaxTextLength();

    @Override
    public String extension() {
        return OutputFormat.XLSX.extension();
    }

    @Override
    public Path write(ClassTable table, Path directory, String baseName) throws IOException {
        Files.createDirectories(directory);
        Path target = directory.resolve(TableWriter.fileSafe(baseName) + "." + extension());
        List<String> columns = table.columns();
        if (columns.size() > MAX_COLUMNS) {
            LOG.warn(
                    "{} has {} columns, only the first {} fit in a sheet",
                    table.className(),
                    columns.size(),
                    MAX_COLUMNS);
            columns = columns.subList(0, MAX_COLUMNS);
        }

        try (XSSFWorkbook workbook = new XSSFWorkbook();
                OutputStream out = Files.newOutputStream(target)) {
            Sheet sheet = workbook.createSheet(WorkbookUtil.createSafeSheetName(table.className()));
            CellStyle headerStyle = workbook.createCellStyle();
            Font bold = workbook.createFont();
            bold.setBold(true);
            headerStyle.setFont(bold);

            Row header = sheet.createRow(0);
            for (int col = 0; col < columns.size(); col++) {
                Cell cell = header.createCell(col);
                cell.setCellValue(columns.get(col));
                cell.setCellStyle(headerStyle);
            }
            sheet.createFreezePane(0, 1);

            for (int row = 0; row < table.rowCount(); row++) {
                Row sheetRow = sheet.createRow(row + 1);
                for (int col = 0; col < columns.size(); col++) {
                    String value = table.cell(row, columns.get(col));
                    if (!value.isEmpty()) {
                        setValue(sheetRow.createCell(col), value);
                    }
                }
            }
            workbook.write(out);
        }
        LOG.info("Wrote {} rows -> {}", table.rowCount(), target);
        return target;
    }

    static void setValue(Cell cell, String value) {
        if (NUMBER.matcher(value).matches()) {
            cell.setCellValue(Double.parseDouble(value));
        } else if ("true".equalsIgnoreCase(value) || "false".equalsIgnoreCase(value)) {
            cell.setCellValue(Boolean.parseBoolean(value));
        } else if (value.length() > MAX_TEXT) {
            cell.setCellValue(value.substring(0, MAX_TEXT));
        } else {
            cell.setCellValue(value);
        }
    }
}
