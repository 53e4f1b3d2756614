package com.fotogeo.core.update;

import com.fotogeo.core.export.ExcelTableRenderer;
import com.fotogeo.core.export.TableColumns;
import com.fotogeo.core.model.UpdateRow;
import com.fotogeo.logging.AppLogger;
import com.opencsv.CSVReader;
import com.opencsv.exceptions.CsvException;
import org.apache.poi.EncryptedDocumentException;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.DataFormatter;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.usermodel.WorkbookFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.logging.Logger;

/**
 * Reads the rows of an edited table (the exported {@code .xlsx} or {@code .csv}). Only the file name and
 * the two editable columns are read; any other column is ignored.
 */
public final class EditedTableReader {
    private static final Logger LOGGER = AppLogger.get();

    /** Rows searched for the header line. */
    static final int HEADER_SEARCH_ROWS = 10;

    public List<UpdateRow> read(Path table) throws IOException {
        if (!Files.isRegularFile(table)) {
            throw new IOException("Edited table not found: " + table);
        }
        String name = table.getFileName().toString().toLowerCase(Locale.ROOT);
        List<List<String>> rows = name.endsWith(".csv") ? readCsv(table) : readWorkbook(table);
        return toUpdateRows(rows, table);
    }

    private static List<List<String>> readWorkbook(Path table) throws IOException {
        DataFormatter formatter = new DataFormatter(Locale.ROOT);
        try (Workbook workbook = WorkbookFactory.create(table.toFile(), null, true)) {
            Sheet sheet = workbook.getSheet(ExcelTableRenderer.SHEET_NAME);
            if (sheet == null) {
                if (workbook.getNumberOfSheets() == 0) {
                    throw new IOException("Workbook has no sheets: " + table);
                }
                sheet = workbook.getSheetAt(0);
                LOGGER.info("Sheet '" + ExcelTableRenderer.SHEET_NAME + "' not found, reading '" + sheet.getSheetName() + "'");
            }
            List<List<String>> rows = new ArrayList<>();
            for (int r = 0; r <= sheet.getLastRowNum(); r++) {
                Row row = sheet.getRow(r);
                List<String> cells = new ArrayList<>();
                if (row != null) {
                    for (int c = 0; c < Math.max(0, row.getLastCellNum()); c++) {
                        Cell cell = row.getCell(c);
                        cells.add(cell == null ? "" : formatter.formatCellValue(cell));
                    }
                }
                rows.add(cells);
            }
            return rows;
        } catch (EncryptedDocumentException | IllegalArgumentException ex) {
            throw new IOException("Unable to open " + table + " as a spreadsheet: " + ex.getMessage(), ex);
        }
    }

    private static List<List<String>> readCsv(Path table) throws IOException {
        try (BufferedReader reader = Files.newBufferedReader(table, StandardCharsets.UTF_8)) {
            skipByteOrderMark(reader);
            try (CSVReader csv = new CSVReader(reader)) {
                List<List<String>> rows = new ArrayList<>();
                for (String[] line : csv.readAll()) {
                    rows.add(List.of(line));
                }
                return rows;
            }
        } catch (CsvException ex) {
            throw new IOException("Unable to parse " + table + ": " + ex.getMessage(), ex);
        }
    }

    private static void skipByteOrderMark(Reader reader) throws IOException {
        reader.mark(1);
        if (reader.read() != '\uFEFF') {
            reader.reset();
        }
    }

    static List<UpdateRow> toUpdateRows(List<List<String>> rows, Path table) throws IOException {
        int headerIndex = -1;
        for (int i = 0; i < Math.min(HEADER_SEARCH_ROWS, rows.size()); i++) {
            if (indexOf(rows.get(i), TableColumns.NOME.header()) >= 0) {
                headerIndex = i;
                break;
            }
        }
        if (headerIndex < 0) {
            throw new IOException("Edited table has no '" + TableColumns.NOME.header() + "' column: " + table);
        }

        List<String> header = rows.get(headerIndex);
        int nameColumn = indexOf(header, TableColumns.NOME.header());
        int customNameColumn = indexOf(header, TableColumns.NOME_PERSONALIZADO.header());
        int descriptionColumn = indexOf(header, TableColumns.DESCRICAO.header());
        if (customNameColumn < 0) {
            LOGGER.warning("Column '" + TableColumns.NOME_PERSONALIZADO.header() + "' not found; custom names are kept");
        }
        if (descriptionColumn < 0) {
            LOGGER.warning("Column '" + TableColumns.DESCRICAO.header() + "' not found; descriptions are kept");
        }

        List<UpdateRow> result = new ArrayList<>();
        for (int i = headerIndex + 1; i < rows.size(); i++) {
            List<String> row = rows.get(i);
            int rowNumber = i + 1;
            String filename = cell(row, nameColumn);
            if (filename == null || filename.isEmpty()) {
                LOGGER.fine(() -> "Row " + rowNumber + " ignored: no file name");
                continue;
            }
            result.add(new UpdateRow(
                rowNumber,
                filename,
                customNameColumn < 0 ? null : valueOrEmpty(cell(row, customNameColumn)),
                descriptionColumn < 0 ? null : valueOrEmpty(cell(row, descriptionColumn))
            ));
        }
        LOGGER.info("Read " + result.size() + " row(s) from " + table.getFileName());
        return result;
    }

    private static int indexOf(List<String> header, String name) {
        for (int i = 0; i < header.size(); i++) {
            if (header.get(i) != null && header.get(i).trim().equals(name)) {
                return i;
            }
        }
        return -1;
    }

    private static String cell(List<String> row, int column) {
        if (column < 0 || column >= row.size()) {
            return null;
        }
        String value = row.get(column);
        return value == null ? null : value.strip();
    }

    private static String valueOrEmpty(String value) {
        return value == null ? "" : value;
    }
}
