package com.fotogeo.core.export;

import com.fotogeo.core.fs.AtomicFileWriter;
import com.fotogeo.core.image.OrientedThumbnailer;
import com.fotogeo.core.image.Thumbnail;
import com.fotogeo.core.model.ImageRecord;
import com.fotogeo.logging.AppLogger;
import org.apache.poi.ss.usermodel.ClientAnchor;
import org.apache.poi.ss.usermodel.Comment;
import org.apache.poi.ss.usermodel.CreationHelper;
import org.apache.poi.ss.usermodel.FillPatternType;
import org.apache.poi.ss.usermodel.Font;
import org.apache.poi.ss.usermodel.IndexedColors;
import org.apache.poi.ss.usermodel.VerticalAlignment;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.xssf.usermodel.XSSFCell;
import org.apache.poi.xssf.usermodel.XSSFCellStyle;
import org.apache.poi.xssf.usermodel.XSSFDrawing;
import org.apache.poi.xssf.usermodel.XSSFRow;
import org.apache.poi.xssf.usermodel.XSSFSheet;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Spreadsheet with an upright thumbnail in column A followed by the table columns. The sheet is protected;
 * only the editable columns are unlocked, and they are highlighted so users know where to type.
 */
public final class ExcelTableRenderer implements ExportRenderer {
    private static final Logger LOGGER = AppLogger.get();

    public static final String SHEET_NAME = "Coordenadas_UTM_Data";
    static final String IMAGE_HEADER = "Foto";
    static final int IMAGE_COLUMN = 0;
    static final int FIRST_DATA_COLUMN = 1;

    private static final float DEFAULT_ROW_HEIGHT = 15f;
    private static final Map<TableColumns, Integer> COLUMN_WIDTHS = new EnumMap<>(Map.of(
        TableColumns.NOME, 25,
        TableColumns.NOME_PERSONALIZADO, 30,
        TableColumns.DESCRICAO, 40,
        TableColumns.DATA_HORA, 20
    ));

    private final OrientedThumbnailer thumbnailer;

    public ExcelTableRenderer(OrientedThumbnailer thumbnailer) {
        this.thumbnailer = thumbnailer;
    }

    @Override
    public ExportFormat format() {
        return ExportFormat.EXCEL;
    }

    @Override
    public RenderResult render(List<ImageRecord> records, ExportContext context) throws IOException {
        int thumbnailWidth = context.settings().excelThumbnailWidth();
        double quality = context.settings().excelImageQuality();
        List<RenderFailure> failures = new ArrayList<>();
        Path target = context.target(format());

        try (XSSFWorkbook workbook = new XSSFWorkbook()) {
            XSSFSheet sheet = workbook.createSheet(SHEET_NAME);
            Styles styles = new Styles(workbook);
            writeHeader(workbook, sheet, styles);
            sheet.setColumnWidth(IMAGE_COLUMN, Math.min(255 * 256, pixelsToWidthUnits(thumbnailWidth) + 512));
            for (TableColumns column : TableColumns.values()) {
                sheet.setColumnWidth(FIRST_DATA_COLUMN + column.ordinal(), COLUMN_WIDTHS.getOrDefault(column, 15) * 256);
            }

            XSSFDrawing drawing = sheet.createDrawingPatriarch();
            int rowIndex = 1;
            for (ImageRecord record : records) {
                XSSFRow row = sheet.createRow(rowIndex);
                row.createCell(IMAGE_COLUMN).setCellStyle(styles.locked);
                writeCells(row, TableRowFormatter.format(record), styles);
                try {
                    Path source = record.source().orElseThrow(() -> new IOException("no source file"));
                    Thumbnail thumbnail = thumbnailer.createThumbnail(source, record.orientation(), thumbnailWidth, quality);
                    embed(workbook, drawing, thumbnail, rowIndex);
                    row.setHeightInPoints(Math.min(409f, thumbnail.height() * 0.75f + 4f));
                } catch (IOException | RuntimeException ex) {
                    LOGGER.warning("Excel: thumbnail of " + record.filename() + " not embedded: " + ex.getMessage());
                    failures.add(new RenderFailure(format(), record.filename(), "thumbnail not embedded: " + ex.getMessage()));
                    row.setHeightInPoints(DEFAULT_ROW_HEIGHT);
                }
                rowIndex++;
            }

            sheet.createFreezePane(0, 1);
            sheet.lockFormatColumns(false);
            sheet.lockFormatRows(false);
            sheet.enableLocking();
            AtomicFileWriter.write(target, workbook::write);
        }
        LOGGER.info("Excel saved: " + target + " (" + records.size() + " row(s))");
        return new RenderResult(format(), target, records.size(), failures);
    }

    private static void writeHeader(XSSFWorkbook workbook, XSSFSheet sheet, Styles styles) {
        CreationHelper helper = workbook.getCreationHelper();
        XSSFDrawing drawing = sheet.createDrawingPatriarch();
        XSSFRow header = sheet.createRow(0);
        XSSFCell imageCell = header.createCell(IMAGE_COLUMN);
        imageCell.setCellValue(IMAGE_HEADER);
        imageCell.setCellStyle(styles.header);
        for (TableColumns column : TableColumns.values()) {
            XSSFCell cell = header.createCell(FIRST_DATA_COLUMN + column.ordinal());
            cell.setCellValue(column.header());
            cell.setCellStyle(styles.header);
            if (column.isEditable()) {
                ClientAnchor anchor = helper.createClientAnchor();
                anchor.setCol1(cell.getColumnIndex());
                anchor.setCol2(cell.getColumnIndex() + 3);
                anchor.setRow1(0);
                anchor.setRow2(3);
                Comment comment = drawing.createCellComment(anchor);
                comment.setString(helper.createRichTextString(
                    "Editable: the value is written back to the photo by the update command."));
                cell.setCellComment(comment);
            }
        }
    }

    private static void writeCells(XSSFRow row, List<String> cells, Styles styles) {
        for (TableColumns column : TableColumns.values()) {
            XSSFCell cell = row.createCell(FIRST_DATA_COLUMN + column.ordinal());
            String value = cells.get(column.ordinal());
            switch (column) {
                case LATITUDE, LONGITUDE -> numeric(cell, value, styles.degrees);
                case ESTE, NORTE -> numeric(cell, value, styles.meters);
                case ZONA -> numeric(cell, value, styles.integer);
                default -> {
                    cell.setCellValue(value);
                    cell.setCellStyle(column.isEditable() ? styles.editable : styles.locked);
                }
            }
        }
    }

    private static void numeric(XSSFCell cell, String value, XSSFCellStyle style) {
        cell.setCellStyle(style);
        if (!value.isEmpty()) {
            cell.setCellValue(Double.parseDouble(value));
        }
    }

    private static void embed(XSSFWorkbook workbook, XSSFDrawing drawing, Thumbnail thumbnail, int rowIndex) {
        int pictureIndex = workbook.addPicture(thumbnail.jpeg(), Workbook.PICTURE_TYPE_JPEG);
        ClientAnchor anchor = workbook.getCreationHelper().createClientAnchor();
        anchor.setAnchorType(ClientAnchor.AnchorType.MOVE_AND_RESIZE);
        anchor.setCol1(IMAGE_COLUMN);
        anchor.setRow1(rowIndex);
        anchor.setCol2(IMAGE_COLUMN + 1);
        anchor.setRow2(rowIndex + 1);
        drawing.createPicture(anchor, pictureIndex);
    }

    static int pixelsToWidthUnits(int pixels) {
        return (int) Math.round(pixels * 256 / 7.0);
    }

    private static final class Styles {
        final XSSFCellStyle header;
        final XSSFCellStyle locked;
        final XSSFCellStyle editable;
        final XSSFCellStyle degrees;
        final XSSFCellStyle meters;
        final XSSFCellStyle integer;

        Styles(XSSFWorkbook workbook) {
            Font bold = workbook.createFont();
            bold.setBold(true);
            header = workbook.createCellStyle();
            header.setFont(bold);
            header.setLocked(true);

            locked = workbook.createCellStyle();
            locked.setLocked(true);
            locked.setVerticalAlignment(VerticalAlignment.TOP);

            editable = workbook.createCellStyle();
            editable.setLocked(false);
            editable.setWrapText(true);
            editable.setVerticalAlignment(VerticalAlignment.TOP);
            editable.setFillForegroundColor(IndexedColors.LIGHT_YELLOW.getIndex());
            editable.setFillPattern(FillPatternType.SOLID_FOREGROUND);

            short degreesFormat = workbook.createDataFormat().getFormat("0.0000000");
            short metersFormat = workbook.createDataFormat().getFormat("0.00");
            short integerFormat = workbook.createDataFormat().getFormat("0");
            degrees = numberStyle(workbook, degreesFormat);
            meters = numberStyle(workbook, metersFormat);
            integer = numberStyle(workbook, integerFormat);
        }

        private static XSSFCellStyle numberStyle(XSSFWorkbook workbook, short format) {
            XSSFCellStyle style = workbook.createCellStyle();
            style.setLocked(true);
            style.setVerticalAlignment(VerticalAlignment.TOP);
            style.setDataFormat(format);
            return style;
        }
    }
}
