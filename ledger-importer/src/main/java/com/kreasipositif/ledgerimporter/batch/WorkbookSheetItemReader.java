package com.kreasipositif.ledgerimporter.batch;

import com.kreasipositif.ledgerimporter.domain.RawTransactionRecord;
import lombok.extern.slf4j.Slf4j;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellType;
import org.apache.poi.ss.usermodel.DateUtil;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.usermodel.WorkbookFactory;
import org.springframework.batch.item.file.mapping.FieldSetMapper;
import org.springframework.batch.item.file.transform.DefaultFieldSet;
import org.springframework.batch.item.support.AbstractItemCountingItemStreamItemReader;
import org.springframework.core.io.Resource;

import java.io.IOException;
import java.io.InputStream;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Arrays;
import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;

/**
 * Reads the data rows of one workbook sheet, in order, as {@link RawTransactionRecord}s.
 *
 * <p>The first row is the header; its trimmed cell texts name the columns. Every data cell is
 * rendered as text the way it appears in the sheet (blank → empty string) and handed to the
 * {@link FieldSetMapper} as a {@link DefaultFieldSet}. Fully blank rows are skipped; cells
 * beyond the header are kept as unnamed columns.
 *
 * <p>{@link #open} fails with {@link WorkbookImportException} when the workbook cannot be read or
 * the sheet does not exist. The workbook is only ever read.
 */
@Slf4j
public class WorkbookSheetItemReader extends AbstractItemCountingItemStreamItemReader<RawTransactionRecord> {

    private static final DateTimeFormatter DATE_TIME = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");
    private static final DateTimeFormatter TIME = DateTimeFormatter.ofPattern("HH:mm:ss");

    private final Resource resource;
    private final String sheetName;
    private final FieldSetMapper<RawTransactionRecord> fieldSetMapper;

    private Workbook workbook;
    private Iterator<Row> rows;
    private String[] header;

    public WorkbookSheetItemReader(Resource resource, String sheetName,
                                   FieldSetMapper<RawTransactionRecord> fieldSetMapper) {
        this.resource = resource;
        this.sheetName = sheetName;
        this.fieldSetMapper = fieldSetMapper;
    }

    @Override
    protected void doOpen() {
        if (resource == null || !resource.exists()) {
            throw new WorkbookImportException("Workbook not found: " + resource);
        }
        try (InputStream in = resource.getInputStream()) {
            workbook = WorkbookFactory.create(in);
        } catch (IOException | RuntimeException e) {
            throw new WorkbookImportException("Cannot read workbook " + resource.getDescription(), e);
        }

        Sheet sheet = workbook.getSheet(sheetName);
        if (sheet == null) {
            doClose();
            throw new WorkbookImportException(
                    "Sheet '%s' not found in %s".formatted(sheetName, resource.getDescription()));
        }

        rows = sheet.rowIterator();
        header = rows.hasNext() ? readHeader(rows.next()) : new String[0];
        log.debug("Opened sheet '{}' with columns {}", sheetName, Arrays.toString(header));
    }

    @Override
    protected RawTransactionRecord doRead() throws Exception {
        if (rows == null) {
            return null;
        }
        while (rows.hasNext()) {
            Row row = rows.next();
            int width = Math.max(header.length, row.getLastCellNum());
            String[] tokens = new String[width];
            boolean blank = true;
            for (int i = 0; i < width; i++) {
                tokens[i] = render(row.getCell(i));
                blank &= tokens[i].isBlank();
            }
            if (blank) {
                continue;
            }
            return fieldSetMapper.mapFieldSet(new DefaultFieldSet(tokens, columnNames(width)));
        }
        return null;
    }

    @Override
    protected void doClose() {
        rows = null;
        if (workbook != null) {
            try {
                workbook.close();
            } catch (IOException e) {
                log.warn("Failed to close workbook {}: {}", resource.getDescription(), e.getMessage());
            } finally {
                workbook = null;
            }
        }
    }

    // ─── helpers ────────────────────────────────────────────────────────────

    /**
     * Blank header cells become {@code Unnamed: <index>}; repeated names get a {@code .<n>} suffix.
     */
    private String[] readHeader(Row headerRow) {
        int width = Math.max(headerRow.getLastCellNum(), 0);
        String[] names = new String[width];
        Map<String, Integer> seen = new HashMap<>();
        for (int i = 0; i < width; i++) {
            String name = render(headerRow.getCell(i)).trim();
            if (name.isEmpty()) {
                name = "Unnamed: " + i;
            }
            int count = seen.merge(name, 1, Integer::sum);
            names[i] = count > 1 ? name + "." + (count - 1) : name;
        }
        return names;
    }

    /**
     * Cells right of the last header cell are kept under {@code Unnamed: <index>}.
     */
    private String[] columnNames(int width) {
        if (width == header.length) {
            return header;
        }
        String[] names = Arrays.copyOf(header, width);
        for (int i = header.length; i < width; i++) {
            names[i] = "Unnamed: " + i;
        }
        return names;
    }

    private String render(Cell cell) {
        if (cell == null) {
            return "";
        }
        CellType type = cell.getCellType() == CellType.FORMULA
                ? cell.getCachedFormulaResultType()
                : cell.getCellType();
        return switch (type) {
            case STRING -> cell.getStringCellValue();
            case NUMERIC -> renderNumeric(cell);
            case BOOLEAN -> String.valueOf(cell.getBooleanCellValue());
            default -> "";
        };
    }

    private String renderNumeric(Cell cell) {
        double value = cell.getNumericCellValue();
        if (DateUtil.isCellDateFormatted(cell)) {
            LocalDateTime dateTime = cell.getLocalDateTimeCellValue();
            if (value < 1) {
                return dateTime.format(TIME);
            }
            if (dateTime.toLocalTime().toSecondOfDay() == 0) {
                return dateTime.toLocalDate().toString();
            }
            return dateTime.format(DATE_TIME);
        }
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }
}
