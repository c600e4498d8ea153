package io.github.yok.toch.reader;

import io.github.yok.toch.exception.SourceAccessException;
import io.github.yok.toch.source.CellRange;
import java.io.IOException;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellType;
import org.apache.poi.ss.usermodel.DataFormatter;
import org.apache.poi.ss.usermodel.DateUtil;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Row.MissingCellPolicy;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.util.NumberToTextConverter;

/**
 * Row reader over one sheet of an Excel workbook (Apache POI usermodel).
 *
 * <p>
 * Only cells inside the configured {@link CellRange} are yielded. Range bounds are 0-based and
 * inclusive; an end of 0 extends to the last populated row or column of the sheet. Rows without
 * any populated cell in the range are skipped and missing cells become empty strings, so every
 * yielded row has the range width.
 * </p>
 *
 * <p>
 * The skip count is applied to sheet rows from the start of the range, blank or not, before blank
 * rows are dropped. Open column ends are resolved over the rows left after skipping.
 * </p>
 *
 * <p>
 * Cell rendering:
 * </p>
 * <ul>
 * <li>date-formatted numeric cells: ISO {@code yyyy-MM-dd}, or ISO date-time when a time part is
 * present</li>
 * <li>other numeric cells: Excel "General" text of the raw value (no grouping separators)</li>
 * <li>formula cells: their cached result, rendered by the same rules</li>
 * <li>everything else: {@link DataFormatter}</li>
 * </ul>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class SpreadsheetRowReader extends AbstractRowReader {

    private final Workbook workbook;
    private final Sheet sheet;
    private final DataFormatter formatter = new DataFormatter();

    // Effective inclusive bounds (0-based)
    private final int lastRow;
    private final int colStart;
    private final int colEnd;

    private int nextRowIndex;
    private long rowNumber;

    /**
     * Creates a reader over a sheet of the given workbook. The workbook is closed by
     * {@link #close()}.
     *
     * @param description source description for messages
     * @param workbook opened workbook
     * @param sheetName sheet to read, or blank for the first sheet
     * @param range cell range
     * @param skip leading rows of the range to discard
     * @throws SourceAccessException if the sheet does not exist
     */
    public SpreadsheetRowReader(String description, Workbook workbook, String sheetName,
            CellRange range, int skip) {
        super(description, 0);
        this.workbook = workbook;
        this.sheet = selectSheet(description, workbook, sheetName);

        this.nextRowIndex = range.getRowStart() + skip;
        this.lastRow = range.isOpenRowEnd() ? sheet.getLastRowNum() : range.getRowEnd();
        this.colStart = range.getColStart();
        this.colEnd = range.isOpenColEnd() ? lastPopulatedColumn() : range.getColEnd();
        log.debug("Opened sheet '{}' of {}: rows {}..{}, columns {}..{}", sheet.getSheetName(),
                description, nextRowIndex, lastRow, colStart, colEnd);
    }

    private static Sheet selectSheet(String description, Workbook workbook, String sheetName) {
        Sheet selected;
        if (StringUtils.isBlank(sheetName)) {
            selected = workbook.getNumberOfSheets() > 0 ? workbook.getSheetAt(0) : null;
        } else {
            selected = workbook.getSheet(sheetName);
        }
        if (selected == null) {
            closeQuietly(workbook);
            throw new SourceAccessException("Sheet not found in " + description + ": "
                    + StringUtils.defaultIfBlank(sheetName, "(first sheet)"));
        }
        return selected;
    }

    private static void closeQuietly(Workbook workbook) {
        try {
            workbook.close();
        } catch (IOException e) {
            log.warn("Failed to close workbook: {}", e.getMessage());
        }
    }

    // Last column index holding a cell in any row of the row range
    private int lastPopulatedColumn() {
        int last = colStart - 1;
        for (int r = nextRowIndex; r <= lastRow; r++) {
            Row row = sheet.getRow(r);
            if (row != null && row.getLastCellNum() > 0) {
                last = Math.max(last, row.getLastCellNum() - 1);
            }
        }
        return last;
    }

    @Override
    protected List<String> readRecord() {
        while (nextRowIndex <= lastRow) {
            int index = nextRowIndex++;
            Row row = sheet.getRow(index);
            if (row == null) {
                continue;
            }
            List<String> cells = new ArrayList<>(Math.max(0, colEnd - colStart + 1));
            boolean populated = false;
            for (int c = colStart; c <= colEnd; c++) {
                Cell cell = row.getCell(c, MissingCellPolicy.RETURN_BLANK_AS_NULL);
                String value = cell == null ? "" : render(cell);
                populated |= !value.isEmpty();
                cells.add(value);
            }
            if (populated) {
                rowNumber = index + 1L;
                return cells;
            }
        }
        return null;
    }

    private String render(Cell cell) {
        CellType type = cell.getCellType();
        if (type == CellType.FORMULA) {
            type = cell.getCachedFormulaResultType();
            switch (type) {
                case STRING:
                    return cell.getStringCellValue();
                case BOOLEAN:
                    return cell.getBooleanCellValue() ? "TRUE" : "FALSE";
                case NUMERIC:
                    break;
                default:
                    return "";
            }
        }
        if (type == CellType.NUMERIC) {
            if (DateUtil.isCellDateFormatted(cell)) {
                LocalDateTime value = cell.getLocalDateTimeCellValue();
                return LocalTime.MIDNIGHT.equals(value.toLocalTime())
                        ? value.toLocalDate().toString()
                        : value.toString();
            }
            return NumberToTextConverter.toText(cell.getNumericCellValue());
        }
        return formatter.formatCellValue(cell);
    }

    @Override
    protected long currentRowNumber() {
        return rowNumber;
    }

    @Override
    public void close() throws IOException {
        workbook.close();
    }
}
