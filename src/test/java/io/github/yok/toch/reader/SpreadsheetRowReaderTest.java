package io.github.yok.toch.reader;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import io.github.yok.toch.exception.SourceAccessException;
import io.github.yok.toch.source.CellRange;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellStyle;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.junit.jupiter.api.Test;

class SpreadsheetRowReaderTest {

    private static Row row(Sheet sheet, int index) {
        Row row = sheet.getRow(index);
        return row != null ? row : sheet.createRow(index);
    }

    private static void put(Sheet sheet, int r, int c, String value) {
        row(sheet, r).createCell(c).setCellValue(value);
    }

    private static void put(Sheet sheet, int r, int c, double value) {
        row(sheet, r).createCell(c).setCellValue(value);
    }

    // Title block in rows 0-3, junk in columns 0-1, data table from row 4 / column 2
    private static Workbook report() {
        Workbook wb = new XSSFWorkbook();
        Sheet sheet = wb.createSheet("Report");
        put(sheet, 0, 0, "Quarterly report");
        put(sheet, 1, 5, "wide title cell outside the row range");
        put(sheet, 2, 0, "generated 2023-01-01");
        put(sheet, 4, 0, "note");
        put(sheet, 4, 2, "Region");
        put(sheet, 4, 3, "Units");
        put(sheet, 4, 4, "Price");
        put(sheet, 5, 2, "North");
        put(sheet, 5, 3, 12);
        put(sheet, 5, 4, 1234.5);
        put(sheet, 6, 1, "junk only");
        put(sheet, 7, 2, "South");
        put(sheet, 7, 4, 3.25);
        return wb;
    }

    @Test
    void next_正常ケース_範囲4から0と2から0_範囲内のセルのみが読めること() throws Exception {
        CellRange range = new CellRange(4, 0, 2, 0);
        try (RowReader r = new SpreadsheetRowReader("report.xlsx", report(), null, range, 0)) {
            assertEquals(List.of("Region", "Units", "Price"), r.readHeader());
            assertEquals(3, r.getWidth());

            RawRow first = r.next();
            assertEquals(List.of("North", "12", "1234.5"), first.getCells());
            assertEquals(6, first.getRowNumber());

            // row 6 has nothing inside the range and is skipped; the missing cell becomes ""
            RawRow second = r.next();
            assertEquals(List.of("South", "", "3.25"), second.getCells());
            assertEquals(8, second.getRowNumber());

            assertNull(r.next());
        }
    }

    @Test
    void next_正常ケース_終了位置を指定する_範囲で打ち切られること() throws Exception {
        CellRange range = new CellRange(4, 5, 2, 3);
        try (RowReader r = new SpreadsheetRowReader("report.xlsx", report(), "Report", range, 0)) {
            assertEquals(List.of("Region", "Units"), r.readHeader());
            assertEquals(List.of("North", "12"), r.next().getCells());
            assertNull(r.next());
        }
    }

    @Test
    void next_正常ケース_skip指定_範囲内で読み飛ばされること() throws Exception {
        CellRange range = new CellRange(4, 0, 2, 0);
        try (RowReader r = new SpreadsheetRowReader("report.xlsx", report(), null, range, 1)) {
            assertEquals(List.of("North", "12", "1234.5"), r.readHeader());
        }
    }

    @Test
    void next_正常ケース_skip指定_空行も範囲先頭からの行数に含まれること() throws Exception {
        CellRange range = new CellRange(4, 0, 2, 0);
        // rows 4, 5 and the blank-in-range row 6 are skipped
        try (RowReader r = new SpreadsheetRowReader("report.xlsx", report(), null, range, 3)) {
            RawRow first = r.next();
            assertEquals(List.of("South", "", "3.25"), first.getCells());
            assertEquals(8, first.getRowNumber());
            assertNull(r.next());
        }
    }

    @Test
    void next_正常ケース_skip指定_列の終端は読み飛ばし後の行から決まること() throws Exception {
        // row 1 holds the only cell in column 5 and is skipped
        try (RowReader r = new SpreadsheetRowReader("report.xlsx", report(), null, CellRange.ALL,
                2)) {
            assertEquals(List.of("generated 2023-01-01", "", "", "", ""), r.readHeader());
        }
    }

    @Test
    void next_正常ケース_日付と数式のセル_ISO形式と計算結果で読めること() throws Exception {
        Workbook wb = new XSSFWorkbook();
        Sheet sheet = wb.createSheet("S");
        CellStyle dateStyle = wb.createCellStyle();
        dateStyle.setDataFormat(wb.getCreationHelper().createDataFormat().getFormat("yyyy/mm/dd"));
        CellStyle timeStyle = wb.createCellStyle();
        timeStyle.setDataFormat(
                wb.getCreationHelper().createDataFormat().getFormat("yyyy-mm-dd hh:mm"));

        Row row = sheet.createRow(0);
        Cell date = row.createCell(0);
        date.setCellValue(LocalDate.of(2023, 1, 31));
        date.setCellStyle(dateStyle);
        Cell stamp = row.createCell(1);
        stamp.setCellValue(LocalDateTime.of(2023, 1, 31, 10, 30));
        stamp.setCellStyle(timeStyle);
        row.createCell(2).setCellFormula("2*21");
        row.createCell(3).setCellFormula("\"ab\"&\"cd\"");
        row.createCell(4).setCellValue(true);
        wb.getCreationHelper().createFormulaEvaluator().evaluateAll();

        try (RowReader r = new SpreadsheetRowReader("s.xlsx", wb, null, CellRange.ALL, 0)) {
            assertEquals(List.of("2023-01-31", "2023-01-31T10:30", "42", "abcd", "TRUE"),
                    r.next().getCells());
        }
    }

    @Test
    void next_正常ケース_空のシート_行が返されないこと() throws Exception {
        Workbook wb = new XSSFWorkbook();
        wb.createSheet("Empty");
        try (RowReader r = new SpreadsheetRowReader("e.xlsx", wb, null, CellRange.ALL, 0)) {
            assertNull(r.next());
        }
    }

    @Test
    void コンストラクタ_異常ケース_存在しないシート_SourceAccessExceptionが送出されること() {
        assertThrows(SourceAccessException.class,
                () -> new SpreadsheetRowReader("r.xlsx", report(), "Nope", CellRange.ALL, 0));
    }
}
