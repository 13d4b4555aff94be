package enricher.table;

import enricher.model.Table;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class XlsxTableIOTest {

    @TempDir
    Path dir;

    @Test
    @DisplayName("Written workbook loads back with the same headers and cells")
    void writeThenLoad() throws IOException {
        Path file = dir.resolve("nested/out.xlsx");
        List<List<String>> rows = List.of(List.of("1", "Paris, FR"), List.of("2", ""));

        TableFormat.XLSX.writer().write(file, List.of("id", "city"), rows);
        Table table = TableFormat.of(file).loader().load(file);

        assertEquals(List.of("id", "city"), table.headers());
        assertEquals(2, table.rowCount());
        assertEquals(List.of("1", "Paris, FR"), table.rows().get(0).values());
        assertEquals(List.of("2", ""), table.rows().get(1).values());
        assertEquals(List.of(XlsxTableWriter.SHEET_NAME), XlsxTableLoader.sheetNames(file));
    }

    @Test
    @DisplayName("Sheet number selects which sheet is read")
    void secondSheet() throws IOException {
        Path file = workbook(book -> {
            fill(book.createSheet("People"), List.of("name"), List.of("Ann"));
            fill(book.createSheet("Places"), List.of("city", "country"), List.of("Rome", "IT"));
        });

        Table first = TableFormat.XLSX.loader(',', 1).load(file);
        Table second = TableFormat.XLSX.loader(',', 2).load(file);

        assertEquals(List.of("name"), first.headers());
        assertEquals(List.of("city", "country"), second.headers());
        assertEquals("IT", second.rows().get(0).get("country"));
        assertEquals(List.of("People", "Places"), XlsxTableLoader.sheetNames(file));
    }

    @Test
    void sheetOutOfRange() throws IOException {
        Path file = workbook(book -> fill(book.createSheet("Only"), List.of("a"), List.of("1")));

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> new XlsxTableLoader(3).load(file));
        assertEquals("invalid sheet index 3 (file has 1 sheet)", e.getMessage());
        assertThrows(IllegalArgumentException.class, () -> new XlsxTableLoader(0));
    }

    @Test
    @DisplayName("Numbers and formulas are read as displayed text")
    void numericAndFormulaCells() throws IOException {
        Path file = workbook(book -> {
            Sheet sheet = book.createSheet("Calc");
            Row header = sheet.createRow(0);
            header.createCell(0).setCellValue("a");
            header.createCell(1).setCellValue("b");
            header.createCell(2).setCellValue("sum");
            Row row = sheet.createRow(1);
            row.createCell(0).setCellValue(2);
            row.createCell(1).setCellValue(3);
            row.createCell(2).setCellFormula("A2+B2");
        });

        Table table = new XlsxTableLoader(1).load(file);

        assertEquals(List.of("2", "3", "5"), table.rows().get(0).values());
    }

    @Test
    @DisplayName("Trailing blank rows are dropped, short rows are padded")
    void trailingBlankRows() throws IOException {
        Path file = workbook(book -> {
            Sheet sheet = book.createSheet("Data");
            fill(sheet, List.of("id", "note"), List.of("1"));
            sheet.createRow(2).createCell(0).setCellValue("  ");
            sheet.createRow(4).createCell(1).setCellValue("");
        });

        Table table = new XlsxTableLoader(1).load(file);

        assertEquals(1, table.rowCount());
        assertEquals(List.of("1", ""), table.rows().get(0).values());
    }

    @Test
    void emptySheetIsAnError() throws IOException {
        Path file = workbook(book -> book.createSheet("Blank"));

        IOException e = assertThrows(IOException.class, () -> new XlsxTableLoader(1).load(file));
        assertTrue(e.getMessage().contains("Blank"), e.getMessage());
    }

    interface BookBuilder {
        void build(XSSFWorkbook book);
    }

    private Path workbook(BookBuilder builder) throws IOException {
        Path file = dir.resolve("book.xlsx");
        try (XSSFWorkbook book = new XSSFWorkbook(); OutputStream out = Files.newOutputStream(file)) {
            builder.build(book);
            book.write(out);
        }
        return file;
    }

    private static void fill(Sheet sheet, List<String> header, List<String> values) {
        Row h = sheet.createRow(0);
        for (int c = 0; c < header.size(); c++) {
            h.createCell(c).setCellValue(header.get(c));
        }
        Row r = sheet.createRow(1);
        for (int c = 0; c < values.size(); c++) {
            r.createCell(c).setCellValue(values.get(c));
        }
    }
}
