package enricher.table;

import org.apache.poi.ss.SpreadsheetVersion;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Writes a table to the first sheet ({@code Sheet1}) of a new Excel workbook.
 * Every cell is a string cell; text beyond Excel's cell limit is cut.
 */
public class XlsxTableWriter implements TableWriter {

    public static final String SHEET_NAME = "Sheet1";

    private static final int MAX_CELL_TEXT = SpreadsheetVersion.EXCEL2007.getMaxTextLength();

    @Override
    public void write(Path path, List<String> headers, List<List<String>> rows) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }

        try (XSSFWorkbook workbook = new XSSFWorkbook()) {
            Sheet sheet = workbook.createSheet(SHEET_NAME);
            writeRow(sheet.createRow(0), headers);
            for (int r = 0; r < rows.size(); r++) {
                writeRow(sheet.createRow(r + 1), rows.get(r));
            }
            try (OutputStream out = Files.newOutputStream(path)) {
                workbook.write(out);
            }
        }
    }

    private static void writeRow(Row row, List<String> values) {
        for (int c = 0; c < values.size(); c++) {
            String v = values.get(c);
            if (v == null)
                v = "";
            else if (v.length() > MAX_CELL_TEXT)
                v = v.substring(0, MAX_CELL_TEXT);
            row.createCell(c).setCellValue(v);
        }
    }
}
