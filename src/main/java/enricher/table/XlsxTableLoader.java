package enricher.table;

import enricher.model.Table;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.DataFormatter;
import org.apache.poi.ss.usermodel.FormulaEvaluator;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.usermodel.WorkbookFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Loads one sheet of an Excel workbook. The sheet's first row is the header.
 *
 * <p>Cells are read as the text Excel would display (formulas evaluated,
 * number formats applied). Trailing blank rows are dropped.</p>
 */
public class XlsxTableLoader implements TableLoader {

    private static final Logger log = LoggerFactory.getLogger(XlsxTableLoader.class);

    private final int sheet;

    /**
     * @param sheet 1-based sheet number
     */
    public XlsxTableLoader(int sheet) {
        if (sheet < 1) {
            throw new IllegalArgumentException("sheet number must be >= 1");
        }
        this.sheet = sheet;
    }

    @Override
    public Table load(Path path) throws IOException {
        try (Workbook workbook = WorkbookFactory.create(path.toFile(), null, true)) {
            int sheets = workbook.getNumberOfSheets();
            if (sheet > sheets) {
                throw new IllegalArgumentException("invalid sheet index " + sheet
                        + " (file has " + sheets + " sheet" + (sheets == 1 ? "" : "s") + ")");
            }
            Sheet source = workbook.getSheetAt(sheet - 1);
            DataFormatter formatter = new DataFormatter();
            FormulaEvaluator evaluator = workbook.getCreationHelper().createFormulaEvaluator();

            List<List<String>> records = new ArrayList<>();
            for (int r = source.getFirstRowNum(); r >= 0 && r <= source.getLastRowNum(); r++) {
                records.add(cells(source.getRow(r), formatter, evaluator));
            }
            while (!records.isEmpty() && isBlank(records.get(records.size() - 1))) {
                records.remove(records.size() - 1);
            }
            if (records.isEmpty()) {
                throw new IOException("Sheet '" + source.getSheetName() + "' is empty: " + path);
            }

            List<String> headers = records.get(0);
            List<List<String>> data = records.subList(1, records.size());
            log.info("Loaded {} rows x {} columns from {} (sheet {} of {}: {})",
                    data.size(), headers.size(), path, sheet, sheets, source.getSheetName());
            return Table.of(headers, data);
        }
    }

    /** Sheet names of a workbook, in order. */
    public static List<String> sheetNames(Path path) throws IOException {
        try (Workbook workbook = WorkbookFactory.create(path.toFile(), null, true)) {
            List<String> names = new ArrayList<>(workbook.getNumberOfSheets());
            for (int i = 0; i < workbook.getNumberOfSheets(); i++) {
                names.add(workbook.getSheetName(i));
            }
            return names;
        }
    }

    private static List<String> cells(Row row, DataFormatter formatter, FormulaEvaluator evaluator) {
        List<String> values = new ArrayList<>();
        if (row == null || row.getLastCellNum() < 0)
            return values;
        for (int c = 0; c < row.getLastCellNum(); c++) {
            Cell cell = row.getCell(c);
            values.add(cell == null ? "" : formatter.formatCellValue(cell, evaluator));
        }
        return values;
    }

    private static boolean isBlank(List<String> record) {
        for (String v : record) {
            if (!v.isBlank())
                return false;
        }
        return true;
    }
}
