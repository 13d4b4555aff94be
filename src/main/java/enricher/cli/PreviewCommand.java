package enricher.cli;

import enricher.model.Row;
import enricher.model.Table;
import enricher.service.ColumnProfile;
import enricher.service.ColumnProfiler;
import enricher.table.TableFormat;
import enricher.table.XlsxTableLoader;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Random;

/**
 * {@code preview <file> [--rows N] [--sample first|random] [--delimiter C] [--sheet N]}:
 * summary statistics, column analysis and a sample of rows.
 */
public final class PreviewCommand {

    static final int MAX_DISPLAY_ROWS = 20;

    private final PrintStream out;
    private final Random random;

    public PreviewCommand(PrintStream out, Random random) {
        this.out = out;
        this.random = random;
    }

    /**
     * @return process exit code
     */
    public int run(Args args) throws IOException {
        String file = args.stringOrPositional("file");
        if (file == null)
            file = args.string("input");
        if (file == null) {
            throw new IllegalArgumentException("file name is required (preview <file> [--rows N] [--sample first|random])");
        }

        int rowCount = args.integer("rows", MAX_DISPLAY_ROWS);
        if (rowCount < 1) {
            throw new IllegalArgumentException("--rows must be >= 1");
        }
        String sampleType = args.string("sample", "first").toLowerCase(Locale.ROOT);
        if (!sampleType.equals("first") && !sampleType.equals("random")) {
            throw new IllegalArgumentException("--sample must be 'first' or 'random'");
        }
        int sheet = args.integer("sheet", TableFormat.FIRST_SHEET);
        if (sheet < 1) {
            throw new IllegalArgumentException("--sheet must be >= 1");
        }

        Path path = Path.of(file);
        TableFormat format = TableFormat.of(path);
        char delimiter = TableFormat.parseDelimiter(args.string("delimiter"), format.defaultDelimiter());
        Table table = format.loader(delimiter, sheet).load(path);
        String sheetInfo = format == TableFormat.XLSX ? sheetInfo(path, sheet) : null;

        if (table.rowCount() == 0) {
            out.println(format == TableFormat.XLSX
                    ? "Warning: Excel sheet contains only headers, no data rows"
                    : "Warning: file contains only headers, no data rows");
            return 0;
        }

        List<ColumnProfile> columns = ColumnProfiler.profile(table);
        List<Row> rows = ColumnProfiler.selectRows(table, rowCount, sampleType.equals("random"), random);
        print(file, format, sheetInfo, table, columns, rows, sampleType);
        return 0;
    }

    private void print(String file, TableFormat format, String sheetInfo, Table table, List<ColumnProfile> columns,
            List<Row> rows, String sampleType) {
        String separator = "=".repeat(80);

        out.println(separator);
        out.println("FILE: " + file);
        out.println("TYPE: " + format.displayName());
        if (sheetInfo != null)
            out.println("SHEET: " + sheetInfo);
        out.println(separator);
        out.println();

        out.println("SUMMARY STATISTICS:");
        out.println("Total Rows: " + table.rowCount());
        out.println("Total Columns: " + table.columnCount());
        out.println("Rows Displayed: " + rows.size() + " (" + sampleType + ")");
        out.println();

        out.println("COLUMN ANALYSIS:");
        List<List<String>> analysis = new ArrayList<>();
        for (ColumnProfile col : columns) {
            String samples = String.join(", ", col.samples());
            if (col.samples().size() < col.uniqueCount())
                samples += "...";
            analysis.add(List.of(
                    String.valueOf(col.index()),
                    ColumnProfiler.truncate(col.name(), 20),
                    col.type().label(),
                    String.valueOf(col.uniqueCount()),
                    col.nullCount() + " (" + percent(col.nullCount(), col.totalCount()) + ")",
                    samples));
        }
        out.println(ConsoleTable.render(
                List.of("Idx", "Column Name", "Type", "Unique", "Nulls", "Sample Values"), analysis, 120));
        out.println();

        out.println(sampleType.equals("random") ? "DATA PREVIEW (Random Sample):" : "DATA PREVIEW:");
        List<String> headers = new ArrayList<>();
        headers.add("Row");
        headers.addAll(table.headers());

        List<List<String>> display = new ArrayList<>();
        List<String> typeRow = new ArrayList<>();
        typeRow.add("");
        for (ColumnProfile col : columns) {
            typeRow.add("[" + col.type().label() + "]");
        }
        display.add(typeRow);

        int shown = Math.min(rows.size(), MAX_DISPLAY_ROWS);
        for (int i = 0; i < shown; i++) {
            List<String> line = new ArrayList<>();
            line.add(String.valueOf(i + 1));
            line.addAll(rows.get(i).values());
            display.add(line);
        }
        if (table.rowCount() > rows.size()) {
            List<String> ellipsis = new ArrayList<>();
            for (int i = 0; i < headers.size(); i++) {
                ellipsis.add("...");
            }
            display.add(ellipsis);
        }
        out.println(ConsoleTable.render(headers, display, 150));
        out.println();
        out.println("[Showing " + shown + " of " + table.rowCount() + " rows]");
        out.println();

        out.println("USAGE HINTS:");
        out.println("• Use column index (0-" + (table.columnCount() - 1) + ") or column name to reference columns");
        out.println("• To see more rows: preview " + file + " --rows 50");
        if (sampleType.equals("random")) {
            out.println("• To see first rows instead: preview " + file + " --sample first");
        } else {
            out.println("• To see random sample: preview " + file + " --sample random");
        }
        out.println(separator);
    }

    /** {@code Sheet 2 of 3: "Orders"}. */
    static String sheetInfo(Path path, int sheet) throws IOException {
        List<String> names = XlsxTableLoader.sheetNames(path);
        return "Sheet " + sheet + " of " + names.size() + ": \"" + names.get(sheet - 1) + "\"";
    }

    static String percent(int count, int total) {
        if (total == 0)
            return "0%";
        return String.format(Locale.ROOT, "%.1f%%", count * 100.0 / total);
    }
}
