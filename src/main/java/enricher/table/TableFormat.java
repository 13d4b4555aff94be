package enricher.table;

import java.nio.file.Path;
import java.util.Locale;

/**
 * Supported table file formats, picked by file extension.
 */
public enum TableFormat {
    CSV("csv"),
    TSV("tsv"),
    JSONL("jsonl"),
    XLSX("xlsx");

    public static final int FIRST_SHEET = 1;

    private final String extension;

    TableFormat(String extension) {
        this.extension = extension;
    }

    public String extension() {
        return extension;
    }

    /** Field separator for delimited text; tab for {@code .tsv}, comma otherwise. */
    public char defaultDelimiter() {
        return this == TSV ? '\t' : ',';
    }

    /**
     * @param delimiter field separator, used by the delimited text formats
     * @param sheet     1-based sheet number, used by {@link #XLSX}
     */
    public TableLoader loader(char delimiter, int sheet) {
        return switch (this) {
            case CSV, TSV -> new CsvTableLoader(delimiter);
            case JSONL -> new JsonlTableLoader();
            case XLSX -> new XlsxTableLoader(sheet);
        };
    }

    public TableLoader loader(char delimiter) {
        return loader(delimiter, FIRST_SHEET);
    }

    public TableLoader loader() {
        return loader(defaultDelimiter(), FIRST_SHEET);
    }

    public TableWriter writer() {
        return switch (this) {
            case CSV, TSV -> new CsvTableWriter(defaultDelimiter());
            case JSONL -> new JsonlTableWriter();
            case XLSX -> new XlsxTableWriter();
        };
    }

    public String displayName() {
        return switch (this) {
            case CSV -> "CSV File";
            case TSV -> "TSV File";
            case JSONL -> "JSON Lines File";
            case XLSX -> "Excel Spreadsheet";
        };
    }

    /**
     * Detect the format of a path from its extension: {@code .csv} and {@code .txt}
     * are comma separated, {@code .tsv} tab separated, {@code .jsonl} and
     * {@code .ndjson} JSON Lines, {@code .xlsx} an Excel workbook.
     *
     * @throws IllegalArgumentException for anything else
     */
    public static TableFormat of(Path path) {
        String name = path.getFileName().toString().toLowerCase(Locale.ROOT);
        if (name.endsWith(".csv") || name.endsWith(".txt"))
            return CSV;
        if (name.endsWith(".tsv"))
            return TSV;
        if (name.endsWith(".jsonl") || name.endsWith(".ndjson"))
            return JSONL;
        if (name.endsWith(".xlsx"))
            return XLSX;
        throw new IllegalArgumentException("Unsupported file type: " + path.getFileName()
                + " (expected .csv, .tsv, .txt, .jsonl, .ndjson or .xlsx)");
    }

    /**
     * Parse a {@code --format} value: {@code same} keeps the input's format.
     */
    public static TableFormat parse(String value, TableFormat same) {
        if (value == null || value.isBlank() || value.equalsIgnoreCase("same"))
            return same;
        for (TableFormat f : values()) {
            if (f.extension.equalsIgnoreCase(value.trim()))
                return f;
        }
        throw new IllegalArgumentException("Unknown output format: " + value
                + " (expected same, csv, tsv, jsonl or xlsx)");
    }

    /**
     * Parse a {@code --delimiter} value. Shells pass a tab as the two characters
     * {@code \t}, so that form and the word {@code tab} both mean a tab.
     *
     * @param value flag value, may be null
     * @param def   delimiter to use when the flag is absent
     * @throws IllegalArgumentException if the value is not a single character
     */
    public static char parseDelimiter(String value, char def) {
        if (value == null)
            return def;
        if (value.equals("\\t") || value.equalsIgnoreCase("tab"))
            return '\t';
        if (value.length() != 1)
            throw new IllegalArgumentException("--delimiter must be a single character, \\t or tab: " + value);
        return value.charAt(0);
    }

    /** Default output path: {@code data.csv} becomes {@code data_enriched.<ext>}. */
    public static Path defaultOutput(Path input, TableFormat format) {
        String name = input.getFileName().toString();
        int dot = name.lastIndexOf('.');
        String base = dot > 0 ? name.substring(0, dot) : name;
        return input.resolveSibling(base + "_enriched." + format.extension());
    }
}
