package enricher.table;

import com.opencsv.CSVWriter;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Writes a table as RFC-4180 style delimited text with every field quoted.
 */
public class CsvTableWriter implements TableWriter {

    private final char separator;

    public CsvTableWriter() {
        this(CSVWriter.DEFAULT_SEPARATOR);
    }

    public CsvTableWriter(char separator) {
        this.separator = separator;
    }

    @Override
    public void write(Path path, List<String> headers, List<List<String>> rows) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }

        try (Writer out = Files.newBufferedWriter(path, StandardCharsets.UTF_8);
                CSVWriter writer = new CSVWriter(
                        out,
                        separator,
                        CSVWriter.DEFAULT_QUOTE_CHARACTER,
                        CSVWriter.DEFAULT_ESCAPE_CHARACTER,
                        CSVWriter.DEFAULT_LINE_END)) {

            writer.writeNext(headers.toArray(String[]::new));
            for (List<String> row : rows) {
                writer.writeNext(row.stream().map(v -> v == null ? "" : v).toArray(String[]::new));
            }
            writer.flush();
            if (writer.checkError()) {
                throw new IOException("CSV write failed: " + path);
            }
        }
    }
}
