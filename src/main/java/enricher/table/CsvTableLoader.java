package enricher.table;

import com.opencsv.CSVParserBuilder;
import com.opencsv.CSVReader;
import com.opencsv.CSVReaderBuilder;
import com.opencsv.exceptions.CsvException;
import enricher.model.Table;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Loads a delimited text file. The first record is the header.
 * Leading whitespace in fields is ignored; quoting is lenient.
 */
public class CsvTableLoader implements TableLoader {

    private static final Logger log = LoggerFactory.getLogger(CsvTableLoader.class);

    private final char delimiter;

    public CsvTableLoader() {
        this(',');
    }

    public CsvTableLoader(char delimiter) {
        this.delimiter = delimiter;
    }

    @Override
    public Table load(Path path) throws IOException {
        List<String[]> records;
        try (Reader in = Files.newBufferedReader(path, StandardCharsets.UTF_8);
                CSVReader reader = new CSVReaderBuilder(in)
                        .withCSVParser(new CSVParserBuilder()
                                .withSeparator(delimiter)
                                .withIgnoreLeadingWhiteSpace(true)
                                .build())
                        .build()) {
            records = reader.readAll();
        } catch (CsvException e) {
            throw new IOException("Error reading CSV " + path + " at line " + e.getLineNumber()
                    + ": " + e.getMessage(), e);
        }

        if (records.isEmpty()) {
            throw new IOException("CSV file is empty: " + path);
        }

        List<String> headers = stripBom(Arrays.asList(records.get(0)));
        List<List<String>> data = new ArrayList<>(records.size() - 1);
        for (int i = 1; i < records.size(); i++) {
            data.add(Arrays.asList(records.get(i)));
        }

        log.info("Loaded {} rows x {} columns from {}", data.size(), headers.size(), path);
        return Table.of(headers, data);
    }

    private static List<String> stripBom(List<String> headers) {
        if (headers.isEmpty() || !headers.get(0).startsWith("\uFEFF"))
            return headers;
        List<String> copy = new ArrayList<>(headers);
        copy.set(0, copy.get(0).substring(1));
        return copy;
    }
}
