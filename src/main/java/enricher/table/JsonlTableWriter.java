package enricher.table;

import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Writes one JSON object per row, keys in header order, all values as strings.
 */
public class JsonlTableWriter implements TableWriter {

    private final ObjectMapper mapper;

    public JsonlTableWriter() {
        this(new ObjectMapper());
    }

    public JsonlTableWriter(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    @Override
    public void write(Path path, List<String> headers, List<List<String>> rows) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }

        try (BufferedWriter out = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
            for (List<String> row : rows) {
                Map<String, String> record = new LinkedHashMap<>();
                for (int i = 0; i < headers.size(); i++) {
                    String value = i < row.size() ? row.get(i) : null;
                    record.put(headers.get(i), value == null ? "" : value);
                }
                out.write(mapper.writeValueAsString(record));
                out.write('\n');
            }
        }
    }
}
