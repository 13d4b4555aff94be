package enricher.table;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import enricher.model.Table;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Loads a JSON Lines file: one flat JSON object per line.
 * Headers are the union of keys in first-seen order; nested values are kept as JSON text.
 */
public class JsonlTableLoader implements TableLoader {

    private static final Logger log = LoggerFactory.getLogger(JsonlTableLoader.class);

    private final ObjectMapper mapper;

    public JsonlTableLoader() {
        this(new ObjectMapper());
    }

    public JsonlTableLoader(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    @Override
    public Table load(Path path) throws IOException {
        Set<String> headers = new LinkedHashSet<>();
        List<Map<String, String>> records = new ArrayList<>();

        try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            String line;
            int lineNo = 0;
            while ((line = reader.readLine()) != null) {
                lineNo++;
                if (line.isBlank())
                    continue;

                JsonNode node;
                try {
                    node = mapper.readTree(line);
                } catch (JsonProcessingException e) {
                    throw new IOException("Invalid JSON on line " + lineNo + " of " + path + ": "
                            + e.getOriginalMessage(), e);
                }
                if (node == null || !node.isObject()) {
                    throw new IOException("Line " + lineNo + " of " + path + " is not a JSON object");
                }

                Map<String, String> record = new LinkedHashMap<>();
                Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
                while (fields.hasNext()) {
                    Map.Entry<String, JsonNode> field = fields.next();
                    headers.add(field.getKey());
                    record.put(field.getKey(), text(field.getValue()));
                }
                records.add(record);
            }
        }

        if (headers.isEmpty()) {
            throw new IOException("JSONL file is empty: " + path);
        }

        List<String> headerList = List.copyOf(headers);
        List<List<String>> data = new ArrayList<>(records.size());
        for (Map<String, String> record : records) {
            List<String> cells = new ArrayList<>(headerList.size());
            for (String h : headerList) {
                cells.add(record.getOrDefault(h, ""));
            }
            data.add(cells);
        }

        log.info("Loaded {} rows x {} columns from {}", data.size(), headerList.size(), path);
        return Table.of(headerList, data);
    }

    private static String text(JsonNode value) {
        if (value == null || value.isNull())
            return "";
        if (value.isValueNode())
            return value.asText();
        return value.toString();
    }
}
