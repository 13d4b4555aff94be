package enricher.transform;

import enricher.model.ColumnSpec;
import enricher.model.Row;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds the chat messages and the function schema for one row.
 */
public final class PromptBuilder {

    public static final String FUNCTION_NAME = "extract_data";
    public static final String FUNCTION_DESCRIPTION = "Extract or generate the requested data fields";

    public static final String SYSTEM_PROMPT = """
            You are a data processing assistant. You analyze input data and extract or generate the requested information in a structured format.
            Always return valid values for all requested fields. If a value cannot be determined, use "N/A" or an appropriate default.
            Be consistent in your formatting across all rows.""";

    private PromptBuilder() {
    }

    /**
     * One {@code field: value} line per column in header order, blanks shown as {@code [empty]},
     * followed by the task.
     */
    public static String userMessage(Row row, String instruction) {
        StringBuilder data = new StringBuilder();
        for (int i = 0; i < row.size(); i++) {
            String value = row.get(i);
            data.append(row.headers().get(i)).append(": ")
                    .append(value.isEmpty() ? "[empty]" : value)
                    .append('\n');
        }
        return "Data:\n" + data + "\n\nTask: " + instruction;
    }

    /**
     * JSON schema of the function arguments: one required string property per target.
     */
    public static Map<String, Object> argumentsSchema(List<ColumnSpec> targets) {
        Map<String, Object> properties = new LinkedHashMap<>();
        List<String> required = new ArrayList<>();
        for (ColumnSpec spec : targets) {
            Map<String, Object> property = new LinkedHashMap<>();
            property.put("type", "string");
            property.put("description", "Value for " + spec.name() + " column");
            properties.put(spec.name(), property);
            required.add(spec.name());
        }

        Map<String, Object> schema = new LinkedHashMap<>();
        schema.put("type", "object");
        schema.put("properties", properties);
        schema.put("required", required);
        schema.put("additionalProperties", false);
        return schema;
    }
}
