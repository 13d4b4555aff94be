package enricher.transform;

import enricher.model.ColumnSpec;
import enricher.model.Row;
import org.junit.jupiter.api.*;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class PromptBuilderTest {

    @Test
    @DisplayName("User message lists fields in header order and marks blanks")
    void userMessage() {
        Row row = Row.of(List.of("zeta", "alpha", "mid"), List.of("1", "", "x"));

        String message = PromptBuilder.userMessage(row, "Find the country");

        assertEquals("Data:\nzeta: 1\nalpha: [empty]\nmid: x\n\n\nTask: Find the country", message);
    }

    @Test
    @SuppressWarnings("unchecked")
    @DisplayName("Schema has one required string property per target and no extras")
    void schema() {
        Map<String, Object> schema = PromptBuilder.argumentsSchema(ColumnSpec.parseList("country,risk:number"));

        assertEquals("object", schema.get("type"));
        assertEquals(false, schema.get("additionalProperties"));
        assertEquals(List.of("country", "risk"), schema.get("required"));
        Map<String, Object> props = (Map<String, Object>) schema.get("properties");
        assertEquals(List.of("country", "risk"), List.copyOf(props.keySet()));
        assertEquals(Map.of("type", "string", "description", "Value for risk column"), props.get("risk"));
    }
}
