package enricher.transform.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * A callable tool offered to the model.
 */
public record Tool(
        @JsonProperty("type") String type,
        @JsonProperty("function") FunctionDefinition function) {

    public static Tool function(String name, String description, Map<String, Object> parameters) {
        return new Tool("function", new FunctionDefinition(name, description, parameters));
    }

    public record FunctionDefinition(
            @JsonProperty("name") String name,
            @JsonProperty("description") String description,
            @JsonProperty("parameters") Map<String, Object> parameters) {
    }
}
