package enricher.transform.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Forces the model to call one named function.
 */
public record ToolChoice(
        @JsonProperty("type") String type,
        @JsonProperty("function") Named function) {

    public static ToolChoice function(String name) {
        return new ToolChoice("function", new Named(name));
    }

    public record Named(@JsonProperty("name") String name) {
    }
}
