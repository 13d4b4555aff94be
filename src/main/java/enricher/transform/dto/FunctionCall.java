package enricher.transform.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Function name plus its arguments as a JSON-encoded string.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record FunctionCall(
        @JsonProperty("name") String name,
        @JsonProperty("arguments") String arguments) {
}
