package enricher.transform.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Error body returned with non-2xx statuses: {@code {"error":{"message":...}}}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ErrorResponse(@JsonProperty("error") Detail error) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Detail(
            @JsonProperty("message") String message,
            @JsonProperty("type") String type,
            @JsonProperty("code") String code) {
    }
}
