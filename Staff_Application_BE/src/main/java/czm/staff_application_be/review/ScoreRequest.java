package czm.staff_application_be.review;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Score form as typed by the reviewer; value and scale are parsed server side.
 */
public record ScoreRequest(
        @JsonProperty("actor") Actor actor,
        @JsonProperty("value") String value,
        @JsonProperty("scale") String scale) {
}
