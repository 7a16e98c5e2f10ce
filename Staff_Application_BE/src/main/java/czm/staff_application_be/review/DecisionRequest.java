package czm.staff_application_be.review;

import com.fasterxml.jackson.annotation.JsonProperty;

public record DecisionRequest(
        @JsonProperty("actor") Actor actor,
        @JsonProperty("reason") String reason) {
}
