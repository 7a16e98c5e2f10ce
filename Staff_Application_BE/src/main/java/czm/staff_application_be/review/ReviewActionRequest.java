package czm.staff_application_be.review;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Request DTO for actions that carry nothing but the invoking actor (pick, decision check, transcript).
 */
public record ReviewActionRequest(@JsonProperty("actor") Actor actor) {
}
