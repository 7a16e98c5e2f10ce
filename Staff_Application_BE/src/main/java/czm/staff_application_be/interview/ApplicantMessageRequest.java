package czm.staff_application_be.interview;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;

/**
 * A direct message the applicant sent to the bot.
 */
public record ApplicantMessageRequest(
        @JsonProperty("applicant_id") @NotBlank String applicantId,
        @JsonProperty("text") String text) {
}
