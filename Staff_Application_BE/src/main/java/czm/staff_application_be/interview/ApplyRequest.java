package czm.staff_application_be.interview;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;

/**
 * Request DTO of the apply command.
 */
public record ApplyRequest(
        @JsonProperty("applicant_id") @NotBlank String applicantId,
        @JsonProperty("applicant_name") String applicantName) {
}
