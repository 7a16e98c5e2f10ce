package czm.staff_application_be.interview;

import com.fasterxml.jackson.annotation.JsonProperty;
import czm.staff_application_be.application.ApplicationStatus;

public record ApplicantMessageResponse(
        @JsonProperty("handled") boolean handled,
        @JsonProperty("application_id") String applicationId,
        @JsonProperty("answered_index") Integer answeredIndex,
        @JsonProperty("next_question_index") Integer nextQuestionIndex,
        @JsonProperty("status") ApplicationStatus status) {

    static ApplicantMessageResponse from(InterviewEngine.InterviewStep step) {
        return new ApplicantMessageResponse(step.handled(), step.applicationId(), step.answeredIndex(),
                step.nextQuestionIndex(), step.status());
    }
}
