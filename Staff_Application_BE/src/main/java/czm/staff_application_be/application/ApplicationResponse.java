package czm.staff_application_be.application;

import com.fasterxml.jackson.annotation.JsonProperty;
import czm.staff_application_be.application.ApplicationDao.ApplicationRow;

import java.time.OffsetDateTime;

/**
 * DTO returned by every endpoint that reports an application.
 */
public record ApplicationResponse(
        @JsonProperty("id") String id,
        @JsonProperty("applicant_id") String applicantId,
        @JsonProperty("applicant_name") String applicantName,
        @JsonProperty("status") ApplicationStatus status,
        @JsonProperty("reviewer_id") String reviewerId,
        @JsonProperty("reviewer_name") String reviewerName,
        @JsonProperty("score") Integer score,
        @JsonProperty("scale") Integer scale,
        @JsonProperty("decision") Decision decision,
        @JsonProperty("reason") String reason,
        @JsonProperty("created_at") OffsetDateTime createdAt,
        @JsonProperty("submitted_at") OffsetDateTime submittedAt,
        @JsonProperty("claimed_at") OffsetDateTime claimedAt,
        @JsonProperty("scored_at") OffsetDateTime scoredAt,
        @JsonProperty("decided_at") OffsetDateTime decidedAt) {

    public static ApplicationResponse from(ApplicationRow row) {
        return new ApplicationResponse(row.id(), row.applicantId(), row.applicantName(), row.status(),
                row.reviewerId(), row.reviewerName(), row.score(), row.scale(), row.decision(), row.reason(),
                row.createdAt(), row.submittedAt(), row.claimedAt(), row.scoredAt(), row.decidedAt());
    }
}
