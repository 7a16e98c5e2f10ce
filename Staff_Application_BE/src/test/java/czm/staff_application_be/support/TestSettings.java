package czm.staff_application_be.support;

import czm.staff_application_be.application.ApplicationDao.ApplicationRow;
import czm.staff_application_be.application.ApplicationStatus;
import czm.staff_application_be.application.Decision;
import czm.staff_application_be.config.ApplicationSettings;

import java.time.Duration;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.TreeSet;

/**
 * Shared fixtures for the unit tests.
 */
public final class TestSettings {
    public static final OffsetDateTime NOW = OffsetDateTime.of(2024, 5, 1, 12, 0, 0, 0, ZoneOffset.UTC);
    public static final String STAFF_CHANNEL = "staff-channel";

    private TestSettings() {
    }

    public static ApplicationSettings twoQuestions() {
        return new ApplicationSettings(
                List.of("Why do you want to join?", "How active are you?"),
                Duration.ofSeconds(300),
                STAFF_CHANNEL,
                "reviewer-role",
                new TreeSet<>(List.of(5, 10, 50, 100)),
                "Approved {id} by {reviewer} with {score}/{scale}: {reason}",
                "Denied {id} by {reviewer} with {score}/{scale}: {reason}",
                1000,
                1900);
    }

    public static ApplicationRow row(String id, String applicantId, ApplicationStatus status) {
        return new ApplicationRow(id, applicantId, "Applicant", status, null, null, null, null, null, null,
                NOW, null, null, null, null);
    }

    public static ApplicationRow claimed(String id, String applicantId, String reviewerId) {
        return new ApplicationRow(id, applicantId, "Applicant", ApplicationStatus.CLAIMED, reviewerId, "Reviewer",
                null, null, null, null, NOW, NOW, NOW, null, null);
    }

    public static ApplicationRow scored(String id, String applicantId, String reviewerId, int score, int scale) {
        return new ApplicationRow(id, applicantId, "Applicant", ApplicationStatus.SCORED, reviewerId, "Reviewer",
                score, scale, null, null, NOW, NOW, NOW, NOW, null);
    }

    public static ApplicationRow decided(String id, String applicantId, String reviewerId, Decision decision, String reason) {
        return new ApplicationRow(id, applicantId, "Applicant", decision.resultingStatus(), reviewerId, "Reviewer",
                8, 10, decision, reason, NOW, NOW, NOW, NOW, NOW);
    }
}
