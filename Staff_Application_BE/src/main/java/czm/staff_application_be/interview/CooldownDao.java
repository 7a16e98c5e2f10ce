package czm.staff_application_be.interview;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Data-access component for the {@code application_cooldown} table.
 */
@Repository
public class CooldownDao {
    private final JdbcTemplate jdbc;

    public CooldownDao(JdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    public Optional<OffsetDateTime> findLastApplied(String applicantId) {
        List<OffsetDateTime> rows = jdbc.query(
                "SELECT last_applied_at FROM application_cooldown WHERE applicant_id = ?",
                (rs, rn) -> rs.getObject("last_applied_at", OffsetDateTime.class),
                applicantId);
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    /**
     * Stores {@code appliedAt} as the applicant's latest apply. Runs inside the transaction that created
     * the application, which already holds the applicant's unique active slot.
     */
    public void recordApplied(String applicantId, OffsetDateTime appliedAt) {
        int updated = jdbc.update(
                "UPDATE application_cooldown SET last_applied_at = ? WHERE applicant_id = ?",
                appliedAt, applicantId);
        if (updated == 0) {
            jdbc.update(
                    "INSERT INTO application_cooldown (applicant_id, last_applied_at) VALUES (?, ?)",
                    applicantId, appliedAt);
        }
    }
}
