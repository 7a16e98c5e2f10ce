package czm.staff_application_be.application;

/**
 * Low-level JDBC access for the staff application aggregate.
 *
 * Every state transition is a single conditional UPDATE guarded by the expected current state,
 * so the caller learns from the affected row count whether it won. No transition relies on an
 * in-process lock.
 */
import org.springframework.dao.support.DataAccessUtils;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

@Repository
public class ApplicationDao {
    private final JdbcTemplate jdbc;

    public record ApplicationRow(String id,
                                 String applicantId,
                                 String applicantName,
                                 ApplicationStatus status,
                                 String reviewerId,
                                 String reviewerName,
                                 Integer score,
                                 Integer scale,
                                 Decision decision,
                                 String reason,
                                 OffsetDateTime createdAt,
                                 OffsetDateTime submittedAt,
                                 OffsetDateTime claimedAt,
                                 OffsetDateTime scoredAt,
                                 OffsetDateTime decidedAt) {

        public boolean isOwnedBy(String actorId) {
            return reviewerId != null && reviewerId.equals(actorId);
        }

        public String reviewerLabel() {
            return reviewerName != null && !reviewerName.isBlank() ? reviewerName : reviewerId;
        }

        public String applicantLabel() {
            return applicantName != null && !applicantName.isBlank()
                    ? applicantName + " (" + applicantId + ")"
                    : applicantId;
        }
    }

    public record AnswerRow(String applicationId, int questionIndex, String question, String answer,
                            OffsetDateTime answeredAt) {}

    private static final String SQL_SELECT_BASE = """
            SELECT id, applicant_id, applicant_name, status, reviewer_id, reviewer_name,
                   score, scale, decision, reason,
                   created_at, submitted_at, claimed_at, scored_at, decided_at
            FROM staff_application
            """;

    private static final RowMapper<ApplicationRow> APPLICATION_MAPPER = new RowMapper<>() {
        @Override
        public ApplicationRow mapRow(ResultSet rs, int rowNum) throws SQLException {
            String decision = rs.getString("decision");
            return new ApplicationRow(
                    rs.getString("id"),
                    rs.getString("applicant_id"),
                    rs.getString("applicant_name"),
                    ApplicationStatus.valueOf(rs.getString("status")),
                    rs.getString("reviewer_id"),
                    rs.getString("reviewer_name"),
                    rs.getObject("score", Integer.class),
                    rs.getObject("scale", Integer.class),
                    decision != null ? Decision.valueOf(decision) : null,
                    rs.getString("reason"),
                    rs.getObject("created_at", OffsetDateTime.class),
                    rs.getObject("submitted_at", OffsetDateTime.class),
                    rs.getObject("claimed_at", OffsetDateTime.class),
                    rs.getObject("scored_at", OffsetDateTime.class),
                    rs.getObject("decided_at", OffsetDateTime.class));
        }
    };

    private static final RowMapper<AnswerRow> ANSWER_MAPPER = (rs, rn) -> new AnswerRow(
            rs.getString("application_id"),
            rs.getInt("question_index"),
            rs.getString("question"),
            rs.getString("answer"),
            rs.getObject("answered_at", OffsetDateTime.class));

    public ApplicationDao(JdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    /**
     * Inserts a new IN_PROGRESS application. Throws {@link org.springframework.dao.DuplicateKeyException}
     * when the applicant already has a non-terminal application.
     */
    public void insert(String id, String applicantId, String applicantName, OffsetDateTime createdAt) {
        jdbc.update("""
                INSERT INTO staff_application (id, applicant_id, applicant_name, active_applicant_id, status, created_at)
                VALUES (?, ?, ?, ?, ?, ?)
                """, id, applicantId, applicantName, applicantId, ApplicationStatus.IN_PROGRESS.name(), createdAt);
    }

    public Optional<ApplicationRow> findById(String id) {
        List<ApplicationRow> rows = jdbc.query(SQL_SELECT_BASE + " WHERE id = ?", APPLICATION_MAPPER, id);
        return Optional.ofNullable(DataAccessUtils.singleResult(rows));
    }

    /**
     * Reads the application and locks its row until the surrounding transaction ends.
     * Only other writers of the same application wait.
     */
    public Optional<ApplicationRow> findByIdForUpdate(String id) {
        List<ApplicationRow> rows = jdbc.query(SQL_SELECT_BASE + " WHERE id = ? FOR UPDATE", APPLICATION_MAPPER, id);
        return Optional.ofNullable(DataAccessUtils.singleResult(rows));
    }

    /**
     * The applicant's non-terminal application, if any.
     */
    public Optional<ApplicationRow> findActiveByApplicant(String applicantId) {
        List<ApplicationRow> rows = jdbc.query(SQL_SELECT_BASE + " WHERE active_applicant_id = ?",
                APPLICATION_MAPPER, applicantId);
        return Optional.ofNullable(DataAccessUtils.singleResult(rows));
    }

    public Optional<ApplicationRow> findLatestByApplicant(String applicantId) {
        List<ApplicationRow> rows = jdbc.query(SQL_SELECT_BASE + """
                 WHERE applicant_id = ?
                 ORDER BY created_at DESC, id DESC
                 LIMIT 1
                """, APPLICATION_MAPPER, applicantId);
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    public List<ApplicationRow> findAllByApplicant(String applicantId) {
        return jdbc.query(SQL_SELECT_BASE + " WHERE applicant_id = ? ORDER BY created_at DESC, id DESC",
                APPLICATION_MAPPER, applicantId);
    }

    public int countAnswers(String applicationId) {
        Integer count = jdbc.queryForObject(
                "SELECT COUNT(*) FROM application_answer WHERE application_id = ?", Integer.class, applicationId);
        return count != null ? count : 0;
    }

    public void insertAnswer(String applicationId, int index, String question, String answer, OffsetDateTime answeredAt) {
        jdbc.update("""
                INSERT INTO application_answer (application_id, question_index, question, answer, answered_at)
                VALUES (?, ?, ?, ?, ?)
                """, applicationId, index, question, answer, answeredAt);
    }

    public List<AnswerRow> findAnswers(String applicationId) {
        return jdbc.query("""
                SELECT application_id, question_index, question, answer, answered_at
                FROM application_answer
                WHERE application_id = ?
                ORDER BY question_index
                """, ANSWER_MAPPER, applicationId);
    }

    /**
     * IN_PROGRESS -> SUBMITTED. Returns the number of updated rows (0 or 1).
     */
    public int markSubmitted(String id, OffsetDateTime submittedAt) {
        return jdbc.update("""
                UPDATE staff_application
                SET status = ?, submitted_at = ?
                WHERE id = ? AND status = ?
                """, ApplicationStatus.SUBMITTED.name(), submittedAt, id, ApplicationStatus.IN_PROGRESS.name());
    }

    /**
     * Compare-and-set on {@code reviewer_id}: succeeds only while the application is SUBMITTED and
     * unclaimed. Of any number of concurrent callers exactly one sees 1.
     */
    public int claim(String id, String reviewerId, String reviewerName, OffsetDateTime claimedAt) {
        Objects.requireNonNull(reviewerId, "reviewerId");
        return jdbc.update("""
                UPDATE staff_application
                SET status = ?, reviewer_id = ?, reviewer_name = ?, claimed_at = ?
                WHERE id = ? AND status = ? AND reviewer_id IS NULL
                """, ApplicationStatus.CLAIMED.name(), reviewerId, reviewerName, claimedAt,
                id, ApplicationStatus.SUBMITTED.name());
    }

    /**
     * CLAIMED -> SCORED for the owning reviewer only.
     */
    public int score(String id, String reviewerId, int score, int scale, OffsetDateTime scoredAt) {
        return jdbc.update("""
                UPDATE staff_application
                SET status = ?, score = ?, scale = ?, scored_at = ?
                WHERE id = ? AND status = ? AND reviewer_id = ?
                """, ApplicationStatus.SCORED.name(), score, scale, scoredAt,
                id, ApplicationStatus.CLAIMED.name(), reviewerId);
    }

    /**
     * SCORED -> APPROVED/DENIED for the owning reviewer only. Frees the applicant for a new application.
     */
    public int decide(String id, String reviewerId, Decision decision, String reason, OffsetDateTime decidedAt) {
        return jdbc.update("""
                UPDATE staff_application
                SET status = ?, decision = ?, reason = ?, decided_at = ?, active_applicant_id = NULL
                WHERE id = ? AND status = ? AND reviewer_id = ? AND score IS NOT NULL
                """, decision.resultingStatus().name(), decision.name(), reason, decidedAt,
                id, ApplicationStatus.SCORED.name(), reviewerId);
    }
}
