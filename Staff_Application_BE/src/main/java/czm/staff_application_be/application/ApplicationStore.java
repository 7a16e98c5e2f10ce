package czm.staff_application_be.application;

import czm.staff_application_be.application.ApplicationDao.AnswerRow;
import czm.staff_application_be.application.ApplicationDao.ApplicationRow;
import czm.staff_application_be.config.ApplicationSettings;
import czm.staff_application_be.web.ApiException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Durable record of applications and the only place their status changes.
 *
 * <p>Answer appends and submits lock the application row; claim, score and decide are conditional
 * updates. When a conditional update affects no row the current row is re-read to report why,
 * which keeps the rejection free of side effects.</p>
 */
@Service
public class ApplicationStore {
    private static final Logger log = LoggerFactory.getLogger(ApplicationStore.class);
    private static final DateTimeFormatter ID_TIMESTAMP = DateTimeFormatter.ofPattern("yyyyMMddHHmmss");
    /** Column width of answers and decision reasons. */
    public static final int MAX_TEXT_LENGTH = 4000;

    private final ApplicationDao dao;
    private final ApplicationSettings settings;
    private final Clock clock;

    public ApplicationStore(ApplicationDao dao, ApplicationSettings settings, Clock clock) {
        this.dao = dao;
        this.settings = settings;
        this.clock = clock;
    }

    @Transactional
    public ApplicationRow create(String applicantId, String applicantName) {
        requireText(applicantId, "applicant_id");
        Optional<ApplicationRow> active = dao.findActiveByApplicant(applicantId);
        if (active.isPresent()) {
            throw ApiException.duplicateActiveApplication(active.get().id());
        }
        String id = newApplicationId();
        try {
            dao.insert(id, applicantId, normalizeName(applicantName), now());
        } catch (DuplicateKeyException ex) {
            // a concurrent apply of the same applicant won the unique active slot
            throw ApiException.duplicateActiveApplication(null);
        }
        ApplicationRow row = require(id);
        log.info("Application created id={} applicant={}", row.id(), applicantId);
        return row;
    }

    /**
     * Appends the answer for {@code index}; the index must be exactly the number of answers stored so far.
     */
    @Transactional
    public void appendAnswer(String id, int index, String text) {
        ApplicationRow row = dao.findByIdForUpdate(id)
                .orElseThrow(() -> notFound(id));
        if (row.status() != ApplicationStatus.IN_PROGRESS) {
            throw ApiException.invalidState("Answers can no longer be changed.", "answers_frozen");
        }
        int expected = dao.countAnswers(id);
        if (index != expected) {
            throw ApiException.invalidState("Answers must be given in order.",
                    "expected_index=" + expected + " got=" + index);
        }
        if (index >= settings.questionCount()) {
            throw ApiException.invalidState("All questions are already answered.", "index_out_of_range");
        }
        String answer = text != null ? text.trim() : "";
        requireMaxLength(answer, "answer");
        dao.insertAnswer(id, index, settings.question(index), answer, now());
        log.debug("Answer stored id={} index={}", id, index);
    }

    @Transactional
    public ApplicationRow submit(String id) {
        ApplicationRow row = dao.findByIdForUpdate(id)
                .orElseThrow(() -> notFound(id));
        if (row.status() != ApplicationStatus.IN_PROGRESS) {
            throw ApiException.invalidState("Application was already submitted.", "already_submitted");
        }
        int answered = dao.countAnswers(id);
        if (answered != settings.questionCount()) {
            throw ApiException.invalidState("Not all questions are answered.",
                    "answered=" + answered + " required=" + settings.questionCount());
        }
        dao.markSubmitted(id, now());
        ApplicationRow submitted = require(id);
        log.info("Application submitted id={} applicant={}", id, submitted.applicantId());
        return submitted;
    }

    public ApplicationRow claim(String id, String reviewerId, String reviewerName) {
        requireText(reviewerId, "reviewer_id");
        if (dao.claim(id, reviewerId, normalizeName(reviewerName), now()) == 1) {
            log.info("Application claimed id={} reviewer={}", id, reviewerId);
            return require(id);
        }
        ApplicationRow row = require(id);
        if (row.status().isTerminal()) {
            throw ApiException.alreadyDecided(id);
        }
        if (row.reviewerId() != null) {
            throw ApiException.alreadyClaimed(id);
        }
        throw ApiException.invalidState("The application has not been submitted yet.", row.status().name());
    }

    public ApplicationRow checkScorable(String id, String reviewerId) {
        ApplicationRow row = require(id);
        rejectScore(row, reviewerId);
        return row;
    }

    public ApplicationRow setScore(String id, String reviewerId, int value, int scale) {
        rejectScore(require(id), reviewerId);
        if (!settings.scoreScales().contains(scale)) {
            throw ApiException.invalidScore("Scale must be one of: " + settings.scoreScales() + ".");
        }
        if (value < 0 || value > scale) {
            throw ApiException.invalidScore("Score must be between 0 and " + scale + ".");
        }
        if (dao.score(id, reviewerId, value, scale, now()) == 1) {
            log.info("Application scored id={} reviewer={} score={}/{}", id, reviewerId, value, scale);
            return require(id);
        }
        // lost a race against another transition; report the state that beat us
        rejectScore(require(id), reviewerId);
        throw ApiException.invalidState("The application can no longer be scored.", "score_rejected");
    }

    /**
     * Validates that {@code reviewerId} could decide the application right now without changing anything.
     */
    public ApplicationRow checkDecidable(String id, String reviewerId) {
        ApplicationRow row = require(id);
        rejectDecision(row, reviewerId);
        return row;
    }

    public ApplicationRow decide(String id, String reviewerId, Decision decision, String reason) {
        rejectDecision(require(id), reviewerId);
        if (decision == null) {
            throw ApiException.validation("Decision is required.", "decision_required");
        }
        String normalizedReason = reason != null ? reason.trim() : "";
        if (normalizedReason.isEmpty()) {
            throw ApiException.validation("Reason is required.", "reason_required");
        }
        requireMaxLength(normalizedReason, "reason");
        if (dao.decide(id, reviewerId, decision, normalizedReason, now()) == 1) {
            log.info("Application decided id={} reviewer={} decision={}", id, reviewerId, decision);
            return require(id);
        }
        rejectDecision(require(id), reviewerId);
        throw ApiException.invalidState("The application can no longer be decided.", "decision_rejected");
    }

    public ApplicationRow require(String id) {
        return dao.findById(id).orElseThrow(() -> notFound(id));
    }

    /**
     * Most recent application of the applicant, whatever its status.
     */
    public Optional<ApplicationRow> getByApplicant(String applicantId) {
        return dao.findLatestByApplicant(applicantId);
    }

    public List<ApplicationRow> listByApplicant(String applicantId) {
        return dao.findAllByApplicant(applicantId);
    }

    /**
     * The application currently collecting answers for the applicant, if any.
     */
    public Optional<ApplicationRow> findInterviewInProgress(String applicantId) {
        return dao.findActiveByApplicant(applicantId)
                .filter(row -> row.status() == ApplicationStatus.IN_PROGRESS);
    }

    public int answerCount(String id) {
        return dao.countAnswers(id);
    }

    public List<AnswerRow> answers(String id) {
        return dao.findAnswers(id);
    }

    private void rejectScore(ApplicationRow row, String reviewerId) {
        if (row.status().isTerminal()) {
            throw ApiException.alreadyDecided(row.id());
        }
        if (!row.isOwnedBy(reviewerId)) {
            throw ApiException.notOwner(row.id());
        }
        if (row.status() != ApplicationStatus.CLAIMED) {
            throw ApiException.invalidState("The application has already been scored.", row.status().name());
        }
    }

    private void rejectDecision(ApplicationRow row, String reviewerId) {
        if (row.status().isTerminal()) {
            throw ApiException.alreadyDecided(row.id());
        }
        if (row.score() == null) {
            throw ApiException.missingScore(row.id());
        }
        if (!row.isOwnedBy(reviewerId)) {
            throw ApiException.notOwner(row.id());
        }
    }

    private String newApplicationId() {
        String suffix = UUID.randomUUID().toString().replace("-", "").substring(0, 6);
        return "app_" + ID_TIMESTAMP.format(now()) + "_" + suffix;
    }

    private OffsetDateTime now() {
        return OffsetDateTime.now(clock);
    }

    private static ApiException notFound(String id) {
        return ApiException.notFound("Application not found.", id);
    }

    private static String normalizeName(String name) {
        if (name == null) return null;
        String trimmed = name.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

    private static void requireMaxLength(String value, String field) {
        if (value.length() > MAX_TEXT_LENGTH) {
            throw ApiException.validation("Field " + field + " is longer than " + MAX_TEXT_LENGTH + " characters.",
                    field + "_too_long length=" + value.length());
        }
    }

    private static void requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw ApiException.validation("Field " + field + " is required.", field + "_required");
        }
    }
}
