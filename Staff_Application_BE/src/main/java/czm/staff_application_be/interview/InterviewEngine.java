package czm.staff_application_be.interview;

import czm.staff_application_be.application.ApplicationDao.ApplicationRow;
import czm.staff_application_be.application.ApplicationStatus;
import czm.staff_application_be.application.ApplicationStore;
import czm.staff_application_be.config.ApplicationSettings;
import czm.staff_application_be.notification.MessageComposer;
import czm.staff_application_be.notification.MessageLedger;
import czm.staff_application_be.notification.MessageRef;
import czm.staff_application_be.notification.MessageRole;
import czm.staff_application_be.web.ApiException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.EnumSet;
import java.util.Optional;

/**
 * Drives the question/answer interview in the applicant's direct conversation.
 *
 * <p>The engine keeps no per-applicant memory. The current question is the number of stored answers
 * of the applicant's IN_PROGRESS application, so an interview resumes where it stopped after a
 * restart. Messages are sent only after the state change they announce has been committed.</p>
 */
@Service
public class InterviewEngine {
    private static final Logger log = LoggerFactory.getLogger(InterviewEngine.class);

    private final ApplicationStore store;
    private final CooldownDao cooldowns;
    private final MessageLedger ledger;
    private final MessageComposer composer;
    private final ApplicationSettings settings;
    private final TransactionTemplate txTemplate;
    private final Clock clock;

    public InterviewEngine(ApplicationStore store,
                           CooldownDao cooldowns,
                           MessageLedger ledger,
                           MessageComposer composer,
                           ApplicationSettings settings,
                           PlatformTransactionManager transactionManager,
                           Clock clock) {
        this.store = store;
        this.cooldowns = cooldowns;
        this.ledger = ledger;
        this.composer = composer;
        this.settings = settings;
        this.txTemplate = new TransactionTemplate(transactionManager);
        this.clock = clock;
    }

    /**
     * Outcome of one applicant message.
     *
     * @param handled           false when the message was not part of an interview
     * @param answeredIndex     index of the question the message answered
     * @param nextQuestionIndex index of the question sent next, null once the interview is submitted
     */
    public record InterviewStep(boolean handled,
                                String applicationId,
                                Integer answeredIndex,
                                Integer nextQuestionIndex,
                                ApplicationStatus status) {

        static InterviewStep ignored() {
            return new InterviewStep(false, null, null, null, null);
        }
    }

    /**
     * Starts a new interview: checks the cooldown, creates the application and sends the first question.
     */
    public ApplicationRow apply(String applicantId, String applicantName) {
        ApplicationRow created = txTemplate.execute(status -> {
            OffsetDateTime now = OffsetDateTime.now(clock);
            Optional<OffsetDateTime> lastApplied = cooldowns.findLastApplied(applicantId);
            if (lastApplied.isPresent()) {
                Duration elapsed = Duration.between(lastApplied.get(), now);
                if (elapsed.compareTo(settings.cooldown()) < 0) {
                    Duration left = settings.cooldown().minus(elapsed);
                    throw ApiException.cooldownActive(Math.max(1, (left.toMillis() + 999) / 1000));
                }
            }
            ApplicationRow row = store.create(applicantId, applicantName);
            cooldowns.recordApplied(applicantId, now);
            return row;
        });
        if (created == null) {
            throw new IllegalStateException("Application was not created for " + applicantId);
        }
        ledger.sendTracked(MessageRef.directConversation(applicantId), MessageRole.QUESTION_PROMPT,
                created.id(), composer.questionPrompt(created, 0));
        log.info("Interview started id={} applicant={} questions={}", created.id(), applicantId, settings.questionCount());
        return created;
    }

    /**
     * Records a direct message of the applicant as the answer to the current question. Messages from
     * applicants without an interview in progress are ignored.
     */
    public InterviewStep onApplicantMessage(String applicantId, String text) {
        Optional<ApplicationRow> active = store.findInterviewInProgress(applicantId);
        if (active.isEmpty()) {
            log.debug("Ignoring message from {} without an interview in progress", applicantId);
            return InterviewStep.ignored();
        }
        if (text == null || text.isBlank()) {
            log.debug("Ignoring empty message from {}", applicantId);
            return InterviewStep.ignored();
        }
        ApplicationRow application = active.get();
        int index = store.answerCount(application.id());
        if (index >= settings.questionCount()) {
            // every answer is stored but the submit did not happen, finish it now
            return finish(application, null);
        }

        try {
            store.appendAnswer(application.id(), index, text);
        } catch (ApiException ex) {
            if (!"INVALID_STATE".equals(ex.getCode())) {
                throw ex;
            }
            log.warn("Dropped answer of {} for application {}: {} ({})", applicantId, application.id(), ex.getMessage(), ex.getDetails());
            return InterviewStep.ignored();
        }

        int next = index + 1;
        if (next < settings.questionCount()) {
            ledger.sendTracked(MessageRef.directConversation(applicantId), MessageRole.QUESTION_PROMPT,
                    application.id(), composer.questionPrompt(application, next));
            return new InterviewStep(true, application.id(), index, next, ApplicationStatus.IN_PROGRESS);
        }
        return finish(application, index);
    }

    private InterviewStep finish(ApplicationRow application, Integer answeredIndex) {
        ApplicationRow submitted;
        try {
            submitted = store.submit(application.id());
        } catch (ApiException ex) {
            if (!"INVALID_STATE".equals(ex.getCode())) {
                throw ex;
            }
            log.warn("Submit of application {} rejected: {} ({})", application.id(), ex.getMessage(), ex.getDetails());
            return InterviewStep.ignored();
        }

        String conversation = MessageRef.directConversation(submitted.applicantId());
        int removed = ledger.removeAll(conversation, EnumSet.of(MessageRole.QUESTION_PROMPT));
        ledger.sendTracked(conversation, MessageRole.SUMMARY, submitted.id(), composer.submissionSummary(submitted));
        publishReviewCard(submitted);
        log.info("Interview finished id={} applicant={} promptsRemoved={}", submitted.id(), submitted.applicantId(), removed);
        return new InterviewStep(true, submitted.id(), answeredIndex, null, submitted.status());
    }

    private void publishReviewCard(ApplicationRow submitted) {
        String staffChannel = settings.staffChannelId();
        if (staffChannel == null) {
            log.warn("Staff channel is not configured, review card for {} was not posted", submitted.id());
            return;
        }
        ledger.sendTracked(staffChannel, MessageRole.STAFF_REVIEW_CARD, submitted.id(),
                composer.reviewCard(submitted, store.answers(submitted.id())));
    }
}
