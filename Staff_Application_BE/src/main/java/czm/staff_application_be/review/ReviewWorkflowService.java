package czm.staff_application_be.review;

import czm.staff_application_be.application.ApplicationDao.ApplicationRow;
import czm.staff_application_be.application.ApplicationStore;
import czm.staff_application_be.application.Decision;
import czm.staff_application_be.notification.MessageComposer;
import czm.staff_application_be.notification.MessageContent;
import czm.staff_application_be.notification.MessageLedger;
import czm.staff_application_be.notification.MessageRef;
import czm.staff_application_be.notification.MessageRole;
import czm.staff_application_be.notification.NotificationDispatcher;
import czm.staff_application_be.web.ApiException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Staff actions on a submitted application.
 *
 * <p>Every action first changes the application through {@link ApplicationStore} and only then
 * touches messages: the review card is edited in place and, after a decision, the applicant's
 * direct conversation is cleaned up and receives the result. A rejected action leaves both the
 * application and the card untouched.</p>
 */
@Service
public class ReviewWorkflowService {
    private static final Logger log = LoggerFactory.getLogger(ReviewWorkflowService.class);

    private final ApplicationStore store;
    private final ReviewerAuthorization authorization;
    private final MessageLedger ledger;
    private final NotificationDispatcher dispatcher;
    private final MessageComposer composer;

    public ReviewWorkflowService(ApplicationStore store,
                                 ReviewerAuthorization authorization,
                                 MessageLedger ledger,
                                 NotificationDispatcher dispatcher,
                                 MessageComposer composer) {
        this.store = store;
        this.authorization = authorization;
        this.ledger = ledger;
        this.dispatcher = dispatcher;
        this.composer = composer;
    }

    /**
     * Result of a command that answers with a direct message to the requester.
     */
    public record Delivery(String applicationId, String conversationId, boolean delivered) {}

    public ApplicationRow pick(String applicationId, Actor actor) {
        String actorId = requireActor(actor);
        if (store.require(applicationId).status().isTerminal()) {
            throw ApiException.alreadyDecided(applicationId);
        }
        if (!authorization.mayReview(actor)) {
            throw ApiException.forbidden("Only staff reviewers can pick applications.");
        }
        ApplicationRow claimed = store.claim(applicationId, actorId, actor.actorName());
        refreshReviewCard(claimed);
        return claimed;
    }

    public ApplicationRow score(String applicationId, Actor actor, String value, String scale) {
        String actorId = requireActor(actor);
        store.checkScorable(applicationId, actorId);
        int parsedScale = parseNumber(scale, "Scale");
        int parsedValue = parseNumber(value, "Score");
        ApplicationRow scored = store.setScore(applicationId, actorId, parsedValue, parsedScale);
        refreshReviewCard(scored);
        return scored;
    }

    /**
     * Rejects Approve/Deny before the reason form is opened.
     */
    public ApplicationRow checkDecision(String applicationId, Actor actor) {
        return store.checkDecidable(applicationId, requireActor(actor));
    }

    public ApplicationRow approve(String applicationId, Actor actor, String reason) {
        return decide(applicationId, actor, Decision.APPROVED, reason);
    }

    public ApplicationRow deny(String applicationId, Actor actor, String reason) {
        return decide(applicationId, actor, Decision.DENIED, reason);
    }

    public Delivery viewTranscript(String applicationId, Actor actor) {
        ApplicationRow application = requireReader(applicationId, actor);
        MessageContent content = composer.transcript(application, store.answers(applicationId));
        return deliver(application, actor, content);
    }

    public Delivery confirmResults(String applicationId, Actor actor) {
        ApplicationRow application = requireReader(applicationId, actor);
        MessageContent content = composer.resultsOverview(application, store.answers(applicationId));
        return deliver(application, actor, content);
    }

    private ApplicationRow decide(String applicationId, Actor actor, Decision decision, String reason) {
        ApplicationRow decided = store.decide(applicationId, requireActor(actor), decision, reason);
        refreshReviewCard(decided);

        String conversation = MessageRef.directConversation(decided.applicantId());
        int removed = ledger.removeAllExcept(conversation, MessageRole.RESULT);
        Optional<MessageRef> result = ledger.sendTracked(conversation, MessageRole.RESULT, decided.id(), composer.result(decided));
        log.info("Decision delivered id={} decision={} removedMessages={} resultSent={}",
                decided.id(), decision, removed, result.isPresent());
        return decided;
    }

    private Delivery deliver(ApplicationRow application, Actor actor, MessageContent content) {
        String conversation = MessageRef.directConversation(actor.actorId());
        boolean delivered = dispatcher.send(conversation, MessageRole.TRANSCRIPT, application.id(), content).isPresent();
        return new Delivery(application.id(), conversation, delivered);
    }

    private ApplicationRow requireReader(String applicationId, Actor actor) {
        String actorId = requireActor(actor);
        ApplicationRow application = store.require(applicationId);
        if (!actorId.equals(application.applicantId()) && !authorization.mayReview(actor)) {
            throw ApiException.forbidden("Only the applicant or staff reviewers can view this application.");
        }
        return application;
    }

    private void refreshReviewCard(ApplicationRow application) {
        Optional<MessageRef> card = ledger.reviewCard(application.id());
        if (card.isEmpty()) {
            log.warn("No review card recorded for application {}, nothing to update", application.id());
            return;
        }
        dispatcher.edit(card.get(), composer.reviewCard(application, store.answers(application.id())));
    }

    private static String requireActor(Actor actor) {
        if (actor == null || actor.actorId() == null || actor.actorId().isBlank()) {
            throw ApiException.validation("Field actor.actor_id is required.", "actor_required");
        }
        return actor.actorId();
    }

    private static int parseNumber(String raw, String label) {
        if (raw == null || raw.isBlank()) {
            throw ApiException.invalidScore(label + " is required.");
        }
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException ex) {
            throw ApiException.invalidScore(label + " must be a whole number.");
        }
    }
}
