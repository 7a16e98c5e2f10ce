package czm.staff_application_be.notification;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Owned set of message references per conversation.
 *
 * <p>Invariant: a conversation holds at most one SUMMARY or RESULT reference. Installing a new one
 * first asks the dispatcher to delete the previous one and forgets it, then records the new one.
 * A reference is forgotten once its deletion was requested, whether or not the transport managed
 * to delete it. Two installs racing on the same conversation can both record a reference; the
 * newest one is kept and the older ones are released.</p>
 */
@Component
public class MessageLedger {
    private static final Logger log = LoggerFactory.getLogger(MessageLedger.class);
    private static final Set<MessageRole> SINGLETON_ROLES = EnumSet.of(MessageRole.SUMMARY, MessageRole.RESULT);

    private final MessageRefDao dao;
    private final NotificationDispatcher dispatcher;
    private final Clock clock;

    public MessageLedger(MessageRefDao dao, NotificationDispatcher dispatcher, Clock clock) {
        this.dao = dao;
        this.dispatcher = dispatcher;
        this.clock = clock;
    }

    /**
     * Sends a message and remembers it. SUMMARY and RESULT messages replace the conversation's previous one.
     */
    public Optional<MessageRef> sendTracked(String conversationId, MessageRole role, String applicationId, MessageContent content) {
        if (!role.isTracked()) {
            throw new IllegalArgumentException(role + " messages are not tracked");
        }
        if (role.isSingleton()) {
            release(dao.findByConversation(conversationId, SINGLETON_ROLES));
        }
        Optional<MessageRef> sent = dispatcher.send(conversationId, role, applicationId, content);
        sent.ifPresent(ref -> dao.insert(ref, OffsetDateTime.now(clock)));
        if (role.isSingleton()) {
            enforceSingleLiveSummary(conversationId);
        }
        return sent;
    }

    /**
     * Requests deletion of every tracked message of the given roles in the conversation.
     */
    public int removeAll(String conversationId, Set<MessageRole> roles) {
        List<MessageRef> refs = dao.findByConversation(conversationId, roles);
        release(refs);
        return refs.size();
    }

    /**
     * Requests deletion of every tracked message in the conversation except those with {@code keep}.
     */
    public int removeAllExcept(String conversationId, MessageRole keep) {
        Set<MessageRole> roles = EnumSet.allOf(MessageRole.class);
        roles.remove(keep);
        roles.removeIf(role -> !role.isTracked());
        return removeAll(conversationId, roles);
    }

    public Optional<MessageRef> reviewCard(String applicationId) {
        return dao.findByApplicationAndRole(applicationId, MessageRole.STAFF_REVIEW_CARD);
    }

    /**
     * Keeps only the newest SUMMARY/RESULT reference of the conversation.
     *
     * @return number of references released
     */
    int enforceSingleLiveSummary(String conversationId) {
        List<MessageRef> live = dao.findByConversation(conversationId, SINGLETON_ROLES);
        if (live.size() <= 1) {
            return 0;
        }
        List<MessageRef> stale = live.subList(0, live.size() - 1);
        log.warn("Conversation {} held {} summary/result messages, releasing {} older ones: {}",
                conversationId, live.size(), stale.size(), stale);
        release(List.copyOf(stale));
        return stale.size();
    }

    private void release(List<MessageRef> refs) {
        if (refs.isEmpty()) {
            return;
        }
        int deleted = dispatcher.deleteMany(refs);
        refs.forEach(dao::delete);
        log.debug("Released {} message refs ({} deleted by transport)", refs.size(), deleted);
    }
}
