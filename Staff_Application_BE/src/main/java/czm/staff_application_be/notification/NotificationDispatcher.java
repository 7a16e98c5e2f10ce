package czm.staff_application_be.notification;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.Optional;

/**
 * Sends message intents through the {@link MessageGateway}. Callers have already committed their
 * state transition, so transport failures are logged and swallowed here and never roll anything back.
 */
@Component
public class NotificationDispatcher {
    private static final Logger log = LoggerFactory.getLogger(NotificationDispatcher.class);

    private final MessageGateway gateway;

    public NotificationDispatcher(MessageGateway gateway) {
        this.gateway = gateway;
    }

    /**
     * @return the reference of the sent message, or empty when the transport failed
     */
    public Optional<MessageRef> send(String conversationId, MessageRole role, String applicationId, MessageContent content) {
        try {
            String handle = gateway.send(conversationId, content);
            return Optional.of(new MessageRef(conversationId, handle, role, applicationId));
        } catch (RuntimeException ex) {
            log.warn("Failed to send {} message to {} for application {}: {}", role, conversationId, applicationId, ex.getMessage());
            return Optional.empty();
        }
    }

    public boolean edit(MessageRef ref, MessageContent content) {
        try {
            gateway.edit(ref.conversationId(), ref.messageHandle(), content);
            return true;
        } catch (RuntimeException ex) {
            log.warn("Failed to edit {} message {} in {}: {}", ref.role(), ref.messageHandle(), ref.conversationId(), ex.getMessage());
            return false;
        }
    }

    /**
     * Best effort; a message that is already gone or can no longer be deleted only produces a warning.
     */
    public boolean delete(MessageRef ref) {
        try {
            gateway.delete(ref.conversationId(), ref.messageHandle());
            return true;
        } catch (RuntimeException ex) {
            log.warn("Failed to delete {} message {} in {}: {}", ref.role(), ref.messageHandle(), ref.conversationId(), ex.getMessage());
            return false;
        }
    }

    public int deleteMany(Collection<MessageRef> refs) {
        int deleted = 0;
        for (MessageRef ref : refs) {
            if (delete(ref)) {
                deleted++;
            }
        }
        return deleted;
    }
}
