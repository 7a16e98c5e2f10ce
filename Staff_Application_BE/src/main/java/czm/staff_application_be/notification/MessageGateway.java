package czm.staff_application_be.notification;

/**
 * Outbound chat transport. Implementations may throw any runtime exception; {@link NotificationDispatcher}
 * decides which failures are tolerated.
 */
public interface MessageGateway {

    /**
     * Posts a message and returns the handle the transport assigned to it.
     */
    String send(String conversationId, MessageContent content);

    void edit(String conversationId, String messageHandle, MessageContent content);

    void delete(String conversationId, String messageHandle);
}
