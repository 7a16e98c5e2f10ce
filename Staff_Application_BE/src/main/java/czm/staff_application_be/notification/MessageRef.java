package czm.staff_application_be.notification;

/**
 * Handle of a message sent through the bridge. {@code messageHandle} is assigned by the bridge and opaque here.
 */
public record MessageRef(String conversationId, String messageHandle, MessageRole role, String applicationId) {

    public static String directConversation(String userId) {
        return "dm:" + userId;
    }
}
