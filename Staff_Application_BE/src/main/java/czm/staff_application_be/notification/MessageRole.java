package czm.staff_application_be.notification;

/**
 * Purpose of a message the service owns. Only the first four are tracked in {@code message_ref};
 * transcripts and status overviews are ordinary replies.
 */
public enum MessageRole {
    QUESTION_PROMPT,
    SUMMARY,
    RESULT,
    STAFF_REVIEW_CARD,
    TRANSCRIPT;

    /** At most one SUMMARY or RESULT may be live per applicant conversation. */
    public boolean isSingleton() {
        return this == SUMMARY || this == RESULT;
    }

    public boolean isTracked() {
        return this != TRANSCRIPT;
    }
}
