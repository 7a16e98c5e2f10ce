package czm.staff_application_be.application;

/**
 * Lifecycle state of a staff application as stored in {@code staff_application.status}.
 * Transitions only move forward; there is no un-claim.
 */
public enum ApplicationStatus {
    IN_PROGRESS,
    SUBMITTED,
    CLAIMED,
    SCORED,
    APPROVED,
    DENIED;

    public boolean isTerminal() {
        return this == APPROVED || this == DENIED;
    }
}
