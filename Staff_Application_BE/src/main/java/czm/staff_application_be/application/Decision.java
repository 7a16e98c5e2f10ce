package czm.staff_application_be.application;

public enum Decision {
    APPROVED("Approved"),
    DENIED("Denied");

    private final String label;

    Decision(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public ApplicationStatus resultingStatus() {
        return this == APPROVED ? ApplicationStatus.APPROVED : ApplicationStatus.DENIED;
    }
}
