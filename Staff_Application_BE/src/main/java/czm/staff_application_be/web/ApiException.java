package czm.staff_application_be.web;

import org.springframework.http.HttpStatus;

/**
 * Recoverable, actor-local failure. Every workflow rule violation is raised as one of these and
 * reported back to the invoking actor only; none of them leaves a partial state change behind.
 */
public class ApiException extends RuntimeException {
    private final String code;
    private final HttpStatus status;
    private final String details;

    private ApiException(String code, String message, String details, HttpStatus status) {
        super(message);
        this.code = code;
        this.status = status;
        this.details = details;
    }

    public static ApiException validation(String message, String details) {
        return new ApiException("VALIDATION", message, details, HttpStatus.BAD_REQUEST);
    }

    public static ApiException notFound(String message, String details) {
        return new ApiException("NOT_FOUND", message, details, HttpStatus.NOT_FOUND);
    }

    public static ApiException forbidden(String message) {
        return new ApiException("FORBIDDEN", message, null, HttpStatus.FORBIDDEN);
    }

    public static ApiException duplicateActiveApplication(String applicationId) {
        return new ApiException("DUPLICATE_ACTIVE_APPLICATION",
                "You already have an application in progress or under review.", applicationId, HttpStatus.CONFLICT);
    }

    public static ApiException cooldownActive(long secondsLeft) {
        return new ApiException("COOLDOWN_ACTIVE",
                "Please wait before starting another application.", "retry_after_seconds=" + secondsLeft,
                HttpStatus.TOO_MANY_REQUESTS);
    }

    public static ApiException invalidState(String message, String details) {
        return new ApiException("INVALID_STATE", message, details, HttpStatus.CONFLICT);
    }

    public static ApiException alreadyClaimed(String applicationId) {
        return new ApiException("ALREADY_CLAIMED", "Already claimed.", applicationId, HttpStatus.CONFLICT);
    }

    public static ApiException notOwner(String applicationId) {
        return new ApiException("NOT_OWNER",
                "This application is claimed by another staff member.", applicationId, HttpStatus.FORBIDDEN);
    }

    public static ApiException invalidScore(String message) {
        return new ApiException("INVALID_SCORE", message, null, HttpStatus.BAD_REQUEST);
    }

    public static ApiException missingScore(String applicationId) {
        return new ApiException("MISSING_SCORE",
                "Please score the application before making a decision.", applicationId, HttpStatus.CONFLICT);
    }

    public static ApiException alreadyDecided(String applicationId) {
        return new ApiException("ALREADY_DECIDED",
                "A decision has already been recorded for this application.", applicationId, HttpStatus.CONFLICT);
    }

    public String getCode() {
        return code;
    }

    public HttpStatus getStatus() {
        return status;
    }

    public String getDetails() {
        return details;
    }
}
