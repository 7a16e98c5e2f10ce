package czm.staff_application_be.web;

/**
 * Notice returned to the actor whose command was rejected. The bridge shows it privately to that
 * actor only.
 */
public class ApiErrorResponse {
    public ErrorBody error;

    public static class ErrorBody {
        public String code;
        public String message;
        public String details;
        public int httpStatus;
        public String requestId;
    }

    public static ApiErrorResponse of(String code, String message, String details, int httpStatus, String requestId) {
        ApiErrorResponse r = new ApiErrorResponse();
        r.error = new ErrorBody();
        r.error.code = code;
        r.error.message = message;
        r.error.details = details;
        r.error.httpStatus = httpStatus;
        r.error.requestId = requestId;
        return r;
    }

    public static ApiErrorResponse of(ApiException ex) {
        return of(ex.getCode(), ex.getMessage(), ex.getDetails(), ex.getStatus().value(), null);
    }
}
