package czm.staff_application_be.web;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

@ControllerAdvice
public class GlobalExceptionHandler {
    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(ApiException.class)
    public ResponseEntity<ApiErrorResponse> handleApi(ApiException ex) {
        log.debug("Rejected command code={} details={}", ex.getCode(), ex.getDetails());
        return ResponseEntity.status(ex.getStatus()).body(ApiErrorResponse.of(ex));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ApiErrorResponse> handleIllegalArgument(IllegalArgumentException ex) {
        ApiErrorResponse body = ApiErrorResponse.of(
                "BAD_REQUEST",
                ex.getMessage() != null ? ex.getMessage() : "Invalid input.",
                null,
                HttpStatus.BAD_REQUEST.value(),
                null);
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(body);
    }

    @ExceptionHandler({MethodArgumentTypeMismatchException.class, HttpMessageNotReadableException.class, MethodArgumentNotValidException.class})
    public ResponseEntity<ApiErrorResponse> handleValidation(Exception ex) {
        ApiErrorResponse body = ApiErrorResponse.of(
                "VALIDATION",
                "Invalid input. Check the command parameters.",
                ex.getMessage(),
                HttpStatus.BAD_REQUEST.value(),
                null);
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(body);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiErrorResponse> handleGeneric(Exception ex) {
        log.error("Unhandled exception", ex);
        ApiErrorResponse body = ApiErrorResponse.of(
                "UNKNOWN",
                "Something went wrong. Try again later or contact an administrator.",
                ex.getMessage(),
                500,
                null);
        return ResponseEntity.status(500).body(body);
    }
}
