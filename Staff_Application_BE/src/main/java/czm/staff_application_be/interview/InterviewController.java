package czm.staff_application_be.interview;

import czm.staff_application_be.application.ApplicationResponse;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api")
@Tag(name = "Interviews", description = "Apply command and applicant direct messages")
public class InterviewController {
    private final InterviewEngine engine;

    public InterviewController(InterviewEngine engine) {
        this.engine = engine;
    }

    @PostMapping("/applications/apply")
    @Operation(summary = "Start an application",
            description = "Creates a new application for the applicant and sends the first question to their direct conversation.")
    @ApiResponse(responseCode = "201", description = "The interview was started.")
    @ApiResponse(responseCode = "409", description = "The applicant already has an active application.")
    @ApiResponse(responseCode = "429", description = "The applicant applied too recently.")
    public ResponseEntity<ApplicationResponse> apply(@Valid @RequestBody ApplyRequest request) {
        ApplicationResponse response = ApplicationResponse.from(engine.apply(request.applicantId(), request.applicantName()));
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @PostMapping("/interviews/messages")
    @Operation(summary = "Applicant direct message",
            description = "Stores the message as the answer to the current question. Messages outside an interview are ignored.")
    public ApplicantMessageResponse message(@Valid @RequestBody ApplicantMessageRequest request) {
        return ApplicantMessageResponse.from(engine.onApplicantMessage(request.applicantId(), request.text()));
    }
}
