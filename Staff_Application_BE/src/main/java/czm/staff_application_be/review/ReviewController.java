package czm.staff_application_be.review;

import czm.staff_application_be.application.ApplicationResponse;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/applications/{id}")
@Tag(name = "Review", description = "Staff actions on review cards and read-only application commands")
public class ReviewController {
    private final ReviewWorkflowService service;

    public ReviewController(ReviewWorkflowService service) {
        this.service = service;
    }

    @PostMapping("/review/pick")
    @Operation(summary = "Pick an application", description = "Claims the application for the invoking reviewer.")
    @ApiResponse(responseCode = "409", description = "Another reviewer already picked the application.")
    public ApplicationResponse pick(@PathVariable String id, @RequestBody ReviewActionRequest request) {
        return ApplicationResponse.from(service.pick(id, request.actor()));
    }

    @PostMapping("/review/score")
    @Operation(summary = "Score an application", description = "Stores the score given by the reviewer who picked the application.")
    public ApplicationResponse score(@PathVariable String id, @RequestBody ScoreRequest request) {
        return ApplicationResponse.from(service.score(id, request.actor(), request.value(), request.scale()));
    }

    @PostMapping("/review/decision-check")
    @Operation(summary = "Check a decision",
            description = "Verifies that the actor could approve or deny the application now, without changing it.")
    public ApplicationResponse decisionCheck(@PathVariable String id, @RequestBody ReviewActionRequest request) {
        return ApplicationResponse.from(service.checkDecision(id, request.actor()));
    }

    @PostMapping("/review/approve")
    @Operation(summary = "Approve an application")
    public ApplicationResponse approve(@PathVariable String id, @RequestBody DecisionRequest request) {
        return ApplicationResponse.from(service.approve(id, request.actor(), request.reason()));
    }

    @PostMapping("/review/deny")
    @Operation(summary = "Deny an application")
    public ApplicationResponse deny(@PathVariable String id, @RequestBody DecisionRequest request) {
        return ApplicationResponse.from(service.deny(id, request.actor(), request.reason()));
    }

    @PostMapping("/transcript")
    @Operation(summary = "View transcript", description = "Sends the full transcript to the requester's direct conversation.")
    public DeliveryResponse transcript(@PathVariable String id, @RequestBody ReviewActionRequest request) {
        return DeliveryResponse.from(service.viewTranscript(id, request.actor()));
    }

    @PostMapping("/results")
    @Operation(summary = "Confirm results", description = "Sends the application's status overview to the requester's direct conversation.")
    public DeliveryResponse results(@PathVariable String id, @RequestBody ReviewActionRequest request) {
        return DeliveryResponse.from(service.confirmResults(id, request.actor()));
    }
}
