package czm.staff_application_be.application;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/applications")
@Tag(name = "Applications", description = "Read access to stored applications")
public class ApplicationController {
    private final ApplicationStore store;

    public ApplicationController(ApplicationStore store) {
        this.store = store;
    }

    @GetMapping("/{id}")
    @Operation(summary = "Application detail")
    public ApplicationResponse get(@PathVariable String id) {
        return ApplicationResponse.from(store.require(id));
    }

    @GetMapping
    @Operation(summary = "Applications of an applicant", description = "Newest first.")
    public List<ApplicationResponse> byApplicant(
            @Parameter(description = "Applicant id", required = true)
            @RequestParam("applicant_id") String applicantId) {
        return store.listByApplicant(applicantId).stream()
                .map(ApplicationResponse::from)
                .toList();
    }
}
