package czm.staff_application_be.review;

import czm.staff_application_be.config.ApplicationSettings;
import org.springframework.stereotype.Component;

/**
 * Grants the reviewer role to actors holding {@code staff-application.reviewer-role-id}. Without a
 * configured role every actor may review.
 */
@Component
public class RoleBasedReviewerAuthorization implements ReviewerAuthorization {
    private final String reviewerRoleId;

    public RoleBasedReviewerAuthorization(ApplicationSettings settings) {
        this.reviewerRoleId = settings.reviewerRoleId();
    }

    @Override
    public boolean mayReview(Actor actor) {
        if (actor == null) {
            return false;
        }
        return reviewerRoleId == null || actor.hasRole(reviewerRoleId);
    }
}
