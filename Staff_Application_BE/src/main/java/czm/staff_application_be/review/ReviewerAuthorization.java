package czm.staff_application_be.review;

/**
 * Decides whether an actor may act as a reviewer.
 */
public interface ReviewerAuthorization {

    boolean mayReview(Actor actor);
}
