package czm.staff_application_be.review;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * The member who pressed a button or ran a command, as reported by the chat bridge.
 */
public record Actor(
        @JsonProperty("actor_id") String actorId,
        @JsonProperty("actor_name") String actorName,
        @JsonProperty("role_ids") List<String> roleIds) {

    public Actor {
        roleIds = roleIds != null ? List.copyOf(roleIds) : List.of();
    }

    public boolean hasRole(String roleId) {
        return roleIds.contains(roleId);
    }
}
