package czm.staff_application_be.review;

import com.fasterxml.jackson.annotation.JsonProperty;

public record DeliveryResponse(
        @JsonProperty("application_id") String applicationId,
        @JsonProperty("conversation_id") String conversationId,
        @JsonProperty("delivered") boolean delivered) {

    static DeliveryResponse from(ReviewWorkflowService.Delivery delivery) {
        return new DeliveryResponse(delivery.applicationId(), delivery.conversationId(), delivery.delivered());
    }
}
