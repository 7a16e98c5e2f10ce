package czm.staff_application_be;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import czm.staff_application_be.notification.MessageContent;
import czm.staff_application_be.notification.MessageGateway;
import czm.staff_application_be.support.MutableClock;
import czm.staff_application_be.support.RecordingMessageGateway;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Primary;
import org.springframework.http.MediaType;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.ResultActions;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest(properties = {
        "spring.datasource.url=jdbc:h2:mem:staff_application_flow;MODE=PostgreSQL;DATABASE_TO_UPPER=false;DB_CLOSE_DELAY=-1",
        "spring.datasource.driver-class-name=org.h2.Driver",
        "spring.datasource.username=sa",
        "spring.datasource.password=",
        "spring.flyway.enabled=true",
        "SECRETS_DIR=target/no-secrets",
        "staff-application.questions[0]=Why do you want to join?",
        "staff-application.questions[1]=How active are you?",
        "staff-application.cooldown-seconds=300",
        "staff-application.staff-channel-id=staff-room",
        "staff-application.reviewer-role-id=reviewer",
        "staff-application.templates.approved=Approved {id} by {reviewer} ({score}/{scale}): {reason}"
})
@AutoConfigureMockMvc
class StaffApplicationFlowIntegrationTest {
    private static final Instant START = Instant.parse("2024-05-01T12:00:00Z");
    private static final String STAFF_ROOM = "staff-room";

    @TestConfiguration
    static class GatewayConfig {
        @Bean
        @Primary
        RecordingMessageGateway recordingMessageGateway() {
            return new RecordingMessageGateway();
        }

        @Bean
        @Primary
        MutableClock testClock() {
            return new MutableClock(START);
        }
    }

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    @Autowired
    private RecordingMessageGateway gateway;

    @Autowired
    private MutableClock clock;

    @BeforeEach
    void cleanState() {
        jdbcTemplate.update("DELETE FROM message_ref");
        jdbcTemplate.update("DELETE FROM application_answer");
        jdbcTemplate.update("DELETE FROM staff_application");
        jdbcTemplate.update("DELETE FROM application_cooldown");
        gateway.reset();
        clock.set(START);
    }

    @Test
    void interviewReviewAndApproval() throws Exception {
        String id = apply("u1", "Alice")
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.status").value("IN_PROGRESS"))
                .andReturn().getResponse().getContentAsString()
                .transform(this::readId);
        assertThat(id).matches("app_20240501120000_[0-9a-f]{6}");
        assertThat(gateway.liveMessages("dm:u1")).extracting(MessageContent::title).containsExactly("Question 1 of 2");

        message("u1", "I like helping people")
                .andExpect(jsonPath("$.handled").value(true))
                .andExpect(jsonPath("$.next_question_index").value(1));
        message("u1", "Every evening")
                .andExpect(jsonPath("$.status").value("SUBMITTED"));

        assertThat(gateway.liveMessages("dm:u1")).extracting(MessageContent::title).containsExactly("Application Submitted");
        assertThat(gateway.deletedHandles()).hasSize(2);
        assertThat(gateway.liveMessages(STAFF_ROOM)).extracting(MessageContent::title).containsExactly("New Staff Application");

        review(id, "pick", Map.of("actor", reviewer("r1", "Rita")))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("CLAIMED"))
                .andExpect(jsonPath("$.reviewer_name").value("Rita"));
        review(id, "pick", Map.of("actor", reviewer("r2", "Bob")))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error.code").value("ALREADY_CLAIMED"));
        review(id, "score", Map.of("actor", reviewer("r2", "Bob"), "value", "3", "scale", "5"))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.error.code").value("NOT_OWNER"));
        review(id, "decision-check", Map.of("actor", reviewer("r1", "Rita")))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error.code").value("MISSING_SCORE"));
        review(id, "score", Map.of("actor", reviewer("r1", "Rita"), "value", "12", "scale", "10"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error.code").value("INVALID_SCORE"));
        review(id, "score", Map.of("actor", reviewer("r1", "Rita"), "value", "8", "scale", "10"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("SCORED"));

        MessageContent card = gateway.liveMessages(STAFF_ROOM).get(0);
        assertThat(card.field("Score").value()).isEqualTo("8/10");

        review(id, "approve", Map.of("actor", reviewer("r1", "Rita"), "reason", "Great answers"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("APPROVED"))
                .andExpect(jsonPath("$.decision").value("APPROVED"));
        review(id, "deny", Map.of("actor", reviewer("r1", "Rita"), "reason", "Changed my mind"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error.code").value("ALREADY_DECIDED"));
        review(id, "pick", Map.of("actor", Map.of("actor_id", "m1", "actor_name", "Member", "role_ids", List.of())))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error.code").value("ALREADY_DECIDED"));

        List<MessageContent> dm = gateway.liveMessages("dm:u1");
        assertThat(dm).hasSize(1);
        assertThat(dm.get(0).description()).isEqualTo("Approved " + id + " by Rita (8/10): Great answers");
        MessageContent finalCard = gateway.liveMessages(STAFF_ROOM).get(0);
        assertThat(finalCard.title()).isEqualTo("Staff Application (Final)");
        assertThat(finalCard.actions()).extracting(MessageContent.Action::label).containsExactly("View Transcript");

        mockMvc.perform(get("/api/applications/{id}", id))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.reason").value("Great answers"))
                .andExpect(jsonPath("$.score").value(8));
        Integer refs = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM message_ref WHERE conversation_id = 'dm:u1'", Integer.class);
        assertThat(refs).isEqualTo(1);
    }

    @Test
    void cooldownAndSingleActiveApplication() throws Exception {
        apply("u2", "Dan").andExpect(status().isCreated());

        clock.advance(Duration.ofSeconds(10));
        apply("u2", "Dan")
                .andExpect(status().isTooManyRequests())
                .andExpect(jsonPath("$.error.code").value("COOLDOWN_ACTIVE"))
                .andExpect(jsonPath("$.error.details").value("retry_after_seconds=290"));

        clock.advance(Duration.ofSeconds(300));
        apply("u2", "Dan")
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error.code").value("DUPLICATE_ACTIVE_APPLICATION"));

        mockMvc.perform(get("/api/applications").param("applicant_id", "u2"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(1));
    }

    @Test
    void oversizedAnswerIsRejectedAndInterviewContinues() throws Exception {
        String id = apply("u9", "Ivy").andReturn().getResponse().getContentAsString().transform(this::readId);

        message("u9", "a".repeat(5000))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error.code").value("VALIDATION"))
                .andExpect(jsonPath("$.error.details").value("answer_too_long length=5000"));

        message("u9", "A short answer")
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.answered_index").value(0))
                .andExpect(jsonPath("$.next_question_index").value(1));
        Integer answers = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM application_answer WHERE application_id = ?", Integer.class, id);
        assertThat(answers).isEqualTo(1);
    }

    @Test
    void strayMessagesAreIgnored() throws Exception {
        message("nobody", "hello?")
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.handled").value(false));

        assertThat(gateway.sentMessages()).isEmpty();
    }

    @Test
    void transcriptGoesToRequesterOnly() throws Exception {
        String id = apply("u3", "Eve").andReturn().getResponse().getContentAsString().transform(this::readId);
        message("u3", "First");

        review(id, "transcript", Map.of("actor", Map.of("actor_id", "x1", "actor_name", "Mallory", "role_ids", List.of())), "")
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.error.code").value("FORBIDDEN"));
        review(id, "transcript", Map.of("actor", Map.of("actor_id", "u3", "actor_name", "Eve", "role_ids", List.of())), "")
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.delivered").value(true))
                .andExpect(jsonPath("$.conversation_id").value("dm:u3"));

        MessageContent transcript = gateway.sentMessages().get(gateway.sentMessages().size() - 1);
        assertThat(transcript.description()).contains("Q: Why do you want to join?\nA: First");
    }

    @Test
    void applyRequiresApplicantId() throws Exception {
        mockMvc.perform(post("/api/applications/apply")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"applicant_name\":\"Nobody\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error.code").value("VALIDATION"));
    }

    private ResultActions apply(String applicantId, String name) throws Exception {
        return mockMvc.perform(post("/api/applications/apply")
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(Map.of("applicant_id", applicantId, "applicant_name", name))));
    }

    private ResultActions message(String applicantId, String text) throws Exception {
        return mockMvc.perform(post("/api/interviews/messages")
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(Map.of("applicant_id", applicantId, "text", text))));
    }

    private ResultActions review(String id, String action, Map<String, Object> body) throws Exception {
        return review(id, action, body, "/review");
    }

    private ResultActions review(String id, String action, Map<String, Object> body, String prefix) throws Exception {
        return mockMvc.perform(post("/api/applications/{id}" + prefix + "/" + action, id)
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(body)));
    }

    private static Map<String, Object> reviewer(String id, String name) {
        return Map.of("actor_id", id, "actor_name", name, "role_ids", List.of("reviewer"));
    }

    private String readId(String json) {
        try {
            JsonNode node = objectMapper.readTree(json);
            return node.get("id").asText();
        } catch (Exception ex) {
            throw new IllegalStateException(ex);
        }
    }
}
