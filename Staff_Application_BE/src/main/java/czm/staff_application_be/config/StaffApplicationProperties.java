package czm.staff_application_be.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

@Validated
@ConfigurationProperties(prefix = "staff-application")
public class StaffApplicationProperties {
    /** Interview questions in the order they are asked. */
    @NotEmpty
    private List<String> questions = new ArrayList<>();
    /** Minimum gap between two apply commands of one applicant. */
    @Min(0)
    private long cooldownSeconds = 300;
    /** Conversation id of the staff channel receiving review cards. */
    private String staffChannelId;
    /** Role required to pick, score and decide; blank lets every actor review. */
    private String reviewerRoleId;
    /** Allowed score scales. */
    @NotEmpty
    private List<Integer> scoreScales = new ArrayList<>(List.of(5, 10, 50, 100));
    /** Max characters of the transcript shown on the review card. */
    @Min(1)
    private int transcriptPreviewLength = 1000;
    /** Max characters of a transcript sent as a direct message. */
    @Min(1)
    private int transcriptMaxLength = 1900;
    @Valid
    private Templates templates = new Templates();

    public static class Templates {
        private String approved = "Congrats! Your application (ID {id}) has been approved. Reviewer: {reviewer}. Score: {score}/{scale}. Reason: {reason}";
        private String denied = "We're sorry, your application (ID {id}) has been denied. Reviewer: {reviewer}. Score: {score}/{scale}. Reason: {reason}";

        public String getApproved() { return approved; }
        public void setApproved(String approved) { this.approved = approved; }
        public String getDenied() { return denied; }
        public void setDenied(String denied) { this.denied = denied; }
    }

    public List<String> getQuestions() { return questions; }
    public void setQuestions(List<String> questions) { this.questions = questions; }
    public long getCooldownSeconds() { return cooldownSeconds; }
    public void setCooldownSeconds(long cooldownSeconds) { this.cooldownSeconds = cooldownSeconds; }
    public String getStaffChannelId() { return staffChannelId; }
    public void setStaffChannelId(String staffChannelId) { this.staffChannelId = staffChannelId; }
    public String getReviewerRoleId() { return reviewerRoleId; }
    public void setReviewerRoleId(String reviewerRoleId) { this.reviewerRoleId = reviewerRoleId; }
    public List<Integer> getScoreScales() { return scoreScales; }
    public void setScoreScales(List<Integer> scoreScales) { this.scoreScales = scoreScales; }
    public int getTranscriptPreviewLength() { return transcriptPreviewLength; }
    public void setTranscriptPreviewLength(int transcriptPreviewLength) { this.transcriptPreviewLength = transcriptPreviewLength; }
    public int getTranscriptMaxLength() { return transcriptMaxLength; }
    public void setTranscriptMaxLength(int transcriptMaxLength) { this.transcriptMaxLength = transcriptMaxLength; }
    public Templates getTemplates() { return templates; }
    public void setTemplates(Templates templates) { this.templates = templates; }
}
