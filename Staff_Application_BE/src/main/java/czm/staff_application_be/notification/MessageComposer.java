package czm.staff_application_be.notification;

import czm.staff_application_be.application.ApplicationDao.AnswerRow;
import czm.staff_application_be.application.ApplicationDao.ApplicationRow;
import czm.staff_application_be.application.ApplicationStatus;
import czm.staff_application_be.application.Decision;
import czm.staff_application_be.config.ApplicationSettings;
import czm.staff_application_be.notification.MessageContent.Accent;
import org.springframework.stereotype.Component;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Builds the cards sent to applicants and to the staff channel.
 */
@Component
public class MessageComposer {
    private static final Pattern PLACEHOLDER = Pattern.compile("\\{(id|reviewer|score|scale|reason)}");
    private static final DateTimeFormatter TIMESTAMP_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm 'UTC'");

    public static final String ACTION_PICK = "pick";
    public static final String ACTION_SCORE = "score";
    public static final String ACTION_APPROVE = "approve";
    public static final String ACTION_DENY = "deny";
    public static final String ACTION_VIEW = "view";

    private final ApplicationSettings settings;

    public MessageComposer(ApplicationSettings settings) {
        this.settings = settings;
    }

    public MessageContent questionPrompt(ApplicationRow application, int index) {
        MessageContent.Builder builder = MessageContent.builder(
                        "Question " + (index + 1) + " of " + settings.questionCount())
                .description(settings.question(index))
                .footer("Application " + application.id())
                .accent(Accent.INFO);
        if (index == 0) {
            builder.field("Staff Application", "Answer the questions below. Reply to each message with your answer; it is saved automatically.", false)
                    .field("Application ID", application.id(), false);
        }
        return builder.build();
    }

    public MessageContent submissionSummary(ApplicationRow application) {
        return MessageContent.builder("Application Submitted")
                .description("Thank you, your application has been submitted and will be reviewed by staff.")
                .field("Application ID", application.id(), false)
                .footer("Keep this ID to check your application later.")
                .accent(Accent.SUCCESS)
                .build();
    }

    /**
     * Staff-facing card reflecting the application's current status and the actions it allows.
     */
    public MessageContent reviewCard(ApplicationRow application, List<AnswerRow> answers) {
        String id = application.id();
        ApplicationStatus status = application.status();
        if (status.isTerminal()) {
            boolean approved = status == ApplicationStatus.APPROVED;
            return MessageContent.builder("Staff Application (Final)")
                    .field("Applicant", application.applicantLabel(), false)
                    .field("Application ID", id, true)
                    .field("Status", application.decision().label(), true)
                    .field("Score", scoreLabel(application), true)
                    .field("Reviewer", application.reviewerLabel(), true)
                    .field("Reason", application.reason(), false)
                    .footer("Application " + id)
                    .accent(approved ? Accent.SUCCESS : Accent.DANGER)
                    .action(actionId(ACTION_VIEW, id), "View Transcript", true)
                    .build();
        }

        MessageContent.Builder builder = MessageContent.builder(
                        status == ApplicationStatus.SUBMITTED ? "New Staff Application" : "Staff Application")
                .field("Applicant", application.applicantLabel(), false)
                .field("Application ID", id, true)
                .field("Started", formatTimestamp(application.createdAt()), true);
        if (application.score() != null) {
            builder.field("Score", scoreLabel(application), true);
        }
        builder.field("Transcript Preview", truncate(transcriptText(answers), settings.transcriptPreviewLength()), false)
                .footer("Application " + id)
                .accent(Accent.PENDING);

        if (application.reviewerId() == null) {
            builder.action(actionId(ACTION_PICK, id), "Pick", true);
        } else {
            builder.action(actionId(ACTION_PICK, id), "Picked by " + application.reviewerLabel(), false)
                    .action(actionId(ACTION_SCORE, id), "Score", status == ApplicationStatus.CLAIMED)
                    .action(actionId(ACTION_APPROVE, id), "Approve", status == ApplicationStatus.SCORED)
                    .action(actionId(ACTION_DENY, id), "Deny", status == ApplicationStatus.SCORED);
        }
        return builder.action(actionId(ACTION_VIEW, id), "View Transcript", true).build();
    }

    public MessageContent result(ApplicationRow application) {
        Decision decision = application.decision();
        String template = decision == Decision.APPROVED ? settings.approvedTemplate() : settings.deniedTemplate();
        return MessageContent.builder("Application Result")
                .description(render(template, placeholders(application)))
                .field("Application ID", application.id(), false)
                .field("Result", decision.label(), true)
                .field("Score", scoreLabel(application), true)
                .field("Reviewer", application.reviewerLabel(), true)
                .field("Reason", application.reason(), false)
                .footer("Thank you for applying")
                .accent(decision == Decision.APPROVED ? Accent.SUCCESS : Accent.DANGER)
                .build();
    }

    public MessageContent transcript(ApplicationRow application, List<AnswerRow> answers) {
        return MessageContent.builder("Transcript " + application.id())
                .description(codeBlock(truncate(transcriptText(answers), settings.transcriptMaxLength())))
                .accent(Accent.NEUTRAL)
                .build();
    }

    /**
     * Status overview sent by the confirm-results command.
     */
    public MessageContent resultsOverview(ApplicationRow application, List<AnswerRow> answers) {
        return MessageContent.builder("Application " + application.id())
                .field("Applicant", application.applicantLabel(), false)
                .field("Started", formatTimestamp(application.createdAt()), true)
                .field("Finished", formatTimestamp(application.submittedAt()), true)
                .field("Status", application.status().name(), true)
                .field("Score", application.score() != null ? scoreLabel(application) : "Not scored", true)
                .field("Decision", application.decision() != null ? application.decision().label() : "Pending", true)
                .field("Reason", application.reason() != null ? application.reason() : "N/A", false)
                .field("Transcript", codeBlock(truncate(transcriptText(answers), settings.transcriptMaxLength())), false)
                .accent(Accent.INFO)
                .build();
    }

    public static String actionId(String action, String applicationId) {
        return action + ":" + applicationId;
    }

    /**
     * Replaces {@code {id} {reviewer} {score} {scale} {reason}}; unknown placeholders stay as written.
     */
    public static String render(String template, Map<String, String> values) {
        if (template == null) {
            return "";
        }
        Matcher matcher = PLACEHOLDER.matcher(template);
        StringBuilder out = new StringBuilder();
        while (matcher.find()) {
            String value = values.get(matcher.group(1));
            matcher.appendReplacement(out, Matcher.quoteReplacement(value != null ? value : matcher.group()));
        }
        matcher.appendTail(out);
        return out.toString();
    }

    static Map<String, String> placeholders(ApplicationRow application) {
        Map<String, String> values = new LinkedHashMap<>();
        values.put("id", application.id());
        values.put("reviewer", application.reviewerLabel());
        values.put("score", application.score() != null ? String.valueOf(application.score()) : "N/A");
        values.put("scale", application.scale() != null ? String.valueOf(application.scale()) : "N/A");
        values.put("reason", application.reason() != null ? application.reason() : "");
        return values;
    }

    static String transcriptText(List<AnswerRow> answers) {
        if (answers.isEmpty()) {
            return "No transcript saved";
        }
        StringBuilder sb = new StringBuilder();
        for (AnswerRow answer : answers) {
            if (!sb.isEmpty()) {
                sb.append('\n');
            }
            sb.append("Q: ").append(answer.question()).append('\n')
                    .append("A: ").append(answer.answer()).append('\n');
        }
        return sb.toString();
    }

    private static String scoreLabel(ApplicationRow application) {
        return application.score() != null ? application.score() + "/" + application.scale() : "N/A";
    }

    private static String formatTimestamp(OffsetDateTime value) {
        return value != null ? TIMESTAMP_FORMAT.format(value.withOffsetSameInstant(ZoneOffset.UTC)) : "N/A";
    }

    private static String codeBlock(String text) {
        return "```\n" + text + "\n```";
    }

    private static String truncate(String s, int max) {
        return s.length() <= max ? s : s.substring(0, max) + "...";
    }
}
