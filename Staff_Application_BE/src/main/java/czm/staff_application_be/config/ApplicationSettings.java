package czm.staff_application_be.config;

import java.time.Duration;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Configuration snapshot taken once at startup. Components receive it through their constructors
 * and never re-read configuration, so a running interview always sees the same question list.
 */
public record ApplicationSettings(List<String> questions,
                                  Duration cooldown,
                                  String staffChannelId,
                                  String reviewerRoleId,
                                  SortedSet<Integer> scoreScales,
                                  String approvedTemplate,
                                  String deniedTemplate,
                                  int transcriptPreviewLength,
                                  int transcriptMaxLength) {

    public ApplicationSettings {
        Objects.requireNonNull(questions, "questions");
        if (questions.isEmpty()) {
            throw new IllegalArgumentException("At least one question must be configured");
        }
        questions = List.copyOf(questions);
        scoreScales = Collections.unmodifiableSortedSet(new TreeSet<>(scoreScales));
        staffChannelId = blankToNull(staffChannelId);
        reviewerRoleId = blankToNull(reviewerRoleId);
    }

    public static ApplicationSettings from(StaffApplicationProperties props) {
        return new ApplicationSettings(
                props.getQuestions(),
                Duration.ofSeconds(props.getCooldownSeconds()),
                props.getStaffChannelId(),
                props.getReviewerRoleId(),
                new TreeSet<>(props.getScoreScales()),
                props.getTemplates().getApproved(),
                props.getTemplates().getDenied(),
                props.getTranscriptPreviewLength(),
                props.getTranscriptMaxLength());
    }

    public int questionCount() {
        return questions.size();
    }

    public String question(int index) {
        return questions.get(index);
    }

    private static String blankToNull(String value) {
        if (value == null) return null;
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
