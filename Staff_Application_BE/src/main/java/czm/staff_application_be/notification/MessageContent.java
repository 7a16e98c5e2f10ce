package czm.staff_application_be.notification;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

/**
 * Transport-neutral card. The bridge renders it (embed, buttons) for the chat platform.
 */
public record MessageContent(
        @JsonProperty("title") String title,
        @JsonProperty("description") String description,
        @JsonProperty("fields") List<Field> fields,
        @JsonProperty("footer") String footer,
        @JsonProperty("accent") Accent accent,
        @JsonProperty("actions") List<Action> actions) {

    public enum Accent { NEUTRAL, INFO, PENDING, SUCCESS, DANGER }

    public record Field(@JsonProperty("name") String name,
                        @JsonProperty("value") String value,
                        @JsonProperty("inline") boolean inline) {}

    /**
     * Button on a card. {@code id} is echoed back by the bridge when the button is clicked.
     */
    public record Action(@JsonProperty("id") String id,
                         @JsonProperty("label") String label,
                         @JsonProperty("enabled") boolean enabled) {}

    public MessageContent {
        fields = fields != null ? List.copyOf(fields) : List.of();
        actions = actions != null ? List.copyOf(actions) : List.of();
    }

    public static Builder builder(String title) {
        return new Builder(title);
    }

    public Field field(String name) {
        return fields.stream().filter(f -> f.name().equals(name)).findFirst().orElse(null);
    }

    public static final class Builder {
        private final String title;
        private String description;
        private final List<Field> fields = new ArrayList<>();
        private String footer;
        private Accent accent = Accent.NEUTRAL;
        private final List<Action> actions = new ArrayList<>();

        private Builder(String title) {
            this.title = title;
        }

        public Builder description(String description) { this.description = description; return this; }
        public Builder field(String name, String value, boolean inline) { fields.add(new Field(name, value, inline)); return this; }
        public Builder footer(String footer) { this.footer = footer; return this; }
        public Builder accent(Accent accent) { this.accent = accent; return this; }
        public Builder action(String id, String label, boolean enabled) { actions.add(new Action(id, label, enabled)); return this; }

        public MessageContent build() {
            return new MessageContent(title, description, fields, footer, accent, actions);
        }
    }
}
