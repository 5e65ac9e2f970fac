package at.sv.suggest.automation;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public final class TemplateOptions {
    /**
     * Full hour of a time template, {@code HH:mm} or {@code HH:mm:ss}.
     */
    @Builder.Default
    String time = "08:00:00";
    String weekday;
    /**
     * The state to set for time and sequence templates.
     */
    @Builder.Default
    String state = "on";
    String triggerEntity;
    String triggerState;
    /**
     * The state to set for state templates.
     */
    @Builder.Default
    String actionState = "on";
}
