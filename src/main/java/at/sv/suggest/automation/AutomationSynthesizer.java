package at.sv.suggest.automation;

import at.sv.suggest.DiscoveryConfig;
import at.sv.suggest.FormatUtil;
import at.sv.suggest.mining.ConditionalPattern;
import at.sv.suggest.mining.DailyPattern;
import at.sv.suggest.mining.Pattern;
import at.sv.suggest.mining.PeriodicPattern;
import at.sv.suggest.mining.SequencePattern;
import at.sv.suggest.mining.SequenceStep;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Turns a mined pattern into an automation reproducing it.
 */
public final class AutomationSynthesizer {

    static final String PLACEHOLDER_TRIGGER_NOTE =
            "Note: This automation uses a placeholder MQTT button trigger. You should customize this.";

    private final AutomationIds ids;
    private final AutomationYaml yaml;

    public AutomationSynthesizer(DiscoveryConfig config) {
        this(config, Clock.systemDefaultZone());
    }

    public AutomationSynthesizer(DiscoveryConfig config, Clock clock) {
        ids = new AutomationIds(clock, config.isTimestampedIds());
        yaml = new AutomationYaml();
    }

    public AutomationDocument synthesize(Pattern pattern) {
        AutomationDocument.AutomationDocumentBuilder automation = AutomationDocument.builder()
                                                                                   .id(ids.createId(pattern))
                                                                                   .mode(AutomationDocument.MODE_SINGLE)
                                                                                   .condition(new ArrayList<>());
        if (pattern instanceof DailyPattern daily) {
            String day = FormatUtil.formatDayOfWeek(daily.dayOfWeek());
            String time = FormatUtil.formatHour(daily.hour());
            automation.alias("Turn " + daily.state() + " " + daily.entityId() + " on " + day + " at " + time)
                      .description("Automatically turn " + daily.state() + " the " + daily.entityId() + " every " +
                                   day + " at " + time)
                      .trigger(List.of(Trigger.time(String.format(Locale.ROOT, "%02d:00:00", daily.hour()),
                              List.of(daily.dayOfWeek() + 1))))
                      .action(List.of(ActionFactory.createAction(daily.entityId(), daily.domain(), daily.state())));
        } else if (pattern instanceof SequencePattern sequence) {
            List<SequenceStep> steps = sequence.steps();
            automation.alias("Sequence: " + sequence.firstStep().entityId() + " and " + (steps.size() - 1) +
                             " other devices")
                      .description("Automation to control " + steps.size() + " devices in sequence\n" +
                                   PLACEHOLDER_TRIGGER_NOTE)
                      .trigger(List.of(Trigger.placeholderButton()))
                      .action(steps.stream()
                                   .map(step -> ActionFactory.createAction(step.entityId(), step.domain(), step.state()))
                                   .collect(Collectors.toList()));
        } else if (pattern instanceof ConditionalPattern conditional) {
            automation.alias("Control " + conditional.entityId() + " based on " + conditional.conditionEntity())
                      .description("Turn " + conditional.targetState() + " the " + conditional.entityId() + " when " +
                                   conditional.conditionEntity() + " changes to " + conditional.conditionState())
                      .trigger(List.of(Trigger.state(conditional.conditionEntity(), conditional.conditionState())))
                      .action(List.of(ActionFactory.createAction(conditional.entityId(), conditional.domain(),
                              conditional.targetState())));
        } else if (pattern instanceof PeriodicPattern periodic) {
            String interval = FormatUtil.formatHours(periodic.intervalHours());
            automation.alias("Control " + periodic.entityId() + " every " + interval + " hours")
                      .description("Turn " + periodic.state() + " the " + periodic.entityId() + " every " + interval +
                                   " hours")
                      .trigger(List.of(Trigger.timePattern("/" + interval)))
                      .action(List.of(ActionFactory.createAction(periodic.entityId(), periodic.domain(), periodic.state())));
        } else {
            throw new IllegalArgumentException("Unsupported pattern " + pattern);
        }
        return automation.build();
    }

    public String toYaml(AutomationDocument automation) {
        return yaml.write(automation);
    }
}
