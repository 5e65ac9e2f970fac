package at.sv.suggest.automation;

import at.sv.suggest.history.EntityIds;
import at.sv.suggest.mining.ConditionalPattern;
import at.sv.suggest.mining.DailyPattern;
import at.sv.suggest.mining.Pattern;
import at.sv.suggest.mining.SequencePattern;
import at.sv.suggest.mining.SequenceStep;
import lombok.extern.slf4j.Slf4j;

import java.time.LocalTime;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Creates automations from explicit user input instead of mined history. The input is expressed as pattern with full
 * confidence, so the automations look the same as the suggested ones.
 */
@Slf4j
public final class AutomationTemplates {

    private final AutomationSynthesizer synthesizer;

    public AutomationTemplates(AutomationSynthesizer synthesizer) {
        this.synthesizer = synthesizer;
    }

    public List<AutomationDocument> create(TemplateType type, List<String> entities, TemplateOptions options) {
        if (entities == null || entities.isEmpty()) {
            throw new InvalidTemplateException("At least one entity is required for a " + type + " template.");
        }
        List<Pattern> patterns = createPatterns(type, entities, options);
        log.debug("Create {} automation(s) from {} template.", patterns.size(), type);
        return patterns.stream().map(synthesizer::synthesize).collect(Collectors.toList());
    }

    private static List<Pattern> createPatterns(TemplateType type, List<String> entities, TemplateOptions options) {
        switch (type) {
            case TIME:
                int hour = parseFullHour(options.getTime());
                int dayOfWeek = parseWeekday(options.getWeekday());
                return entities.stream()
                               .map(entityId -> (Pattern) new DailyPattern(entityId, EntityIds.getDomain(entityId),
                                       dayOfWeek, hour, options.getState(), 1.0, 1))
                               .collect(Collectors.toList());
            case STATE:
                assertStateTemplateOptions(entities, options);
                return entities.stream()
                               .map(entityId -> (Pattern) new ConditionalPattern(entityId, EntityIds.getDomain(entityId),
                                       options.getTriggerEntity(), options.getTriggerState(), options.getActionState(),
                                       1.0, 1))
                               .collect(Collectors.toList());
            case SEQUENCE:
                if (entities.size() < SequencePattern.MIN_STEPS) {
                    throw new InvalidTemplateException("A sequence template needs at least " + SequencePattern.MIN_STEPS +
                                                       " entities, got " + entities.size() + ".");
                }
                List<SequenceStep> steps = entities.stream()
                                                   .map(entityId -> SequenceStep.of(entityId, options.getState()))
                                                   .collect(Collectors.toList());
                return List.of(new SequencePattern(steps, 1.0, 1));
            default:
                throw new InvalidTemplateException("Unsupported template type " + type);
        }
    }

    private static int parseFullHour(String time) {
        if (time == null) {
            throw new InvalidTemplateException("A time template needs a time, e.g. '08:00'.");
        }
        LocalTime localTime;
        try {
            localTime = LocalTime.parse(time.trim());
        } catch (DateTimeParseException e) {
            throw new InvalidTemplateException("Invalid time '" + time + "'. Expected format: HH:mm or HH:mm:ss");
        }
        if (localTime.getMinute() != 0 || localTime.getSecond() != 0 || localTime.getNano() != 0) {
            throw new InvalidTemplateException("Invalid time '" + time + "'. Only full hours are supported.");
        }
        return localTime.getHour();
    }

    private static int parseWeekday(String weekday) {
        if (weekday == null) {
            throw new InvalidTemplateException("A time template needs a weekday, e.g. 'Mo'.");
        }
        return DayOfWeekParser.parseDay(weekday).getValue() - 1;
    }

    private static void assertStateTemplateOptions(List<String> entities, TemplateOptions options) {
        if (isBlank(options.getTriggerEntity()) || isBlank(options.getTriggerState())) {
            throw new InvalidTemplateException("Trigger entity and state are required for a state template.");
        }
        if (entities.contains(options.getTriggerEntity())) {
            throw new InvalidTemplateException("Entity '" + options.getTriggerEntity() + "' can't trigger itself.");
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
