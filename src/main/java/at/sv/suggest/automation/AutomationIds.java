package at.sv.suggest.automation;

import at.sv.suggest.FormatUtil;
import at.sv.suggest.history.EntityIds;
import at.sv.suggest.mining.ConditionalPattern;
import at.sv.suggest.mining.DailyPattern;
import at.sv.suggest.mining.Pattern;
import at.sv.suggest.mining.PeriodicPattern;
import at.sv.suggest.mining.SequencePattern;

import java.time.Clock;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.stream.Collectors;

/**
 * Creates automation ids. Deterministic ids are derived from the pattern only, so the same history always yields
 * the same ids. Timestamped ids add the creation time and differ between runs.
 */
public final class AutomationIds {

    private static final DateTimeFormatter TIMESTAMP_FORMAT = DateTimeFormatter.ofPattern("yyyyMMddHHmmss");

    private final Clock clock;
    private final boolean timestamped;

    public AutomationIds(Clock clock, boolean timestamped) {
        this.clock = clock;
        this.timestamped = timestamped;
    }

    public String createId(Pattern pattern) {
        String entity = EntityIds.sanitize(pattern.entityIds().get(0));
        String discriminator = getDiscriminator(pattern);
        if (timestamped) {
            return "auto_" + pattern.type().getCategory() + "_" + entity + "_" +
                   ZonedDateTime.now(clock).format(TIMESTAMP_FORMAT) + "_" + discriminator;
        }
        return getPrefix(pattern) + "_" + entity + "_" + discriminator;
    }

    private static String getPrefix(Pattern pattern) {
        if (pattern instanceof ConditionalPattern) {
            return "condition";
        }
        return pattern.type().getCategory();
    }

    /**
     * The pattern fields that tell apart patterns of the same type for the same entity.
     */
    private static String getDiscriminator(Pattern pattern) {
        if (pattern instanceof DailyPattern daily) {
            return daily.dayOfWeek() + "_" + daily.hour();
        } else if (pattern instanceof SequencePattern sequence) {
            return sequence.steps().size() + "_" + getShapeHash(sequence);
        } else if (pattern instanceof ConditionalPattern conditional) {
            return EntityIds.sanitize(conditional.conditionEntity());
        } else if (pattern instanceof PeriodicPattern periodic) {
            return FormatUtil.formatHours(periodic.intervalHours()).replace('.', '_');
        }
        throw new IllegalArgumentException("Unsupported pattern " + pattern);
    }

    /**
     * Distinguishes sequences with the same first entity and length.
     */
    private static String getShapeHash(SequencePattern sequence) {
        String shape = sequence.steps().stream()
                               .map(step -> step.entityId() + "=" + step.state())
                               .collect(Collectors.joining(","));
        return Integer.toHexString(shape.hashCode());
    }
}
