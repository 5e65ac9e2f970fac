package at.sv.suggest.mining;

import java.util.List;

/**
 * An entity that enters a state in regular intervals.
 *
 * @param intervalHours the interval in hours, in [1, 24] and a multiple of 0.5
 */
public record PeriodicPattern(String entityId, String domain, String state, double intervalHours,
                              double confidence, int occurrences) implements Pattern {

    public static final double MIN_INTERVAL_HOURS = 1.0;
    public static final double MAX_INTERVAL_HOURS = 24.0;

    public PeriodicPattern {
        Pattern.assertCommonFields(confidence, occurrences);
        if (intervalHours < MIN_INTERVAL_HOURS || intervalHours > MAX_INTERVAL_HOURS) {
            throw new IllegalArgumentException("Interval " + intervalHours + "h outside of [1, 24]");
        }
        if (intervalHours * 2 != Math.rint(intervalHours * 2)) {
            throw new IllegalArgumentException("Interval " + intervalHours + "h is no multiple of half an hour");
        }
    }

    @Override
    public PatternType type() {
        return PatternType.PERIODIC;
    }

    @Override
    public List<String> entityIds() {
        return List.of(entityId);
    }
}
