package at.sv.suggest.mining;

import java.time.DayOfWeek;
import java.util.List;

/**
 * An entity that is in the same state at the same weekday and hour.
 *
 * @param dayOfWeek zero based weekday, 0 = Monday
 */
public record DailyPattern(String entityId, String domain, int dayOfWeek, int hour, String state,
                           double confidence, int occurrences) implements Pattern {

    public DailyPattern {
        Pattern.assertCommonFields(confidence, occurrences);
        if (dayOfWeek < 0 || dayOfWeek > 6) {
            throw new IllegalArgumentException("Day of week " + dayOfWeek + " outside of [0, 6]");
        }
        if (hour < 0 || hour > 23) {
            throw new IllegalArgumentException("Hour " + hour + " outside of [0, 23]");
        }
    }

    @Override
    public PatternType type() {
        return PatternType.DAILY;
    }

    @Override
    public List<String> entityIds() {
        return List.of(entityId);
    }

    public DayOfWeek weekday() {
        return DayOfWeek.of(dayOfWeek + 1);
    }
}
