package at.sv.suggest.mining;

import at.sv.suggest.DiscoveryConfig;
import at.sv.suggest.history.EntityHistory;
import at.sv.suggest.history.StateEvent;

import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Finds entities that are in the same state at the same weekday and hour.
 */
public final class DailyPatternMiner implements PatternMiner {

    private final int minOccurrences;
    private final double confidenceThreshold;

    public DailyPatternMiner(DiscoveryConfig config) {
        minOccurrences = config.getMinOccurrences();
        confidenceThreshold = config.getConfidenceThreshold();
    }

    @Override
    public PatternType getType() {
        return PatternType.DAILY;
    }

    @Override
    public List<Pattern> mine(Map<String, EntityHistory> histories) {
        List<Pattern> patterns = new ArrayList<>();
        for (EntityHistory history : histories.values()) {
            if (!history.hasAtLeast(minOccurrences)) {
                continue;
            }
            groupByDayAndHour(history).forEach((bucket, tally) -> {
                if (tally.total() < minOccurrences) {
                    return;
                }
                StateTally.Majority majority = tally.majority();
                if (majority.confidence() >= confidenceThreshold) {
                    patterns.add(new DailyPattern(history.entityId(), history.domain(), bucket.dayOfWeek(),
                            bucket.hour(), majority.state(), majority.confidence(), majority.count()));
                }
            });
        }
        return patterns;
    }

    private static Map<DayHour, StateTally> groupByDayAndHour(EntityHistory history) {
        Map<DayHour, StateTally> buckets = new LinkedHashMap<>();
        for (StateEvent event : history.events()) {
            buckets.computeIfAbsent(DayHour.of(event.timestamp()), bucket -> new StateTally()).add(event.state());
        }
        return buckets;
    }

    private record DayHour(int dayOfWeek, int hour) {
        static DayHour of(ZonedDateTime timestamp) {
            return new DayHour(timestamp.getDayOfWeek().getValue() - 1, timestamp.getHour());
        }
    }
}
