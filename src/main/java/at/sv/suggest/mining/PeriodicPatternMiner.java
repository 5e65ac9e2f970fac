package at.sv.suggest.mining;

import at.sv.suggest.DiscoveryConfig;
import at.sv.suggest.history.EntityHistory;
import at.sv.suggest.history.EntityIds;
import at.sv.suggest.history.StateEvent;

import java.time.Duration;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Finds controllable entities that enter a state in regular intervals. The intervals between consecutive
 * occurrences of a state are accepted as regular, if their standard deviation stays below 30% of their mean.
 */
public final class PeriodicPatternMiner implements PatternMiner {

    static final double MAX_RELATIVE_DEVIATION = 0.3;
    private static final double NANOS_PER_HOUR = Duration.ofHours(1).toNanos();

    private final int minOccurrences;

    public PeriodicPatternMiner(DiscoveryConfig config) {
        minOccurrences = config.getMinOccurrences();
    }

    @Override
    public PatternType getType() {
        return PatternType.PERIODIC;
    }

    @Override
    public List<Pattern> mine(Map<String, EntityHistory> histories) {
        int requiredSamples = minOccurrences * 2;
        List<Pattern> patterns = new ArrayList<>();
        for (EntityHistory history : histories.values()) {
            if (!EntityIds.isControllable(history.entityId()) || !history.hasAtLeast(requiredSamples)) {
                continue;
            }
            groupTimestampsByState(history).forEach((state, timestamps) -> {
                if (timestamps.size() < requiredSamples) {
                    return;
                }
                IntervalStats stats = IntervalStats.of(timestamps);
                if (stats.mean() <= 0.0 || stats.stdDev() >= stats.mean() * MAX_RELATIVE_DEVIATION) {
                    return;
                }
                double roundedInterval = roundToHalfHour(stats.mean());
                if (roundedInterval >= PeriodicPattern.MIN_INTERVAL_HOURS && roundedInterval <= PeriodicPattern.MAX_INTERVAL_HOURS) {
                    patterns.add(new PeriodicPattern(history.entityId(), history.domain(), state, roundedInterval,
                            1.0 - stats.stdDev() / stats.mean(), timestamps.size()));
                }
            });
        }
        return patterns;
    }

    private static Map<String, List<ZonedDateTime>> groupTimestampsByState(EntityHistory history) {
        Map<String, List<ZonedDateTime>> timestampsByState = new LinkedHashMap<>();
        for (StateEvent event : history.events()) {
            timestampsByState.computeIfAbsent(event.state(), state -> new ArrayList<>()).add(event.timestamp());
        }
        return timestampsByState;
    }

    /**
     * Rounds to the nearest half hour, exact quarters are rounded to the even half.
     */
    static double roundToHalfHour(double hours) {
        return Math.rint(hours * 2) / 2;
    }

    record IntervalStats(double mean, double stdDev) {

        /**
         * Computes mean and population standard deviation in hours of the intervals between the given timestamps.
         * Needs at least two timestamps.
         */
        static IntervalStats of(List<ZonedDateTime> timestamps) {
            List<ZonedDateTime> sorted = new ArrayList<>(timestamps);
            sorted.sort(Comparator.comparing(ZonedDateTime::toInstant));
            double[] intervals = new double[sorted.size() - 1];
            for (int i = 1; i < sorted.size(); i++) {
                intervals[i - 1] = Duration.between(sorted.get(i - 1), sorted.get(i)).toNanos() / NANOS_PER_HOUR;
            }
            double sum = 0.0;
            for (double interval : intervals) {
                sum += interval;
            }
            double mean = sum / intervals.length;
            double squaredDeviations = 0.0;
            for (double interval : intervals) {
                squaredDeviations += (interval - mean) * (interval - mean);
            }
            return new IntervalStats(mean, Math.sqrt(squaredDeviations / intervals.length));
        }
    }
}
