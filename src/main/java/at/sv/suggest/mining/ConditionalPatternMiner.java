package at.sv.suggest.mining;

import at.sv.suggest.DiscoveryConfig;
import at.sv.suggest.history.EntityHistory;
import at.sv.suggest.history.EntityIds;
import at.sv.suggest.history.StateEvent;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Finds controllable entities whose state changes follow the state changes of a sensor-like entity. A target change
 * counts for a condition change if it happens at the same time or up to the condition window after it, both bounds
 * inclusive.
 */
public final class ConditionalPatternMiner implements PatternMiner {

    private final int minOccurrences;
    private final double confidenceThreshold;
    private final Duration window;

    public ConditionalPatternMiner(DiscoveryConfig config) {
        minOccurrences = config.getMinOccurrences();
        confidenceThreshold = config.getConfidenceThreshold();
        window = config.getConditionWindow();
    }

    @Override
    public PatternType getType() {
        return PatternType.CONDITIONAL;
    }

    @Override
    public List<Pattern> mine(Map<String, EntityHistory> histories) {
        List<EntityHistory> conditions = histories.values().stream()
                                                  .filter(history -> EntityIds.isConditionCandidate(history.entityId()))
                                                  .filter(history -> history.hasAtLeast(minOccurrences))
                                                  .toList();
        List<Pattern> patterns = new ArrayList<>();
        for (EntityHistory target : histories.values()) {
            if (!EntityIds.isControllable(target.entityId()) || !target.hasAtLeast(minOccurrences)) {
                continue;
            }
            for (EntityHistory condition : conditions) {
                if (condition.entityId().equals(target.entityId())) {
                    continue;
                }
                correlate(condition, target).forEach((conditionState, tally) -> {
                    if (tally.total() < minOccurrences) {
                        return;
                    }
                    StateTally.Majority majority = tally.majority();
                    if (majority.confidence() >= confidenceThreshold) {
                        patterns.add(new ConditionalPattern(target.entityId(), target.domain(), condition.entityId(),
                                conditionState, majority.state(), majority.confidence(), majority.count()));
                    }
                });
            }
        }
        return patterns;
    }

    private Map<String, StateTally> correlate(EntityHistory condition, EntityHistory target) {
        Map<String, StateTally> correlations = new LinkedHashMap<>();
        for (StateEvent conditionEvent : condition.events()) {
            for (StateEvent targetEvent : target.events()) {
                Duration delay = Duration.between(conditionEvent.timestamp(), targetEvent.timestamp());
                if (delay.compareTo(window) > 0) {
                    break; // target events are ordered
                }
                if (!delay.isNegative()) {
                    correlations.computeIfAbsent(conditionEvent.state(), state -> new StateTally())
                                .add(targetEvent.state());
                }
            }
        }
        return correlations;
    }
}
