package at.sv.suggest.mining;

import at.sv.suggest.DiscoveryConfig;
import at.sv.suggest.history.EntityHistory;
import at.sv.suggest.history.StateEvent;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Finds groups of entities that change their state in the same order within a short window. Every event on the
 * global timeline seeds a candidate made of the following events of other entities inside the window. Each distinct
 * candidate shape is only evaluated once.
 */
public final class SequencePatternMiner implements PatternMiner {

    /**
     * Number of occurrences at which a sequence reaches full confidence.
     */
    static final double FULL_CONFIDENCE_OCCURRENCES = 10.0;

    private final int minOccurrences;
    private final Duration window;

    public SequencePatternMiner(DiscoveryConfig config) {
        minOccurrences = config.getMinOccurrences();
        window = config.getSequenceWindow();
    }

    @Override
    public PatternType getType() {
        return PatternType.SEQUENCE;
    }

    @Override
    public List<Pattern> mine(Map<String, EntityHistory> histories) {
        List<StateEvent> timeline = createTimeline(histories);
        Set<List<SequenceStep>> seenShapes = new HashSet<>();
        List<Pattern> patterns = new ArrayList<>();
        for (int i = 0; i < timeline.size(); i++) {
            List<SequenceStep> steps = collectCandidate(timeline, i);
            if (steps.size() < SequencePattern.MIN_STEPS || !seenShapes.add(steps)) {
                continue;
            }
            int occurrences = countOccurrences(timeline, steps);
            if (occurrences >= minOccurrences) {
                double confidence = Math.min(1.0, occurrences / FULL_CONFIDENCE_OCCURRENCES);
                patterns.add(new SequencePattern(steps, confidence, occurrences));
            }
        }
        return patterns;
    }

    private static List<StateEvent> createTimeline(Map<String, EntityHistory> histories) {
        List<StateEvent> timeline = new ArrayList<>();
        histories.values().forEach(history -> timeline.addAll(history.events()));
        timeline.sort(Comparator.comparing(event -> event.timestamp().toInstant())); // stable
        return timeline;
    }

    private List<SequenceStep> collectCandidate(List<StateEvent> timeline, int seedIndex) {
        StateEvent seed = timeline.get(seedIndex);
        List<SequenceStep> steps = new ArrayList<>();
        steps.add(SequenceStep.of(seed));
        for (int j = seedIndex + 1; j < timeline.size(); j++) {
            StateEvent event = timeline.get(j);
            if (isOutsideWindow(seed, event)) {
                break;
            }
            if (!event.entityId().equals(seed.entityId())) {
                steps.add(SequenceStep.of(event));
            }
        }
        return steps;
    }

    /**
     * Counts the timeline positions starting the given steps, where every further step has to follow the previous
     * one in order and within the window of the first step.
     */
    int countOccurrences(List<StateEvent> timeline, List<SequenceStep> steps) {
        int count = 0;
        for (int start = 0; start < timeline.size(); start++) {
            if (steps.get(0).matches(timeline.get(start)) && matchesFrom(timeline, start, steps)) {
                count++;
            }
        }
        return count;
    }

    private boolean matchesFrom(List<StateEvent> timeline, int start, List<SequenceStep> steps) {
        StateEvent first = timeline.get(start);
        int position = start + 1;
        for (int s = 1; s < steps.size(); s++) {
            int match = findStep(timeline, first, position, steps.get(s));
            if (match == -1) {
                return false;
            }
            position = match + 1;
        }
        return true;
    }

    private int findStep(List<StateEvent> timeline, StateEvent first, int from, SequenceStep step) {
        for (int k = from; k < timeline.size(); k++) {
            StateEvent event = timeline.get(k);
            if (isOutsideWindow(first, event)) {
                return -1;
            }
            if (step.matches(event)) {
                return k;
            }
        }
        return -1;
    }

    private boolean isOutsideWindow(StateEvent first, StateEvent event) {
        return Duration.between(first.timestamp(), event.timestamp()).compareTo(window) > 0;
    }
}
