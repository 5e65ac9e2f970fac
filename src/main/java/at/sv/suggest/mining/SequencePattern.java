package at.sv.suggest.mining;

import java.util.List;

/**
 * Several entities changing their state in the same order within a short time window.
 */
public record SequencePattern(List<SequenceStep> steps, double confidence, int occurrences) implements Pattern {

    public static final int MIN_STEPS = 3;

    public SequencePattern {
        Pattern.assertCommonFields(confidence, occurrences);
        steps = List.copyOf(steps);
        if (steps.size() < MIN_STEPS) {
            throw new IllegalArgumentException("A sequence needs at least " + MIN_STEPS + " steps, got " + steps.size());
        }
    }

    @Override
    public PatternType type() {
        return PatternType.SEQUENCE;
    }

    @Override
    public List<String> entityIds() {
        return steps.stream().map(SequenceStep::entityId).distinct().toList();
    }

    public SequenceStep firstStep() {
        return steps.get(0);
    }
}
