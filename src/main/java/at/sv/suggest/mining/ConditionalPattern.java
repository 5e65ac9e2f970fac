package at.sv.suggest.mining;

import java.util.List;

/**
 * An entity that follows the state change of another entity.
 */
public record ConditionalPattern(String entityId, String domain, String conditionEntity, String conditionState,
                                 String targetState, double confidence, int occurrences) implements Pattern {

    public ConditionalPattern {
        Pattern.assertCommonFields(confidence, occurrences);
        if (entityId.equals(conditionEntity)) {
            throw new IllegalArgumentException("Entity '" + entityId + "' can't be its own condition");
        }
    }

    @Override
    public PatternType type() {
        return PatternType.CONDITIONAL;
    }

    @Override
    public List<String> entityIds() {
        return List.of(entityId, conditionEntity);
    }
}
