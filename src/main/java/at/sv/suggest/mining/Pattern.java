package at.sv.suggest.mining;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.util.List;

/**
 * A recurring usage pattern found in the state history.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = DailyPattern.class, name = "daily"),
        @JsonSubTypes.Type(value = SequencePattern.class, name = "sequence"),
        @JsonSubTypes.Type(value = ConditionalPattern.class, name = "conditional"),
        @JsonSubTypes.Type(value = PeriodicPattern.class, name = "periodic")
})
public interface Pattern {

    PatternType type();

    /**
     * @return a heuristic score in [0, 1] of how consistently the pattern held
     */
    double confidence();

    /**
     * @return the number of observations supporting the pattern, at least 1
     */
    int occurrences();

    /**
     * @return the ids of all entities involved, the controlled entity first
     */
    List<String> entityIds();

    static void assertCommonFields(double confidence, int occurrences) {
        if (Double.isNaN(confidence) || confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("Confidence " + confidence + " outside of [0, 1]");
        }
        if (occurrences < 1) {
            throw new IllegalArgumentException("At least one occurrence required, got " + occurrences);
        }
    }
}
