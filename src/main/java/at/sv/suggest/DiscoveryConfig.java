package at.sv.suggest;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.time.Duration;
import java.time.ZoneId;

/**
 * Options for pattern discovery and suggestion ranking. All values are validated on construction, unset values
 * fall back to their defaults.
 */
@Getter
@ToString
@EqualsAndHashCode
public final class DiscoveryConfig {

    public static final int DEFAULT_MIN_OCCURRENCES = 3;
    public static final double DEFAULT_CONFIDENCE_THRESHOLD = 0.7;
    public static final double DEFAULT_MIN_CONFIDENCE = 0.7;
    public static final int DEFAULT_MAX_SUGGESTIONS = 5;
    public static final Duration DEFAULT_SEQUENCE_WINDOW = Duration.ofMinutes(2);
    public static final Duration DEFAULT_CONDITION_WINDOW = Duration.ofSeconds(600);

    /**
     * The minimum number of samples before a pattern is proposed. Also known as the suggestion threshold.
     */
    private final int minOccurrences;
    /**
     * The confidence a mined pattern needs to be emitted by the miners.
     */
    private final double confidenceThreshold;
    /**
     * The confidence a suggestion needs to be returned to the caller.
     */
    private final double minConfidence;
    private final int maxSuggestions;
    /**
     * The maximum time between the first and the last step of a sequence.
     */
    private final Duration sequenceWindow;
    /**
     * The maximum delay between a condition change and a correlated target change.
     */
    private final Duration conditionWindow;
    /**
     * The zone used for weekday and hour bucketing, and for timestamps without an offset. If null, each timestamp
     * keeps the offset it was recorded with.
     */
    private final ZoneId timeZone;
    /**
     * If true, automation ids carry the creation time instead of the pattern's discriminating fields.
     */
    private final boolean timestampedIds;

    @Builder
    private DiscoveryConfig(Integer minOccurrences, Double confidenceThreshold, Double minConfidence,
                            Integer maxSuggestions, Duration sequenceWindow, Duration conditionWindow,
                            ZoneId timeZone, boolean timestampedIds) {
        this.minOccurrences = minOccurrences != null ? minOccurrences : DEFAULT_MIN_OCCURRENCES;
        this.confidenceThreshold = confidenceThreshold != null ? confidenceThreshold : DEFAULT_CONFIDENCE_THRESHOLD;
        this.minConfidence = minConfidence != null ? minConfidence : DEFAULT_MIN_CONFIDENCE;
        this.maxSuggestions = maxSuggestions != null ? maxSuggestions : DEFAULT_MAX_SUGGESTIONS;
        this.sequenceWindow = sequenceWindow != null ? sequenceWindow : DEFAULT_SEQUENCE_WINDOW;
        this.conditionWindow = conditionWindow != null ? conditionWindow : DEFAULT_CONDITION_WINDOW;
        this.timeZone = timeZone;
        this.timestampedIds = timestampedIds;
        assertValid();
    }

    public static DiscoveryConfig defaults() {
        return builder().build();
    }

    private void assertValid() {
        if (minOccurrences < 1) {
            throw new InvalidConfigurationException("Invalid min occurrences '" + minOccurrences + "'. Needs to be at least 1.");
        }
        assertRatio("confidence threshold", confidenceThreshold);
        assertRatio("min confidence", minConfidence);
        if (maxSuggestions < 0) {
            throw new InvalidConfigurationException("Invalid max suggestions '" + maxSuggestions + "'. Must not be negative.");
        }
        assertPositive("sequence window", sequenceWindow);
        assertPositive("condition window", conditionWindow);
    }

    private static void assertRatio(String name, double value) {
        if (Double.isNaN(value) || value < 0.0 || value > 1.0) {
            throw new InvalidConfigurationException("Invalid " + name + " '" + value + "'. Allowed range: [0.0..1.0]");
        }
    }

    private static void assertPositive(String name, Duration value) {
        if (value.isZero() || value.isNegative()) {
            throw new InvalidConfigurationException("Invalid " + name + " '" + value + "'. Needs to be positive.");
        }
    }
}
