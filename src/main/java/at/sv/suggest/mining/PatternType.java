package at.sv.suggest.mining;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum PatternType {
    DAILY,
    SEQUENCE,
    CONDITIONAL,
    PERIODIC;

    /**
     * @return the lower case name used for suggestion categories and automation ids
     */
    @JsonValue
    public String getCategory() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static PatternType fromCategory(String category) {
        for (PatternType type : values()) {
            if (type.getCategory().equals(category.trim().toLowerCase(Locale.ROOT))) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown pattern category '" + category + "'. " +
                                           "Supported values: [daily, sequence, conditional, periodic]");
    }
}
