package at.sv.suggest.automation;

import java.util.Locale;

public enum TemplateType {
    /**
     * Sets entities to a state at a fixed weekday and hour.
     */
    TIME,
    /**
     * Sets entities to a state when a trigger entity changes its state.
     */
    STATE,
    /**
     * Sets at least three entities to a state, one after the other.
     */
    SEQUENCE;

    public static TemplateType fromName(String name) {
        for (TemplateType type : values()) {
            if (type.name().equals(name.trim().toUpperCase(Locale.ROOT))) {
                return type;
            }
        }
        throw new InvalidTemplateException("Unknown template type '" + name + "'. Supported values: [time, state, sequence]");
    }
}
