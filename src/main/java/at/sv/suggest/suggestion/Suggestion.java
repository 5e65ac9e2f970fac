package at.sv.suggest.suggestion;

import at.sv.suggest.automation.AutomationDocument;
import at.sv.suggest.mining.Pattern;
import at.sv.suggest.mining.PatternType;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.util.List;

/**
 * An automation proposed to the user, based on a mined pattern.
 */
@Getter
@Builder
@ToString(exclude = {"config", "yaml"})
@JsonPropertyOrder({"id", "type", "title", "description", "confidence", "entities", "pattern", "config", "yaml"})
public final class Suggestion {
    private final String id;
    private final PatternType type;
    private final String title;
    private final String description;
    private final double confidence;
    /**
     * The distinct ids of all involved entities, the controlled entity first.
     */
    private final List<String> entities;
    private final Pattern pattern;
    private final AutomationDocument config;
    /**
     * The automation config serialized as YAML.
     */
    private final String yaml;

    public boolean involves(String entityId) {
        return entities.contains(entityId);
    }
}
